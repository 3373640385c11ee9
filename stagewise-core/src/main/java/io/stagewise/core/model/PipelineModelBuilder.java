package io.stagewise.core.model;

import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.registration.RegisterStep;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Stitches validated registrations into one execution order across stages.
///
/// Steps are grouped into stages by input shape. Starting at the root stage, each
/// stage contributes its ordinary steps (sorted by {@link StepGraph}) and then its
/// single connector; a non-terminal connector leads to the stage of its output
/// shape, a terminator ends the walk.
///
/// ### Failure modes
/// All raised as {@link PipelineConfigurationException}:
/// - no registration for the root shape
/// - more than one connector in a stage
/// - no connector in a stage while other stages are still unvisited
/// - a connector leading back to a visited stage
/// - a connector leading to a shape with no registrations while other stages are
///   still unvisited
///
/// Stages left unvisited after a terminator are ignored with a warning.
///
/// @see io.stagewise.core.registration.StepRegistrationCoordinator for the validation
/// that runs before this builder
public final class PipelineModelBuilder {

    private static final Logger logger = Logger.getLogger(PipelineModelBuilder.class.getName());

    private final ContextShape<?> rootShape;
    private final List<RegisterStep> registrations;

    /// Creates a builder over validated registrations.
    ///
    /// @param rootShape shape of the first stage, not null
    /// @param registrations live registrations in registration order, not null
    public PipelineModelBuilder(ContextShape<?> rootShape, List<RegisterStep> registrations) {
        this.rootShape = Objects.requireNonNull(rootShape, "rootShape must not be null");
        this.registrations = List.copyOf(registrations);
    }

    /// Resolves the execution order.
    ///
    /// @return the ordered model, never null (empty when there are no registrations)
    /// @throws PipelineConfigurationException if the registrations cannot be ordered
    public PipelineModel build() {
        if (registrations.isEmpty()) {
            return PipelineModel.empty(rootShape);
        }

        Map<ContextShape<?>, List<RegisterStep>> stages = new LinkedHashMap<>();
        for (RegisterStep registration : registrations) {
            stages.computeIfAbsent(registration.getSignature().input(), shape -> new ArrayList<>())
                    .add(registration);
        }

        if (!stages.containsKey(rootShape)) {
            throw new PipelineConfigurationException(
                    "Can't find any behaviors or connectors for the root context (" + rootShape + ")");
        }

        List<RegisterStep> finalOrder = new ArrayList<>(registrations.size());
        List<Stage> resolvedStages = new ArrayList<>();
        Set<ContextShape<?>> visited = new LinkedHashSet<>();
        ContextShape<?> currentShape = rootShape;

        while (currentShape != null) {
            visited.add(currentShape);
            List<RegisterStep> stageSteps = stages.get(currentShape);

            List<RegisterStep> ordinary =
                    stageSteps.stream().filter(step -> !step.isStageConnector()).toList();
            List<RegisterStep> sorted = StepGraph.sort(ordinary);
            finalOrder.addAll(sorted);

            List<RegisterStep> connectors =
                    stageSteps.stream().filter(RegisterStep::isStageConnector).toList();
            if (connectors.size() > 1) {
                String names =
                        connectors.stream()
                                .map(c -> "'" + c.getBehaviorType().getName() + "'")
                                .collect(Collectors.joining(", "));
                throw new PipelineConfigurationException(
                        "Multiple stage connectors found for stage '"
                                + currentShape
                                + "'. Remove one of: "
                                + names);
            }

            RegisterStep connector = connectors.isEmpty() ? null : connectors.get(0);
            if (connector != null) {
                finalOrder.add(connector);
            }
            resolvedStages.add(new Stage(currentShape, sorted, connector));
            currentShape = nextShape(currentShape, connector, stages, visited);
        }

        logger.info(
                "Resolved pipeline for "
                        + rootShape
                        + ": "
                        + finalOrder.size()
                        + " steps in "
                        + resolvedStages.size()
                        + " stages");
        return new PipelineModel(rootShape, finalOrder, resolvedStages);
    }

    private static ContextShape<?> nextShape(
            ContextShape<?> currentShape,
            RegisterStep connector,
            Map<ContextShape<?>, List<RegisterStep>> stages,
            Set<ContextShape<?>> visited) {
        boolean allVisited = visited.size() == stages.size();

        if (connector == null) {
            if (!allVisited) {
                throw new PipelineConfigurationException(
                        "No stage connector found for stage '"
                                + currentShape
                                + "'. Stages never reached: "
                                + unvisited(stages, visited));
            }
            return null;
        }

        if (connector.getSignature().isTerminator()) {
            if (!allVisited) {
                logger.warning(
                        "Pipeline terminated by '"
                                + connector.getStepId()
                                + "'; ignoring stages never reached: "
                                + unvisited(stages, visited));
            }
            return null;
        }

        ContextShape<?> output = connector.getSignature().output();
        if (visited.contains(output)) {
            throw new PipelineConfigurationException(
                    "Stage connector '"
                            + connector.getStepId()
                            + "' leads back to stage '"
                            + output
                            + "' which already ran");
        }
        if (stages.containsKey(output)) {
            return output;
        }
        if (!allVisited) {
            throw new PipelineConfigurationException(
                    "Stage connector '"
                            + connector.getStepId()
                            + "' leads to stage '"
                            + output
                            + "' which has no registered behaviors. Stages never reached: "
                            + unvisited(stages, visited));
        }
        return null;
    }

    private static String unvisited(
            Map<ContextShape<?>, List<RegisterStep>> stages, Set<ContextShape<?>> visited) {
        return stages.keySet().stream()
                .filter(shape -> !visited.contains(shape))
                .map(shape -> "'" + shape + "'")
                .collect(Collectors.joining(", "));
    }
}
