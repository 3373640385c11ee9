package io.stagewise.core.registration;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.model.PipelineModelBuilder;
import io.stagewise.core.settings.ReadOnlySettings;
import io.stagewise.core.util.StepIds;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Validates step registrations and applies removals and replacements before
/// the pipeline is ordered.
///
/// ### Resolution order
/// 1. Uniqueness: a duplicate id (ignoring case) fails, naming both behaviors
/// 2. Replacements: each target must exist; behavior and factory are overwritten,
///    the description only when a non-blank one is given
/// 3. Removals, deduplicated ignoring case: each target must exist and no live
///    step may be ordered against it
/// 4. Enablement: steps whose {@link RegisterStep#isEnabled(ReadOnlySettings)} is
///    `false` are dropped
///
/// Nothing is instantiated here.
///
/// @implNote Not thread-safe. Used once, on the configuring thread.
///
/// @see PipelineModelBuilder for the ordering that follows
public class StepRegistrationCoordinator {

    private static final Logger logger =
            Logger.getLogger(StepRegistrationCoordinator.class.getName());

    private final List<RegisterStep> additions = new ArrayList<>();
    private final List<RemoveStep> removals;
    private final List<ReplaceStep> replacements;

    /// Creates a coordinator with the given removals and replacements.
    ///
    /// @param removals removal requests, not null
    /// @param replacements replacement requests, not null
    public StepRegistrationCoordinator(List<RemoveStep> removals, List<ReplaceStep> replacements) {
        this.removals = List.copyOf(removals);
        this.replacements = List.copyOf(replacements);
    }

    /// Creates a coordinator holding all of `modifications`.
    ///
    /// @param modifications collected additions, removals and replacements, not null
    /// @return new coordinator, never null
    public static StepRegistrationCoordinator from(PipelineModifications modifications) {
        Objects.requireNonNull(modifications, "modifications must not be null");
        StepRegistrationCoordinator coordinator =
                new StepRegistrationCoordinator(
                        modifications.getRemovals(), modifications.getReplacements());
        modifications.getAdditions().forEach(coordinator::register);
        return coordinator;
    }

    /// Registers a step built by the behavior builder.
    ///
    /// @param stepId unique step id, not blank
    /// @param behaviorType the behavior type, not null
    /// @param signature shapes and role, not null
    /// @param description what the step does, not null
    /// @return the new registration, for adding constraints
    public RegisterStep register(
            String stepId,
            Class<? extends Behavior<?, ?>> behaviorType,
            BehaviorSignature signature,
            String description) {
        RegisterStep step = RegisterStep.create(stepId, behaviorType, signature, description);
        additions.add(step);
        return step;
    }

    /// Registers a pre-built step.
    ///
    /// @param step the registration, not null
    public void register(RegisterStep step) {
        additions.add(Objects.requireNonNull(step, "step must not be null"));
    }

    /// Applies the resolution order and returns the live registrations.
    ///
    /// @param settings settings the enablement predicates read, not null
    /// @return live registrations in registration order, never null
    /// @throws PipelineConfigurationException on any validation failure
    public List<RegisterStep> resolveRegistrations(ReadOnlySettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        Map<String, RegisterStep> registrations = new LinkedHashMap<>();

        for (RegisterStep step : additions) {
            RegisterStep existing = registrations.putIfAbsent(StepIds.key(step.getStepId()), step);
            if (existing != null) {
                throw new PipelineConfigurationException(
                        "Step registration with id '"
                                + step.getStepId()
                                + "' is already registered for '"
                                + existing.getBehaviorType().getName()
                                + "'; cannot register '"
                                + step.getBehaviorType().getName()
                                + "' under the same id.");
            }
        }

        for (ReplaceStep replacement : replacements) {
            RegisterStep target = registrations.get(StepIds.key(replacement.replaceId()));
            if (target == null) {
                throw new PipelineConfigurationException(
                        "You can only replace an existing step registration, '"
                                + replacement.replaceId()
                                + "' registration does not exist.");
            }
            target.replace(replacement);
            logger.fine(
                    "Replaced step '"
                            + target.getStepId()
                            + "' with "
                            + replacement.behaviorType().getName());
        }

        Set<String> processedRemovals = new HashSet<>();
        for (RemoveStep removal : removals) {
            String key = StepIds.key(removal.removeId());
            if (!processedRemovals.add(key)) {
                continue;
            }
            if (!registrations.containsKey(key)) {
                throw new PipelineConfigurationException(
                        "You cannot remove step registration with id '"
                                + removal.removeId()
                                + "', registration does not exist.");
            }
            Optional<RegisterStep> dependant = findDependant(registrations, removal.removeId());
            if (dependant.isPresent()) {
                throw new PipelineConfigurationException(
                        "You cannot remove step registration with id '"
                                + removal.removeId()
                                + "', registration with id '"
                                + dependant.get().getStepId()
                                + "' depends on it.");
            }
            registrations.remove(key);
            logger.fine("Removed step '" + removal.removeId() + "'");
        }

        List<RegisterStep> live = new ArrayList<>(registrations.size());
        for (RegisterStep step : registrations.values()) {
            if (step.isEnabled(settings)) {
                live.add(step);
            } else {
                logger.fine("Step '" + step.getStepId() + "' is disabled by settings");
            }
        }
        return live;
    }

    /// Resolves registrations and orders them for `rootShape`.
    ///
    /// @param rootShape shape of the first stage, not null
    /// @param settings settings the enablement predicates read, not null
    /// @return the ordered model, never null
    /// @throws PipelineConfigurationException on any validation or ordering failure
    public PipelineModel buildPipelineModelFor(ContextShape<?> rootShape, ReadOnlySettings settings) {
        return new PipelineModelBuilder(rootShape, resolveRegistrations(settings)).build();
    }

    private static Optional<RegisterStep> findDependant(
            Map<String, RegisterStep> registrations, String removeId) {
        return registrations.values().stream()
                .filter(step -> !StepIds.same(step.getStepId(), removeId))
                .filter(step -> step.dependsOn(removeId))
                .findFirst();
    }
}
