package io.stagewise.core.model;

import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.registration.RegisterStep;
import java.util.List;
import java.util.Objects;

/// Fully ordered result of resolving step registrations for one root shape.
///
/// `steps` is the flat execution order the chain compiler consumes: each
/// stage's ordinary steps followed by its connector, stage after stage.
/// `stages` keeps the same steps grouped for inspection and rendering.
///
/// @implNote Immutable. The contained {@link RegisterStep}s are the registrations
/// themselves; they are not modified after the model is built.
///
/// @param rootShape the shape of the first stage, not null
/// @param steps every step in execution order, not null
/// @param stages the visited stages in execution order, not null
public record PipelineModel(ContextShape<?> rootShape, List<RegisterStep> steps, List<Stage> stages) {

    public PipelineModel {
        Objects.requireNonNull(rootShape, "rootShape must not be null");
        steps = List.copyOf(steps);
        stages = List.copyOf(stages);
    }

    /// Model of a pipeline without registrations.
    ///
    /// @param rootShape the root shape, not null
    /// @return empty model, never null
    public static PipelineModel empty(ContextShape<?> rootShape) {
        return new PipelineModel(rootShape, List.of(), List.of());
    }

    /// Returns the step ids in execution order.
    ///
    /// @return ids, never null
    public List<String> stepIds() {
        return steps.stream().map(RegisterStep::getStepId).toList();
    }

    /// Returns whether the model has no steps.
    ///
    /// @return `true` if empty
    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
