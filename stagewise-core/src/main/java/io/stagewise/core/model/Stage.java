package io.stagewise.core.model;

import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.registration.RegisterStep;
import java.util.List;
import java.util.Objects;

/// One resolved stage of a {@link PipelineModel}.
///
/// @param shape the context shape every step of the stage consumes, not null
/// @param steps the ordinary steps in execution order, not null (may be empty)
/// @param connector the connector closing the stage, null for a final stage without one
public record Stage(ContextShape<?> shape, List<RegisterStep> steps, RegisterStep connector) {

    public Stage {
        Objects.requireNonNull(shape, "shape must not be null");
        steps = List.copyOf(steps);
    }

    /// Returns whether a connector closes this stage.
    ///
    /// @return `true` if {@link #connector()} is non-null
    public boolean hasConnector() {
        return connector != null;
    }
}
