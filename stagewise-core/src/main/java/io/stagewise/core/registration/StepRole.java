package io.stagewise.core.registration;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.behavior.PipelineTerminator;
import io.stagewise.core.behavior.StageConnector;

/// Capability of a registered step, fixed at registration.
public enum StepRole {
    /// Ordinary step; input and output shapes are the same.
    BEHAVIOR,
    /// Closes a stage and opens the stage of its output shape.
    STAGE_CONNECTOR,
    /// Closes the final stage and ends the pipeline.
    TERMINATOR;

    /// Returns whether instances of `type` may fill this role.
    ///
    /// @param type behavior type, not null
    /// @return `true` if the type's class hierarchy matches the role
    public boolean accepts(Class<?> type) {
        return switch (this) {
            case BEHAVIOR -> Behavior.class.isAssignableFrom(type)
                    && !StageConnector.class.isAssignableFrom(type);
            case STAGE_CONNECTOR -> StageConnector.class.isAssignableFrom(type)
                    && !PipelineTerminator.class.isAssignableFrom(type);
            case TERMINATOR -> PipelineTerminator.class.isAssignableFrom(type);
        };
    }

    /// Returns whether this role marks a stage boundary.
    ///
    /// @return `true` for connectors and terminators
    public boolean isStageConnector() {
        return this != BEHAVIOR;
    }
}
