package io.stagewise.core.registration;

import io.stagewise.core.behavior.ContextShape;
import java.util.Objects;

/// The input shape, output shape and role of a registered step.
///
/// Declared once when the step is registered, so ordering never needs to inspect
/// behavior classes for their context types.
///
/// ### Contracts
/// - {@link StepRole#BEHAVIOR}: `input` equals `output`
/// - {@link StepRole#STAGE_CONNECTOR}: `input` differs from `output`, neither is
///   {@link ContextShape#TERMINATED}
/// - {@link StepRole#TERMINATOR}: `output` is {@link ContextShape#TERMINATED}
///
/// @param input shape of the stage the step belongs to, not null
/// @param output shape handed to the next step, not null
/// @param role capability of the step, not null
public record BehaviorSignature(ContextShape<?> input, ContextShape<?> output, StepRole role) {

    public BehaviorSignature {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (input.isTerminated()) {
            throw new IllegalArgumentException("input shape must not be the terminating marker");
        }
        switch (role) {
            case BEHAVIOR -> {
                if (!input.equals(output)) {
                    throw new IllegalArgumentException(
                            "A behavior must keep its shape: " + input + " -> " + output);
                }
            }
            case STAGE_CONNECTOR -> {
                if (input.equals(output) || output.isTerminated()) {
                    throw new IllegalArgumentException(
                            "A stage connector must lead to another stage: "
                                    + input
                                    + " -> "
                                    + output);
                }
            }
            case TERMINATOR -> {
                if (!output.isTerminated()) {
                    throw new IllegalArgumentException(
                            "A terminator must output the terminating marker, not " + output);
                }
            }
        }
    }

    /// Signature of an ordinary step of the `shape` stage.
    ///
    /// @param shape the stage shape, not null
    /// @return new signature, never null
    public static BehaviorSignature behavior(ContextShape<?> shape) {
        return new BehaviorSignature(shape, shape, StepRole.BEHAVIOR);
    }

    /// Signature of a connector from the `from` stage to the `to` stage.
    ///
    /// @param from the stage it closes, not null
    /// @param to the stage it opens, not null
    /// @return new signature, never null
    public static BehaviorSignature connector(ContextShape<?> from, ContextShape<?> to) {
        return new BehaviorSignature(from, to, StepRole.STAGE_CONNECTOR);
    }

    /// Signature of the terminator of the `shape` stage.
    ///
    /// @param shape the final stage shape, not null
    /// @return new signature, never null
    public static BehaviorSignature terminator(ContextShape<?> shape) {
        return new BehaviorSignature(shape, ContextShape.TERMINATED, StepRole.TERMINATOR);
    }

    /// Returns whether the step marks a stage boundary.
    ///
    /// @return `true` for connectors and terminators
    public boolean isStageConnector() {
        return role.isStageConnector();
    }

    /// Returns whether the step ends the pipeline.
    ///
    /// @return `true` for terminators
    public boolean isTerminator() {
        return role == StepRole.TERMINATOR;
    }
}
