package io.stagewise.core.registration;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.builder.BehaviorBuilder;
import io.stagewise.core.util.StepIds;
import java.util.Objects;
import java.util.function.Function;

/// Request to swap the behavior of a registered step while keeping its id,
/// signature and ordering constraints.
///
/// @param replaceId id of the step to replace, not blank
/// @param behaviorType the new behavior type, not null
/// @param description new description, or null/blank to keep the current one
/// @param factory creates the new behavior, or null to build `behaviorType`
public record ReplaceStep(
        String replaceId,
        Class<? extends Behavior<?, ?>> behaviorType,
        String description,
        Function<BehaviorBuilder, ? extends Behavior<?, ?>> factory) {

    public ReplaceStep {
        StepIds.requireValid(replaceId, "replaceId");
        Objects.requireNonNull(behaviorType, "behaviorType must not be null");
    }

    /// Replacement built by the behavior builder, keeping the current description.
    public ReplaceStep(String replaceId, Class<? extends Behavior<?, ?>> behaviorType) {
        this(replaceId, behaviorType, null, null);
    }

    /// Replacement built by the behavior builder with a new description.
    public ReplaceStep(
            String replaceId, Class<? extends Behavior<?, ?>> behaviorType, String description) {
        this(replaceId, behaviorType, description, null);
    }
}
