package io.stagewise.core.registration;

/// One ordering constraint declared by a step.
///
/// @param dependantId id of the step declaring the constraint
/// @param dependsOnId id of the step it is ordered against
/// @param direction whether the dependant runs before or after the other step
/// @param enforced `false` when a missing `dependsOnId` is to be ignored
public record Dependency(
        String dependantId, String dependsOnId, Direction direction, boolean enforced) {

    /// Relative position of the dependant.
    public enum Direction {
        BEFORE,
        AFTER
    }
}
