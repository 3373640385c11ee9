package io.stagewise.core.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/// Helpers for step identifiers, which compare case-insensitively.
public final class StepIds {

    private StepIds() {}

    /// Returns the lookup key for `stepId`.
    ///
    /// @param stepId the step id, not null
    /// @return case-folded key, never null
    public static String key(String stepId) {
        return stepId.toLowerCase(Locale.ROOT);
    }

    /// Returns whether two step ids denote the same step.
    ///
    /// @param first first id, not null
    /// @param second second id, may be null
    /// @return `true` if equal ignoring case
    public static boolean same(String first, String second) {
        return first.equalsIgnoreCase(second);
    }

    /// Validates a step id.
    ///
    /// @param stepId the id to check
    /// @param name the parameter name used in the error message, not null
    /// @return `stepId`, never null
    /// @throws NullPointerException if `stepId` is null
    /// @throws IllegalArgumentException if `stepId` is blank
    public static String requireValid(String stepId, String name) {
        Objects.requireNonNull(stepId, name + " must not be null");
        if (stepId.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return stepId;
    }

    /// Formats ids for diagnostics as `'a', 'b', 'c'`.
    ///
    /// @param stepIds ids to format, not null
    /// @return quoted, comma separated ids, never null
    public static String quoted(Collection<String> stepIds) {
        return stepIds.stream().map(id -> "'" + id + "'").collect(Collectors.joining(", "));
    }
}
