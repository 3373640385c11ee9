package io.stagewise.core.registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Collects the additions, removals and replacements contributed by
/// configuration code before a pipeline is built.
///
/// Order matters only for additions: registration order is the fallback order
/// of unconstrained steps.
///
/// @implNote Not thread-safe; filled during single-threaded configuration.
public class PipelineModifications {

    private final List<RegisterStep> additions = new ArrayList<>();
    private final List<RemoveStep> removals = new ArrayList<>();
    private final List<ReplaceStep> replacements = new ArrayList<>();

    /// Adds a step registration.
    ///
    /// @param step the registration, not null
    /// @return the same registration, for adding constraints
    public RegisterStep add(RegisterStep step) {
        additions.add(Objects.requireNonNull(step, "step must not be null"));
        return step;
    }

    /// Requests removal of a step.
    ///
    /// @param stepId id of the step to remove, not blank
    /// @return this for chaining
    public PipelineModifications remove(String stepId) {
        removals.add(new RemoveStep(stepId));
        return this;
    }

    /// Requests replacement of a step's behavior.
    ///
    /// @param replacement the replacement, not null
    /// @return this for chaining
    public PipelineModifications replace(ReplaceStep replacement) {
        replacements.add(Objects.requireNonNull(replacement, "replacement must not be null"));
        return this;
    }

    /// @return additions in registration order, unmodifiable
    public List<RegisterStep> getAdditions() {
        return Collections.unmodifiableList(additions);
    }

    /// @return removals in request order, unmodifiable
    public List<RemoveStep> getRemovals() {
        return Collections.unmodifiableList(removals);
    }

    /// @return replacements in request order, unmodifiable
    public List<ReplaceStep> getReplacements() {
        return Collections.unmodifiableList(replacements);
    }
}
