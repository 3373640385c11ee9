package io.stagewise.core.registration;

import io.stagewise.core.util.StepIds;

/// Request to drop a registered step before the pipeline is ordered.
///
/// @param removeId id of the step to drop, not blank
public record RemoveStep(String removeId) {

    public RemoveStep {
        StepIds.requireValid(removeId, "removeId");
    }
}
