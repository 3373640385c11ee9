package io.stagewise.core.exception;

import java.io.Serial;

/// Thrown when a pipeline cannot be built from its registrations.
///
/// Signals a programming or configuration mistake detected while the pipeline
/// is assembled, never during execution. Common causes:
/// - Duplicate step id, or replace/remove of an unknown step
/// - Removal of a step other steps are ordered against
/// - Enforced ordering reference to a step that does not exist
/// - Dependency cycle, or a stage with no or several connectors
/// - Write to locked settings
///
/// Must not be retried; no partially built pipeline is reachable after it is
/// thrown.
public class PipelineConfigurationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 2871645709437781306L;

    /// Creates exception with message.
    ///
    /// @param message description of the configuration mistake
    public PipelineConfigurationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the configuration mistake
    /// @param cause the underlying exception
    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
