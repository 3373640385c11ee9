package io.stagewise.core.behavior;

/// Marker for the context value a pipeline stage operates over.
///
/// A context type carries whatever per-invocation data the behaviors of one
/// stage share. Each {@link io.stagewise.core.execution.CompiledPipeline#execute}
/// call owns its own context instance; nothing in the pipeline itself retains it.
///
/// @see ContextShape for the registration-time identifier of a context type
public interface BehaviorContext {}
