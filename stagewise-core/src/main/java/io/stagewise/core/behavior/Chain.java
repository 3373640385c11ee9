package io.stagewise.core.behavior;

import java.util.concurrent.CompletionStage;

/// Context-preserving form of {@link Continuation} used by {@link SimpleBehavior}.
///
/// The context and cancellation signal are already bound; calling {@link #proceed()}
/// forwards the unchanged context to the next step.
@FunctionalInterface
public interface Chain {

    /// Invokes the next step with the current context and signal.
    ///
    /// @return stage that completes when the rest of the pipeline has completed, never null
    CompletionStage<Void> proceed();
}
