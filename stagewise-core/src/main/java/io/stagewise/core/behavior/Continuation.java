package io.stagewise.core.behavior;

import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// The rest of the pipeline as seen from one behavior.
///
/// Calling {@link #proceed} hands control to the next step with the given
/// context and signal. Not calling it short-circuits every later step.
///
/// @param <C> the context type the next step consumes
/// @see Behavior#invoke
@FunctionalInterface
public interface Continuation<C extends BehaviorContext> {

    /// Invokes the next step of the pipeline.
    ///
    /// @param context the context for the next step, not null
    /// @param signal the cancellation signal to pass on, usually the one received, not null
    /// @return stage that completes when the rest of the pipeline has completed, never null
    CompletionStage<Void> proceed(C context, CancellationSignal signal);
}
