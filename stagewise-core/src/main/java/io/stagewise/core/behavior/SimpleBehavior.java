package io.stagewise.core.behavior;

import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// Base class for the common case: a behavior whose output context is its input
/// context.
///
/// Subclasses implement {@link #invoke(BehaviorContext, Chain, CancellationSignal)}
/// and call `next.proceed()` to continue; the general
/// {@link Behavior#invoke(BehaviorContext, Continuation, CancellationSignal)} form
/// forwards the unchanged context and the ambient signal.
///
/// {@snippet :
/// class AuditBehavior extends SimpleBehavior<IncomingContext> {
///     @Override
///     public CompletionStage<Void> invoke(
///             IncomingContext context, Chain next, CancellationSignal signal) {
///         context.record("audit");
///         return next.proceed();
///     }
/// }
/// }
///
/// @param <C> the context type consumed and forwarded
public abstract class SimpleBehavior<C extends BehaviorContext> implements Behavior<C, C> {

    @Override
    public final CompletionStage<Void> invoke(
            C context, Continuation<C> next, CancellationSignal signal) {
        return invoke(context, () -> next.proceed(context, signal), signal);
    }

    /// Runs this step.
    ///
    /// @param context the context, not null
    /// @param next continues the pipeline with the same context and signal, not null
    /// @param signal the ambient cancellation signal, not null
    /// @return stage completing when this step and every step it proceeded to are done
    public abstract CompletionStage<Void> invoke(C context, Chain next, CancellationSignal signal);
}
