package io.stagewise.core.behavior;

import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// One step of a pipeline, consuming an input context and handing an output
/// context to the next step.
///
/// Behaviors are composed by {@link io.stagewise.core.execution.ChainCompiler}
/// into a single nested call chain: each behavior receives the continuation for
/// everything after it and decides whether, when, and with which context to
/// proceed.
///
/// ### Contracts
/// - **Precondition**: `context`, `next` and `signal` are non-null
/// - **Postcondition**: returns a non-null stage
/// - **Invariant**: `next` is invoked at most once per call
///
/// ### Cancellation
/// Cancellation is cooperative. A behavior that wants to honour it checks
/// {@link CancellationSignal#throwIfCancellationRequested()} (typically on entry)
/// instead of calling `next`. The resulting
/// {@link java.util.concurrent.CancellationException} reaches the caller of
/// `execute` unchanged.
///
/// @implNote A single instance is shared by every concurrent execution of a
/// compiled pipeline. Implementations holding mutable state must synchronize it
/// themselves.
///
/// @param <I> the context type this behavior consumes
/// @param <O> the context type handed to the next step
/// @see SimpleBehavior for behaviors that keep the same context
/// @see StageConnector for behaviors that change the context type
public interface Behavior<I extends BehaviorContext, O extends BehaviorContext> {

    /// Runs this step.
    ///
    /// @param context the input context, not null
    /// @param next the rest of the pipeline, not null
    /// @param signal the ambient cancellation signal, not null
    /// @return stage completing when this step and every step it proceeded to are done
    CompletionStage<Void> invoke(I context, Continuation<O> next, CancellationSignal signal);
}
