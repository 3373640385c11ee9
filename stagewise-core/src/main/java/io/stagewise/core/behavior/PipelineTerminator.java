package io.stagewise.core.behavior;

import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// The connector that ends a pipeline.
///
/// A terminator never calls its continuation; it resolves the chain itself
/// through {@link #terminate}. Its output context type is the marker
/// {@link TerminatingContext}, which no stage is ever registered for.
///
/// @param <C> the context type of the final stage
/// @see ContextShape#TERMINATED
public abstract class PipelineTerminator<C extends BehaviorContext>
        extends StageConnector<C, PipelineTerminator.TerminatingContext> {

    /// Marker output context of every terminator.
    public interface TerminatingContext extends BehaviorContext {}

    /// Completes the pipeline for `context`.
    ///
    /// @param context the context of the final stage, not null
    /// @param signal the ambient cancellation signal, not null
    /// @return stage completing when termination is done, never null
    protected abstract CompletionStage<Void> terminate(C context, CancellationSignal signal);

    @Override
    public final CompletionStage<Void> invoke(
            C context, Continuation<TerminatingContext> next, CancellationSignal signal) {
        return terminate(context, signal);
    }
}
