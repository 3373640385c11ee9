package io.stagewise.core.behavior;

import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// A behavior that turns one context type into another and so marks the
/// boundary between two stages.
///
/// Each stage of a pipeline has at most one connector; it always runs after
/// every ordinary behavior of its stage and before any behavior of the stage it
/// leads to.
///
/// @param <I> the context type of the stage this connector closes
/// @param <O> the context type of the stage this connector opens
/// @see PipelineTerminator for the connector that ends a pipeline
public abstract class StageConnector<I extends BehaviorContext, O extends BehaviorContext>
        implements Behavior<I, O> {

    /// Converts `context` and continues with the next stage.
    ///
    /// @param context the context of the closing stage, not null
    /// @param stage the first step of the next stage, not null
    /// @param signal the ambient cancellation signal, not null
    /// @return stage completing when the rest of the pipeline is done
    @Override
    public abstract CompletionStage<Void> invoke(
            I context, Continuation<O> stage, CancellationSignal signal);
}
