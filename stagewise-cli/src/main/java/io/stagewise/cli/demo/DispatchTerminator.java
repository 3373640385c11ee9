package io.stagewise.cli.demo;

import io.stagewise.core.behavior.PipelineTerminator;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public class DispatchTerminator extends PipelineTerminator<OutgoingContext> {

    @Override
    protected CompletionStage<Void> terminate(OutgoingContext context, CancellationSignal signal) {
        context.record(getClass().getSimpleName() + ": sent " + context.payload());
        return CompletableFuture.completedFuture(null);
    }
}
