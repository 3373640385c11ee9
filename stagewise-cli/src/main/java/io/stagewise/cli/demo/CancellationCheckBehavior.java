package io.stagewise.cli.demo;

import io.stagewise.core.behavior.Chain;
import io.stagewise.core.behavior.SimpleBehavior;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

/// Records itself, then aborts the chain with a
/// {@link java.util.concurrent.CancellationException} when cancellation was requested.
public class CancellationCheckBehavior extends SimpleBehavior<IncomingContext> {

    @Override
    public CompletionStage<Void> invoke(
            IncomingContext context, Chain next, CancellationSignal signal) {
        context.record(getClass().getSimpleName());
        signal.throwIfCancellationRequested();
        return next.proceed();
    }
}
