package io.stagewise.cli.demo;

import io.stagewise.core.behavior.Chain;
import io.stagewise.core.behavior.SimpleBehavior;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/// Counts the messages it has seen. The counter is shared by every execution of
/// the compiled pipeline, hence atomic.
public class AuditBehavior extends SimpleBehavior<IncomingContext> {

    private final AtomicLong seen = new AtomicLong();

    @Override
    public CompletionStage<Void> invoke(
            IncomingContext context, Chain next, CancellationSignal signal) {
        context.record(getClass().getSimpleName() + ": message #" + seen.incrementAndGet());
        return next.proceed();
    }
}
