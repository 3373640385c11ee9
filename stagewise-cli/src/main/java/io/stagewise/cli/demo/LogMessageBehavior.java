package io.stagewise.cli.demo;

import io.stagewise.core.behavior.Chain;
import io.stagewise.core.behavior.SimpleBehavior;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.concurrent.CompletionStage;

public class LogMessageBehavior extends SimpleBehavior<IncomingContext> {

    @Override
    public CompletionStage<Void> invoke(
            IncomingContext context, Chain next, CancellationSignal signal) {
        context.record(getClass().getSimpleName() + ": " + context.message());
        return next.proceed();
    }
}
