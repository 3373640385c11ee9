package io.stagewise.cli.demo;

import io.stagewise.core.behavior.Continuation;
import io.stagewise.core.behavior.StageConnector;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.Locale;
import java.util.concurrent.CompletionStage;

/// Turns the incoming message into an outgoing payload.
public class IncomingToOutgoingConnector extends StageConnector<IncomingContext, OutgoingContext> {

    @Override
    public CompletionStage<Void> invoke(
            IncomingContext context, Continuation<OutgoingContext> stage, CancellationSignal signal) {
        String payload = context.message().toUpperCase(Locale.ROOT);
        context.record(getClass().getSimpleName() + ": " + payload);
        return stage.proceed(new OutgoingContext(context, payload), signal);
    }
}
