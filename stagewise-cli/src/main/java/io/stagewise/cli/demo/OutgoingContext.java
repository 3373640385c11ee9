package io.stagewise.cli.demo;

import java.util.Objects;

/// Context of the outgoing stage. Shares the trace of the incoming context it
/// was created from.
public final class OutgoingContext extends DemoContext {

    private final String payload;

    OutgoingContext(IncomingContext incoming, String payload) {
        super(incoming.sharedTrace());
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
    }

    public String payload() {
        return payload;
    }
}
