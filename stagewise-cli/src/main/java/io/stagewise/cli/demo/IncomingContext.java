package io.stagewise.cli.demo;

import java.util.Objects;

/// Root context of the demo pipeline: an incoming message.
public final class IncomingContext extends DemoContext {

    private final String message;

    public IncomingContext(String message) {
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public String message() {
        return message;
    }
}
