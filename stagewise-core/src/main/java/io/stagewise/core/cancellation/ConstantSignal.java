package io.stagewise.core.cancellation;

import java.util.Objects;

/// Signals whose state never changes.
enum ConstantSignal implements CancellationSignal {
    NONE(false),
    CANCELLED(true);

    private final boolean cancelled;

    ConstantSignal(boolean cancelled) {
        this.cancelled = cancelled;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled;
    }

    @Override
    public CancellationRegistration onCancellation(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        if (cancelled) {
            callback.run();
        }
        return CancellationRegistration.empty();
    }
}
