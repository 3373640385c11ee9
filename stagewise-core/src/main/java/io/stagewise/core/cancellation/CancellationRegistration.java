package io.stagewise.core.cancellation;

/// Handle to a callback registered with {@link CancellationSignal#onCancellation(Runnable)}.
///
/// Closing the handle removes the callback if it has not run yet. Closing is
/// idempotent and never runs the callback.
@FunctionalInterface
public interface CancellationRegistration extends AutoCloseable {

    /// Returns a handle with nothing to remove.
    ///
    /// @return shared no-op handle, never null
    static CancellationRegistration empty() {
        return () -> {};
    }

    /// Removes the callback if it is still pending.
    @Override
    void close();
}
