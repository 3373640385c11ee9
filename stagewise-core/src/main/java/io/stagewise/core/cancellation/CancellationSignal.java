package io.stagewise.core.cancellation;

import java.util.concurrent.CancellationException;

/// Read-only view of a cooperative cancellation request.
///
/// A signal is threaded unchanged through every step of a compiled pipeline
/// unless a behavior deliberately derives a new one from a
/// {@link CancellationSource}. Steps that honour cancellation test the signal
/// themselves; nothing polls or preempts on their behalf.
///
/// ### Contracts
/// - **Invariant**: once {@link #isCancellationRequested()} returns `true` it never
///   returns `false` again
///
/// @see CancellationSource for the owning side
public interface CancellationSignal {

    /// Returns a signal that is never cancelled.
    ///
    /// @return shared non-cancellable signal, never null
    static CancellationSignal none() {
        return ConstantSignal.NONE;
    }

    /// Returns a signal that is already cancelled.
    ///
    /// @return shared cancelled signal, never null
    static CancellationSignal cancelled() {
        return ConstantSignal.CANCELLED;
    }

    /// Returns whether cancellation has been requested.
    ///
    /// @return `true` if cancelled
    boolean isCancellationRequested();

    /// Registers a callback to run once cancellation is requested.
    ///
    /// If cancellation was already requested the callback runs immediately on the
    /// calling thread; otherwise it runs on the thread that requests cancellation.
    ///
    /// Close the returned handle once the callback is no longer wanted so that a
    /// long-lived signal does not keep it.
    ///
    /// @param callback the callback, not null
    /// @return handle that removes the callback, never null
    CancellationRegistration onCancellation(Runnable callback);

    /// Raises {@link CancellationException} if cancellation has been requested.
    ///
    /// @throws CancellationException if {@link #isCancellationRequested()} is `true`
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("The operation was canceled.");
        }
    }
}
