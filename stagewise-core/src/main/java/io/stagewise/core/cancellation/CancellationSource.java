package io.stagewise.core.cancellation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/// Owning side of a {@link CancellationSignal}.
///
/// The owner hands {@link #signal()} to a pipeline execution and may call
/// {@link #cancel()} at any time, from any thread. A behavior that needs its own
/// scope (for example to bound the rest of the chain) derives a child source with
/// {@link #linkedTo(CancellationSignal)}; the child is cancelled when either it or
/// its parent is. A linked child drops its callback from the parent once it is
/// cancelled or closed, so a long-lived parent does not accumulate children.
///
/// @implNote Thread-safe. The cancelled flag is atomic and each callback runs
/// exactly once, on whichever thread removes it from the pending list first.
public final class CancellationSource implements AutoCloseable {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final CancellationSignal signal = new SourceSignal();
    private volatile CancellationRegistration parentRegistration = CancellationRegistration.empty();

    /// Creates a source that is not cancelled.
    public CancellationSource() {}

    /// Creates a source that is cancelled when `parent` is.
    ///
    /// @param parent the signal to follow, not null
    /// @return new linked source, never null
    public static CancellationSource linkedTo(CancellationSignal parent) {
        Objects.requireNonNull(parent, "parent must not be null");
        CancellationSource source = new CancellationSource();
        source.parentRegistration = parent.onCancellation(source::cancel);
        return source;
    }

    /// Returns the read-only signal of this source.
    ///
    /// @return the signal, never null
    public CancellationSignal signal() {
        return signal;
    }

    /// Returns whether {@link #cancel()} has been called.
    ///
    /// @return `true` if cancelled
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /// Requests cancellation and runs every registered callback.
    ///
    /// A linked source also unregisters from its parent. Subsequent calls have no effect. When callbacks fail, every callback still
    /// runs and the first failure is rethrown with the others suppressed.
    ///
    /// @throws RuntimeException the first exception raised by a callback
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        parentRegistration.close();
        List<RuntimeException> failures = new ArrayList<>();
        for (Runnable callback : callbacks) {
            if (!callbacks.remove(callback)) {
                continue;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            failures.subList(1, failures.size()).forEach(first::addSuppressed);
            throw first;
        }
    }

    /// Unlinks this source from its parent without cancelling it.
    ///
    /// The source can still be cancelled directly. Has no effect on an unlinked source.
    @Override
    public void close() {
        parentRegistration.close();
    }

    int pendingCallbackCount() {
        return callbacks.size();
    }

    private final class SourceSignal implements CancellationSignal {

        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }

        @Override
        public CancellationRegistration onCancellation(Runnable callback) {
            Objects.requireNonNull(callback, "callback must not be null");
            callbacks.add(callback);
            // whoever removes the callback first runs it
            if (cancelled.get() && callbacks.remove(callback)) {
                callback.run();
                return CancellationRegistration.empty();
            }
            return () -> callbacks.remove(callback);
        }

        @Override
        public String toString() {
            return "CancellationSignal[cancelled=" + cancelled.get() + "]";
        }
    }
}
