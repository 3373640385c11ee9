package io.stagewise.core.execution;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.behavior.BehaviorContext;
import io.stagewise.core.behavior.Continuation;
import io.stagewise.core.builder.BehaviorBuilder;
import io.stagewise.core.cancellation.CancellationSignal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/// Immutable, reusable invocation chain produced by {@link ChainCompiler}.
///
/// {@link #execute} runs every behavior in order, each nested inside the
/// previous one's continuation. The pipeline keeps no per-call state: concurrent
/// executions share only the behavior instances.
///
/// ### Failure propagation
/// Nothing is caught, wrapped or logged here. A behavior throwing synchronously
/// makes `execute` throw the same exception; a behavior returning a failed stage
/// makes the returned stage fail with it. The pipeline remains usable either way.
///
/// @implNote Thread-safe for {@link #execute}. {@link #close()} must not race with
/// executions.
///
/// @param <C> the root context type
public final class CompiledPipeline<C extends BehaviorContext> implements AutoCloseable {

    private final Continuation<C> entry;
    private final List<Behavior<?, ?>> behaviors;
    private final BehaviorBuilder owner;

    CompiledPipeline(Continuation<C> entry, List<Behavior<?, ?>> behaviors, BehaviorBuilder owner) {
        this.entry = entry;
        this.behaviors = List.copyOf(behaviors);
        this.owner = owner;
    }

    /// Runs the pipeline for `context`.
    ///
    /// @param context the root context, owned by this call, not null
    /// @param signal the cancellation signal threaded through every step, not null
    /// @return stage completing when the chain completes, or failing with the first
    ///     exception a behavior completed exceptionally with
    /// @throws java.util.concurrent.CancellationException if a behavior observes a
    ///     requested signal synchronously
    public CompletionStage<Void> execute(C context, CancellationSignal signal) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        return entry.proceed(context, signal);
    }

    /// Runs the pipeline with a signal that is never cancelled.
    ///
    /// @param context the root context, not null
    /// @return stage completing when the chain completes
    public CompletionStage<Void> execute(C context) {
        return execute(context, CancellationSignal.none());
    }

    /// Returns the behaviors in execution order.
    ///
    /// @return unmodifiable list, never null
    public List<Behavior<?, ?>> behaviors() {
        return behaviors;
    }

    /// Releases every behavior through the builder that created it.
    ///
    /// Pipelines compiled from plain behavior lists own nothing and do nothing
    /// here.
    @Override
    public void close() {
        if (owner == null) {
            return;
        }
        List<RuntimeException> failures = new ArrayList<>();
        for (Behavior<?, ?> behavior : behaviors) {
            try {
                owner.release(behavior);
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
}
