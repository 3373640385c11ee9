package io.stagewise.core.execution;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.behavior.BehaviorContext;
import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.behavior.Continuation;
import io.stagewise.core.behavior.PipelineTerminator;
import io.stagewise.core.builder.BehaviorBuilder;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.registration.RegisterStep;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.logging.Logger;

/// Composes an ordered list of behaviors into one {@link CompiledPipeline}.
///
/// Composition runs right to left. The continuation after the last behavior
/// completes immediately; the continuation for behavior *i* is
///
/// ```
/// (context, signal) -> behavior[i].invoke(context, continuation[i + 1], signal)
/// ```
///
/// and the continuation for the first behavior is the pipeline's entry point.
/// The result is equivalent to nesting every behavior inside the next:
///
/// ```
/// (rootContext, rootSignal)
///     -> b1.invoke(rootContext, (c1, s1) -> b2.invoke(c1, ... (cN, sN) -> done, s1), rootSignal)
/// ```
///
/// ### Contracts
/// - **Precondition**: the list is in execution order with any terminator last
/// - **Postcondition**: each behavior runs at most once per execution, in order
///
/// @implNote Compilation is the expensive part and happens once; execution costs
/// one lambda call per behavior.
///
/// @see CompiledPipeline
/// @see io.stagewise.core.model.PipelineModelBuilder for producing the order
public final class ChainCompiler {

    private static final Logger logger = Logger.getLogger(ChainCompiler.class.getName());

    private static final CompletionStage<Void> DONE = CompletableFuture.completedStage(null);

    private ChainCompiler() {}

    /// Compiles already-built behaviors.
    ///
    /// @param rootShape shape of the root context, not null
    /// @param behaviors behaviors in execution order, not null (may be empty)
    /// @param <C> root context type
    /// @return the compiled pipeline, never null
    /// @throws PipelineConfigurationException if the list contains null or a
    ///     terminator anywhere but last
    public static <C extends BehaviorContext> CompiledPipeline<C> compile(
            ContextShape<C> rootShape, List<? extends Behavior<?, ?>> behaviors) {
        Objects.requireNonNull(rootShape, "rootShape must not be null");
        Objects.requireNonNull(behaviors, "behaviors must not be null");
        Continuation<C> entry = compose(behaviors);
        return new CompiledPipeline<>(entry, new ArrayList<>(behaviors), null);
    }

    /// Builds one behavior per step of `model` and compiles them.
    ///
    /// If building any behavior fails, every behavior built so far is released
    /// before the exception propagates.
    ///
    /// @param rootShape shape of the root context, must equal the model's, not null
    /// @param model the ordered steps, not null
    /// @param builder creates behaviors and later releases them, not null
    /// @param <C> root context type
    /// @return the compiled pipeline owning the built behaviors, never null
    /// @throws PipelineConfigurationException if the shapes differ or a step produces
    ///     an unsuitable behavior
    public static <C extends BehaviorContext> CompiledPipeline<C> compile(
            ContextShape<C> rootShape, PipelineModel model, BehaviorBuilder builder) {
        Objects.requireNonNull(rootShape, "rootShape must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(builder, "builder must not be null");
        if (!rootShape.equals(model.rootShape())) {
            throw new PipelineConfigurationException(
                    "Pipeline model was resolved for root context '"
                            + model.rootShape()
                            + "', not '"
                            + rootShape
                            + "'");
        }

        List<Behavior<?, ?>> behaviors = new ArrayList<>(model.steps().size());
        try {
            for (RegisterStep step : model.steps()) {
                behaviors.add(step.createBehavior(builder));
            }
        } catch (RuntimeException e) {
            releaseQuietly(builder, behaviors, e);
            throw e;
        }

        Continuation<C> entry;
        try {
            entry = compose(behaviors);
        } catch (RuntimeException e) {
            releaseQuietly(builder, behaviors, e);
            throw e;
        }
        CompiledPipeline<C> pipeline = new CompiledPipeline<>(entry, behaviors, builder);
        logger.info(
                "Compiled pipeline for " + rootShape + " with " + behaviors.size() + " behaviors");
        return pipeline;
    }

    private static <C extends BehaviorContext> Continuation<C> compose(
            List<? extends Behavior<?, ?>> behaviors) {
        Continuation<?> next = (context, signal) -> DONE;
        for (int i = behaviors.size() - 1; i >= 0; i--) {
            Behavior<?, ?> behavior = behaviors.get(i);
            if (behavior == null) {
                throw new PipelineConfigurationException("Behavior at position " + i + " is null");
            }
            if (behavior instanceof PipelineTerminator && i != behaviors.size() - 1) {
                throw new PipelineConfigurationException(
                        "Pipeline terminator "
                                + behavior.getClass().getName()
                                + " at position "
                                + i
                                + " must be the last behavior");
            }
            next = link(behavior, next);
        }
        return narrow(next);
    }

    private static <I extends BehaviorContext, O extends BehaviorContext> Continuation<I> link(
            Behavior<I, O> behavior, Continuation<?> next) {
        Continuation<O> downstream = narrow(next);
        return (context, signal) -> behavior.invoke(context, downstream, signal);
    }

    /// Adjacent shapes are checked by the model builder.
    @SuppressWarnings("unchecked")
    private static <C extends BehaviorContext> Continuation<C> narrow(Continuation<?> continuation) {
        return (Continuation<C>) continuation;
    }

    private static void releaseQuietly(
            BehaviorBuilder builder, List<Behavior<?, ?>> built, RuntimeException failure) {
        for (Behavior<?, ?> behavior : built) {
            try {
                builder.release(behavior);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
