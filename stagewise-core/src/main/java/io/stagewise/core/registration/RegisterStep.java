package io.stagewise.core.registration;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.builder.BehaviorBuilder;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.registration.Dependency.Direction;
import io.stagewise.core.settings.ReadOnlySettings;
import io.stagewise.core.util.StepIds;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/// Registration of one pipeline step: id, behavior, description, signature,
/// ordering constraints and enablement.
///
/// Constraints accumulate: every `insert*` call appends to the before or after
/// list, in call order. A {@link ReplaceStep} overwrites the behavior and
/// (optionally) the description in place; id, signature and constraints never
/// change after creation.
///
/// {@snippet :
/// RegisterStep step =
///         RegisterStep.create("audit", AuditBehavior.class, BehaviorSignature.behavior(INCOMING),
///                         "Records every incoming message")
///                 .insertAfter("decode")
///                 .insertBeforeIfExists("metrics");
/// }
///
/// ### Contracts
/// - **Invariant**: the behavior type always satisfies the signature's {@link StepRole}
///
/// @implNote Not thread-safe. Steps are configured on one thread before the
/// pipeline is built.
///
/// @see StepRegistrationCoordinator for validation and ordering
public class RegisterStep {

    private final String stepId;
    private final BehaviorSignature signature;
    private final List<Dependency> befores = new ArrayList<>();
    private final List<Dependency> afters = new ArrayList<>();
    private Class<? extends Behavior<?, ?>> behaviorType;
    private Function<BehaviorBuilder, ? extends Behavior<?, ?>> factory;
    private String description;
    private Predicate<ReadOnlySettings> enabledWhen = settings -> true;

    /// Creates a registration.
    ///
    /// @param stepId unique step id, not blank
    /// @param behaviorType the behavior type, not null
    /// @param signature shapes and role of the step, not null
    /// @param description what the step does, not null
    /// @param factory creates the behavior, or null to build `behaviorType`
    /// @throws PipelineConfigurationException if `behaviorType` does not fit the role
    protected RegisterStep(
            String stepId,
            Class<? extends Behavior<?, ?>> behaviorType,
            BehaviorSignature signature,
            String description,
            Function<BehaviorBuilder, ? extends Behavior<?, ?>> factory) {
        this.stepId = StepIds.requireValid(stepId, "stepId");
        this.behaviorType = Objects.requireNonNull(behaviorType, "behaviorType must not be null");
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.factory = factory;
        requireRole(behaviorType);
    }

    /// Registers a step built by the behavior builder.
    ///
    /// @param stepId unique step id, not blank
    /// @param behaviorType the behavior type, not null
    /// @param signature shapes and role of the step, not null
    /// @param description what the step does, not null
    /// @return new registration, never null
    /// @throws PipelineConfigurationException if `behaviorType` does not fit the role
    public static RegisterStep create(
            String stepId,
            Class<? extends Behavior<?, ?>> behaviorType,
            BehaviorSignature signature,
            String description) {
        return new RegisterStep(stepId, behaviorType, signature, description, null);
    }

    /// Registers a step created by a factory.
    ///
    /// @param stepId unique step id, not blank
    /// @param behaviorType the type the factory returns, not null
    /// @param signature shapes and role of the step, not null
    /// @param description what the step does, not null
    /// @param factory creates the behavior, receives the builder, not null
    /// @return new registration, never null
    /// @throws PipelineConfigurationException if `behaviorType` does not fit the role
    public static RegisterStep create(
            String stepId,
            Class<? extends Behavior<?, ?>> behaviorType,
            BehaviorSignature signature,
            String description,
            Function<BehaviorBuilder, ? extends Behavior<?, ?>> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        return new RegisterStep(stepId, behaviorType, signature, description, factory);
    }

    /// Orders this step before `id`. Fails the build if `id` does not exist.
    ///
    /// @param id the step to run after this one, not blank
    /// @return this registration for chaining
    public RegisterStep insertBefore(String id) {
        befores.add(dependency(id, Direction.BEFORE, true));
        return this;
    }

    /// Orders this step before `id` if such a step exists; ignored otherwise.
    ///
    /// @param id the step to run after this one, not blank
    /// @return this registration for chaining
    public RegisterStep insertBeforeIfExists(String id) {
        befores.add(dependency(id, Direction.BEFORE, false));
        return this;
    }

    /// Orders this step after `id`. Fails the build if `id` does not exist.
    ///
    /// @param id the step to run before this one, not blank
    /// @return this registration for chaining
    public RegisterStep insertAfter(String id) {
        afters.add(dependency(id, Direction.AFTER, true));
        return this;
    }

    /// Orders this step after `id` if such a step exists; ignored otherwise.
    ///
    /// @param id the step to run before this one, not blank
    /// @return this registration for chaining
    public RegisterStep insertAfterIfExists(String id) {
        afters.add(dependency(id, Direction.AFTER, false));
        return this;
    }

    /// Makes inclusion of this step depend on settings.
    ///
    /// @param predicate evaluated once per build against the locked settings, not null
    /// @return this registration for chaining
    public RegisterStep enabledWhen(Predicate<ReadOnlySettings> predicate) {
        this.enabledWhen = Objects.requireNonNull(predicate, "predicate must not be null");
        return this;
    }

    /// Returns whether this step takes part in the pipeline.
    ///
    /// Subclasses may override instead of using {@link #enabledWhen(Predicate)}.
    ///
    /// @param settings the locked settings, not null
    /// @return `true` to include the step
    public boolean isEnabled(ReadOnlySettings settings) {
        return enabledWhen.test(settings);
    }

    /// Returns the step id.
    ///
    /// @return id as registered, never null
    public String getStepId() {
        return stepId;
    }

    /// Returns the current behavior type.
    ///
    /// @return behavior type, never null
    public Class<? extends Behavior<?, ?>> getBehaviorType() {
        return behaviorType;
    }

    /// Returns the current description.
    ///
    /// @return description, never null
    public String getDescription() {
        return description;
    }

    /// Returns the shapes and role declared at registration.
    ///
    /// @return signature, never null
    public BehaviorSignature getSignature() {
        return signature;
    }

    /// Returns whether this step marks a stage boundary.
    ///
    /// @return `true` for connectors and terminators
    public boolean isStageConnector() {
        return signature.isStageConnector();
    }

    /// Returns the before constraints in declaration order.
    ///
    /// @return unmodifiable list, never null (may be empty)
    public List<Dependency> getBefores() {
        return Collections.unmodifiableList(befores);
    }

    /// Returns the after constraints in declaration order.
    ///
    /// @return unmodifiable list, never null (may be empty)
    public List<Dependency> getAfters() {
        return Collections.unmodifiableList(afters);
    }

    /// Returns whether any before or after constraint of this step names `id`.
    ///
    /// @param id the step id to look for, not null
    /// @return `true` if this step is ordered against `id`
    public boolean dependsOn(String id) {
        return befores.stream().anyMatch(d -> StepIds.same(d.dependsOnId(), id))
                || afters.stream().anyMatch(d -> StepIds.same(d.dependsOnId(), id));
    }

    /// Creates the behavior instance for this step.
    ///
    /// Uses the factory when one was given, the builder otherwise. A rejected
    /// instance is handed back to `builder` before the exception is thrown.
    ///
    /// @param builder the behavior builder, not null
    /// @return a live behavior, never null
    /// @throws PipelineConfigurationException if the produced instance is null, not a
    ///     {@link #getBehaviorType()} or does not fit the role
    public Behavior<?, ?> createBehavior(BehaviorBuilder builder) {
        Behavior<?, ?> behavior = factory != null ? factory.apply(builder) : builder.build(behaviorType);
        if (behavior == null) {
            throw new PipelineConfigurationException(
                    "Factory of step '" + stepId + "' returned no behavior");
        }
        if (!behaviorType.isInstance(behavior) || !signature.role().accepts(behavior.getClass())) {
            PipelineConfigurationException failure =
                    new PipelineConfigurationException(
                            "Step '"
                                    + stepId
                                    + "' expected a "
                                    + signature.role()
                                    + " of type "
                                    + behaviorType.getName()
                                    + " but got "
                                    + behavior.getClass().getName());
            try {
                builder.release(behavior);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
            throw failure;
        }
        return behavior;
    }

    void replace(ReplaceStep replacement) {
        if (!StepIds.same(stepId, replacement.replaceId())) {
            throw new PipelineConfigurationException(
                    "Cannot replace step '"
                            + stepId
                            + "' with '"
                            + replacement.replaceId()
                            + "'. The id of the replacement must match the replaced step.");
        }
        requireRole(replacement.behaviorType());
        behaviorType = replacement.behaviorType();
        factory = replacement.factory();
        if (replacement.description() != null && !replacement.description().isBlank()) {
            description = replacement.description();
        }
    }

    private void requireRole(Class<?> type) {
        if (!signature.role().accepts(type)) {
            throw new PipelineConfigurationException(
                    "Step '"
                            + stepId
                            + "' is registered as a "
                            + signature.role()
                            + " but "
                            + type.getName()
                            + " is not one");
        }
    }

    private Dependency dependency(String id, Direction direction, boolean enforced) {
        return new Dependency(stepId, StepIds.requireValid(id, "id"), direction, enforced);
    }

    @Override
    public String toString() {
        return stepId + "(" + behaviorType.getName() + ") - " + description;
    }
}
