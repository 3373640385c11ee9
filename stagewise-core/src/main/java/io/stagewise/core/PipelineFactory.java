package io.stagewise.core;

import io.stagewise.core.behavior.Behavior;
import io.stagewise.core.behavior.BehaviorContext;
import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.builder.BehaviorBuilder;
import io.stagewise.core.builder.DefaultBehaviorBuilder;
import io.stagewise.core.execution.ChainCompiler;
import io.stagewise.core.execution.CompiledPipeline;
import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.registration.BehaviorSignature;
import io.stagewise.core.registration.PipelineModifications;
import io.stagewise.core.registration.RegisterStep;
import io.stagewise.core.registration.ReplaceStep;
import io.stagewise.core.registration.StepRegistrationCoordinator;
import io.stagewise.core.settings.SettingsHolder;
import java.util.Objects;

/// Entry point wiring registration, ordering, instantiation and compilation.
///
/// {@snippet :
/// ContextShape<IncomingContext> incoming = ContextShape.of(IncomingContext.class);
///
/// PipelineFactory.Builder factory = PipelineFactory.builder();
/// factory.register("decode", DecodeBehavior.class, BehaviorSignature.behavior(incoming), "Decodes");
/// factory.register("audit", AuditBehavior.class, BehaviorSignature.behavior(incoming), "Audits")
///         .insertAfter("decode");
///
/// CompiledPipeline<IncomingContext> pipeline = factory.build(incoming);
/// pipeline.execute(new IncomingContext(), CancellationSignal.none());
/// }
///
/// ### Build sequence
/// 1. The settings are locked
/// 2. {@link StepRegistrationCoordinator} validates additions, removals,
///    replacements and enablement
/// 3. {@link io.stagewise.core.model.PipelineModelBuilder} orders the steps
/// 4. {@link ChainCompiler} builds one behavior per step and composes them
///
/// Every failure is a {@link io.stagewise.core.exception.PipelineConfigurationException}
/// raised before any pipeline is returned.
///
/// @see CompiledPipeline
public final class PipelineFactory {

    private PipelineFactory() {}

    /// Creates a new factory builder with empty settings and a
    /// {@link DefaultBehaviorBuilder}.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Collects registrations and collaborators for one or more pipeline builds.
    ///
    /// @implNote Not thread-safe. Configure on one thread, then build.
    public static final class Builder {
        private SettingsHolder settings = new SettingsHolder();
        private BehaviorBuilder behaviorBuilder = new DefaultBehaviorBuilder();
        private PipelineModifications modifications = new PipelineModifications();

        private Builder() {}

        /// Sets the settings read by enablement predicates. Locked on build.
        ///
        /// @param settings the settings, not null
        /// @return this builder for chaining
        public Builder settings(SettingsHolder settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        /// Sets the builder that creates behaviors.
        ///
        /// @param behaviorBuilder the behavior builder, not null
        /// @return this builder for chaining
        public Builder behaviorBuilder(BehaviorBuilder behaviorBuilder) {
            this.behaviorBuilder =
                    Objects.requireNonNull(behaviorBuilder, "behaviorBuilder must not be null");
            return this;
        }

        /// Uses `modifications` instead of the builder's own collection.
        ///
        /// @param modifications collected registrations, not null
        /// @return this builder for chaining
        public Builder modifications(PipelineModifications modifications) {
            this.modifications =
                    Objects.requireNonNull(modifications, "modifications must not be null");
            return this;
        }

        /// Registers a step built by the behavior builder.
        ///
        /// @param stepId unique step id, not blank
        /// @param behaviorType the behavior type, not null
        /// @param signature shapes and role, not null
        /// @param description what the step does, not null
        /// @return the registration, for adding ordering constraints
        public RegisterStep register(
                String stepId,
                Class<? extends Behavior<?, ?>> behaviorType,
                BehaviorSignature signature,
                String description) {
            return modifications.add(
                    RegisterStep.create(stepId, behaviorType, signature, description));
        }

        /// Registers a pre-built step.
        ///
        /// @param step the registration, not null
        /// @return this builder for chaining
        public Builder register(RegisterStep step) {
            modifications.add(step);
            return this;
        }

        /// Requests removal of a step.
        ///
        /// @param stepId id of the step to remove, not blank
        /// @return this builder for chaining
        public Builder remove(String stepId) {
            modifications.remove(stepId);
            return this;
        }

        /// Requests replacement of a step's behavior.
        ///
        /// @param replacement the replacement, not null
        /// @return this builder for chaining
        public Builder replace(ReplaceStep replacement) {
            modifications.replace(replacement);
            return this;
        }

        /// Locks the settings and resolves the execution order without
        /// instantiating anything.
        ///
        /// @param rootShape shape of the first stage, not null
        /// @return the ordered model, never null
        public PipelineModel buildModel(ContextShape<?> rootShape) {
            settings.lock();
            return StepRegistrationCoordinator.from(modifications)
                    .buildPipelineModelFor(rootShape, settings);
        }

        /// Resolves, instantiates and compiles the pipeline.
        ///
        /// @param rootShape shape of the root context, not null
        /// @param <C> root context type
        /// @return the compiled pipeline, never null
        public <C extends BehaviorContext> CompiledPipeline<C> build(ContextShape<C> rootShape) {
            PipelineModel model = buildModel(rootShape);
            return ChainCompiler.compile(rootShape, model, behaviorBuilder);
        }
    }
}
