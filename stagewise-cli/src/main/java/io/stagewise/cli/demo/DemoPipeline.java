package io.stagewise.cli.demo;

import io.stagewise.core.PipelineFactory;
import io.stagewise.core.behavior.ContextShape;
import io.stagewise.core.registration.BehaviorSignature;
import io.stagewise.core.registration.RegisterStep;
import io.stagewise.core.settings.ReadOnlySettings;
import io.stagewise.core.util.StepIds;

/// Registrations of the demo pipeline.
///
/// ```
/// IncomingContext: LogMessage -> Audit -> CheckCancellation -> ToOutgoing
/// OutgoingContext: Dispatch (terminator)
/// ```
///
/// Every step can be switched off with the setting returned by
/// {@link #disabledKey(String)}. Ordering uses soft constraints, so disabling an
/// ordinary step leaves the rest in place.
public final class DemoPipeline {

    public static final ContextShape<IncomingContext> INCOMING =
            ContextShape.of(IncomingContext.class);
    public static final ContextShape<OutgoingContext> OUTGOING =
            ContextShape.of(OutgoingContext.class);

    public static final String LOG_MESSAGE = "LogMessage";
    public static final String AUDIT = "Audit";
    public static final String CHECK_CANCELLATION = "CheckCancellation";
    public static final String TO_OUTGOING = "ToOutgoing";
    public static final String DISPATCH = "Dispatch";

    private static final String DISABLED_PREFIX = "stagewise.disabled.";

    private DemoPipeline() {}

    /// Settings key that disables `stepId` when set to `true`.
    ///
    /// @param stepId id of a demo step, not blank
    /// @return the settings key, never null
    public static String disabledKey(String stepId) {
        return DISABLED_PREFIX + StepIds.requireValid(stepId, "stepId");
    }

    /// Adds the demo steps to `factory`.
    ///
    /// @param factory the factory to register with, not null
    /// @return the same factory for chaining
    public static PipelineFactory.Builder register(PipelineFactory.Builder factory) {
        BehaviorSignature incoming = BehaviorSignature.behavior(INCOMING);

        switchable(
                factory.register(
                        LOG_MESSAGE, LogMessageBehavior.class, incoming, "Logs the incoming message"));
        switchable(
                        factory.register(
                                AUDIT, AuditBehavior.class, incoming, "Counts processed messages"))
                .insertAfterIfExists(LOG_MESSAGE);
        switchable(
                        factory.register(
                                CHECK_CANCELLATION,
                                CancellationCheckBehavior.class,
                                incoming,
                                "Aborts when cancellation was requested"))
                .insertAfterIfExists(AUDIT)
                .insertAfterIfExists(LOG_MESSAGE);
        switchable(
                factory.register(
                        TO_OUTGOING,
                        IncomingToOutgoingConnector.class,
                        BehaviorSignature.connector(INCOMING, OUTGOING),
                        "Turns the message into an outgoing payload"));
        switchable(
                factory.register(
                        DISPATCH,
                        DispatchTerminator.class,
                        BehaviorSignature.terminator(OUTGOING),
                        "Sends the payload"));
        return factory;
    }

    private static RegisterStep switchable(RegisterStep step) {
        String key = disabledKey(step.getStepId());
        return step.enabledWhen(settings -> !isDisabled(settings, key));
    }

    private static boolean isDisabled(ReadOnlySettings settings, String key) {
        return settings.getOrDefault(key, Boolean.class, Boolean.FALSE);
    }
}
