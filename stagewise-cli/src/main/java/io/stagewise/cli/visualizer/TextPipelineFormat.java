package io.stagewise.cli.visualizer;

import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.model.Stage;
import io.stagewise.core.registration.Dependency;
import io.stagewise.core.registration.RegisterStep;
import java.util.ArrayList;
import java.util.List;

/// Plain text rendering: one numbered line per step, grouped by stage, with the
/// ordering constraints each step declared.
///
/// ```
/// Pipeline: IncomingContext
/// ==================================================
///
/// Stage 1: IncomingContext
///   1. LogMessage [LogMessageBehavior] - Logs the incoming message
///   2. Audit [AuditBehavior] - Counts processed messages
///      after: LogMessage (if present)
///   -> ToOutgoing [IncomingToOutgoingConnector] connects to OutgoingContext
/// ```
///
/// @implNote Thread-safe. Stateless rendering.
/// @see MermaidPipelineFormat for diagram output
public class TextPipelineFormat implements PipelineFormat {

    private static final String NL = System.lineSeparator();

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(PipelineModel model) {
        StringBuilder sb = new StringBuilder();
        sb.append("Pipeline: ").append(model.rootShape()).append(NL);
        sb.append("=".repeat(50)).append(NL);

        if (model.isEmpty()) {
            sb.append(NL).append("(no steps registered)").append(NL);
            return sb.toString();
        }

        int position = 1;
        int stageNumber = 1;
        for (Stage stage : model.stages()) {
            sb.append(NL)
                    .append("Stage ")
                    .append(stageNumber++)
                    .append(": ")
                    .append(stage.shape())
                    .append(NL);
            for (RegisterStep step : stage.steps()) {
                sb.append("  ").append(position++).append(". ").append(describe(step)).append(NL);
                renderConstraints(sb, step);
            }
            if (stage.hasConnector()) {
                RegisterStep connector = stage.connector();
                sb.append("  -> ").append(describe(connector));
                if (connector.getSignature().isTerminator()) {
                    sb.append(" ends the pipeline");
                } else {
                    sb.append(" connects to ").append(connector.getSignature().output());
                }
                sb.append(NL);
            }
        }
        return sb.toString();
    }

    private static String describe(RegisterStep step) {
        return step.getStepId()
                + " ["
                + step.getBehaviorType().getSimpleName()
                + "] - "
                + step.getDescription();
    }

    private static void renderConstraints(StringBuilder sb, RegisterStep step) {
        List<String> lines = new ArrayList<>();
        for (Dependency before : step.getBefores()) {
            lines.add("before: " + target(before));
        }
        for (Dependency after : step.getAfters()) {
            lines.add("after: " + target(after));
        }
        for (String line : lines) {
            sb.append("     ").append(line).append(NL);
        }
    }

    private static String target(Dependency dependency) {
        return dependency.enforced()
                ? dependency.dependsOnId()
                : dependency.dependsOnId() + " (if present)";
    }
}
