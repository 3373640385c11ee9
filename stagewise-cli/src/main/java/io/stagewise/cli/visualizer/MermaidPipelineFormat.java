package io.stagewise.cli.visualizer;

import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.model.Stage;
import io.stagewise.core.registration.RegisterStep;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Mermaid flowchart rendering of a resolved pipeline, wrapped in a Markdown code
/// block. Output can be pasted into GitHub Markdown or [mermaid.live](https://mermaid.live).
///
/// ### Shape Mapping
/// - **Behavior**: rectangle with its behavior type
/// - **Stage connector**: hexagon
/// - **Terminator**: stadium
///
/// Each stage becomes a subgraph; a solid arrow links every step to the next one
/// in execution order.
///
/// Node ids are step ids with every character outside `[a-zA-Z0-9_]` replaced by
/// `_`. When two step ids map to the same node id, the later step gets its
/// 1-based position in execution order appended (`a_b`, `a_b_2`).
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextPipelineFormat for plain text output
public class MermaidPipelineFormat implements PipelineFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(PipelineModel model) {
        StringBuilder sb = new StringBuilder();
        Set<String> usedIds = new HashSet<>();
        List<String> stageIds = model.stages().stream()
                .map(stage -> uniqueId(sanitizeId("stage_" + stage.shape()), usedIds, 0))
                .toList();
        List<RegisterStep> steps = model.steps();
        Map<RegisterStep, String> nodeIds = new IdentityHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            RegisterStep step = steps.get(i);
            nodeIds.put(step, uniqueId(sanitizeId(step.getStepId()), usedIds, i + 1));
        }

        sb.append("```mermaid\n");
        sb.append("flowchart LR\n");

        for (int s = 0; s < model.stages().size(); s++) {
            Stage stage = model.stages().get(s);
            String stageName = stage.shape().toString();
            sb.append("  subgraph ")
                    .append(stageIds.get(s))
                    .append("[\"")
                    .append(stageName)
                    .append("\"]\n");
            for (RegisterStep step : stage.steps()) {
                renderStep(sb, step, nodeIds.get(step));
            }
            if (stage.hasConnector()) {
                renderStep(sb, stage.connector(), nodeIds.get(stage.connector()));
            }
            sb.append("  end\n");
        }

        if (!steps.isEmpty()) {
            sb.append("\n");
        }
        for (int i = 1; i < steps.size(); i++) {
            sb.append("  ")
                    .append(nodeIds.get(steps.get(i - 1)))
                    .append(" --> ")
                    .append(nodeIds.get(steps.get(i)))
                    .append("\n");
        }

        sb.append("```\n");
        return sb.toString();
    }

    private void renderStep(StringBuilder sb, RegisterStep step, String id) {
        String label = step.getStepId() + "\\n[" + step.getBehaviorType().getSimpleName() + "]";

        String shape;
        if (step.getSignature().isTerminator()) {
            shape = id + "([\"" + label + "\"])";
        } else if (step.isStageConnector()) {
            shape = id + "{{\"" + label + "\"}}";
        } else {
            shape = id + "[\"" + label + "\"]";
        }
        sb.append("    ").append(shape).append("\n");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        // Prefix reserved Mermaid keywords
        if (isReservedKeyword(sanitized)) {
            return "step_" + sanitized;
        }
        return sanitized;
    }

    private String uniqueId(String id, Set<String> usedIds, int position) {
        String candidate = id;
        int suffix = Math.max(position, 2);
        while (!usedIds.add(candidate)) {
            candidate = id + "_" + suffix++;
        }
        return candidate;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "end",
                    "subgraph",
                    "graph",
                    "flowchart",
                    "direction",
                    "click",
                    "style",
                    "classdef",
                    "class",
                    "linkstyle" -> true;
            default -> false;
        };
    }
}
