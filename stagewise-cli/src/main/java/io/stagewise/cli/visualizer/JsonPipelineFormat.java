package io.stagewise.cli.visualizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagewise.core.model.PipelineModel;
import io.stagewise.core.model.Stage;
import io.stagewise.core.registration.Dependency;
import io.stagewise.core.registration.RegisterStep;

/// Pretty-printed JSON rendering of a resolved pipeline, for tooling that wants
/// the order without parsing text.
///
/// ```
/// {
///   "rootShape" : "IncomingContext",
///   "stages" : [ {
///     "shape" : "IncomingContext",
///     "steps" : [ { "id" : "LogMessage", "behaviorType" : "...", "role" : "BEHAVIOR", ... } ],
///     "connector" : { "id" : "ToOutgoing", ..., "leadsTo" : "OutgoingContext" }
///   } ]
/// }
/// ```
///
/// Every step carries its `before` and `after` constraints; `connector` is
/// omitted for a final stage without one.
///
/// @implNote Thread-safe. The mapper is configured once and only used for writing.
/// @see TextPipelineFormat for plain text output
public class JsonPipelineFormat implements PipelineFormat {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getName() {
        return "json";
    }

    @Override
    public String render(PipelineModel model) {
        ObjectNode root = mapper.createObjectNode();
        root.put("rootShape", model.rootShape().toString());
        ArrayNode stages = root.putArray("stages");
        for (Stage stage : model.stages()) {
            ObjectNode stageNode = stages.addObject();
            stageNode.put("shape", stage.shape().toString());
            ArrayNode steps = stageNode.putArray("steps");
            for (RegisterStep step : stage.steps()) {
                writeStep(steps.addObject(), step);
            }
            if (stage.hasConnector()) {
                ObjectNode connector = stageNode.putObject("connector");
                writeStep(connector, stage.connector());
                if (!stage.connector().getSignature().isTerminator()) {
                    connector.put("leadsTo", stage.connector().getSignature().output().toString());
                }
            }
        }

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render pipeline as JSON: " + e.getMessage(), e);
        }
    }

    private static void writeStep(ObjectNode node, RegisterStep step) {
        node.put("id", step.getStepId());
        node.put("behaviorType", step.getBehaviorType().getName());
        node.put("role", step.getSignature().role().name());
        node.put("description", step.getDescription());
        writeConstraints(node.putArray("before"), step.getBefores());
        writeConstraints(node.putArray("after"), step.getAfters());
    }

    private static void writeConstraints(ArrayNode array, Iterable<Dependency> dependencies) {
        for (Dependency dependency : dependencies) {
            array.addObject()
                    .put("stepId", dependency.dependsOnId())
                    .put("enforced", dependency.enforced());
        }
    }
}
