package io.stagewise.core.model;

import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.registration.Dependency;
import io.stagewise.core.registration.RegisterStep;
import io.stagewise.core.util.StepIds;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Stable topological sort of the ordinary steps of one stage.
///
/// One node per step, in registration order. `insertBefore(X)` makes the step a
/// predecessor of X; `insertAfter(Y)` makes Y a predecessor of the step. Nodes
/// are visited in registration order and each node emits its predecessors
/// (in the order the edges were added) before itself, so unconstrained steps keep
/// their registration order.
///
/// ### Contracts
/// - **Postcondition**: every step appears exactly once
/// - References to ids outside the stage are missing: ignored when not enforced,
///   a {@link PipelineConfigurationException} listing the known ids otherwise
/// - A cycle among constraints is a {@link PipelineConfigurationException} naming
///   the cycle
final class StepGraph {

    private StepGraph() {}

    static List<RegisterStep> sort(List<RegisterStep> registrations) {
        if (registrations.isEmpty()) {
            return List.of();
        }

        Map<String, Node> nameToNode = new LinkedHashMap<>();
        List<Node> allNodes = new ArrayList<>(registrations.size());
        for (RegisterStep registration : registrations) {
            Node node = new Node(registration);
            nameToNode.put(StepIds.key(registration.getStepId()), node);
            allNodes.add(node);
        }

        for (Node node : allNodes) {
            for (Dependency before : node.step.getBefores()) {
                Node referenced = resolve(before, "insertBefore", nameToNode);
                if (referenced != null) {
                    referenced.previous.add(node);
                }
            }
            for (Dependency after : node.step.getAfters()) {
                Node referenced = resolve(after, "insertAfter", nameToNode);
                if (referenced != null) {
                    node.previous.add(referenced);
                }
            }
        }

        List<RegisterStep> output = new ArrayList<>(allNodes.size());
        List<Node> path = new ArrayList<>();
        for (Node node : allNodes) {
            visit(node, output, path);
        }
        return output;
    }

    private static Node resolve(Dependency dependency, String kind, Map<String, Node> nameToNode) {
        Node referenced = nameToNode.get(StepIds.key(dependency.dependsOnId()));
        if (referenced != null || !dependency.enforced()) {
            return referenced;
        }
        List<String> currentIds =
                nameToNode.values().stream().map(n -> n.step.getStepId()).toList();
        throw new PipelineConfigurationException(
                "Step '"
                        + dependency.dependsOnId()
                        + "' referenced by "
                        + kind
                        + " of step '"
                        + dependency.dependantId()
                        + "' does not exist. Current step ids: "
                        + StepIds.quoted(currentIds));
    }

    private static void visit(Node node, List<RegisterStep> output, List<Node> path) {
        if (node.state == State.VISITED) {
            return;
        }
        if (node.state == State.VISITING) {
            throw cycle(node, path);
        }
        node.state = State.VISITING;
        path.add(node);
        for (Node previous : node.previous) {
            visit(previous, output, path);
        }
        path.remove(path.size() - 1);
        node.state = State.VISITED;
        output.add(node.step);
    }

    private static PipelineConfigurationException cycle(Node repeated, List<Node> path) {
        List<Node> loop = new ArrayList<>(path.subList(path.indexOf(repeated), path.size()));
        loop.add(repeated);
        String description =
                loop.stream().map(n -> "'" + n.step.getStepId() + "'").collect(Collectors.joining(" -> "));
        return new PipelineConfigurationException(
                "Circular ordering constraints, each step must run after the next: " + description);
    }

    private enum State {
        UNVISITED,
        VISITING,
        VISITED
    }

    private static final class Node {
        private final RegisterStep step;
        private final List<Node> previous = new ArrayList<>();
        private State state = State.UNVISITED;

        private Node(RegisterStep step) {
            this.step = step;
        }
    }
}
