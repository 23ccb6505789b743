package io.arazzolens.core.graph;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Control flow of one workflow. Nodes and edges keep the order in which they were built.
 */
@Value
public class TransitionGraph {
    String workflowId;
    // declared input properties and output names of the workflow
    @NonNull
    ImmutableList<String> inputNames;
    @NonNull
    ImmutableList<String> outputNames;
    @NonNull
    ImmutableList<GraphNode> nodes;
    @NonNull
    ImmutableList<GraphEdge> edges;

    public Optional<GraphNode> findNode(final String id) {
        return nodes.stream().filter(node -> node.getId().equals(id)).findFirst();
    }

    public ImmutableList<GraphEdge> outgoing(final String id) {
        return edges.stream()
                .filter(edge -> Objects.equals(edge.getFrom(), id))
                .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<String> nodeIds() {
        return nodes.stream().map(GraphNode::getId).collect(ImmutableList.toImmutableList());
    }
}
