package io.arazzolens.core.ir;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import io.arazzolens.core.graph.GraphEdge;
import io.arazzolens.core.graph.GraphNode;
import io.arazzolens.core.graph.TransitionGraph;

import java.util.Collection;
import java.util.Objects;

/**
 * Maps a {@link TransitionGraph} onto the {@link GraphIr}. Node and edge order are taken from
 * the graph as is, so equal graphs always give equal IR. Labels only need what the graph carries.
 */
public class GraphIrEmitter {

    public GraphIr toIr(final TransitionGraph graph) {
        ImmutableList<IrNode> nodes = graph.getNodes().stream()
                .map(node -> new IrNode(node.getId(), node.getKind().getValue(), label(node, graph)))
                .collect(ImmutableList.toImmutableList());
        ImmutableList<IrEdge> edges = graph.getEdges().stream()
                .map(this::toIrEdge)
                .collect(ImmutableList.toImmutableList());
        return new GraphIr(graph.getWorkflowId(), nodes, edges);
    }

    private IrEdge toIrEdge(final GraphEdge edge) {
        return new IrEdge(edge.getFrom(), edge.getTo(), edge.getKind().getValue(), edge.getLabel());
    }

    private String label(final GraphNode node, final TransitionGraph graph) {
        switch (node.getKind()) {
            case INPUT:
                return "Inputs: " + names(graph.getInputNames());
            case OUTPUT:
                return "Outputs: " + names(graph.getOutputNames());
            case ERROR_SINK:
                return "Error";
            case WORKFLOW:
                return "Workflow: " + node.getRef();
            default:
                return stepLabel(node);
        }
    }

    private String stepLabel(final GraphNode node) {
        String name = Objects.nonNull(node.getRef()) ? node.getRef() : node.getId();
        String badge = HttpMethodHeuristic.guess(node.getOperationId())
                .map(method -> "[%s] ".formatted(method))
                .orElse("");
        return "%d. %s%s".formatted(node.getStepIndex() + 1, badge, name);
    }

    private static String names(final Collection<String> names) {
        return names.isEmpty() ? "none" : Joiner.on(", ").join(names);
    }
}
