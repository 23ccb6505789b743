package io.arazzolens.core.graph;

import lombok.NonNull;
import lombok.Value;

@Value
public class GraphEdge {
    @NonNull
    String from;
    @NonNull
    String to;
    @NonNull
    GraphEdgeKind kind;
    String label;

    public static GraphEdge sequential(final String from, final String to) {
        return new GraphEdge(from, to, GraphEdgeKind.SEQUENTIAL, null);
    }

    @Override
    public String toString() {
        return "%s -> %s".formatted(from, to);
    }
}
