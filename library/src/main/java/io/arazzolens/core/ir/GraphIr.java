package io.arazzolens.core.ir;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;

/**
 * Renderer neutral form of a transition graph.
 */
@Value
public class GraphIr {
    String workflowId;
    @NonNull
    ImmutableList<IrNode> nodes;
    @NonNull
    ImmutableList<IrEdge> edges;
}
