package io.arazzolens.core.graph;

import io.arazzolens.core.tree.SourceRange;
import lombok.NonNull;
import lombok.Value;

@Value
public class GraphNode {

    public static final String INPUT_ID = "input";
    public static final String OUTPUT_ID = "output";
    public static final String ERROR_SINK_ID = "errorSink";
    public static final String WORKFLOW_ID_PREFIX = "workflow:";

    @NonNull
    String id;
    @NonNull
    GraphNodeKind kind;
    // stepId for step nodes, target workflow for placeholders, null otherwise
    String ref;
    // declaration index for step nodes, -1 otherwise
    int stepIndex;
    // operationId of step nodes
    String operationId;
    @NonNull
    SourceRange range;

    public static GraphNode input(final SourceRange range) {
        return new GraphNode(INPUT_ID, GraphNodeKind.INPUT, null, -1, null, range);
    }

    public static GraphNode output(final SourceRange range) {
        return new GraphNode(OUTPUT_ID, GraphNodeKind.OUTPUT, null, -1, null, range);
    }

    public static GraphNode errorSink(final SourceRange range) {
        return new GraphNode(ERROR_SINK_ID, GraphNodeKind.ERROR_SINK, null, -1, null, range);
    }

    public static GraphNode workflow(final String workflowId, final SourceRange range) {
        return new GraphNode(WORKFLOW_ID_PREFIX + workflowId, GraphNodeKind.WORKFLOW, workflowId, -1, null, range);
    }

    public boolean isStep() {
        return kind == GraphNodeKind.STEP;
    }
}
