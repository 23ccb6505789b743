package io.arazzolens.infrastructure.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.arazzolens.core.exception.ArazzoIllegalStateException;
import io.arazzolens.core.ir.GraphIr;
import io.arazzolens.core.ir.IrEdge;
import io.arazzolens.core.ir.IrNode;

import java.util.Objects;

/**
 * Serialises {@link GraphIr} to JSON. Fields are written in a fixed order so that equal IR
 * always gives byte-identical output.
 */
public class GraphIrWriter {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(final GraphIr ir) {
        try {
            return JSON_MAPPER.writeValueAsString(toTree(ir));
        } catch (JsonProcessingException e) {
            throw new ArazzoIllegalStateException("Failed to serialise graph of workflow '%s'".formatted(ir.getWorkflowId()), e);
        }
    }

    public ObjectNode toTree(final GraphIr ir) {
        ObjectNode root = JSON_MAPPER.createObjectNode();
        if (Objects.nonNull(ir.getWorkflowId())) {
            root.put("workflowId", ir.getWorkflowId());
        } else {
            root.putNull("workflowId");
        }

        ArrayNode nodes = root.putArray("nodes");
        for (IrNode node : ir.getNodes()) {
            nodes.addObject()
                    .put("id", node.getId())
                    .put("kind", node.getKind())
                    .put("label", node.getLabel());
        }

        ArrayNode edges = root.putArray("edges");
        for (IrEdge edge : ir.getEdges()) {
            ObjectNode edgeNode = edges.addObject()
                    .put("from", edge.getFrom())
                    .put("to", edge.getTo())
                    .put("kind", edge.getKind());
            if (Objects.nonNull(edge.getLabel())) {
                edgeNode.put("label", edge.getLabel());
            }
        }
        return root;
    }
}
