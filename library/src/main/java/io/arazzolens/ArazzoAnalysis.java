package io.arazzolens;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.graph.TransitionGraph;
import io.arazzolens.core.ir.GraphIr;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.EntityRef;
import io.arazzolens.core.symbol.SymbolNode;
import lombok.NonNull;
import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything derived from one revision of a document. Graphs and their IR are listed in
 * workflow declaration order; stub workflows have none.
 */
@Value
public class ArazzoAnalysis {
    @NonNull
    ArazzoDocument document;
    @NonNull
    ImmutableList<Diagnostic> diagnostics;
    @NonNull
    ImmutableList<EntityRef> stubs;
    @NonNull
    ImmutableList<TransitionGraph> graphs;
    @NonNull
    ImmutableList<GraphIr> graphIrs;
    @NonNull
    ImmutableList<SymbolNode> symbols;

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public Optional<TransitionGraph> findGraph(final String workflowId) {
        return graphs.stream()
                .filter(graph -> Objects.equals(graph.getWorkflowId(), workflowId))
                .findFirst();
    }

    public Optional<GraphIr> findGraphIr(final String workflowId) {
        return graphIrs.stream()
                .filter(ir -> Objects.equals(ir.getWorkflowId(), workflowId))
                .findFirst();
    }
}
