package io.arazzolens.core.symbol;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.tree.SourceRange;
import lombok.NonNull;
import lombok.Value;

@Value
public class SymbolNode {
    @NonNull
    String name;
    // summary or description of the entity, empty when absent
    @NonNull
    String detail;
    @NonNull
    SymbolKind kind;
    @NonNull
    SourceRange range;
    @NonNull
    ImmutableList<SymbolNode> children;

    public static SymbolNode leaf(final String name, final String detail, final SymbolKind kind, final SourceRange range) {
        return new SymbolNode(name, detail, kind, range, ImmutableList.of());
    }
}
