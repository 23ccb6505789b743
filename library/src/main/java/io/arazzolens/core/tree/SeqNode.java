package io.arazzolens.core.tree;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

@ToString
@EqualsAndHashCode
public final class SeqNode implements RangedNode {

    private final ImmutableList<RangedNode> items;
    private final SourceRange range;

    public SeqNode(final List<RangedNode> items, final SourceRange range) {
        this.items = ImmutableList.copyOf(items);
        this.range = Objects.requireNonNull(range);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEQ;
    }

    @Override
    public SourceRange range() {
        return range;
    }

    @Override
    public List<RangedNode> items() {
        return items;
    }
}
