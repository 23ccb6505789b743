package io.arazzolens.core.tree;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Stands in for an absent key. Carries the range of the closest enclosing node.
 */
@ToString
@EqualsAndHashCode
public final class MissingNode implements RangedNode {

    private final SourceRange range;

    private MissingNode(final SourceRange range) {
        this.range = range;
    }

    public static MissingNode at(final SourceRange range) {
        return new MissingNode(range);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MISSING;
    }

    @Override
    public SourceRange range() {
        return range;
    }
}
