package io.arazzolens.core.tree;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Objects;

@ToString
@EqualsAndHashCode
public final class ScalarNode implements RangedNode {

    private final Object value;
    private final String text;
    private final SourceRange range;

    public ScalarNode(final Object value, final String text, final SourceRange range) {
        this.value = value;
        this.text = text;
        this.range = Objects.requireNonNull(range);
    }

    public static ScalarNode of(final Object value, final SourceRange range) {
        return new ScalarNode(value, Objects.isNull(value) ? null : String.valueOf(value), range);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SCALAR;
    }

    @Override
    public SourceRange range() {
        return range;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public String text() {
        return text;
    }

    public boolean isNull() {
        return Objects.isNull(value);
    }
}
