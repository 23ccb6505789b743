package io.arazzolens.core.tree;

import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

@ToString
@EqualsAndHashCode
public final class MapNode implements RangedNode {

    private final ImmutableMap<String, RangedNode> entries;
    private final ImmutableMap<String, SourceRange> keyRanges;
    private final SourceRange range;

    public MapNode(final Map<String, RangedNode> entries,
                   final Map<String, SourceRange> keyRanges,
                   final SourceRange range) {
        this.entries = ImmutableMap.copyOf(entries);
        this.keyRanges = ImmutableMap.copyOf(keyRanges);
        this.range = Objects.requireNonNull(range);
    }

    public MapNode(final Map<String, RangedNode> entries, final SourceRange range) {
        this(entries, ImmutableMap.of(), range);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAP;
    }

    @Override
    public SourceRange range() {
        return range;
    }

    @Override
    public RangedNode get(final String key) {
        RangedNode node = entries.get(key);
        return Objects.nonNull(node) ? node : MissingNode.at(range);
    }

    @Override
    public Set<String> keys() {
        return entries.keySet();
    }

    /**
     * @return the range of the key token, falling back to the value range
     */
    public SourceRange keyRange(final String key) {
        SourceRange keyRange = keyRanges.get(key);
        return Objects.nonNull(keyRange) ? keyRange : get(key).range();
    }

    public Map<String, RangedNode> entries() {
        return entries;
    }
}
