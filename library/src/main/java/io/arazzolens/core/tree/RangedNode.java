package io.arazzolens.core.tree;

import java.util.List;
import java.util.Set;

/**
 * Minimal view of a parsed document node. Implementations are closed:
 * {@link MapNode}, {@link SeqNode}, {@link ScalarNode} and {@link MissingNode}.
 * <p>
 * Lookups never return {@code null}; absent keys and out of range indices yield {@link MissingNode}.
 */
public interface RangedNode {

    NodeKind kind();

    SourceRange range();

    default boolean isMap() {
        return kind() == NodeKind.MAP;
    }

    default boolean isSeq() {
        return kind() == NodeKind.SEQ;
    }

    default boolean isScalar() {
        return kind() == NodeKind.SCALAR;
    }

    default boolean isMissing() {
        return kind() == NodeKind.MISSING;
    }

    default RangedNode get(final String key) {
        return MissingNode.at(range());
    }

    default boolean has(final String key) {
        return !get(key).isMissing();
    }

    default Set<String> keys() {
        return Set.of();
    }

    default List<RangedNode> items() {
        return List.of();
    }

    /**
     * @return the scalar value ({@link String}, {@link Number}, {@link Boolean}) or {@code null}
     */
    default Object value() {
        return null;
    }

    /**
     * @return the scalar as written in the document, {@code null} for non-scalars and YAML/JSON null
     */
    default String text() {
        return null;
    }
}
