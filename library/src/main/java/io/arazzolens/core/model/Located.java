package io.arazzolens.core.model;

import io.arazzolens.core.tree.SourceRange;

/**
 * A plain value together with the range it was read from.
 */
public record Located<T>(T value, SourceRange range) {

    public static <T> Located<T> of(final T value, final SourceRange range) {
        return new Located<>(value, range);
    }
}
