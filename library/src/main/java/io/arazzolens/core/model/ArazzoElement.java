package io.arazzolens.core.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.arazzolens.core.tree.SourceRange;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Common part of every entity of the model: the source range of its node, the declared keys
 * with the range of their values, and whether the node could be interpreted at all.
 * <p>
 * An element with {@code valid == false} is a stub: the node had the wrong shape and only the
 * range (and whatever fields could be read) survive.
 */
@Getter
@ToString
@EqualsAndHashCode
@SuperBuilder
public abstract class ArazzoElement {

    @NonNull
    @Builder.Default
    private final SourceRange range = SourceRange.EMPTY;

    @NonNull
    @Builder.Default
    private final ImmutableMap<String, SourceRange> keyRanges = ImmutableMap.of();

    // declared keys whose value had the wrong kind; already reported while building
    @NonNull
    @Builder.Default
    private final ImmutableSet<String> malformedKeys = ImmutableSet.of();

    @Builder.Default
    private final boolean valid = true;

    public boolean has(final String key) {
        return keyRanges.containsKey(key);
    }

    public boolean isMalformed(final String key) {
        return malformedKeys.contains(key);
    }

    public SourceRange rangeOf(final String key) {
        return keyRanges.getOrDefault(key, range);
    }
}
