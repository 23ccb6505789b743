package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class RequestBody extends ArazzoElement {
    private final String contentType;
    // every string scalar found in the payload, in document order
    @Builder.Default
    private final ImmutableList<Located<String>> payloadStrings = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<PayloadReplacement> replacements = ImmutableList.of();
}
