package io.arazzolens.infrastructure.parsing;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ArazzoParseOptions {

    // allows the x-oai- and x-oas- extension prefixes
    private final boolean oaiAuthor;
    private final boolean allowEmptyStrings;
    private final boolean reportUnexpectedAttributes;

    public static ArazzoParseOptions ofDefault() {
        return ArazzoParseOptions.builder()
                .oaiAuthor(false)
                .allowEmptyStrings(false)
                .reportUnexpectedAttributes(true)
                .build();
    }
}
