package io.arazzolens;

import io.arazzolens.core.graph.GraphOptions;
import io.arazzolens.infrastructure.parsing.ArazzoParseOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class ArazzoAnalyzerOptions {
    @NonNull
    private final ArazzoParseOptions parseOptions;
    @NonNull
    private final ArazzoValidationOptions validationOptions;
    @NonNull
    private final GraphOptions graphOptions;

    public static ArazzoAnalyzerOptions ofDefault() {
        return ArazzoAnalyzerOptions.builder()
                .parseOptions(ArazzoParseOptions.ofDefault())
                .validationOptions(ArazzoValidationOptions.ofDefault())
                .graphOptions(GraphOptions.ofDefault())
                .build();
    }
}
