package io.arazzolens.core.graph;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GraphOptions {
    private final boolean includeFailureEdges;
    private final boolean warnOnConditionalSuppression;
    private final boolean reportUnreachableSteps;

    public static GraphOptions ofDefault() {
        return GraphOptions.builder()
                .includeFailureEdges(true)
                .warnOnConditionalSuppression(true)
                .reportUnreachableSteps(true)
                .build();
    }
}
