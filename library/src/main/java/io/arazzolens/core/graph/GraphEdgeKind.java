package io.arazzolens.core.graph;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GraphEdgeKind {
    SEQUENTIAL("sequential"),
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;
}
