package io.arazzolens.core.graph;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GraphNodeKind {
    STEP("step"),
    INPUT("input"),
    OUTPUT("output"),
    ERROR_SINK("errorSink"),
    // placeholder for a workflow targeted by an action
    WORKFLOW("workflow");

    private final String value;
}
