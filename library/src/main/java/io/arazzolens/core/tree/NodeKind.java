package io.arazzolens.core.tree;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum NodeKind {
    MAP("object"),
    SEQ("array"),
    SCALAR("scalar"),
    MISSING("missing");

    private final String value;
}
