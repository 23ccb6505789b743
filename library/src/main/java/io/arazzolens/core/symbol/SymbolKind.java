package io.arazzolens.core.symbol;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SymbolKind {
    MODULE("module"),
    INTERFACE("interface"),
    CLASS("class"),
    METHOD("method"),
    FUNCTION("function"),
    FIELD("field"),
    // list items without an identifier
    ARRAY("array");

    private final String value;
}
