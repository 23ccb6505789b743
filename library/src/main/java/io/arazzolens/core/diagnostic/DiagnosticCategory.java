package io.arazzolens.core.diagnostic;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Origin of a diagnostic. Every category except {@link #GRAPH_WARNING} defaults to error severity.
 */
@Getter
@AllArgsConstructor
public enum DiagnosticCategory {
    SYNTAX_ERROR("SyntaxError"),
    STRUCTURAL_ERROR("StructuralError"),
    REFERENCE_ERROR("ReferenceError"),
    EXPRESSION_ERROR("ExpressionError"),
    GRAPH_WARNING("GraphWarning");

    private final String value;
}
