package io.arazzolens.core.diagnostic;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum DiagnosticSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String value;
}
