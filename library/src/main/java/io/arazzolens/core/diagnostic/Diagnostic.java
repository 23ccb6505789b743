package io.arazzolens.core.diagnostic;

import io.arazzolens.core.tree.SourceRange;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Diagnostic {

    @NonNull
    DiagnosticSeverity severity;
    @NonNull
    DiagnosticCategory category;
    @NonNull
    String message;
    @NonNull
    SourceRange range;

    public static Diagnostic error(final DiagnosticCategory category, final String message, final SourceRange range) {
        return new Diagnostic(DiagnosticSeverity.ERROR, category, message, range);
    }

    public static Diagnostic warning(final DiagnosticCategory category, final String message, final SourceRange range) {
        return new Diagnostic(DiagnosticSeverity.WARNING, category, message, range);
    }

    public boolean isError() {
        return severity == DiagnosticSeverity.ERROR;
    }

    public boolean isWarning() {
        return severity == DiagnosticSeverity.WARNING;
    }

    @Override
    public String toString() {
        return "%s %s %s: %s".formatted(severity.getValue(), category.getValue(), range, message);
    }
}
