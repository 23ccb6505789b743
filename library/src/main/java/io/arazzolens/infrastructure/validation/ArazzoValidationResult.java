package io.arazzolens.infrastructure.validation;

import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.model.ArazzoElement;
import io.arazzolens.core.tree.SourceRange;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Getter
@Builder
@ToString
public class ArazzoValidationResult {

    @Builder.Default
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void addMissing(final String key, final ArazzoElement element) {
        addError("Missing required field: %s".formatted(key), element.getRange());
    }

    public void addError(final String message, final SourceRange range) {
        addError(DiagnosticCategory.STRUCTURAL_ERROR, message, range);
    }

    public void addError(final DiagnosticCategory category, final String message, final SourceRange range) {
        diagnostics.add(Diagnostic.error(category, message, range));
    }

    public void addWarning(final String message, final SourceRange range) {
        diagnostics.add(Diagnostic.warning(DiagnosticCategory.STRUCTURAL_ERROR, message, range));
    }

    public void addAll(final Collection<Diagnostic> other) {
        diagnostics.addAll(other);
    }

    public void merge(final ArazzoValidationResult otherResult) {
        diagnostics.addAll(otherResult.diagnostics);
    }

    public boolean isInvalid() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
