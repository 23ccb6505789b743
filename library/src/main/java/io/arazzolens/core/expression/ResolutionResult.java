package io.arazzolens.core.expression;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import lombok.Value;

import java.util.List;

@Value
public class ResolutionResult {
    // false only when an error was reported; warnings keep the expression valid
    boolean valid;
    ExpressionKind kind;
    ImmutableList<Diagnostic> diagnostics;

    public static ResolutionResult of(final ExpressionKind kind, final List<Diagnostic> diagnostics) {
        boolean valid = diagnostics.stream().noneMatch(Diagnostic::isError);
        return new ResolutionResult(valid, kind, ImmutableList.copyOf(diagnostics));
    }
}
