package io.arazzolens.core.expression;

public interface ExpressionResolver {

    ResolutionResult resolve(final String expression, final ResolutionContext context);
}
