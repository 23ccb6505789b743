package io.arazzolens.core.expression;

public class ExpressionSyntaxException extends RuntimeException {

    public ExpressionSyntaxException(final String message) {
        super(message);
    }
}
