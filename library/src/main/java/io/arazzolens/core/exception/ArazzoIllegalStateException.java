package io.arazzolens.core.exception;

public class ArazzoIllegalStateException extends RuntimeException {

    public ArazzoIllegalStateException(final String message) {
        super(message);
    }

    public ArazzoIllegalStateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
