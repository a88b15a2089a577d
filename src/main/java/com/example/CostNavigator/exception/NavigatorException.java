package com.example.CostNavigator.exception;

/**
 * Base type for failures that end a navigator request.
 * Each subtype maps to one stable error code on the API surface.
 */
public abstract class NavigatorException extends RuntimeException {

    protected NavigatorException(String message) {
        super(message);
    }

    protected NavigatorException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code returned to clients. */
    public abstract String code();

    /** Whether the caller may retry the same request unchanged. */
    public boolean retryable() {
        return false;
    }
}
