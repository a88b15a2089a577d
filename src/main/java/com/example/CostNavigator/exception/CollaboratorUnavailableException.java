package com.example.CostNavigator.exception;

/**
 * The natural-language inference collaborator timed out, failed, or answered with
 * something that could not be read. Always absorbed by the extraction layer.
 */
public class CollaboratorUnavailableException extends NavigatorException {

    public CollaboratorUnavailableException(String message) {
        super(message);
    }

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "collaborator_unavailable";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
