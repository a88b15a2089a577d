package com.example.CostNavigator.model;

public record ErrorResponse(ErrorBody error, boolean retryable) {

    public static ErrorResponse of(String code, String message, boolean retryable) {
        return new ErrorResponse(new ErrorBody(code, message), retryable);
    }

    public record ErrorBody(String code, String message) {
    }
}
