package com.example.CostNavigator.exception;

public class StorageUnavailableException extends NavigatorException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "storage_unavailable";
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
