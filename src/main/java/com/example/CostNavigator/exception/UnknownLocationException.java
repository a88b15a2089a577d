package com.example.CostNavigator.exception;

import lombok.Getter;

@Getter
public class UnknownLocationException extends NavigatorException {

    private final String postalCode;

    public UnknownLocationException(String postalCode) {
        super("Unknown or unsupported ZIP code: " + postalCode);
        this.postalCode = postalCode;
    }

    @Override
    public String code() {
        return "unknown_location";
    }
}
