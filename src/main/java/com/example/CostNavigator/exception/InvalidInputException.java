package com.example.CostNavigator.exception;

import lombok.Getter;

@Getter
public class InvalidInputException extends NavigatorException {

    private final String field;

    public InvalidInputException(String field, String reason) {
        super(reason);
        this.field = field;
    }

    @Override
    public String code() {
        return "invalid_input";
    }
}
