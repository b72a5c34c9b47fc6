package com.tradearena.backend.exception;

public class ValidationException extends SettlementException {

    public ValidationException(String message) {
        super(message);
    }
}
