package com.tradearena.backend.exception;

public class NotFoundException extends SettlementException {

    public NotFoundException(String message) {
        super(message);
    }
}
