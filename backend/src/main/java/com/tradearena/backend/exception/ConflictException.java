package com.tradearena.backend.exception;

/**
 * Concurrent modification or a state that another operation already moved past.
 * Callers retry the whole logical operation.
 */
public class ConflictException extends SettlementException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
