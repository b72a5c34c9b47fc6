package com.tradearena.backend.exception;

/**
 * A unit of work could not commit after its retries were used up.
 */
public class TransactionAbortException extends SettlementException {

    public TransactionAbortException(String message, Throwable cause) {
        super(message, cause);
    }
}
