package com.tradearena.backend.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends ValidationException {

    private final Long userId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientFundsException(Long userId, BigDecimal requested, BigDecimal available) {
        super("Insufficient balance: requested " + requested.toPlainString()
                + ", available " + available.toPlainString());
        this.userId = userId;
        this.requested = requested;
        this.available = available;
    }
}
