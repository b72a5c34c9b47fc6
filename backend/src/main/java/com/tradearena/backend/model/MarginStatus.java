package com.tradearena.backend.model;

public enum MarginStatus {
    SAFE,
    WARNING,
    MARGIN_CALL,
    LIQUIDATION
}
