package com.tradearena.backend.model;

public enum TieBreaker {
    /** Fewer trades ranks higher. */
    TRADES_COUNT,
    WIN_RATE,
    TOTAL_CAPITAL,
    ROI,
    /** Earlier entry ranks higher. */
    JOIN_TIME
}
