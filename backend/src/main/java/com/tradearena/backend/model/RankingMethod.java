package com.tradearena.backend.model;

public enum RankingMethod {
    PNL,
    ROI,
    TOTAL_CAPITAL,
    WIN_RATE,
    TOTAL_WINS,
    PROFIT_FACTOR
}
