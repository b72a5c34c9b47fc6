package com.tradearena.backend.model;

public enum TiePrizePolicy {
    SPLIT_EQUALLY,
    SPLIT_WEIGHTED,
    FIRST_GETS_ALL
}
