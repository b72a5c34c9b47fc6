package com.tradearena.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

public record LedgerChainReport(
        Long userId,
        int transactionsChecked,
        BigDecimal replayedBalance,
        BigDecimal walletBalance,
        List<String> mismatches
) {
    @JsonProperty
    public boolean consistent() {
        return mismatches.isEmpty();
    }
}
