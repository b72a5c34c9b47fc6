package com.tradearena.backend.dto;

import com.tradearena.backend.model.MarginStatus;

import java.math.BigDecimal;

/**
 * Outcome of one margin evaluation. {@code marginLevel} is null when no margin is in use.
 */
public record RiskAssessment(
        Long participantId,
        BigDecimal marginLevel,
        MarginStatus status,
        boolean liquidated,
        boolean priceUnavailable,
        int positionsClosed
) {
    public static RiskAssessment skipped(Long participantId) {
        return new RiskAssessment(participantId, null, MarginStatus.SAFE, false, false, 0);
    }
}
