package com.tradearena.backend.service.risk;

import com.tradearena.backend.model.MarginStatus;
import com.tradearena.backend.model.MarginThresholds;
import com.tradearena.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Margin level is {@code (currentCapital + unrealizedPnl) / usedMargin * 100}. Without used
 * margin the level is unbounded and the participant is SAFE.
 */
public final class MarginCalculator {

    private MarginCalculator() {
    }

    public static BigDecimal equity(BigDecimal currentCapital, BigDecimal unrealizedPnl) {
        return MoneyUtils.add(currentCapital, unrealizedPnl);
    }

    /**
     * @return the level in percent, or {@code null} when no margin is in use
     */
    public static BigDecimal marginLevel(BigDecimal equity, BigDecimal usedMargin) {
        if (usedMargin == null || usedMargin.signum() <= 0) {
            return null;
        }
        return equity.multiply(MoneyUtils.HUNDRED).divide(usedMargin, MoneyUtils.SCALE, RoundingMode.DOWN);
    }

    /**
     * Compares {@code equity * 100} against {@code threshold * usedMargin} so that a level sitting
     * exactly on a threshold is never moved across it by rounding.
     */
    public static MarginStatus classify(BigDecimal equity, BigDecimal usedMargin, MarginThresholds thresholds) {
        if (usedMargin == null || usedMargin.signum() <= 0) {
            return MarginStatus.SAFE;
        }
        BigDecimal scaledEquity = equity.multiply(MoneyUtils.HUNDRED);
        if (scaledEquity.compareTo(thresholds.getLiquidation().multiply(usedMargin)) <= 0) {
            return MarginStatus.LIQUIDATION;
        }
        if (scaledEquity.compareTo(thresholds.getMarginCall().multiply(usedMargin)) <= 0) {
            return MarginStatus.MARGIN_CALL;
        }
        if (scaledEquity.compareTo(thresholds.getWarning().multiply(usedMargin)) < 0) {
            return MarginStatus.WARNING;
        }
        return MarginStatus.SAFE;
    }
}
