package com.tradearena.backend.service.ranking;

import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.RankingMethod;
import com.tradearena.backend.model.TieBreaker;
import com.tradearena.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived participant figures used by ranking and the leaderboard snapshot.
 */
public final class ParticipantMetrics {

    static final BigDecimal PROFIT_FACTOR_CAP = BigDecimal.valueOf(9999);
    private static final int RATIO_SCALE = 8;

    private ParticipantMetrics() {
    }

    public static BigDecimal pnl(Participant participant) {
        return MoneyUtils.subtract(participant.getCurrentCapital(), participant.getStartingCapital());
    }

    public static BigDecimal pnlPercentage(Participant participant) {
        if (participant.getStartingCapital() == null || participant.getStartingCapital().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return pnl(participant).multiply(MoneyUtils.HUNDRED)
                .divide(participant.getStartingCapital(), RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal winRate(Participant participant) {
        if (participant.getTotalTrades() == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(participant.getWinningTrades()).multiply(MoneyUtils.HUNDRED)
                .divide(BigDecimal.valueOf(participant.getTotalTrades()), RATIO_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Gross profit over gross loss, 9999 with profit but no losses, 0 with neither.
     */
    public static BigDecimal profitFactor(Participant participant) {
        BigDecimal profit = participant.getGrossProfit() == null ? BigDecimal.ZERO : participant.getGrossProfit();
        BigDecimal loss = participant.getGrossLoss() == null ? BigDecimal.ZERO : participant.getGrossLoss();
        if (loss.signum() == 0) {
            return profit.signum() > 0 ? PROFIT_FACTOR_CAP : BigDecimal.ZERO;
        }
        return profit.divide(loss, RATIO_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal primary(Participant participant, RankingMethod method) {
        return switch (method) {
            case PNL -> pnl(participant);
            case ROI -> pnlPercentage(participant);
            case TOTAL_CAPITAL -> participant.getCurrentCapital();
            case WIN_RATE -> winRate(participant);
            case TOTAL_WINS -> BigDecimal.valueOf(participant.getWinningTrades());
            case PROFIT_FACTOR -> profitFactor(participant);
        };
    }

    /**
     * A tie-breaker figure where higher is better: fewer trades and earlier entry map to larger
     * values by negation.
     */
    static BigDecimal tieBreakKey(TieBreaker tieBreaker, Participant participant) {
        return switch (tieBreaker) {
            case TRADES_COUNT -> BigDecimal.valueOf(-participant.getTotalTrades());
            case WIN_RATE -> winRate(participant);
            case TOTAL_CAPITAL -> participant.getCurrentCapital();
            case ROI -> pnlPercentage(participant);
            case JOIN_TIME -> BigDecimal.valueOf(participant.getJoinedAt().getEpochSecond())
                    .scaleByPowerOfTen(9)
                    .add(BigDecimal.valueOf(participant.getJoinedAt().getNano()))
                    .negate();
        };
    }
}
