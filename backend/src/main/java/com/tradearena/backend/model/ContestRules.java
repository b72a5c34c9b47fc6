package com.tradearena.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContestRules {

    @Enumerated(EnumType.STRING)
    @Column(name = "ranking_method", nullable = false, length = 32)
    private RankingMethod rankingMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "tie_break_1", nullable = false, length = 32)
    private TieBreaker tieBreak1;

    @Enumerated(EnumType.STRING)
    @Column(name = "tie_break_2", nullable = false, length = 32)
    private TieBreaker tieBreak2;

    @Enumerated(EnumType.STRING)
    @Column(name = "tie_prize_policy", nullable = false, length = 32)
    private TiePrizePolicy tiePrizePolicy;

    @Column(name = "minimum_trades", nullable = false)
    private Integer minimumTrades;

    @Column(name = "minimum_win_rate", precision = 7, scale = 4)
    private BigDecimal minimumWinRate;

    @Column(name = "disqualify_on_liquidation", nullable = false)
    private Boolean disqualifyOnLiquidation;

    @Column(name = "max_leverage", nullable = false)
    private Integer maxLeverage;

    @Column(name = "max_open_positions", nullable = false)
    private Integer maxOpenPositions;

    public static ContestRules defaults() {
        return ContestRules.builder()
                .rankingMethod(RankingMethod.PNL)
                .tieBreak1(TieBreaker.WIN_RATE)
                .tieBreak2(TieBreaker.JOIN_TIME)
                .tiePrizePolicy(TiePrizePolicy.SPLIT_EQUALLY)
                .minimumTrades(0)
                .minimumWinRate(null)
                .disqualifyOnLiquidation(true)
                .maxLeverage(100)
                .maxOpenPositions(10)
                .build();
    }

    /**
     * The one place contest rule defaults are applied: every unset field takes the value from
     * {@link #defaults()}.
     */
    public static ContestRules resolve(ContestRules requested) {
        ContestRules defaults = defaults();
        if (requested == null) {
            return defaults;
        }
        return ContestRules.builder()
                .rankingMethod(requested.getRankingMethod() != null ? requested.getRankingMethod() : defaults.getRankingMethod())
                .tieBreak1(requested.getTieBreak1() != null ? requested.getTieBreak1() : defaults.getTieBreak1())
                .tieBreak2(requested.getTieBreak2() != null ? requested.getTieBreak2() : defaults.getTieBreak2())
                .tiePrizePolicy(requested.getTiePrizePolicy() != null ? requested.getTiePrizePolicy() : defaults.getTiePrizePolicy())
                .minimumTrades(requested.getMinimumTrades() != null ? requested.getMinimumTrades() : defaults.getMinimumTrades())
                .minimumWinRate(requested.getMinimumWinRate())
                .disqualifyOnLiquidation(requested.getDisqualifyOnLiquidation() != null
                        ? requested.getDisqualifyOnLiquidation() : defaults.getDisqualifyOnLiquidation())
                .maxLeverage(requested.getMaxLeverage() != null ? requested.getMaxLeverage() : defaults.getMaxLeverage())
                .maxOpenPositions(requested.getMaxOpenPositions() != null
                        ? requested.getMaxOpenPositions() : defaults.getMaxOpenPositions())
                .build();
    }
}
