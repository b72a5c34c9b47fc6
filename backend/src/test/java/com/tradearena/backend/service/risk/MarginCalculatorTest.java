package com.tradearena.backend.service.risk;

import com.tradearena.backend.model.MarginStatus;
import com.tradearena.backend.model.MarginThresholds;
import com.tradearena.backend.model.Position;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MarginCalculatorTest {

    private final MarginThresholds thresholds = new MarginThresholds(
            new BigDecimal("200"), new BigDecimal("150"), new BigDecimal("100"), new BigDecimal("50"));

    @Test
    void noUsedMarginIsSafeWithoutLevel() {
        assertThat(MarginCalculator.marginLevel(new BigDecimal("1000"), BigDecimal.ZERO)).isNull();
        assertThat(MarginCalculator.classify(new BigDecimal("-5"), BigDecimal.ZERO, thresholds))
                .isEqualTo(MarginStatus.SAFE);
    }

    @Test
    void levelsExactlyOnThresholdsClassifyConsistently() {
        BigDecimal used = new BigDecimal("100");
        assertThat(MarginCalculator.classify(new BigDecimal("150"), used, thresholds)).isEqualTo(MarginStatus.SAFE);
        assertThat(MarginCalculator.classify(new BigDecimal("149.99"), used, thresholds)).isEqualTo(MarginStatus.WARNING);
        assertThat(MarginCalculator.classify(new BigDecimal("100"), used, thresholds)).isEqualTo(MarginStatus.MARGIN_CALL);
        assertThat(MarginCalculator.classify(new BigDecimal("50.01"), used, thresholds)).isEqualTo(MarginStatus.MARGIN_CALL);
        assertThat(MarginCalculator.classify(new BigDecimal("50"), used, thresholds)).isEqualTo(MarginStatus.LIQUIDATION);
    }

    @Test
    void boundaryUsesExactComparison() {
        BigDecimal used = new BigDecimal("3");
        MarginThresholds tight = new MarginThresholds(
                new BigDecimal("300"), new BigDecimal("200"), new BigDecimal("150"), new BigDecimal("100"));

        assertThat(MarginCalculator.classify(new BigDecimal("3"), used, tight)).isEqualTo(MarginStatus.LIQUIDATION);
        assertThat(MarginCalculator.classify(new BigDecimal("3.0001"), used, tight)).isEqualTo(MarginStatus.MARGIN_CALL);
    }

    @Test
    void eurUsdDropBelowLiquidationLevel() {
        // 1 lot EURUSD at 1.0850 with leverage 50 on 2500 capital, marked at bid 1.0800
        BigDecimal margin = PnlCalculator.marginRequired(BigDecimal.ONE, new BigDecimal("100000"), new BigDecimal("1.0850"), 50);
        BigDecimal pnl = PnlCalculator.pnl(Position.Side.LONG,
                new BigDecimal("1.0850"), new BigDecimal("1.0800"), BigDecimal.ONE, new BigDecimal("100000"));
        BigDecimal equity = MarginCalculator.equity(new BigDecimal("2500"), pnl);

        assertThat(margin).isEqualByComparingTo("2170");
        assertThat(equity).isEqualByComparingTo("2000");
        assertThat(MarginCalculator.marginLevel(equity, margin)).isEqualByComparingTo("92.1658");
        MarginThresholds contest = new MarginThresholds(
                new BigDecimal("200"), new BigDecimal("150"), new BigDecimal("100"), new BigDecimal("95"));
        assertThat(MarginCalculator.classify(equity, margin, contest)).isEqualTo(MarginStatus.LIQUIDATION);
    }
}
