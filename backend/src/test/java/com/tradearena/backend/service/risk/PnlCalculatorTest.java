package com.tradearena.backend.service.risk;

import com.tradearena.backend.model.Position;
import com.tradearena.backend.service.marketdata.Quote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PnlCalculatorTest {

    private final Quote quote = new Quote("EURUSD", new BigDecimal("1.0848"), new BigDecimal("1.0850"), Instant.now());

    @Test
    void longsEnterAtAskAndExitAtBid() {
        assertThat(PnlCalculator.entryPrice(Position.Side.LONG, quote)).isEqualByComparingTo("1.0850");
        assertThat(PnlCalculator.exitPrice(Position.Side.LONG, quote)).isEqualByComparingTo("1.0848");
    }

    @Test
    void shortsEnterAtBidAndExitAtAsk() {
        assertThat(PnlCalculator.entryPrice(Position.Side.SHORT, quote)).isEqualByComparingTo("1.0848");
        assertThat(PnlCalculator.exitPrice(Position.Side.SHORT, quote)).isEqualByComparingTo("1.0850");
    }

    @Test
    void shortProfitsWhenPriceFalls() {
        BigDecimal pnl = PnlCalculator.pnl(Position.Side.SHORT, new BigDecimal("1.1000"), new BigDecimal("1.0950"),
                new BigDecimal("0.5"), new BigDecimal("100000"));
        assertThat(pnl).isEqualByComparingTo("250");
    }

    @Test
    void longLosesWhenPriceFalls() {
        BigDecimal pnl = PnlCalculator.pnl(Position.Side.LONG, new BigDecimal("2000"), new BigDecimal("1990"),
                new BigDecimal("2"), new BigDecimal("100"));
        assertThat(pnl).isEqualByComparingTo("-2000");
    }

    @Test
    void percentOfMarginHandlesZeroMargin() {
        assertThat(PnlCalculator.percentOfMargin(new BigDecimal("10"), BigDecimal.ZERO)).isZero();
        assertThat(PnlCalculator.percentOfMargin(new BigDecimal("-50"), new BigDecimal("200")))
                .isEqualByComparingTo("-25");
    }

    @Test
    void marginRequiresPositiveLeverage() {
        assertThatThrownBy(() -> PnlCalculator.marginRequired(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
