package com.tradearena.backend.service.risk;

import com.tradearena.backend.model.Position;
import com.tradearena.backend.service.marketdata.Quote;
import com.tradearena.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class PnlCalculator {

    private PnlCalculator() {
    }

    /**
     * Longs buy at the ask, shorts sell at the bid.
     */
    public static BigDecimal entryPrice(Position.Side side, Quote quote) {
        return MoneyUtils.price(side == Position.Side.LONG ? quote.ask() : quote.bid());
    }

    /**
     * Longs close at the bid, shorts at the ask.
     */
    public static BigDecimal exitPrice(Position.Side side, Quote quote) {
        return MoneyUtils.price(side == Position.Side.LONG ? quote.bid() : quote.ask());
    }

    public static BigDecimal priceDiff(Position.Side side, BigDecimal entry, BigDecimal exit) {
        return side == Position.Side.LONG ? exit.subtract(entry) : entry.subtract(exit);
    }

    public static BigDecimal pnl(Position.Side side, BigDecimal entry, BigDecimal exit,
                                 BigDecimal quantity, BigDecimal multiplier) {
        return MoneyUtils.scale(priceDiff(side, entry, exit).multiply(quantity).multiply(multiplier));
    }

    public static BigDecimal pnl(Position position, BigDecimal exit, BigDecimal multiplier) {
        return pnl(position.getSide(), position.getEntryPrice(), exit, position.getQuantity(), multiplier);
    }

    /**
     * {@code quantity * multiplier * price / leverage}.
     */
    public static BigDecimal marginRequired(BigDecimal quantity, BigDecimal multiplier, BigDecimal price, int leverage) {
        if (leverage <= 0) {
            throw new IllegalArgumentException("Leverage must be positive");
        }
        BigDecimal notional = quantity.multiply(multiplier).multiply(price);
        return notional.divide(BigDecimal.valueOf(leverage), MoneyUtils.SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentOfMargin(BigDecimal pnl, BigDecimal marginUsed) {
        if (marginUsed == null || marginUsed.signum() == 0) {
            return MoneyUtils.ZERO;
        }
        return pnl.multiply(MoneyUtils.HUNDRED).divide(marginUsed, MoneyUtils.SCALE, RoundingMode.HALF_UP);
    }
}
