package com.tradearena.backend.service.marketdata;

import java.math.BigDecimal;
import java.time.Instant;

public record Quote(
        String symbol,
        BigDecimal bid,
        BigDecimal ask,
        Instant timestamp
) {}
