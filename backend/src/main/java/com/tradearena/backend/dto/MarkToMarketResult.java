package com.tradearena.backend.dto;

import java.math.BigDecimal;
import java.util.List;

public record MarkToMarketResult(
        Long participantId,
        int positionsMarked,
        List<Long> triggeredPositionIds,
        BigDecimal unrealizedPnl
) {}
