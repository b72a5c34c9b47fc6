package com.tradearena.backend.service.ranking;

import java.math.BigDecimal;

public record PrizeAward(
        Long participantId,
        Long userId,
        int rank,
        BigDecimal amount
) {}
