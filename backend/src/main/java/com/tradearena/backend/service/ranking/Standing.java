package com.tradearena.backend.service.ranking;

import com.tradearena.backend.model.Participant;

import java.math.BigDecimal;

/**
 * One row of a computed ranking. Tied participants share {@code rank}; {@code group} numbers the
 * distinct rank groups of qualified participants from 1.
 */
public record Standing(
        Participant participant,
        int rank,
        int group,
        BigDecimal primaryValue,
        boolean tied,
        boolean qualified,
        String disqualificationReason
) {}
