package com.tradearena.backend.service.ranking;

import com.tradearena.backend.model.PrizeTier;
import com.tradearena.backend.model.TiePrizePolicy;
import com.tradearena.backend.util.MoneyUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a prize pool over computed standings.
 * <p>
 * Each distinct rank group of qualified participants takes the next prize slot: the first group
 * gets the share configured for rank 1, the second group the share for rank 2, and so on, so two
 * participants tied for first leave the rank-2 share to whoever comes next. Shares of slots no
 * group reaches are split equally among the participants who did win something. Every award is
 * rounded down to whole credit cents; the rounding residue stays with the platform.
 */
@Component
public class PrizeCalculator {

    private static final MathContext MATH = new MathContext(34, RoundingMode.HALF_EVEN);

    public PrizeAllocation allocate(List<Standing> standings, List<PrizeTier> distribution, BigDecimal prizePool,
                                    TiePrizePolicy policy) {
        BigDecimal pool = prizePool == null ? BigDecimal.ZERO : prizePool;
        Map<Integer, BigDecimal> shareBySlot = new TreeMap<>();
        for (PrizeTier tier : distribution) {
            BigDecimal share = pool.multiply(tier.getPercentage(), MATH).divide(MoneyUtils.HUNDRED, MATH);
            shareBySlot.merge(tier.getRank(), share, BigDecimal::add);
        }

        Map<Integer, List<Standing>> groups = new LinkedHashMap<>();
        for (Standing standing : standings) {
            if (standing.qualified()) {
                groups.computeIfAbsent(standing.group(), key -> new ArrayList<>()).add(standing);
            }
        }

        Map<Long, BigDecimal> exact = new LinkedHashMap<>();
        BigDecimal unclaimed = BigDecimal.ZERO;
        for (Map.Entry<Integer, BigDecimal> slot : shareBySlot.entrySet()) {
            List<Standing> group = groups.get(slot.getKey());
            if (group == null) {
                unclaimed = unclaimed.add(slot.getValue());
                continue;
            }
            splitWithinGroup(group, slot.getValue(), policy, exact);
        }

        List<Long> winners = exact.entrySet().stream()
                .filter(entry -> entry.getValue().signum() > 0)
                .map(Map.Entry::getKey)
                .toList();
        if (unclaimed.signum() > 0 && !winners.isEmpty()) {
            BigDecimal bonus = unclaimed.divide(BigDecimal.valueOf(winners.size()), MATH);
            for (Long participantId : winners) {
                exact.merge(participantId, bonus, BigDecimal::add);
            }
        }

        List<PrizeAward> awards = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Standing standing : standings) {
            BigDecimal amount = exact.get(standing.participant().getId());
            if (amount == null || amount.signum() <= 0) {
                continue;
            }
            BigDecimal rounded = MoneyUtils.floorCredits(amount);
            if (rounded.signum() <= 0) {
                continue;
            }
            awards.add(new PrizeAward(standing.participant().getId(), standing.participant().getUserId(),
                    standing.rank(), rounded));
            total = total.add(rounded);
        }
        BigDecimal awarded = MoneyUtils.scale(total);
        return new PrizeAllocation(awards, awarded, MoneyUtils.subtract(pool, awarded));
    }

    private void splitWithinGroup(List<Standing> group, BigDecimal share, TiePrizePolicy policy,
                                  Map<Long, BigDecimal> exact) {
        if (group.size() == 1 || policy == null) {
            splitEqually(group, share, exact);
            return;
        }
        switch (policy) {
            case FIRST_GETS_ALL -> {
                exact.merge(group.get(0).participant().getId(), share, BigDecimal::add);
                for (int i = 1; i < group.size(); i++) {
                    exact.merge(group.get(i).participant().getId(), BigDecimal.ZERO, BigDecimal::add);
                }
            }
            case SPLIT_WEIGHTED -> splitWeighted(group, share, exact);
            default -> splitEqually(group, share, exact);
        }
    }

    private void splitEqually(List<Standing> group, BigDecimal share, Map<Long, BigDecimal> exact) {
        BigDecimal each = share.divide(BigDecimal.valueOf(group.size()), MATH);
        for (Standing standing : group) {
            exact.merge(standing.participant().getId(), each, BigDecimal::add);
        }
    }

    /**
     * Proportional to the primary metric. Falls back to an equal split unless every weight is
     * positive.
     */
    private void splitWeighted(List<Standing> group, BigDecimal share, Map<Long, BigDecimal> exact) {
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (Standing standing : group) {
            if (standing.primaryValue() == null || standing.primaryValue().signum() <= 0) {
                splitEqually(group, share, exact);
                return;
            }
            totalWeight = totalWeight.add(standing.primaryValue());
        }
        for (Standing standing : group) {
            BigDecimal portion = share.multiply(standing.primaryValue(), MATH).divide(totalWeight, MATH);
            exact.merge(standing.participant().getId(), portion, BigDecimal::add);
        }
    }
}
