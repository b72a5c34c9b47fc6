package com.tradearena.backend.service.ranking;

import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.Participant;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Final standings with competition ranking (1, 1, 3).
 * <p>
 * Participants are ordered by the primary metric, descending. Values closer than
 * {@link #TIE_EPSILON} form one primary group, which is then ordered by the two configured
 * tie-breakers. Participants still equal after both share a rank; inside such a group the
 * earlier join time, then the lower participant id, comes first. Disqualified participants are
 * ranked the same way after every qualified one.
 */
@Component
public class RankingEngine {

    public static final BigDecimal TIE_EPSILON = new BigDecimal("0.0001");

    private static final Comparator<Participant> FALLBACK = Comparator
            .comparing(Participant::getJoinedAt)
            .thenComparing(Participant::getId);

    public List<Standing> rank(List<Participant> participants, ContestRules requestedRules) {
        ContestRules rules = ContestRules.resolve(requestedRules);
        List<Participant> qualified = new ArrayList<>();
        List<Participant> disqualified = new ArrayList<>();
        Map<Long, String> reasons = new HashMap<>();
        for (Participant participant : participants) {
            String reason = disqualificationReason(participant, rules);
            if (reason == null) {
                qualified.add(participant);
            } else {
                disqualified.add(participant);
                reasons.put(participant.getId(), reason);
            }
        }

        List<Standing> standings = new ArrayList<>();
        rankBlock(qualified, rules, 1, true, reasons, standings);
        rankBlock(disqualified, rules, qualified.size() + 1, false, reasons, standings);
        return standings;
    }

    /**
     * @return why the participant cannot win a prize, or {@code null} when eligible
     */
    public String disqualificationReason(Participant participant, ContestRules rules) {
        switch (participant.getStatus()) {
            case DISQUALIFIED:
                return participant.getStatusReason() != null ? participant.getStatusReason() : "Disqualified";
            case REFUNDED:
                return "Refunded";
            case LIQUIDATED:
                if (Boolean.TRUE.equals(rules.getDisqualifyOnLiquidation())) {
                    return "Liquidated";
                }
                break;
            default:
                break;
        }
        if (participant.getTotalTrades() < rules.getMinimumTrades()) {
            return "Minimum trades not met (" + participant.getTotalTrades() + " < " + rules.getMinimumTrades() + ")";
        }
        if (rules.getMinimumWinRate() != null
                && ParticipantMetrics.winRate(participant).compareTo(rules.getMinimumWinRate()) < 0) {
            return "Minimum win rate not met";
        }
        return null;
    }

    private void rankBlock(List<Participant> members, ContestRules rules, int firstRank, boolean qualified,
                           Map<Long, String> reasons, List<Standing> out) {
        if (members.isEmpty()) {
            return;
        }
        Map<Long, BigDecimal> primary = new HashMap<>();
        for (Participant participant : members) {
            primary.put(participant.getId(), ParticipantMetrics.primary(participant, rules.getRankingMethod()));
        }
        List<Function<Participant, BigDecimal>> keys = List.of(
                participant -> primary.get(participant.getId()),
                participant -> ParticipantMetrics.tieBreakKey(rules.getTieBreak1(), participant),
                participant -> ParticipantMetrics.tieBreakKey(rules.getTieBreak2(), participant));

        int position = firstRank;
        int group = 0;
        for (List<Participant> tiedGroup : partition(new ArrayList<>(members), keys, 0)) {
            tiedGroup.sort(FALLBACK);
            boolean tied = tiedGroup.size() > 1;
            group++;
            for (Participant participant : tiedGroup) {
                out.add(new Standing(participant, position, qualified ? group : 0,
                        primary.get(participant.getId()), tied, qualified, reasons.get(participant.getId())));
            }
            position += tiedGroup.size();
        }
    }

    /**
     * Splits members into tied groups, best first, one key at a time. Each key sorts exactly,
     * then a group holds every member within {@link #TIE_EPSILON} of the group's first value, so
     * one pairwise rule decides every tie and close values never chain into one group.
     */
    static List<List<Participant>> partition(List<Participant> members,
                                             List<Function<Participant, BigDecimal>> keys, int depth) {
        if (depth == keys.size() || members.size() < 2) {
            return List.of(members);
        }
        Function<Participant, BigDecimal> key = keys.get(depth);
        members.sort(Comparator.comparing(key).reversed().thenComparing(FALLBACK));

        List<List<Participant>> groups = new ArrayList<>();
        List<Participant> current = new ArrayList<>();
        BigDecimal anchor = null;
        for (Participant participant : members) {
            BigDecimal value = key.apply(participant);
            if (anchor != null && anchor.subtract(value).compareTo(TIE_EPSILON) >= 0) {
                groups.addAll(partition(current, keys, depth + 1));
                current = new ArrayList<>();
                anchor = null;
            }
            if (anchor == null) {
                anchor = value;
            }
            current.add(participant);
        }
        groups.addAll(partition(current, keys, depth + 1));
        return groups;
    }
}
