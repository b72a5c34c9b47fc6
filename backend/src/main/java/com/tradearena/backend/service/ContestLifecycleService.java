package com.tradearena.backend.service;

import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.FinalizeReport;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.NotFoundException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.LeaderboardEntry;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.repository.ContestRepository;
import com.tradearena.backend.repository.LeaderboardEntryRepository;
import com.tradearena.backend.repository.ParticipantRepository;
import com.tradearena.backend.repository.PositionRepository;
import com.tradearena.backend.service.marketdata.PriceGateway;
import com.tradearena.backend.service.marketdata.Quote;
import com.tradearena.backend.service.notification.NotificationDispatcher;
import com.tradearena.backend.service.ranking.ParticipantMetrics;
import com.tradearena.backend.service.ranking.PrizeAllocation;
import com.tradearena.backend.service.ranking.PrizeAward;
import com.tradearena.backend.service.ranking.PrizeCalculator;
import com.tradearena.backend.service.ranking.RankingEngine;
import com.tradearena.backend.service.ranking.Standing;
import com.tradearena.backend.service.risk.PnlCalculator;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal contest transitions. {@link #finalizeContest(Long)} and {@link #cancelAndRefund(Long, String)}
 * both lock the contest row and check its status in the transaction that changes it, so at
 * most one of them can reach a terminal state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContestLifecycleService {

    private final ContestRepository contestRepository;
    private final ParticipantRepository participantRepository;
    private final PositionRepository positionRepository;
    private final LeaderboardEntryRepository leaderboardEntryRepository;
    private final PositionSettlementService positionSettlementService;
    private final CreditLedgerService ledger;
    private final PriceGateway priceGateway;
    private final RankingEngine rankingEngine;
    private final PrizeCalculator prizeCalculator;
    private final UnitOfWork unitOfWork;
    private final DeadLetterQueueService deadLetterQueueService;
    private final AuditEventService auditEventService;
    private final NotificationDispatcher notifications;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Refunds exactly the entry fee to every participant not yet refunded, each in its own unit
     * of work. A participant that fails is reported and left for the next run; the others are
     * still processed.
     */
    public BatchResult cancelAndRefund(Long contestId, String reason) {
        Contest contest = unitOfWork.execute("cancel-contest", () -> {
            Contest locked = lockContest(contestId);
            if (locked.getStatus() == Contest.Status.COMPLETED) {
                throw new ConflictException("Contest " + contestId + " is already completed");
            }
            if (locked.getStatus() != Contest.Status.CANCELLED) {
                locked.setStatus(Contest.Status.CANCELLED);
                locked.setCancellationReason(reason);
                contestRepository.save(locked);
                auditEventService.contestTransition(contestId, "CANCELLED", "Contest cancelled: " + reason);
                metrics.recordContestCancelled();
                log.info("Contest {} cancelled: {}", contestId, reason);
            }
            return locked;
        });

        List<ItemOutcome> items = new ArrayList<>();
        for (Participant participant : participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(contestId)) {
            MDC.put("contestId", String.valueOf(contestId));
            MDC.put("participantId", String.valueOf(participant.getId()));
            try {
                if (participant.getStatus() == Participant.Status.REFUNDED) {
                    items.add(ItemOutcome.skipped("participant", participant.getId(), participant.getUserId(),
                            "Already refunded"));
                    continue;
                }
                items.add(refundParticipant(contest, participant.getId(), reason));
            } catch (Exception e) {
                deadLetterQueueService.logFailure(DeadLetterQueueService.REFUND_FAILED,
                        "contest=" + contestId + " participant=" + participant.getId() + " user=" + participant.getUserId(),
                        e.getMessage());
                items.add(ItemOutcome.failed("participant", participant.getId(), participant.getUserId(), e.getMessage()));
            } finally {
                MDC.remove("participantId");
                MDC.remove("contestId");
            }
        }

        BatchResult result = new BatchResult("cancelAndRefund", contestId, Contest.Status.CANCELLED.name(), items);
        if (result.complete()) {
            unitOfWork.run("zero-prize-pool", () -> {
                Contest locked = lockContest(contestId);
                locked.setPrizePool(MoneyUtils.ZERO);
                contestRepository.save(locked);
            });
        } else {
            log.warn("Contest {} cancel left {} participant(s) unrefunded; re-run to retry", contestId, result.failed());
        }
        return result;
    }

    private ItemOutcome refundParticipant(Contest contest, Long participantId, String reason) {
        return unitOfWork.execute("refund-participant", () -> {
            Participant participant = participantRepository.findByIdForUpdate(participantId)
                    .orElseThrow(() -> new NotFoundException("Participant not found: " + participantId));
            if (participant.getStatus() == Participant.Status.REFUNDED) {
                return ItemOutcome.skipped("participant", participantId, participant.getUserId(), "Already refunded");
            }
            for (Position position : positionRepository.findByParticipantIdAndStatusOrderByIdAsc(
                    participantId, Position.Status.OPEN)) {
                positionSettlementService.closeWithoutSettlement(participant, position);
            }
            BigDecimal fee = contest.getEntryFee();
            if (MoneyUtils.isPositive(fee)) {
                ledger.credit(participant.getUserId(), fee, LedgerTransaction.Type.REFUND,
                        "contest:" + contest.getId(), "refund:" + contest.getId() + ":" + participant.getUserId(),
                        "Refund for cancelled contest " + contest.getName());
            }
            participant.setStatus(Participant.Status.REFUNDED);
            participant.setStatusReason(reason);
            participantRepository.save(participant);
            notifications.notifyAfterCommit(participant.getUserId(), "CONTEST_CANCELLED",
                    Map.of("contestId", contest.getId(), "refund", fee));
            return ItemOutcome.succeeded("participant", participantId, participant.getUserId(),
                    "Refunded " + fee.toPlainString());
        });
    }

    /**
     * Settles a contest that has ended: closes remaining positions at market, ranks, pays prizes
     * and stores the leaderboard. A completed contest returns its stored leaderboard unchanged.
     * When a price cannot be obtained the contest stays ACTIVE and the next sweep tries again.
     */
    public FinalizeReport finalizeContest(Long contestId) {
        Contest contest = contestRepository.findById(contestId)
                .orElseThrow(() -> new NotFoundException("Contest not found: " + contestId));
        if (contest.getStatus() == Contest.Status.COMPLETED) {
            return report(contestId, Contest.Status.COMPLETED, List.of());
        }
        if (contest.getStatus() == Contest.Status.CANCELLED) {
            throw new ConflictException("Contest " + contestId + " is cancelled");
        }
        if (contest.getStatus() != Contest.Status.ACTIVE) {
            throw new ValidationException("Contest " + contestId + " is " + contest.getStatus() + ", not ACTIVE");
        }
        if (!contest.hasEnded(clock.instant())) {
            throw new ValidationException("Contest " + contestId + " ends at " + contest.getEndTime());
        }

        List<ItemOutcome> items = new ArrayList<>(closeOpenPositions(contestId));
        long stillOpen = items.stream().filter(item -> item.status() == ItemOutcome.Status.FAILED).count();
        if (stillOpen > 0) {
            log.warn("Contest {} finalize deferred: {} position(s) could not be closed", contestId, stillOpen);
            return report(contestId, Contest.Status.ACTIVE, items);
        }

        List<ItemOutcome> prizes = unitOfWork.execute("finalize-contest", () -> settle(contestId));
        items.addAll(prizes);
        Contest after = contestRepository.findById(contestId).orElse(contest);
        return report(contestId, after.getStatus(), items);
    }

    private List<ItemOutcome> closeOpenPositions(Long contestId) {
        List<ItemOutcome> items = new ArrayList<>();
        Map<String, Quote> quotes = new HashMap<>();
        Map<String, String> unavailable = new HashMap<>();
        for (Position open : positionRepository.findByContestIdAndStatus(contestId, Position.Status.OPEN)) {
            MDC.put("participantId", String.valueOf(open.getParticipantId()));
            try {
                String symbol = open.getSymbol();
                if (!quotes.containsKey(symbol) && !unavailable.containsKey(symbol)) {
                    try {
                        quotes.put(symbol, priceGateway.quote(symbol));
                    } catch (Exception e) {
                        unavailable.put(symbol, e.getMessage());
                    }
                }
                Quote quote = quotes.get(symbol);
                if (quote == null) {
                    throw new IllegalStateException("Price unavailable for " + symbol + ": " + unavailable.get(symbol));
                }
                unitOfWork.run("contest-end-close", () -> {
                    Participant participant = participantRepository.findByIdForUpdate(open.getParticipantId())
                            .orElseThrow(() -> new NotFoundException("Participant not found: " + open.getParticipantId()));
                    Position position = positionRepository.findById(open.getId())
                            .orElseThrow(() -> new NotFoundException("Position not found: " + open.getId()));
                    positionSettlementService.closeAtPrice(participant, position,
                            PnlCalculator.exitPrice(position.getSide(), quote), Position.CloseReason.CONTEST_END);
                });
                items.add(ItemOutcome.succeeded("position", open.getId(), open.getUserId(), "Closed at contest end"));
            } catch (Exception e) {
                deadLetterQueueService.logFailure(DeadLetterQueueService.CONTEST_END_CLOSE_FAILED,
                        "contest=" + contestId + " position=" + open.getId(), e.getMessage());
                items.add(ItemOutcome.failed("position", open.getId(), open.getUserId(), e.getMessage()));
            } finally {
                MDC.remove("participantId");
            }
        }
        return items;
    }

    private List<ItemOutcome> settle(Long contestId) {
        Contest contest = lockContest(contestId);
        if (contest.getStatus() == Contest.Status.COMPLETED) {
            return List.of();
        }
        if (contest.getStatus() != Contest.Status.ACTIVE) {
            throw new ConflictException("Contest " + contestId + " is " + contest.getStatus());
        }
        if (!positionRepository.findByContestIdAndStatus(contestId, Position.Status.OPEN).isEmpty()) {
            throw new ConflictException("Contest " + contestId + " still has open positions");
        }

        ContestRules rules = ContestRules.resolve(contest.getRules());
        List<Participant> participants = participantRepository.findByContestIdOrderByJoinedAtAscIdAsc(contestId);
        List<Standing> standings = rankingEngine.rank(participants, rules);
        PrizeAllocation allocation = prizeCalculator.allocate(standings, contest.sortedPrizeDistribution(),
                contest.getPrizePool(), rules.getTiePrizePolicy());

        List<ItemOutcome> items = new ArrayList<>();
        for (PrizeAward award : allocation.awards()) {
            ledger.credit(award.userId(), award.amount(), LedgerTransaction.Type.PRIZE,
                    "contest:" + contestId, "prize:" + contestId + ":" + award.userId(),
                    "Prize for rank " + award.rank() + " in " + contest.getName());
            items.add(ItemOutcome.succeeded("prize", award.participantId(), award.userId(),
                    "Rank " + award.rank() + " paid " + award.amount().toPlainString()));
        }

        int displayOrder = 1;
        for (Standing standing : standings) {
            Participant participant = standing.participant();
            BigDecimal prize = allocation.awardFor(participant.getId())
                    .map(PrizeAward::amount)
                    .orElse(MoneyUtils.ZERO);
            upsertLeaderboardEntry(contestId, standing, prize, displayOrder++);
            participant.setCurrentRank(standing.rank());
            participant.setPrizeAmount(prize);
            if (participant.getStatus() == Participant.Status.ACTIVE) {
                participant.setStatus(Participant.Status.COMPLETED);
            }
            participantRepository.save(participant);
            notifications.notifyAfterCommit(participant.getUserId(), "CONTEST_COMPLETED",
                    Map.of("contestId", contestId, "rank", standing.rank(), "prize", prize));
        }

        contest.setStatus(Contest.Status.COMPLETED);
        contest.setFinalizedAt(clock.instant());
        contestRepository.save(contest);

        auditEventService.contestTransition(contestId, "FINALIZED",
                "Contest finalized with " + standings.size() + " participant(s)",
                Map.of("prizePool", contest.getPrizePool().toPlainString(),
                        "awarded", allocation.totalAwarded().toPlainString(),
                        "residue", allocation.residue().toPlainString()));
        metrics.recordContestFinalized();
        log.info("Contest {} finalized: {} participant(s), awarded {} of {}", contestId, standings.size(),
                allocation.totalAwarded().toPlainString(), contest.getPrizePool().toPlainString());
        return items;
    }

    private void upsertLeaderboardEntry(Long contestId, Standing standing, BigDecimal prize, int displayOrder) {
        Participant participant = standing.participant();
        LeaderboardEntry entry = leaderboardEntryRepository
                .findByContestIdAndParticipantId(contestId, participant.getId())
                .orElseGet(LeaderboardEntry::new);
        entry.setContestId(contestId);
        entry.setParticipantId(participant.getId());
        entry.setUserId(participant.getUserId());
        entry.setRank(standing.rank());
        entry.setDisplayOrder(displayOrder);
        entry.setFinalCapital(participant.getCurrentCapital());
        entry.setPnl(ParticipantMetrics.pnl(participant));
        entry.setPnlPercentage(MoneyUtils.scale(ParticipantMetrics.pnlPercentage(participant)));
        entry.setTotalTrades(participant.getTotalTrades());
        entry.setWinRate(MoneyUtils.scale(ParticipantMetrics.winRate(participant)));
        entry.setPrizeAmount(prize);
        entry.setTied(standing.tied());
        entry.setQualified(standing.qualified());
        entry.setDisqualificationReason(standing.disqualificationReason());
        leaderboardEntryRepository.save(entry);
    }

    private FinalizeReport report(Long contestId, Contest.Status status, List<ItemOutcome> items) {
        List<LeaderboardEntry> leaderboard = status == Contest.Status.COMPLETED
                ? leaderboardEntryRepository.findByContestIdOrderByDisplayOrderAsc(contestId)
                : List.of();
        return new FinalizeReport(contestId, status, leaderboard,
                new BatchResult("finalize", contestId, status.name(), items));
    }

    public List<LeaderboardEntry> leaderboard(Long contestId) {
        return leaderboardEntryRepository.findByContestIdOrderByDisplayOrderAsc(contestId);
    }

    /**
     * Cancels UPCOMING challenges nobody accepted before the deadline.
     */
    public List<BatchResult> expireChallenges(Instant now) {
        List<BatchResult> results = new ArrayList<>();
        for (Contest challenge : contestRepository.findByTypeAndStatusAndAcceptDeadlineBefore(
                Contest.Type.CHALLENGE, Contest.Status.UPCOMING, now)) {
            try {
                results.add(cancelAndRefund(challenge.getId(), "Challenge not accepted before deadline"));
            } catch (ConflictException e) {
                log.info("Challenge {} not expired: {}", challenge.getId(), e.getMessage());
            }
        }
        return results;
    }

    private Contest lockContest(Long contestId) {
        return contestRepository.findByIdForUpdate(contestId)
                .orElseThrow(() -> new NotFoundException("Contest not found: " + contestId));
    }
}
