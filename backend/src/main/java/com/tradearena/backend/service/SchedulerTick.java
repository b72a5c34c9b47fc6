package com.tradearena.backend.service;

import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.FinalizeReport;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.dto.RiskAssessment;
import com.tradearena.backend.exception.ExternalDependencyException;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.repository.ContestRepository;
import com.tradearena.backend.repository.PositionRepository;
import com.tradearena.backend.service.risk.RiskEvaluationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The periodic sweeps. Each one is safe to run repeatedly and concurrently with itself, with the
 * other sweeps and with live trading: items are re-checked under lock and every money movement
 * carries an idempotency key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerTick {

    private final ContestRepository contestRepository;
    private final PositionRepository positionRepository;
    private final ContestService contestService;
    private final ContestLifecycleService contestLifecycleService;
    private final PositionService positionService;
    private final RiskEvaluationService riskEvaluationService;
    private final PayoutSweeper payoutSweeper;
    private final Clock clock;

    public TickSummary tick() {
        BatchResult activated = activationSweep();
        BatchResult risk = riskSweep();
        BatchResult finalized = finalizeSweep();
        List<BatchResult> expired = challengeExpirySweep();
        int flagged = payoutSweep();
        return new TickSummary(
                (int) activated.succeeded(),
                (int) finalized.succeeded(),
                (int) risk.items().stream().filter(item -> "LIQUIDATED".equals(item.message())).count(),
                expired.size(),
                flagged);
    }

    public BatchResult activationSweep() {
        return contestService.activateDue(clock.instant());
    }

    public BatchResult finalizeSweep() {
        Instant now = clock.instant();
        List<ItemOutcome> items = new ArrayList<>();
        for (Contest contest : contestRepository.findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(
                Contest.Status.ACTIVE, now)) {
            MDC.put("contestId", String.valueOf(contest.getId()));
            try {
                FinalizeReport report = contestLifecycleService.finalizeContest(contest.getId());
                items.add(report.completed()
                        ? ItemOutcome.succeeded("contest", contest.getId(), null, "COMPLETED")
                        : ItemOutcome.failed("contest", contest.getId(), null,
                        report.batch().failed() + " position(s) could not be closed"));
            } catch (Exception e) {
                log.warn("Finalize of contest {} failed: {}", contest.getId(), e.getMessage());
                items.add(ItemOutcome.failed("contest", contest.getId(), null, e.getMessage()));
            } finally {
                MDC.remove("contestId");
            }
        }
        return new BatchResult("finalizeSweep", null, null, items);
    }

    /**
     * Re-marks and re-evaluates every participant holding an open position, catching margin
     * moves caused by price drift alone.
     */
    public BatchResult riskSweep() {
        List<ItemOutcome> items = new ArrayList<>();
        for (Long participantId : positionRepository.findParticipantIdsByPositionStatus(Position.Status.OPEN)) {
            MDC.put("participantId", String.valueOf(participantId));
            try {
                try {
                    positionService.markToMarket(participantId);
                } catch (ExternalDependencyException e) {
                    log.warn("Mark-to-market of participant {} skipped: {}", participantId, e.getMessage());
                }
                RiskAssessment assessment = riskEvaluationService.evaluate(participantId);
                if (assessment.priceUnavailable()) {
                    items.add(ItemOutcome.failed("participant", participantId, null, "Price unavailable"));
                } else {
                    items.add(ItemOutcome.succeeded("participant", participantId, null,
                            assessment.liquidated() ? "LIQUIDATED" : assessment.status().name()));
                }
            } catch (Exception e) {
                log.warn("Risk sweep for participant {} failed: {}", participantId, e.getMessage());
                items.add(ItemOutcome.failed("participant", participantId, null, e.getMessage()));
            } finally {
                MDC.remove("participantId");
            }
        }
        return new BatchResult("riskSweep", null, null, items);
    }

    public List<BatchResult> challengeExpirySweep() {
        return contestLifecycleService.expireChallenges(clock.instant());
    }

    public int payoutSweep() {
        return payoutSweeper.flagStuckPayouts();
    }

    public record TickSummary(
            int contestsActivated,
            int contestsFinalized,
            int participantsLiquidated,
            int challengesExpired,
            int payoutsFlagged
    ) {
        public boolean hasWork() {
            return contestsActivated > 0 || contestsFinalized > 0 || participantsLiquidated > 0
                    || challengesExpired > 0 || payoutsFlagged > 0;
        }
    }
}
