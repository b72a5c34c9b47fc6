package com.tradearena.backend.service.risk;

import com.tradearena.backend.config.RiskProperties;
import com.tradearena.backend.dto.RiskAssessment;
import com.tradearena.backend.exception.ExternalDependencyException;
import com.tradearena.backend.exception.NotFoundException;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.MarginStatus;
import com.tradearena.backend.model.MarginThresholds;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.repository.ContestRepository;
import com.tradearena.backend.repository.ParticipantRepository;
import com.tradearena.backend.repository.PositionRepository;
import com.tradearena.backend.service.DeadLetterQueueService;
import com.tradearena.backend.service.PositionSettlementService;
import com.tradearena.backend.service.RiskEventService;
import com.tradearena.backend.service.SettlementMetrics;
import com.tradearena.backend.service.UnitOfWork;
import com.tradearena.backend.service.marketdata.PriceGateway;
import com.tradearena.backend.service.marketdata.Quote;
import com.tradearena.backend.service.marketdata.SymbolNormalizer;
import com.tradearena.backend.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Margin evaluation and forced liquidation.
 * <p>
 * Quotes are fetched before the participant lock is taken. When they cannot be obtained the
 * positions stay open, the participant stays ACTIVE and an alert goes to the review queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskEvaluationService {

    private final ParticipantRepository participantRepository;
    private final PositionRepository positionRepository;
    private final ContestRepository contestRepository;
    private final PositionSettlementService positionSettlementService;
    private final PriceGateway priceGateway;
    private final UnitOfWork unitOfWork;
    private final RiskEventService riskEventService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final NotificationDispatcher notifications;
    private final SettlementMetrics metrics;
    private final RiskProperties riskProperties;

    public RiskAssessment evaluate(Long participantId) {
        Participant snapshot = participantRepository.findById(participantId)
                .orElseThrow(() -> new NotFoundException("Participant not found: " + participantId));
        if (!snapshot.isActive()) {
            return RiskAssessment.skipped(participantId);
        }
        MDC.put("participantId", String.valueOf(participantId));
        try {
            MarginThresholds thresholds = thresholdsFor(snapshot.getContestId());
            List<Position> open = positionRepository.findByParticipantIdAndStatusOrderByIdAsc(
                    participantId, Position.Status.OPEN);
            Map<String, Quote> quotes;
            try {
                quotes = fetchQuotes(open);
            } catch (ExternalDependencyException e) {
                return onPriceUnavailable(snapshot, thresholds, e);
            }
            try {
                return unitOfWork.execute("risk-evaluate",
                        () -> evaluateLocked(participantId, thresholds, quotes));
            } catch (ExternalDependencyException e) {
                return onPriceUnavailable(snapshot, thresholds, e);
            }
        } finally {
            MDC.remove("participantId");
        }
    }

    private RiskAssessment evaluateLocked(Long participantId, MarginThresholds thresholds, Map<String, Quote> quotes) {
        Participant participant = participantRepository.findByIdForUpdate(participantId)
                .orElseThrow(() -> new NotFoundException("Participant not found: " + participantId));
        if (!participant.isActive()) {
            return RiskAssessment.skipped(participantId);
        }
        List<Position> open = positionRepository.findByParticipantIdAndStatusOrderByIdAsc(
                participantId, Position.Status.OPEN);
        for (Position position : open) {
            Quote quote = quotes.computeIfAbsent(SymbolNormalizer.normalize(position.getSymbol()),
                    key -> priceGateway.quote(position.getSymbol()));
            positionSettlementService.mark(position, PnlCalculator.exitPrice(position.getSide(), quote));
        }
        positionSettlementService.refreshAggregates(participant);

        BigDecimal equity = MarginCalculator.equity(participant.getCurrentCapital(), participant.getUnrealizedPnl());
        BigDecimal level = MarginCalculator.marginLevel(equity, participant.getUsedMargin());
        MarginStatus status = MarginCalculator.classify(equity, participant.getUsedMargin(), thresholds);
        MarginStatus previous = participant.getLastMarginStatus() == null
                ? MarginStatus.SAFE : participant.getLastMarginStatus();

        if (status == MarginStatus.LIQUIDATION) {
            return liquidate(participant, open, quotes, level);
        }
        if ((status == MarginStatus.WARNING || status == MarginStatus.MARGIN_CALL)
                && status.ordinal() > previous.ordinal()) {
            participant.setMarginCallWarnings(participant.getMarginCallWarnings() + 1);
            riskEventService.record(participant.getUserId(), participant.getId(), status.name(),
                    "Margin level " + format(level) + "% entered " + status, "contest=" + participant.getContestId());
            notifications.notifyAfterCommit(participant.getUserId(), status.name(),
                    payload(participant, level));
            log.warn("Participant {} entered {} at margin level {}%", participant.getId(), status, format(level));
        }
        participant.setLastMarginStatus(status);
        participantRepository.save(participant);
        return new RiskAssessment(participantId, level, status, false, false, 0);
    }

    private RiskAssessment liquidate(Participant participant, List<Position> open, Map<String, Quote> quotes,
                                     BigDecimal level) {
        int closed = 0;
        for (Position position : open) {
            Quote quote = quotes.get(SymbolNormalizer.normalize(position.getSymbol()));
            positionSettlementService.closeAtPrice(participant, position,
                    PnlCalculator.exitPrice(position.getSide(), quote), Position.CloseReason.MARGIN_CALL);
            closed++;
        }
        participant.setStatus(Participant.Status.LIQUIDATED);
        participant.setStatusReason("Liquidated at margin level " + format(level) + "%");
        participant.setLastMarginStatus(MarginStatus.LIQUIDATION);
        participantRepository.save(participant);

        riskEventService.record(participant.getUserId(), participant.getId(), "LIQUIDATION",
                "Forced liquidation of " + closed + " position(s) at margin level " + format(level) + "%",
                "contest=" + participant.getContestId());
        notifications.notifyAfterCommit(participant.getUserId(), "LIQUIDATED", payload(participant, level));
        metrics.recordLiquidation();
        log.warn("Participant {} liquidated at margin level {}%, {} position(s) closed",
                participant.getId(), format(level), closed);
        return new RiskAssessment(participant.getId(), level, MarginStatus.LIQUIDATION, true, false, closed);
    }

    private RiskAssessment onPriceUnavailable(Participant snapshot, MarginThresholds thresholds,
                                              ExternalDependencyException e) {
        BigDecimal equity = MarginCalculator.equity(snapshot.getCurrentCapital(), snapshot.getUnrealizedPnl());
        BigDecimal level = MarginCalculator.marginLevel(equity, snapshot.getUsedMargin());
        MarginStatus status = MarginCalculator.classify(equity, snapshot.getUsedMargin(), thresholds);
        if (status == MarginStatus.LIQUIDATION) {
            metrics.recordForcedCloseFailure();
            deadLetterQueueService.logFailure(DeadLetterQueueService.FORCED_CLOSE_PRICE_UNAVAILABLE,
                    "participant=" + snapshot.getId() + " contest=" + snapshot.getContestId()
                            + " lastLevel=" + format(level),
                    e.getMessage());
        } else {
            log.warn("Risk evaluation for participant {} deferred: {}", snapshot.getId(), e.getMessage());
        }
        return new RiskAssessment(snapshot.getId(), level, status, false, true, 0);
    }

    private Map<String, Quote> fetchQuotes(List<Position> positions) {
        Map<String, Quote> quotes = new HashMap<>();
        for (Position position : positions) {
            String key = SymbolNormalizer.normalize(position.getSymbol());
            if (!quotes.containsKey(key)) {
                quotes.put(key, priceGateway.quote(position.getSymbol()));
            }
        }
        return quotes;
    }

    private MarginThresholds thresholdsFor(Long contestId) {
        return contestRepository.findById(contestId)
                .map(Contest::getMarginThresholds)
                .map(requested -> MarginThresholds.resolve(requested, riskProperties))
                .orElseGet(() -> MarginThresholds.defaults(riskProperties));
    }

    private Map<String, Object> payload(Participant participant, BigDecimal level) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contestId", participant.getContestId());
        payload.put("marginLevel", format(level));
        payload.put("marginCallWarnings", participant.getMarginCallWarnings());
        return payload;
    }

    private String format(BigDecimal level) {
        return level == null ? "inf" : level.toPlainString();
    }
}
