package com.tradearena.backend.service;

import com.tradearena.backend.config.RiskProperties;
import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.dto.MarkToMarketResult;
import com.tradearena.backend.dto.OpenPositionRequest;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.ExternalDependencyException;
import com.tradearena.backend.exception.NotFoundException;
import com.tradearena.backend.exception.TransactionAbortException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.Contest;
import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.model.TradeHistoryRecord;
import com.tradearena.backend.repository.ContestRepository;
import com.tradearena.backend.repository.ParticipantRepository;
import com.tradearena.backend.repository.PositionRepository;
import com.tradearena.backend.repository.TradeHistoryRecordRepository;
import com.tradearena.backend.service.marketdata.PriceGateway;
import com.tradearena.backend.service.marketdata.Quote;
import com.tradearena.backend.service.marketdata.SymbolNormalizer;
import com.tradearena.backend.service.risk.PnlCalculator;
import com.tradearena.backend.service.risk.RiskEvaluationService;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PositionService {

    private final ContestRepository contestRepository;
    private final ParticipantRepository participantRepository;
    private final PositionRepository positionRepository;
    private final TradeHistoryRecordRepository tradeHistoryRecordRepository;
    private final PositionSettlementService positionSettlementService;
    private final RiskEvaluationService riskEvaluationService;
    private final ContractSpecService contractSpecService;
    private final PriceGateway priceGateway;
    private final UnitOfWork unitOfWork;
    private final RiskProperties riskProperties;
    private final SettlementMetrics metrics;
    private final DeadLetterQueueService deadLetterQueueService;
    private final Clock clock;

    public Position openPosition(Long contestId, OpenPositionRequest request) {
        validateRequest(request);
        Quote quote = priceGateway.quote(request.getSymbol());

        Position opened = unitOfWork.execute("open-position", () -> {
            Instant now = clock.instant();
            Contest contest = contestRepository.findById(contestId)
                    .orElseThrow(() -> new NotFoundException("Contest not found: " + contestId));
            if (contest.getStatus() != Contest.Status.ACTIVE || contest.hasEnded(now)) {
                throw new ValidationException("Contest " + contestId + " is not open for trading");
            }
            Participant participant = participantRepository
                    .findByContestIdAndUserIdForUpdate(contestId, request.getUserId())
                    .orElseThrow(() -> new NotFoundException("User " + request.getUserId()
                            + " has not joined contest " + contestId));
            if (!participant.isActive()) {
                throw new ValidationException("Participant " + participant.getId() + " is " + participant.getStatus());
            }

            ContestRules rules = ContestRules.resolve(contest.getRules());
            if (request.getLeverage() > rules.getMaxLeverage()) {
                throw new ValidationException("Leverage " + request.getLeverage()
                        + " exceeds contest maximum " + rules.getMaxLeverage());
            }
            long openCount = positionRepository.countByParticipantIdAndStatus(participant.getId(), Position.Status.OPEN);
            if (openCount >= rules.getMaxOpenPositions()) {
                throw new ValidationException("Maximum of " + rules.getMaxOpenPositions() + " open positions reached");
            }

            BigDecimal multiplier = contractSpecService.multiplier(request.getSymbol());
            BigDecimal entryPrice = PnlCalculator.entryPrice(request.getSide(), quote);
            BigDecimal marginRequired = PnlCalculator.marginRequired(
                    request.getQuantity(), multiplier, entryPrice, request.getLeverage());
            if (marginRequired.compareTo(participant.getAvailableCapital()) > 0
                    || MoneyUtils.add(participant.getUsedMargin(), marginRequired).compareTo(participant.getCurrentCapital()) > 0) {
                throw new ValidationException("Insufficient margin: required " + marginRequired.toPlainString()
                        + ", available " + participant.getAvailableCapital().toPlainString());
            }
            validateProtectiveLevels(request, entryPrice);

            BigDecimal exitPrice = PnlCalculator.exitPrice(request.getSide(), quote);
            Position position = positionRepository.save(Position.builder()
                    .contestId(contestId)
                    .participantId(participant.getId())
                    .userId(participant.getUserId())
                    .symbol(SymbolNormalizer.normalize(request.getSymbol()))
                    .side(request.getSide())
                    .quantity(MoneyUtils.scale(request.getQuantity()))
                    .entryPrice(entryPrice)
                    .currentPrice(exitPrice)
                    .leverage(request.getLeverage())
                    .marginUsed(marginRequired)
                    .unrealizedPnl(PnlCalculator.pnl(request.getSide(), entryPrice, exitPrice,
                            request.getQuantity(), multiplier))
                    .stopLoss(MoneyUtils.price(request.getStopLoss()))
                    .takeProfit(MoneyUtils.price(request.getTakeProfit()))
                    .status(Position.Status.OPEN)
                    .openedAt(now)
                    .build());

            participant.setUsedMargin(MoneyUtils.add(participant.getUsedMargin(), marginRequired));
            positionSettlementService.refreshAggregates(participant);
            log.info("Opened position {} participant={} {} {} x{} @ {} leverage={} margin={}", position.getId(),
                    participant.getId(), position.getSide(), position.getSymbol(), position.getQuantity(),
                    entryPrice.toPlainString(), position.getLeverage(), marginRequired.toPlainString());
            return position;
        });

        metrics.recordPositionOpened();
        riskEvaluationService.evaluate(opened.getParticipantId());
        return opened;
    }

    /**
     * Closes at the current market price. Closing a position twice returns the first close's
     * trade record.
     */
    public TradeHistoryRecord closePosition(Long positionId, Position.CloseReason reason) {
        Position snapshot = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found: " + positionId));
        if (!snapshot.isOpen()) {
            return existingRecord(positionId);
        }
        Quote quote = priceGateway.quote(snapshot.getSymbol());

        TradeHistoryRecord record = unitOfWork.execute("close-position", () -> {
            Participant participant = participantRepository.findByIdForUpdate(snapshot.getParticipantId())
                    .orElseThrow(() -> new NotFoundException("Participant not found: " + snapshot.getParticipantId()));
            Position position = positionRepository.findById(positionId)
                    .orElseThrow(() -> new NotFoundException("Position not found: " + positionId));
            if (!position.isOpen()) {
                return existingRecord(positionId);
            }
            if (reason == Position.CloseReason.USER && !participant.isActive()) {
                throw new ValidationException("Participant " + participant.getId() + " is " + participant.getStatus());
            }
            return positionSettlementService.closeAtPrice(participant, position,
                    PnlCalculator.exitPrice(position.getSide(), quote), reason);
        });

        riskEvaluationService.evaluate(snapshot.getParticipantId());
        return record;
    }

    /**
     * Operator close at market with reason ADMIN, reported as a one-item batch.
     */
    public BatchResult forceClosePosition(Long positionId) {
        Position snapshot = positionRepository.findById(positionId)
                .orElseThrow(() -> new NotFoundException("Position not found: " + positionId));
        ItemOutcome outcome;
        if (!snapshot.isOpen()) {
            outcome = ItemOutcome.skipped("position", positionId, snapshot.getUserId(),
                    "Already closed: " + snapshot.getCloseReason());
        } else {
            try {
                TradeHistoryRecord record = closePosition(positionId, Position.CloseReason.ADMIN);
                outcome = ItemOutcome.succeeded("position", positionId, snapshot.getUserId(),
                        "Closed at " + record.getExitPrice().toPlainString() + " pnl " + record.getRealizedPnl().toPlainString());
            } catch (ExternalDependencyException e) {
                deadLetterQueueService.logFailure(DeadLetterQueueService.FORCED_CLOSE_PRICE_UNAVAILABLE,
                        "position=" + positionId + " participant=" + snapshot.getParticipantId(), e.getMessage());
                outcome = ItemOutcome.failed("position", positionId, snapshot.getUserId(), e.getMessage());
            } catch (ConflictException | TransactionAbortException e) {
                outcome = ItemOutcome.failed("position", positionId, snapshot.getUserId(), e.getMessage());
            }
        }
        log.info("Admin force-close of position {}: {} {}", positionId, outcome.status(), outcome.message());
        return new BatchResult("forceClosePosition", positionId, null, List.of(outcome));
    }

    /**
     * Re-marks every open position of a participant and closes those whose stop-loss or
     * take-profit level has been crossed.
     */
    public MarkToMarketResult markToMarket(Long participantId) {
        Participant snapshot = participantRepository.findById(participantId)
                .orElseThrow(() -> new NotFoundException("Participant not found: " + participantId));
        if (!snapshot.isActive()) {
            return new MarkToMarketResult(participantId, 0, List.of(), snapshot.getUnrealizedPnl());
        }
        Map<String, Quote> quotes = new HashMap<>();
        for (Position position : openPositions(participantId)) {
            quotes.computeIfAbsent(position.getSymbol(), priceGateway::quote);
        }

        return unitOfWork.execute("mark-to-market", () -> {
            Participant participant = participantRepository.findByIdForUpdate(participantId)
                    .orElseThrow(() -> new NotFoundException("Participant not found: " + participantId));
            if (!participant.isActive()) {
                return new MarkToMarketResult(participantId, 0, List.of(), participant.getUnrealizedPnl());
            }
            List<Long> triggered = new ArrayList<>();
            int marked = 0;
            for (Position position : openPositions(participantId)) {
                Quote quote = quotes.computeIfAbsent(position.getSymbol(), priceGateway::quote);
                BigDecimal exitPrice = PnlCalculator.exitPrice(position.getSide(), quote);
                Position.CloseReason trigger = protectiveTrigger(position, exitPrice);
                if (trigger != null) {
                    positionSettlementService.closeAtPrice(participant, position, exitPrice, trigger);
                    triggered.add(position.getId());
                } else {
                    positionSettlementService.mark(position, exitPrice);
                    marked++;
                }
            }
            positionSettlementService.refreshAggregates(participant);
            return new MarkToMarketResult(participantId, marked, triggered, participant.getUnrealizedPnl());
        });
    }

    public List<Position> openPositions(Long participantId) {
        return positionRepository.findByParticipantIdAndStatusOrderByIdAsc(participantId, Position.Status.OPEN);
    }

    static Position.CloseReason protectiveTrigger(Position position, BigDecimal exitPrice) {
        BigDecimal stopLoss = position.getStopLoss();
        BigDecimal takeProfit = position.getTakeProfit();
        if (position.getSide() == Position.Side.LONG) {
            if (stopLoss != null && exitPrice.compareTo(stopLoss) <= 0) {
                return Position.CloseReason.STOP_LOSS;
            }
            if (takeProfit != null && exitPrice.compareTo(takeProfit) >= 0) {
                return Position.CloseReason.TAKE_PROFIT;
            }
        } else {
            if (stopLoss != null && exitPrice.compareTo(stopLoss) >= 0) {
                return Position.CloseReason.STOP_LOSS;
            }
            if (takeProfit != null && exitPrice.compareTo(takeProfit) <= 0) {
                return Position.CloseReason.TAKE_PROFIT;
            }
        }
        return null;
    }

    private TradeHistoryRecord existingRecord(Long positionId) {
        return tradeHistoryRecordRepository.findByPositionId(positionId)
                .orElseThrow(() -> new NotFoundException("Trade record not found for position " + positionId));
    }

    private void validateRequest(OpenPositionRequest request) {
        if (request.getSide() == null) {
            throw new ValidationException("Side is required");
        }
        if (!MoneyUtils.isPositive(request.getQuantity())) {
            throw new ValidationException("Quantity must be positive");
        }
        if (request.getQuantity().compareTo(riskProperties.getLimits().getMaxLots()) > 0) {
            throw new ValidationException("Quantity exceeds maximum of " + riskProperties.getLimits().getMaxLots() + " lots");
        }
        if (request.getLeverage() == null || request.getLeverage() < 1
                || request.getLeverage() > riskProperties.getLimits().getMaxLeverage()) {
            throw new ValidationException("Leverage must be between 1 and " + riskProperties.getLimits().getMaxLeverage());
        }
    }

    private void validateProtectiveLevels(OpenPositionRequest request, BigDecimal entryPrice) {
        boolean isLong = request.getSide() == Position.Side.LONG;
        if (request.getStopLoss() != null) {
            boolean valid = isLong ? request.getStopLoss().compareTo(entryPrice) < 0
                    : request.getStopLoss().compareTo(entryPrice) > 0;
            if (!valid) {
                throw new ValidationException("Stop loss " + request.getStopLoss() + " is on the wrong side of entry " + entryPrice);
            }
        }
        if (request.getTakeProfit() != null) {
            boolean valid = isLong ? request.getTakeProfit().compareTo(entryPrice) > 0
                    : request.getTakeProfit().compareTo(entryPrice) < 0;
            if (!valid) {
                throw new ValidationException("Take profit " + request.getTakeProfit() + " is on the wrong side of entry " + entryPrice);
            }
        }
    }
}
