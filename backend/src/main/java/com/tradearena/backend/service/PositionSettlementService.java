package com.tradearena.backend.service;

import com.tradearena.backend.model.Participant;
import com.tradearena.backend.model.Position;
import com.tradearena.backend.model.TradeHistoryRecord;
import com.tradearena.backend.repository.ParticipantRepository;
import com.tradearena.backend.repository.PositionRepository;
import com.tradearena.backend.repository.TradeHistoryRecordRepository;
import com.tradearena.backend.service.risk.PnlCalculator;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Position writes shared by trading, risk evaluation and contest settlement. Every method here
 * expects to run inside a unit of work that already holds the participant row lock and has read
 * the position after taking it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionSettlementService {

    private final PositionRepository positionRepository;
    private final ParticipantRepository participantRepository;
    private final TradeHistoryRecordRepository tradeHistoryRecordRepository;
    private final ContractSpecService contractSpecService;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Closes a position at a price the caller already obtained. A position that is already
     * closed is left alone and its existing trade record returned.
     */
    public TradeHistoryRecord closeAtPrice(Participant participant, Position position, BigDecimal exitPrice,
                                           Position.CloseReason reason) {
        if (!position.isOpen()) {
            return tradeHistoryRecordRepository.findByPositionId(position.getId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Closed position " + position.getId() + " has no trade record"));
        }
        Instant now = clock.instant();
        BigDecimal price = MoneyUtils.price(exitPrice);
        BigDecimal multiplier = contractSpecService.multiplier(position.getSymbol());
        BigDecimal pnl = PnlCalculator.pnl(position, price, multiplier);

        position.setExitPrice(price);
        position.setCurrentPrice(price);
        position.setRealizedPnl(pnl);
        position.setUnrealizedPnl(MoneyUtils.ZERO);
        position.setStatus(Position.Status.CLOSED);
        position.setCloseReason(reason);
        position.setClosedAt(now);
        positionRepository.save(position);

        TradeHistoryRecord record = tradeHistoryRecordRepository.save(TradeHistoryRecord.builder()
                .positionId(position.getId())
                .contestId(position.getContestId())
                .participantId(position.getParticipantId())
                .userId(position.getUserId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .quantity(position.getQuantity())
                .entryPrice(position.getEntryPrice())
                .exitPrice(price)
                .priceChange(MoneyUtils.price(price.subtract(position.getEntryPrice())))
                .realizedPnl(pnl)
                .realizedPnlPct(PnlCalculator.percentOfMargin(pnl, position.getMarginUsed()))
                .leverage(position.getLeverage())
                .marginUsed(position.getMarginUsed())
                .holdingTimeSeconds(Duration.between(position.getOpenedAt(), now).getSeconds())
                .closeReason(reason)
                .winner(pnl.signum() > 0)
                .openedAt(position.getOpenedAt())
                .closedAt(now)
                .build());

        participant.setCurrentCapital(MoneyUtils.add(participant.getCurrentCapital(), pnl));
        BigDecimal usedMargin = MoneyUtils.subtract(participant.getUsedMargin(), position.getMarginUsed());
        participant.setUsedMargin(usedMargin.signum() < 0 ? MoneyUtils.ZERO : usedMargin);
        participant.setRealizedPnl(MoneyUtils.add(participant.getRealizedPnl(), pnl));
        participant.setTotalTrades(participant.getTotalTrades() + 1);
        if (pnl.signum() > 0) {
            participant.setWinningTrades(participant.getWinningTrades() + 1);
            participant.setGrossProfit(MoneyUtils.add(participant.getGrossProfit(), pnl));
        } else if (pnl.signum() < 0) {
            participant.setLosingTrades(participant.getLosingTrades() + 1);
            participant.setGrossLoss(MoneyUtils.add(participant.getGrossLoss(), pnl.abs()));
        }
        refreshAggregates(participant);

        metrics.recordPositionClosed(reason.name());
        log.info("Closed position {} participant={} {} {} @ {} pnl={} reason={}", position.getId(),
                participant.getId(), position.getSide(), position.getSymbol(), price.toPlainString(),
                pnl.toPlainString(), reason);
        return record;
    }

    /**
     * Closes a position of a cancelled contest. Capital is not touched: the exit is booked at the
     * entry price with zero PnL, and the trade record still gets written.
     */
    public TradeHistoryRecord closeWithoutSettlement(Participant participant, Position position) {
        if (!position.isOpen()) {
            return tradeHistoryRecordRepository.findByPositionId(position.getId()).orElse(null);
        }
        Instant now = clock.instant();
        position.setExitPrice(position.getEntryPrice());
        position.setRealizedPnl(MoneyUtils.ZERO);
        position.setUnrealizedPnl(MoneyUtils.ZERO);
        position.setStatus(Position.Status.CLOSED);
        position.setCloseReason(Position.CloseReason.CONTEST_END);
        position.setClosedAt(now);
        positionRepository.save(position);

        TradeHistoryRecord record = tradeHistoryRecordRepository.save(TradeHistoryRecord.builder()
                .positionId(position.getId())
                .contestId(position.getContestId())
                .participantId(position.getParticipantId())
                .userId(position.getUserId())
                .symbol(position.getSymbol())
                .side(position.getSide())
                .quantity(position.getQuantity())
                .entryPrice(position.getEntryPrice())
                .exitPrice(position.getEntryPrice())
                .priceChange(MoneyUtils.price(BigDecimal.ZERO))
                .realizedPnl(MoneyUtils.ZERO)
                .realizedPnlPct(MoneyUtils.ZERO)
                .leverage(position.getLeverage())
                .marginUsed(position.getMarginUsed())
                .holdingTimeSeconds(Duration.between(position.getOpenedAt(), now).getSeconds())
                .closeReason(Position.CloseReason.CONTEST_END)
                .winner(false)
                .openedAt(position.getOpenedAt())
                .closedAt(now)
                .build());

        BigDecimal usedMargin = MoneyUtils.subtract(participant.getUsedMargin(), position.getMarginUsed());
        participant.setUsedMargin(usedMargin.signum() < 0 ? MoneyUtils.ZERO : usedMargin);
        refreshAggregates(participant);
        log.info("Voided position {} of cancelled contest {}", position.getId(), position.getContestId());
        return record;
    }

    /**
     * Refreshes the mark of an open position from an exit-side price.
     */
    public void mark(Position position, BigDecimal exitPrice) {
        BigDecimal price = MoneyUtils.price(exitPrice);
        BigDecimal multiplier = contractSpecService.multiplier(position.getSymbol());
        position.setCurrentPrice(price);
        position.setUnrealizedPnl(PnlCalculator.pnl(position, price, multiplier));
        positionRepository.save(position);
    }

    /**
     * Recomputes unrealized PnL and available capital from the participant's open positions.
     */
    public void refreshAggregates(Participant participant) {
        List<Position> open = positionRepository.findByParticipantIdAndStatusOrderByIdAsc(
                participant.getId(), Position.Status.OPEN);
        BigDecimal unrealized = MoneyUtils.ZERO;
        for (Position position : open) {
            unrealized = MoneyUtils.add(unrealized, position.getUnrealizedPnl());
        }
        participant.setUnrealizedPnl(unrealized);
        participant.setAvailableCapital(MoneyUtils.subtract(participant.getCurrentCapital(), participant.getUsedMargin()));
        participantRepository.save(participant);
    }
}
