package com.tradearena.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SettlementMetrics {

    private final MeterRegistry meterRegistry;

    private Counter idempotentReplaysCounter;
    private Counter liquidationsCounter;
    private Counter forcedCloseFailuresCounter;
    private Counter contestsFinalizedCounter;
    private Counter contestsCancelledCounter;
    private Counter positionsOpenedCounter;
    private Counter positionsClosedCounter;

    @PostConstruct
    void init() {
        idempotentReplaysCounter = Counter.builder("ledger_idempotent_replays_total").register(meterRegistry);
        liquidationsCounter = Counter.builder("participant_liquidations_total").register(meterRegistry);
        forcedCloseFailuresCounter = Counter.builder("forced_close_failures_total").register(meterRegistry);
        contestsFinalizedCounter = Counter.builder("contests_finalized_total").register(meterRegistry);
        contestsCancelledCounter = Counter.builder("contests_cancelled_total").register(meterRegistry);
        positionsOpenedCounter = Counter.builder("positions_opened_total").register(meterRegistry);
        positionsClosedCounter = Counter.builder("positions_closed_total").register(meterRegistry);
    }

    public void recordLedgerMutation(String direction, String type) {
        Counter.builder("ledger_mutations_total")
                .tag("direction", direction)
                .tag("type", type)
                .register(meterRegistry)
                .increment();
    }

    public void recordIdempotentReplay() {
        if (idempotentReplaysCounter != null) {
            idempotentReplaysCounter.increment();
        }
    }

    public void recordLiquidation() {
        if (liquidationsCounter != null) {
            liquidationsCounter.increment();
        }
    }

    public void recordForcedCloseFailure() {
        if (forcedCloseFailuresCounter != null) {
            forcedCloseFailuresCounter.increment();
        }
    }

    public void recordContestFinalized() {
        if (contestsFinalizedCounter != null) {
            contestsFinalizedCounter.increment();
        }
    }

    public void recordContestCancelled() {
        if (contestsCancelledCounter != null) {
            contestsCancelledCounter.increment();
        }
    }

    public void recordPositionOpened() {
        if (positionsOpenedCounter != null) {
            positionsOpenedCounter.increment();
        }
    }

    public void recordPositionClosed(String reason) {
        if (positionsClosedCounter != null) {
            positionsClosedCounter.increment();
        }
        Counter.builder("positions_closed_by_reason_total")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
