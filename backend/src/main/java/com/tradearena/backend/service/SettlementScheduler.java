package com.tradearena.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "settlement.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SettlementScheduler {

    private final SchedulerTick schedulerTick;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${settlement.scheduling.activation-interval-ms:30000}")
    public void activateDueContests() {
        scheduledTaskGuard.run("activation-sweep", () -> {
            var result = schedulerTick.activationSweep();
            if (!result.items().isEmpty()) {
                log.info("Activation sweep: {} activated, {} failed", result.succeeded(), result.failed());
            }
        });
    }

    @Scheduled(fixedDelayString = "${settlement.scheduling.finalize-interval-ms:60000}")
    public void finalizeEndedContests() {
        scheduledTaskGuard.run("finalize-sweep", () -> {
            var result = schedulerTick.finalizeSweep();
            if (!result.items().isEmpty()) {
                log.info("Finalize sweep: {} completed, {} deferred or failed", result.succeeded(), result.failed());
            }
        });
    }

    @Scheduled(fixedDelayString = "${settlement.scheduling.risk-interval-ms:15000}")
    public void reevaluateMargins() {
        scheduledTaskGuard.run("risk-sweep", () -> {
            var result = schedulerTick.riskSweep();
            log.debug("Risk sweep: {} evaluated, {} failed", result.succeeded(), result.failed());
        });
    }

    @Scheduled(fixedDelayString = "${settlement.scheduling.challenge-interval-ms:60000}")
    public void expireChallenges() {
        scheduledTaskGuard.run("challenge-expiry-sweep", () -> {
            int expired = schedulerTick.challengeExpirySweep().size();
            if (expired > 0) {
                log.info("Challenge expiry sweep: {} challenge(s) cancelled", expired);
            }
        });
    }

    @Scheduled(fixedDelayString = "${settlement.scheduling.payout-interval-ms:300000}")
    public void flagStuckPayouts() {
        scheduledTaskGuard.run("payout-sweep", schedulerTick::payoutSweep);
    }
}
