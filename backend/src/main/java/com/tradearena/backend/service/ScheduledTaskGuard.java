package com.tradearena.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Keeps one failing sweep from stopping the scheduler thread. A failure is logged and written
 * to the audit trail; the next tick runs the sweep again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditEventService auditEventService;
    private final Clock clock;

    public boolean run(String taskName, Runnable task) {
        Instant startedAt = clock.instant();
        MDC.put("sweep", taskName);
        try {
            task.run();
            log.debug("Sweep {} finished in {} ms", taskName, Duration.between(startedAt, clock.instant()).toMillis());
            return true;
        } catch (Exception e) {
            log.error("Sweep {} failed after {} ms", taskName, Duration.between(startedAt, clock.instant()).toMillis(), e);
            try {
                auditEventService.sweepFailure(taskName, e);
            } catch (Exception auditFailure) {
                log.warn("Could not audit failure of sweep {}: {}", taskName, auditFailure.getMessage());
            }
            return false;
        } finally {
            MDC.remove("sweep");
        }
    }
}
