package com.tradearena.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradearena.backend.model.AuditEvent;
import com.tradearena.backend.repository.AuditEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduledTaskGuardTest {

    private static final Instant NOW = Instant.parse("2026-06-01T09:00:00Z");

    private AuditEventRepository auditEventRepository;
    private ScheduledTaskGuard guard;

    @BeforeEach
    void setup() {
        auditEventRepository = mock(AuditEventRepository.class);
        when(auditEventRepository.save(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        guard = new ScheduledTaskGuard(new AuditEventService(auditEventRepository, new ObjectMapper(), clock), clock);
    }

    @Test
    void failingSweepIsAuditedAtClockTime() {
        boolean completed = guard.run("finalize-sweep", () -> {
            throw new IllegalStateException("price feed down");
        });

        assertThat(completed).isFalse();
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditEventRepository).save(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.getEventType()).isEqualTo(AuditEventService.SCHEDULER);
        assertThat(event.getAction()).isEqualTo("SWEEP_FAILED");
        assertThat(event.getCreatedAt()).isEqualTo(NOW);
        assertThat(event.getMetadata())
                .contains("\"task\":\"finalize-sweep\"")
                .contains("\"error\":\"price feed down\"");
    }

    @Test
    void successfulSweepWritesNothing() {
        assertThat(guard.run("risk-sweep", () -> { })).isTrue();

        verify(auditEventRepository, never()).save(any());
    }

    @Test
    void auditFailureDoesNotEscapeTheGuard() {
        when(auditEventRepository.save(any(AuditEvent.class))).thenThrow(new IllegalStateException("db down"));

        assertThat(guard.run("payout-sweep", () -> {
            throw new IllegalStateException("boom");
        })).isFalse();
    }
}
