package com.tradearena.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradearena.backend.model.AuditEvent;
import com.tradearena.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only trail of contest and challenge transitions plus sweep failures. Rows join the
 * caller's transaction: a transition that rolls back leaves no audit row behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String CONTEST = "contest";
    public static final String CHALLENGE = "challenge";
    public static final String SCHEDULER = "scheduler";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditEvent contestTransition(Long contestId, String action, String description) {
        return contestTransition(contestId, action, description, null);
    }

    public AuditEvent contestTransition(Long contestId, String action, String description, Map<String, ?> details) {
        return append(CONTEST, contestId, action, description, details);
    }

    public AuditEvent challengeTransition(Long contestId, String action, String description) {
        return append(CHALLENGE, contestId, action, description, null);
    }

    public AuditEvent sweepFailure(String task, Exception failure) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("task", task);
        details.put("exception", failure.getClass().getSimpleName());
        details.put("error", String.valueOf(failure.getMessage()));
        return append(SCHEDULER, null, "SWEEP_FAILED", "Sweep failed: " + task, details);
    }

    public List<AuditEvent> trail(Long contestId) {
        return auditEventRepository.findByContestIdOrderByCreatedAtAscIdAsc(contestId);
    }

    private AuditEvent append(String eventType, Long contestId, String action, String description,
                              Map<String, ?> details) {
        AuditEvent saved = auditEventRepository.save(AuditEvent.builder()
                .contestId(contestId)
                .eventType(eventType)
                .action(action)
                .description(description)
                .metadata(toJson(details))
                .correlationId(MDC.get("correlationId"))
                .createdAt(clock.instant())
                .build());
        log.debug("Audit {}:{} contest={}", eventType, action, contestId);
        return saved;
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit details are not serializable: " + details.keySet(), e);
        }
    }
}
