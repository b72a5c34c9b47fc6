package com.tradearena.backend.service;

import com.tradearena.backend.model.FailedOperation;
import com.tradearena.backend.repository.FailedOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Manual review queue. Entries are written in their own transaction so they survive the
 * rollback of the unit of work that failed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterQueueService {

    public static final String FORCED_CLOSE_PRICE_UNAVAILABLE = "FORCED_CLOSE_PRICE_UNAVAILABLE";
    public static final String CONTEST_END_CLOSE_FAILED = "CONTEST_END_CLOSE_FAILED";
    public static final String REFUND_FAILED = "REFUND_FAILED";
    public static final String PAYOUT_STUCK = "PAYOUT_STUCK";

    private final FailedOperationRepository repo;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FailedOperation logFailure(String type, String details, String error) {
        log.error("DLQ entry [{}] {} -> {}", type, details, error);

        FailedOperation op = FailedOperation.builder()
                .operationType(type)
                .details(truncate(details, 500))
                .errorMessage(truncate(error, 2000))
                .timestamp(clock.instant())
                .resolved(false)
                .retryCount(0)
                .build();

        return repo.save(op);
    }

    public List<FailedOperation> unresolved() {
        return repo.findByResolvedFalse();
    }

    @Transactional
    public void resolve(Long id) {
        repo.findById(id).ifPresent(op -> {
            op.setResolved(true);
            repo.save(op);
            log.info("DLQ operation {} marked as resolved", id);
        });
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
