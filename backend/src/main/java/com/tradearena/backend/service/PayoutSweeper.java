package com.tradearena.backend.service;

import com.tradearena.backend.config.SettlementProperties;
import com.tradearena.backend.model.PayoutRequest;
import com.tradearena.backend.repository.PayoutRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Surfaces withdrawals stuck in PROCESSING for an operator. The provider may already have paid,
 * so nothing is rolled back here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutSweeper {

    private final PayoutRequestRepository payoutRequestRepository;
    private final SettlementProperties properties;
    private final DeadLetterQueueService deadLetterQueueService;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public int flagStuckPayouts() {
        Instant cutoff = clock.instant().minus(properties.getPayout().getStuckAfter());
        List<PayoutRequest> stuck = payoutRequestRepository
                .findByStatusAndFlaggedForReviewFalseAndCreatedAtBefore(PayoutRequest.Status.PROCESSING, cutoff);
        int flagged = 0;
        for (PayoutRequest candidate : stuck) {
            boolean changed = unitOfWork.execute("flag-stuck-payout", () -> {
                PayoutRequest request = payoutRequestRepository.findByIdForUpdate(candidate.getId()).orElse(null);
                if (request == null || request.isTerminal() || request.isFlaggedForReview()) {
                    return false;
                }
                request.setFlaggedForReview(true);
                request.setUpdatedAt(clock.instant());
                payoutRequestRepository.save(request);
                return true;
            });
            if (changed) {
                flagged++;
                deadLetterQueueService.logFailure(DeadLetterQueueService.PAYOUT_STUCK,
                        "withdrawal=" + candidate.getId() + " user=" + candidate.getUserId()
                                + " amount=" + candidate.getAmount().toPlainString(),
                        "PROCESSING since " + candidate.getCreatedAt());
            }
        }
        if (flagged > 0) {
            log.warn("Flagged {} stuck payout(s) for manual review", flagged);
        }
        return flagged;
    }
}
