package com.tradearena.backend.service;

import com.tradearena.backend.exception.NotFoundException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.PayoutRequest;
import com.tradearena.backend.repository.PayoutRequestRepository;
import com.tradearena.backend.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Inbound payment-provider events. Providers redeliver, so every entry point is idempotent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookService {

    private final CreditLedgerService ledger;
    private final PayoutRequestRepository payoutRequestRepository;
    private final UnitOfWork unitOfWork;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    public LedgerTransaction onDepositConfirmed(Long userId, BigDecimal amount, String providerTxId) {
        if (providerTxId == null || providerTxId.isBlank()) {
            throw new ValidationException("providerTxId is required");
        }
        CreditLedgerService.Posting posting = ledger.post(userId, amount, LedgerTransaction.Type.DEPOSIT,
                providerTxId, "deposit:" + providerTxId, "Deposit confirmed by provider");
        LedgerTransaction tx = posting.transaction();
        if (posting.replayed()) {
            log.info("Deposit {} redelivered for user {}, already credited as tx {}", providerTxId, userId, tx.getId());
            return tx;
        }
        notifications.notifyAfterCommit(userId, "DEPOSIT_CONFIRMED",
                Map.of("amount", tx.getAmount(), "balance", tx.getBalanceAfter()));
        return tx;
    }

    public PayoutRequest requestWithdrawal(Long userId, BigDecimal amount) {
        return unitOfWork.execute("request-withdrawal", () -> {
            LedgerTransaction debit = ledger.debit(userId, amount, LedgerTransaction.Type.WITHDRAWAL,
                    null, null, "Withdrawal requested");
            Instant now = clock.instant();
            PayoutRequest request = payoutRequestRepository.save(PayoutRequest.builder()
                    .userId(userId)
                    .amount(debit.getAmount().negate())
                    .ledgerTransactionId(debit.getId())
                    .status(PayoutRequest.Status.PROCESSING)
                    .flaggedForReview(false)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.info("Withdrawal {} opened for user {} amount {}", request.getId(), userId, request.getAmount());
            return request;
        });
    }

    /**
     * Applies the provider's verdict on a withdrawal. A result for a request that is already
     * PAID or FAILED changes nothing.
     */
    public PayoutRequest onPayoutResult(Long withdrawalId, PayoutRequest.Status outcome, String providerReference,
                                        String failureReason) {
        if (outcome == null || outcome == PayoutRequest.Status.PROCESSING) {
            throw new ValidationException("Payout outcome must be PAID or FAILED");
        }
        PayoutRequest result = unitOfWork.execute("payout-result", () -> {
            PayoutRequest request = payoutRequestRepository.findByIdForUpdate(withdrawalId)
                    .orElseThrow(() -> new NotFoundException("Withdrawal not found: " + withdrawalId));
            if (request.isTerminal()) {
                log.info("Ignoring redelivered payout result {} for withdrawal {} already {}",
                        outcome, withdrawalId, request.getStatus());
                return request;
            }
            if (outcome == PayoutRequest.Status.FAILED) {
                ledger.credit(request.getUserId(), request.getAmount(), LedgerTransaction.Type.PAYOUT_REVERSAL,
                        "payout:" + request.getId(), "payout-reversal:" + request.getId(),
                        "Payout failed: " + failureReason);
                request.setFailureReason(failureReason);
            }
            request.setStatus(outcome);
            request.setProviderReference(providerReference);
            request.setUpdatedAt(clock.instant());
            return payoutRequestRepository.save(request);
        });
        notifications.notifyAfterCommit(result.getUserId(), "PAYOUT_" + result.getStatus(),
                Map.of("withdrawalId", result.getId(), "amount", result.getAmount()));
        return result;
    }
}
