package com.tradearena.backend.service;

import com.tradearena.backend.dto.LedgerChainReport;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.InsufficientFundsException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.CreditWallet;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.repository.CreditWalletRepository;
import com.tradearena.backend.repository.LedgerTransactionRepository;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single writer of wallet balances. Every mutation locks the wallet row, writes one
 * {@link LedgerTransaction} and updates the wallet inside the same unit of work.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerService {

    private final CreditWalletRepository walletRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final UnitOfWork unitOfWork;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Outcome of a keyed mutation. {@code replayed} is true when the key had already been
     * applied and the stored transaction was returned without writing anything.
     */
    public record Posting(LedgerTransaction transaction, boolean replayed) {
    }

    public LedgerTransaction credit(Long userId, BigDecimal amount, LedgerTransaction.Type type,
                                    String correlationId, String idempotencyKey, String description) {
        return post(userId, amount, type, correlationId, idempotencyKey, description).transaction();
    }

    /**
     * Credit that also reports whether this call wrote the transaction or replayed an earlier one.
     */
    public Posting post(Long userId, BigDecimal amount, LedgerTransaction.Type type,
                        String correlationId, String idempotencyKey, String description) {
        requirePositive(amount);
        return unitOfWork.execute("ledger-credit",
                () -> apply(userId, MoneyUtils.scale(amount), type, correlationId, idempotencyKey, description, false));
    }

    public LedgerTransaction debit(Long userId, BigDecimal amount, LedgerTransaction.Type type,
                                   String correlationId, String idempotencyKey, String description) {
        requirePositive(amount);
        return unitOfWork.execute("ledger-debit",
                () -> apply(userId, MoneyUtils.scale(amount).negate(), type, correlationId, idempotencyKey, description, false))
                .transaction();
    }

    /**
     * Operator correction. The only mutation allowed to take a balance below zero.
     */
    public LedgerTransaction adjust(Long userId, BigDecimal signedAmount, String reason, Long operatorId) {
        if (signedAmount == null || signedAmount.signum() == 0) {
            throw new ValidationException("Adjustment amount must be non-zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Adjustment reason is required");
        }
        String description = "Adjustment by operator " + operatorId + ": " + reason;
        return unitOfWork.execute("ledger-adjust",
                () -> apply(userId, MoneyUtils.scale(signedAmount), LedgerTransaction.Type.ADJUSTMENT,
                        "operator:" + operatorId, null, description, true))
                .transaction();
    }

    public CreditWallet getWallet(Long userId) {
        return unitOfWork.execute("wallet-get", () -> walletRepository.findByUserId(userId)
                .orElseGet(() -> walletRepository.save(emptyWallet(userId))));
    }

    public BigDecimal balanceOf(Long userId) {
        return walletRepository.findByUserId(userId)
                .map(CreditWallet::getBalance)
                .orElse(MoneyUtils.ZERO);
    }

    public List<LedgerTransaction> history(Long userId) {
        return transactionRepository.findByUserIdOrderByIdAsc(userId);
    }

    public Optional<LedgerTransaction> findByIdempotencyKey(String idempotencyKey) {
        return transactionRepository.findByIdempotencyKey(idempotencyKey);
    }

    /**
     * Replays the completed transactions of a user from a zero balance and reports every break
     * in the chain and any difference from the stored wallet balance.
     */
    public LedgerChainReport verifyChain(Long userId) {
        List<String> mismatches = new ArrayList<>();
        BigDecimal running = MoneyUtils.ZERO;
        int checked = 0;
        for (LedgerTransaction tx : transactionRepository.findByUserIdOrderByIdAsc(userId)) {
            if (tx.getStatus() != LedgerTransaction.Status.COMPLETED) {
                continue;
            }
            checked++;
            BigDecimal expectedAfter = MoneyUtils.add(tx.getBalanceBefore(), tx.getAmount());
            if (expectedAfter.compareTo(tx.getBalanceAfter()) != 0) {
                mismatches.add("tx " + tx.getId() + ": balanceAfter " + tx.getBalanceAfter().toPlainString()
                        + " != balanceBefore + amount " + expectedAfter.toPlainString());
            }
            if (running.compareTo(tx.getBalanceBefore()) != 0) {
                mismatches.add("tx " + tx.getId() + ": balanceBefore " + tx.getBalanceBefore().toPlainString()
                        + " != running balance " + running.toPlainString());
            }
            running = MoneyUtils.add(running, tx.getAmount());
        }
        BigDecimal walletBalance = balanceOf(userId);
        if (running.compareTo(walletBalance) != 0) {
            mismatches.add("wallet balance " + walletBalance.toPlainString()
                    + " != replayed balance " + running.toPlainString());
        }
        if (!mismatches.isEmpty()) {
            log.error("Ledger chain mismatch for user {}: {}", userId, mismatches);
        }
        return new LedgerChainReport(userId, checked, running, walletBalance, mismatches);
    }

    private Posting apply(Long userId, BigDecimal signedAmount, LedgerTransaction.Type type,
                                    String correlationId, String idempotencyKey, String description,
                                    boolean allowNegative) {
        CreditWallet wallet = lockWallet(userId);

        if (idempotencyKey != null) {
            Optional<LedgerTransaction> prior = transactionRepository.findByIdempotencyKey(idempotencyKey);
            if (prior.isPresent()) {
                return new Posting(replay(prior.get(), userId, signedAmount), true);
            }
        }

        BigDecimal before = wallet.getBalance();
        BigDecimal after = MoneyUtils.add(before, signedAmount);
        if (!allowNegative && after.signum() < 0) {
            throw new InsufficientFundsException(userId, signedAmount.abs(), before);
        }

        LedgerTransaction tx = transactionRepository.save(LedgerTransaction.builder()
                .userId(userId)
                .type(type)
                .amount(signedAmount)
                .balanceBefore(before)
                .balanceAfter(after)
                .status(LedgerTransaction.Status.COMPLETED)
                .correlationId(correlationId)
                .idempotencyKey(idempotencyKey)
                .description(description)
                .createdAt(clock.instant())
                .build());

        wallet.setBalance(after);
        applyCounters(wallet, type, signedAmount);
        walletRepository.save(wallet);

        metrics.recordLedgerMutation(signedAmount.signum() >= 0 ? "credit" : "debit", type.name());
        log.info("Ledger {} user={} amount={} balance {} -> {} key={}", type, userId,
                signedAmount.toPlainString(), before.toPlainString(), after.toPlainString(), idempotencyKey);
        return new Posting(tx, false);
    }

    private LedgerTransaction replay(LedgerTransaction prior, Long userId, BigDecimal signedAmount) {
        if (!prior.getUserId().equals(userId) || prior.getAmount().compareTo(signedAmount) != 0) {
            throw new ConflictException("Idempotency key " + prior.getIdempotencyKey()
                    + " already used for a different ledger mutation");
        }
        if (prior.getStatus() != LedgerTransaction.Status.COMPLETED) {
            throw new ConflictException("Ledger transaction " + prior.getId() + " with key "
                    + prior.getIdempotencyKey() + " is " + prior.getStatus());
        }
        metrics.recordIdempotentReplay();
        log.debug("Idempotent replay of ledger key {} -> tx {}", prior.getIdempotencyKey(), prior.getId());
        return prior;
    }

    private CreditWallet lockWallet(Long userId) {
        return walletRepository.findByUserIdForUpdate(userId)
                .orElseGet(() -> walletRepository.saveAndFlush(emptyWallet(userId)));
    }

    private void applyCounters(CreditWallet wallet, LedgerTransaction.Type type, BigDecimal signedAmount) {
        BigDecimal magnitude = signedAmount.abs();
        switch (type) {
            case DEPOSIT -> wallet.setTotalDeposited(MoneyUtils.add(wallet.getTotalDeposited(), magnitude));
            case WITHDRAWAL -> wallet.setTotalWithdrawn(MoneyUtils.add(wallet.getTotalWithdrawn(), magnitude));
            case PAYOUT_REVERSAL -> wallet.setTotalWithdrawn(MoneyUtils.subtract(wallet.getTotalWithdrawn(), magnitude));
            case PRIZE -> wallet.setTotalWon(MoneyUtils.add(wallet.getTotalWon(), magnitude));
            case ENTRY_FEE, FEE -> wallet.setTotalSpent(MoneyUtils.add(wallet.getTotalSpent(), magnitude));
            case REFUND -> wallet.setTotalRefunded(MoneyUtils.add(wallet.getTotalRefunded(), magnitude));
            default -> log.debug("No cumulative counter for {}", type);
        }
    }

    private CreditWallet emptyWallet(Long userId) {
        return CreditWallet.builder()
                .userId(userId)
                .balance(MoneyUtils.ZERO)
                .totalDeposited(MoneyUtils.ZERO)
                .totalWithdrawn(MoneyUtils.ZERO)
                .totalWon(MoneyUtils.ZERO)
                .totalSpent(MoneyUtils.ZERO)
                .totalRefunded(MoneyUtils.ZERO)
                .build();
    }

    private void requirePositive(BigDecimal amount) {
        if (!MoneyUtils.isPositive(amount)) {
            throw new ValidationException("Amount must be positive");
        }
    }
}
