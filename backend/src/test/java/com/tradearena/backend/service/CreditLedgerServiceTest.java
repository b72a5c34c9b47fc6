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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CreditLedgerServiceTest {

    private CreditWalletRepository walletRepository;
    private LedgerTransactionRepository transactionRepository;
    private CreditLedgerService service;
    private CreditWallet wallet;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setup() {
        walletRepository = mock(CreditWalletRepository.class);
        transactionRepository = mock(LedgerTransactionRepository.class);
        UnitOfWork unitOfWork = mock(UnitOfWork.class);
        when(unitOfWork.execute(anyString(), any())).thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(1)).get());

        service = new CreditLedgerService(walletRepository, transactionRepository, unitOfWork,
                new SettlementMetrics(new SimpleMeterRegistry()), Clock.systemUTC());

        wallet = CreditWallet.builder()
                .id(1L)
                .userId(7L)
                .balance(MoneyUtils.bd(100))
                .totalDeposited(MoneyUtils.bd(100))
                .totalWithdrawn(MoneyUtils.ZERO)
                .totalWon(MoneyUtils.ZERO)
                .totalSpent(MoneyUtils.ZERO)
                .totalRefunded(MoneyUtils.ZERO)
                .build();
        when(walletRepository.findByUserIdForUpdate(7L)).thenReturn(Optional.of(wallet));
        when(walletRepository.findByUserId(7L)).thenReturn(Optional.of(wallet));
        when(transactionRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(transactionRepository.save(any(LedgerTransaction.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void debitBeyondBalanceIsRejectedWithoutWrites() {
        assertThatThrownBy(() -> service.debit(7L, MoneyUtils.bd(150), LedgerTransaction.Type.ENTRY_FEE,
                "contest:1", "entry:1:7", "Entry fee"))
                .isInstanceOf(InsufficientFundsException.class);

        verify(transactionRepository, never()).save(any());
        assertThat(wallet.getBalance()).isEqualByComparingTo("100");
    }

    @Test
    void debitRecordsChainAndCounters() {
        LedgerTransaction tx = service.debit(7L, MoneyUtils.bd(30), LedgerTransaction.Type.ENTRY_FEE,
                "contest:1", "entry:1:7", "Entry fee");

        assertThat(tx.getAmount()).isEqualByComparingTo("-30");
        assertThat(tx.getBalanceBefore()).isEqualByComparingTo("100");
        assertThat(tx.getBalanceAfter()).isEqualByComparingTo("70");
        assertThat(wallet.getBalance()).isEqualByComparingTo("70");
        assertThat(wallet.getTotalSpent()).isEqualByComparingTo("30");
    }

    @Test
    void replayOfSameKeyReturnsOriginalTransaction() {
        LedgerTransaction prior = LedgerTransaction.builder()
                .id(9L)
                .userId(7L)
                .type(LedgerTransaction.Type.DEPOSIT)
                .amount(MoneyUtils.bd(50))
                .balanceBefore(MoneyUtils.bd(50))
                .balanceAfter(MoneyUtils.bd(100))
                .status(LedgerTransaction.Status.COMPLETED)
                .idempotencyKey("deposit:tx-1")
                .createdAt(Instant.now())
                .build();
        when(transactionRepository.findByIdempotencyKey("deposit:tx-1")).thenReturn(Optional.of(prior));

        LedgerTransaction replayed = service.credit(7L, MoneyUtils.bd(50), LedgerTransaction.Type.DEPOSIT,
                null, "deposit:tx-1", "Deposit");

        assertThat(replayed).isSameAs(prior);
        assertThat(wallet.getBalance()).isEqualByComparingTo("100");
        verify(transactionRepository, never()).save(any());
    }

    @Test
    void postingReportsWhetherTheKeyWasAlreadyApplied() {
        CreditLedgerService.Posting first = service.post(7L, MoneyUtils.bd(25), LedgerTransaction.Type.DEPOSIT,
                "psp-2", "deposit:psp-2", "Deposit");
        when(transactionRepository.findByIdempotencyKey("deposit:psp-2")).thenReturn(Optional.of(first.transaction()));

        CreditLedgerService.Posting again = service.post(7L, MoneyUtils.bd(25), LedgerTransaction.Type.DEPOSIT,
                "psp-2", "deposit:psp-2", "Deposit");

        assertThat(first.replayed()).isFalse();
        assertThat(again.replayed()).isTrue();
        assertThat(again.transaction()).isSameAs(first.transaction());
        assertThat(wallet.getBalance()).isEqualByComparingTo("125");
    }

    @Test
    void reusingKeyForDifferentAmountConflicts() {
        when(transactionRepository.findByIdempotencyKey("deposit:tx-1")).thenReturn(Optional.of(LedgerTransaction.builder()
                .id(9L)
                .userId(7L)
                .amount(MoneyUtils.bd(50))
                .status(LedgerTransaction.Status.COMPLETED)
                .idempotencyKey("deposit:tx-1")
                .build()));

        assertThatThrownBy(() -> service.credit(7L, MoneyUtils.bd(60), LedgerTransaction.Type.DEPOSIT,
                null, "deposit:tx-1", "Deposit"))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void nonPositiveAmountsAreRejected() {
        assertThatThrownBy(() -> service.credit(7L, BigDecimal.ZERO, LedgerTransaction.Type.DEPOSIT, null, null, "x"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.debit(7L, new BigDecimal("-1"), LedgerTransaction.Type.FEE, null, null, "x"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void adjustmentMayTakeBalanceNegative() {
        LedgerTransaction tx = service.adjust(7L, MoneyUtils.bd(-120), "chargeback", 1L);

        assertThat(tx.getType()).isEqualTo(LedgerTransaction.Type.ADJUSTMENT);
        assertThat(wallet.getBalance()).isEqualByComparingTo("-20");
    }

    @Test
    void verifyChainReportsBrokenLinks() {
        when(transactionRepository.findByUserIdOrderByIdAsc(7L)).thenReturn(List.of(
                completed(1L, "0", "100", "100"),
                completed(2L, "90", "-10", "80")));

        LedgerChainReport report = service.verifyChain(7L);

        assertThat(report.consistent()).isFalse();
        assertThat(report.transactionsChecked()).isEqualTo(2);
        assertThat(report.mismatches()).anyMatch(message -> message.startsWith("tx 2: balanceBefore"));
    }

    private static LedgerTransaction completed(Long id, String before, String amount, String after) {
        return LedgerTransaction.builder()
                .id(id)
                .userId(7L)
                .type(LedgerTransaction.Type.ADJUSTMENT)
                .amount(MoneyUtils.bd(amount))
                .balanceBefore(MoneyUtils.bd(before))
                .balanceAfter(MoneyUtils.bd(after))
                .status(LedgerTransaction.Status.COMPLETED)
                .build();
    }
}
