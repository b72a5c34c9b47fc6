package com.tradearena.backend.service;

import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.repository.PayoutRequestRepository;
import com.tradearena.backend.service.notification.NotificationDispatcher;
import com.tradearena.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PaymentWebhookServiceTest {

    private CreditLedgerService ledger;
    private NotificationDispatcher notifications;
    private PaymentWebhookService service;
    private LedgerTransaction deposit;

    @BeforeEach
    void setup() {
        ledger = mock(CreditLedgerService.class);
        notifications = mock(NotificationDispatcher.class);
        service = new PaymentWebhookService(ledger, mock(PayoutRequestRepository.class), mock(UnitOfWork.class),
                notifications, Clock.systemUTC());
        deposit = LedgerTransaction.builder()
                .id(3L)
                .userId(11L)
                .type(LedgerTransaction.Type.DEPOSIT)
                .amount(MoneyUtils.bd(100))
                .balanceBefore(MoneyUtils.ZERO)
                .balanceAfter(MoneyUtils.bd(100))
                .status(LedgerTransaction.Status.COMPLETED)
                .idempotencyKey("deposit:psp-991")
                .build();
    }

    @Test
    void redeliveredDepositNotifiesOnlyOnce() {
        when(ledger.post(eq(11L), any(), eq(LedgerTransaction.Type.DEPOSIT), eq("psp-991"), eq("deposit:psp-991"), anyString()))
                .thenReturn(new CreditLedgerService.Posting(deposit, false))
                .thenReturn(new CreditLedgerService.Posting(deposit, true));

        LedgerTransaction first = service.onDepositConfirmed(11L, MoneyUtils.bd(100), "psp-991");
        LedgerTransaction second = service.onDepositConfirmed(11L, MoneyUtils.bd(100), "psp-991");

        assertThat(first).isSameAs(deposit);
        assertThat(second).isSameAs(deposit);
        verify(notifications, times(1)).notifyAfterCommit(eq(11L), eq("DEPOSIT_CONFIRMED"), anyMap());
    }

    @Test
    void depositWithoutProviderReferenceIsRejected() {
        assertThatThrownBy(() -> service.onDepositConfirmed(11L, MoneyUtils.bd(100), " "))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(ledger, notifications);
    }
}
