package com.tradearena.backend.controller;

import com.tradearena.backend.dto.DepositConfirmedRequest;
import com.tradearena.backend.dto.PayoutResultRequest;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.PayoutRequest;
import com.tradearena.backend.service.PaymentWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks/payments")
@RequiredArgsConstructor
@Tag(name = "Payment Webhooks")
public class PaymentWebhookController {

    private final PaymentWebhookService paymentWebhookService;

    @PostMapping("/deposit-confirmed")
    @Operation(summary = "Provider confirmed a deposit")
    public ResponseEntity<LedgerTransaction> depositConfirmed(@Valid @RequestBody DepositConfirmedRequest request) {
        return ResponseEntity.ok(paymentWebhookService.onDepositConfirmed(
                request.getUserId(), request.getAmount(), request.getProviderTxId()));
    }

    @PostMapping("/payout-result")
    @Operation(summary = "Provider reported the outcome of a withdrawal")
    public ResponseEntity<PayoutRequest> payoutResult(@Valid @RequestBody PayoutResultRequest request) {
        return ResponseEntity.ok(paymentWebhookService.onPayoutResult(request.getWithdrawalId(), request.getOutcome(),
                request.getProviderReference(), request.getFailureReason()));
    }
}
