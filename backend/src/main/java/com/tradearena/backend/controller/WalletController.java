package com.tradearena.backend.controller;

import com.tradearena.backend.dto.WithdrawalRequest;
import com.tradearena.backend.model.CreditWallet;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.model.PayoutRequest;
import com.tradearena.backend.service.CreditLedgerService;
import com.tradearena.backend.service.PaymentWebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/wallet")
@RequiredArgsConstructor
@Tag(name = "Wallet")
public class WalletController {

    private final CreditLedgerService creditLedgerService;
    private final PaymentWebhookService paymentWebhookService;

    @GetMapping
    public ResponseEntity<CreditWallet> wallet(@PathVariable Long userId) {
        return ResponseEntity.ok(creditLedgerService.getWallet(userId));
    }

    @GetMapping("/transactions")
    @Operation(summary = "Ledger history, oldest first")
    public ResponseEntity<List<LedgerTransaction>> history(@PathVariable Long userId) {
        return ResponseEntity.ok(creditLedgerService.history(userId));
    }

    @PostMapping("/withdrawals")
    @Operation(summary = "Request a withdrawal; credits are held until the provider reports back")
    public ResponseEntity<PayoutRequest> withdraw(@PathVariable Long userId,
                                                  @Valid @RequestBody WithdrawalRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(paymentWebhookService.requestWithdrawal(userId, request.getAmount()));
    }
}
