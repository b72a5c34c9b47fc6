package com.tradearena.backend.controller;

import com.tradearena.backend.dto.AdjustmentRequest;
import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.CancelContestRequest;
import com.tradearena.backend.dto.FinalizeReport;
import com.tradearena.backend.dto.LedgerChainReport;
import com.tradearena.backend.model.FailedOperation;
import com.tradearena.backend.model.LedgerTransaction;
import com.tradearena.backend.service.ContestLifecycleService;
import com.tradearena.backend.service.ContractSpecService;
import com.tradearena.backend.service.CreditLedgerService;
import com.tradearena.backend.service.DeadLetterQueueService;
import com.tradearena.backend.service.PositionService;
import com.tradearena.backend.service.SchedulerTick;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator surface. Batch operations answer with per-item outcomes.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/settlement")
@RequiredArgsConstructor
@Tag(name = "Admin Settlement")
public class AdminSettlementController {

    private final ContestLifecycleService contestLifecycleService;
    private final PositionService positionService;
    private final CreditLedgerService creditLedgerService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ContractSpecService contractSpecService;
    private final SchedulerTick schedulerTick;

    @PostMapping("/contests/{contestId}/finalize")
    @Operation(summary = "Trigger finalize of an ended contest")
    public ResponseEntity<FinalizeReport> finalizeContest(@PathVariable Long contestId) {
        log.warn("Admin finalize requested for contest {}", contestId);
        return ResponseEntity.ok(contestLifecycleService.finalizeContest(contestId));
    }

    @PostMapping("/contests/{contestId}/cancel")
    @Operation(summary = "Cancel a contest and refund entry fees")
    public ResponseEntity<BatchResult> cancelContest(@PathVariable Long contestId,
                                                     @Valid @RequestBody CancelContestRequest request) {
        log.warn("Admin cancel requested for contest {}: {}", contestId, request.getReason());
        return ResponseEntity.ok(contestLifecycleService.cancelAndRefund(contestId, request.getReason()));
    }

    @PostMapping("/positions/{positionId}/force-close")
    @Operation(summary = "Force-close a position at market")
    public ResponseEntity<BatchResult> forceClose(@PathVariable Long positionId) {
        return ResponseEntity.ok(positionService.forceClosePosition(positionId));
    }

    @PostMapping("/tick")
    @Operation(summary = "Run every sweep once")
    public ResponseEntity<SchedulerTick.TickSummary> tick() {
        return ResponseEntity.ok(schedulerTick.tick());
    }

    @GetMapping("/failed-operations")
    @Operation(summary = "List unresolved manual review items")
    public ResponseEntity<List<FailedOperation>> failedOperations() {
        return ResponseEntity.ok(deadLetterQueueService.unresolved());
    }

    @PostMapping("/failed-operations/{id}/resolve")
    @Operation(summary = "Mark a manual review item resolved")
    public ResponseEntity<Void> resolve(@PathVariable Long id) {
        deadLetterQueueService.resolve(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/ledger/{userId}/verify")
    @Operation(summary = "Replay a user's ledger and compare with the wallet")
    public ResponseEntity<LedgerChainReport> verifyLedger(@PathVariable Long userId) {
        return ResponseEntity.ok(creditLedgerService.verifyChain(userId));
    }

    @PostMapping("/ledger/{userId}/adjust")
    @Operation(summary = "Administrative balance adjustment")
    public ResponseEntity<LedgerTransaction> adjust(@PathVariable Long userId,
                                                    @Valid @RequestBody AdjustmentRequest request) {
        log.warn("Admin adjustment user={} amount={} operator={}", userId, request.getAmount(), request.getOperatorId());
        return ResponseEntity.ok(creditLedgerService.adjust(userId, request.getAmount(), request.getReason(),
                request.getOperatorId()));
    }

    @PostMapping("/cache/contracts/invalidate")
    @Operation(summary = "Drop cached contract multipliers")
    public ResponseEntity<Void> invalidateContracts(@RequestParam(required = false) String symbol) {
        if (symbol == null) {
            contractSpecService.invalidateAll();
        } else {
            contractSpecService.invalidate(symbol);
        }
        return ResponseEntity.noContent().build();
    }
}
