package com.tradearena.backend.controller;

import com.tradearena.backend.dto.BatchResult;
import com.tradearena.backend.dto.ItemOutcome;
import com.tradearena.backend.dto.LedgerChainReport;
import com.tradearena.backend.exception.ConflictException;
import com.tradearena.backend.exception.ExternalDependencyException;
import com.tradearena.backend.service.ContestLifecycleService;
import com.tradearena.backend.service.ContractSpecService;
import com.tradearena.backend.service.CreditLedgerService;
import com.tradearena.backend.service.DeadLetterQueueService;
import com.tradearena.backend.service.PositionService;
import com.tradearena.backend.service.SchedulerTick;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminSettlementController.class)
class AdminSettlementControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContestLifecycleService contestLifecycleService;

    @MockBean
    private PositionService positionService;

    @MockBean
    private CreditLedgerService creditLedgerService;

    @MockBean
    private DeadLetterQueueService deadLetterQueueService;

    @MockBean
    private ContractSpecService contractSpecService;

    @MockBean
    private SchedulerTick schedulerTick;

    @Test
    void cancelReturnsPerItemOutcomes() throws Exception {
        when(contestLifecycleService.cancelAndRefund(7L, "feed outage")).thenReturn(new BatchResult(
                "cancelAndRefund", 7L, "CANCELLED", List.of(
                ItemOutcome.succeeded("participant", 1L, 10L, "Refunded 9.00"),
                ItemOutcome.skipped("participant", 2L, 11L, "Already refunded"))));

        mockMvc.perform(post("/api/admin/settlement/contests/7/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"feed outage\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetStatus").value("CANCELLED"))
                .andExpect(jsonPath("$.succeeded").value(1))
                .andExpect(jsonPath("$.skipped").value(1))
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.items[1].message").value("Already refunded"));
    }

    @Test
    void cancelWithoutReasonIsRejected() throws Exception {
        mockMvc.perform(post("/api/admin/settlement/contests/7/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("reason"));
        verify(contestLifecycleService, never()).cancelAndRefund(anyLong(), any());
    }

    @Test
    void cancelOfCompletedContestIsConflict() throws Exception {
        when(contestLifecycleService.cancelAndRefund(8L, "late"))
                .thenThrow(new ConflictException("Contest 8 is COMPLETED and cannot be cancelled"));

        mockMvc.perform(post("/api/admin/settlement/contests/8/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"late\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Contest 8 is COMPLETED and cannot be cancelled"));
    }

    @Test
    void finalizeWithoutPricesIsServiceUnavailable() throws Exception {
        when(contestLifecycleService.finalizeContest(9L))
                .thenThrow(new ExternalDependencyException("price-feed", "No quote available for GBPUSD"));

        mockMvc.perform(post("/api/admin/settlement/contests/9/finalize"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void ledgerVerificationReportsMismatches() throws Exception {
        when(creditLedgerService.verifyChain(42L)).thenReturn(new LedgerChainReport(42L, 3,
                new BigDecimal("90.0000"), new BigDecimal("100.0000"), List.of("replayed 90.0000 != wallet 100.0000")));

        mockMvc.perform(get("/api/admin/settlement/ledger/42/verify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.consistent").value(false))
                .andExpect(jsonPath("$.transactionsChecked").value(3));
    }

    @Test
    void responsesCarryCorrelationId() throws Exception {
        mockMvc.perform(post("/api/admin/settlement/cache/contracts/invalidate")
                        .param("symbol", "XAUUSD")
                        .header("X-Correlation-Id", "ops-123"))
                .andExpect(status().isNoContent())
                .andExpect(header().string("X-Correlation-Id", "ops-123"));
        verify(contractSpecService).invalidate("XAUUSD");
        verify(contractSpecService, never()).invalidateAll();
    }
}
