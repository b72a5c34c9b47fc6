package com.tradearena.backend.dto;

import com.tradearena.backend.model.PayoutRequest;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutResultRequest {

    @NotNull
    private Long withdrawalId;

    @NotNull
    private PayoutRequest.Status outcome;

    private String providerReference;

    private String failureReason;
}
