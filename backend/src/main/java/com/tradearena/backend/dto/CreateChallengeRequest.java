package com.tradearena.backend.dto;

import com.tradearena.backend.model.ContestRules;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateChallengeRequest {

    @NotNull
    private Long challengerId;

    @NotNull
    private Long challengedId;

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal entryFee;

    @NotNull
    @Positive
    private Long durationSeconds;

    private BigDecimal startingCapital;

    private ContestRules rules;
}
