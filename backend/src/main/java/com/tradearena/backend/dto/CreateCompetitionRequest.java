package com.tradearena.backend.dto;

import com.tradearena.backend.model.ContestRules;
import com.tradearena.backend.model.MarginThresholds;
import com.tradearena.backend.model.PrizeTier;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCompetitionRequest {

    @NotBlank
    private String name;

    @NotNull
    private Long organizerId;

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal entryFee;

    @NotNull
    @Positive
    private BigDecimal startingCapital;

    @NotNull
    private Instant startTime;

    @NotNull
    private Instant endTime;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private BigDecimal platformFeePct;

    @NotEmpty
    private List<PrizeTier> prizeDistribution;

    private ContestRules rules;

    private MarginThresholds marginThresholds;

    @NotNull
    @Min(2)
    private Integer maxParticipants;
}
