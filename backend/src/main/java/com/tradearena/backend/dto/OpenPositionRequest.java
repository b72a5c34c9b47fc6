package com.tradearena.backend.dto;

import com.tradearena.backend.model.Position;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
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
public class OpenPositionRequest {

    @NotNull
    private Long userId;

    @NotBlank
    private String symbol;

    @NotNull
    private Position.Side side;

    @NotNull
    @Positive
    private BigDecimal quantity;

    @NotNull
    @Min(1)
    private Integer leverage;

    private BigDecimal stopLoss;

    private BigDecimal takeProfit;
}
