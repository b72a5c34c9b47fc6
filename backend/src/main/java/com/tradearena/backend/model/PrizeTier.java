package com.tradearena.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrizeTier {

    @Column(name = "rank_position", nullable = false)
    private int rank;

    @Column(nullable = false, precision = 7, scale = 4)
    private BigDecimal percentage;

    public static PrizeTier of(int rank, double percentage) {
        return new PrizeTier(rank, BigDecimal.valueOf(percentage));
    }
}
