package com.tradearena.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    private Thresholds thresholds = new Thresholds();
    private Limits limits = new Limits();

    /**
     * Margin level percentages, strictly descending.
     */
    @Data
    public static class Thresholds {
        @Positive
        private BigDecimal safe = BigDecimal.valueOf(200);

        @Positive
        private BigDecimal warning = BigDecimal.valueOf(150);

        @Positive
        private BigDecimal marginCall = BigDecimal.valueOf(100);

        @Positive
        private BigDecimal liquidation = BigDecimal.valueOf(50);
    }

    @Data
    public static class Limits {
        @Min(1)
        private int maxLeverage = 500;

        @Min(1)
        private int maxOpenPositions = 10;

        @Positive
        private BigDecimal maxLots = BigDecimal.valueOf(100);
    }
}
