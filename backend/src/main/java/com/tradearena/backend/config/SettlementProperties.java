package com.tradearena.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "settlement")
@Data
@Validated
public class SettlementProperties {

    private UnitOfWork unitOfWork = new UnitOfWork();
    private Price price = new Price();
    private Payout payout = new Payout();
    private Scheduling scheduling = new Scheduling();
    private Challenge challenge = new Challenge();

    @Data
    public static class UnitOfWork {
        @Min(1)
        private int maxAttempts = 5;

        @Positive
        private long baseDelayMs = 50;

        @DecimalMin("0.0")
        private double jitterFactor = 0.3;
    }

    @Data
    public static class Price {
        @NotNull
        private Duration maxAge = Duration.ofSeconds(30);

        @Min(1)
        private int maxAttempts = 4;

        @Positive
        private long baseDelayMs = 250;

        @DecimalMin("0.0")
        private double jitterFactor = 0.2;
    }

    @Data
    public static class Payout {
        @NotNull
        private Duration stuckAfter = Duration.ofHours(24);
    }

    @Data
    public static class Challenge {
        @NotNull
        private Duration acceptWindow = Duration.ofHours(24);

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private BigDecimal platformFeePct = BigDecimal.TEN;

        @Positive
        private BigDecimal startingCapital = BigDecimal.valueOf(10_000);
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;

        @Positive
        private long finalizeIntervalMs = 60_000;

        @Positive
        private long activationIntervalMs = 30_000;

        @Positive
        private long riskIntervalMs = 15_000;

        @Positive
        private long payoutIntervalMs = 300_000;

        @Positive
        private long challengeIntervalMs = 60_000;
    }
}
