package com.tradearena.backend.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "contracts")
@Data
@Validated
public class ContractProperties {

    /**
     * Units per lot when a symbol has no explicit entry. Standard forex lot.
     */
    @Positive
    private BigDecimal defaultMultiplier = BigDecimal.valueOf(100_000);

    /**
     * Per-symbol overrides keyed by normalized symbol (upper case, no separators), e.g. XAUUSD.
     */
    private Map<String, BigDecimal> multipliers = new HashMap<>();

    @NotNull
    private Duration cacheTtl = Duration.ofMinutes(5);
}
