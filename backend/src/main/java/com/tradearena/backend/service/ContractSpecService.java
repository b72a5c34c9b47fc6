package com.tradearena.backend.service;

import com.tradearena.backend.config.ContractProperties;
import com.tradearena.backend.service.marketdata.SymbolNormalizer;
import com.tradearena.backend.util.TtlCache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Contract multipliers per symbol, served from a TTL cache over {@link ContractProperties}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContractSpecService {

    private final ContractProperties contractProperties;

    private TtlCache<String, BigDecimal> multipliers;

    @PostConstruct
    public void init() {
        multipliers = new TtlCache<>(contractProperties.getCacheTtl());
        log.info("Contract multiplier cache ready ttl={} overrides={}",
                contractProperties.getCacheTtl(), contractProperties.getMultipliers().size());
    }

    public BigDecimal multiplier(String symbol) {
        return multipliers.get(SymbolNormalizer.normalize(symbol), this::load);
    }

    public void invalidate(String symbol) {
        multipliers.invalidate(SymbolNormalizer.normalize(symbol));
    }

    public void invalidateAll() {
        multipliers.invalidateAll();
    }

    @PreDestroy
    public void shutdown() {
        multipliers.invalidateAll();
    }

    private BigDecimal load(String normalizedSymbol) {
        BigDecimal configured = contractProperties.getMultipliers().get(normalizedSymbol);
        return configured != null ? configured : contractProperties.getDefaultMultiplier();
    }
}
