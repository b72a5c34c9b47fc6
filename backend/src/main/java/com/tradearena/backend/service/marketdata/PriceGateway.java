package com.tradearena.backend.service.marketdata;

import com.tradearena.backend.config.SettlementProperties;
import com.tradearena.backend.exception.ExternalDependencyException;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Retrying, staleness-checking front of the {@link PriceFeed}. A quote older than the configured
 * maximum age counts as unavailable.
 */
@Slf4j
@Service
public class PriceGateway {

    private final PriceFeed priceFeed;
    private final Retry priceFeedRetry;
    private final SettlementProperties properties;
    private final Clock clock;

    public PriceGateway(PriceFeed priceFeed,
                        @Qualifier("priceFeedRetry") Retry priceFeedRetry,
                        SettlementProperties properties,
                        Clock clock) {
        this.priceFeed = priceFeed;
        this.priceFeedRetry = priceFeedRetry;
        this.properties = properties;
        this.clock = clock;
    }

    public Quote quote(String symbol) {
        try {
            return Retry.decorateSupplier(priceFeedRetry, () -> fetchFresh(symbol)).get();
        } catch (ExternalDependencyException e) {
            log.warn("Price unavailable for {} after {} attempts: {}", symbol,
                    priceFeedRetry.getRetryConfig().getMaxAttempts(), e.getMessage());
            throw e;
        }
    }

    private Quote fetchFresh(String symbol) {
        Quote quote = priceFeed.getPrice(symbol);
        if (quote == null || quote.bid() == null || quote.ask() == null) {
            throw new ExternalDependencyException("price-feed", "Incomplete quote for " + symbol);
        }
        Duration maxAge = properties.getPrice().getMaxAge();
        Instant now = clock.instant();
        if (quote.timestamp() == null || quote.timestamp().plus(maxAge).isBefore(now)) {
            throw new ExternalDependencyException("price-feed",
                    "Stale quote for " + symbol + " from " + quote.timestamp());
        }
        return quote;
    }
}
