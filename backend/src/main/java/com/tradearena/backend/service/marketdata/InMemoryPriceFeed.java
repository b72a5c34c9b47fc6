package com.tradearena.backend.service.marketdata;

import com.tradearena.backend.exception.ExternalDependencyException;
import com.tradearena.backend.exception.ValidationException;
import com.tradearena.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the last quote pushed by the external price source for each symbol.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InMemoryPriceFeed implements PriceFeed {

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();
    private final Clock clock;

    @Override
    public Quote getPrice(String symbol) {
        Quote quote = quotes.get(SymbolNormalizer.normalize(symbol));
        if (quote == null) {
            throw new ExternalDependencyException("price-feed", "No quote available for " + symbol);
        }
        return quote;
    }

    public Quote publish(String symbol, BigDecimal bid, BigDecimal ask) {
        if (!MoneyUtils.isPositive(bid) || !MoneyUtils.isPositive(ask)) {
            throw new ValidationException("Bid and ask must be positive");
        }
        if (bid.compareTo(ask) > 0) {
            throw new ValidationException("Bid " + bid + " is above ask " + ask + " for " + symbol);
        }
        String key = SymbolNormalizer.normalize(symbol);
        Quote quote = new Quote(key, MoneyUtils.price(bid), MoneyUtils.price(ask), clock.instant());
        quotes.put(key, quote);
        log.debug("Quote {} bid={} ask={}", key, quote.bid(), quote.ask());
        return quote;
    }

    public void withdraw(String symbol) {
        quotes.remove(SymbolNormalizer.normalize(symbol));
    }

    public void clear() {
        quotes.clear();
    }
}
