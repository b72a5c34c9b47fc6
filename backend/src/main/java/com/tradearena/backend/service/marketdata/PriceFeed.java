package com.tradearena.backend.service.marketdata;

import com.tradearena.backend.exception.ExternalDependencyException;

public interface PriceFeed {

    /**
     * Latest two-sided quote for a symbol.
     *
     * @throws ExternalDependencyException when no quote can be produced; implementations never
     *                                     substitute a guessed price
     */
    Quote getPrice(String symbol);
}
