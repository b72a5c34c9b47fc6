package com.tradearena.backend.service.marketdata;

import java.util.Locale;

public final class SymbolNormalizer {

    private SymbolNormalizer() {
    }

    /**
     * EUR/USD, eur-usd and EURUSD all map to EURUSD.
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        return symbol.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
