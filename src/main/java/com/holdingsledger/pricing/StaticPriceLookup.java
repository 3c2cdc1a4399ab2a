package com.holdingsledger.pricing;

import com.holdingsledger.common.TickerSymbols;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Price snapshot taken up front, e.g. from a quote cache, so a report run sees one consistent set of prices.
 * Tickers are matched in canonical form; null or non-positive prices count as missing.
 */
public class StaticPriceLookup implements PriceLookup {

    private final Map<String, BigDecimal> pricesByTicker = new HashMap<>();

    public StaticPriceLookup(Map<String, BigDecimal> prices) {
        prices.forEach((symbol, price) -> {
            if (price != null && price.signum() > 0) {
                pricesByTicker.put(TickerSymbols.normalize(symbol), price);
            }
        });
    }

    public static StaticPriceLookup empty() {
        return new StaticPriceLookup(Map.of());
    }

    @Override
    public Optional<BigDecimal> currentPrice(String symbol) {
        return Optional.ofNullable(pricesByTicker.get(TickerSymbols.normalize(symbol)));
    }
}
