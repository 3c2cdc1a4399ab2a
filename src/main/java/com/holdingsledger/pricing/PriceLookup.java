package com.holdingsledger.pricing;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current market price per share for a ticker, supplied by the host application's market-data layer.
 */
public interface PriceLookup {

    /**
     * Returns empty when no quote is available; callers decide the fallback.
     */
    Optional<BigDecimal> currentPrice(String symbol);
}
