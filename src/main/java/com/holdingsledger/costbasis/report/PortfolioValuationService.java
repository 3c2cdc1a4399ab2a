package com.holdingsledger.costbasis.report;

import com.holdingsledger.common.Decimals;
import com.holdingsledger.domain.Holding;
import com.holdingsledger.pricing.PriceLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unrealized gain of open holdings at current prices. A missing quote falls back to average cost.
 */
@Service
@Slf4j
public class PortfolioValuationService {

    public PortfolioValuation value(Map<String, Holding> holdings, PriceLookup prices) {
        List<HoldingValuation> rows = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (Holding holding : holdings.values()) {
            Optional<BigDecimal> quote = prices.currentPrice(holding.symbol());
            if (quote.isEmpty()) {
                missing.add(holding.symbol());
            }
            BigDecimal price = quote.orElse(holding.avgCost());
            BigDecimal currentValue = holding.quantity().multiply(price);
            BigDecimal gain = currentValue.subtract(holding.costBasis());
            rows.add(new HoldingValuation(
                    holding.symbol(),
                    holding.quantity(),
                    price,
                    quote.isPresent(),
                    currentValue,
                    holding.costBasis(),
                    gain,
                    Decimals.percentOf(gain, holding.costBasis())));
        }
        if (!missing.isEmpty()) {
            log.debug("No current price for {}; valued at average cost", missing);
        }
        rows.sort(Comparator.comparing(HoldingValuation::currentValue).reversed());

        BigDecimal totalValue = Decimals.sum(rows, HoldingValuation::currentValue);
        BigDecimal totalCost = Decimals.sum(rows, HoldingValuation::costBasis);
        BigDecimal unrealized = totalValue.subtract(totalCost);
        return new PortfolioValuation(rows, totalValue, totalCost, unrealized,
                Decimals.percentOf(unrealized, totalCost), missing);
    }
}
