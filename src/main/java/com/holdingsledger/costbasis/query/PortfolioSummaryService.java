package com.holdingsledger.costbasis.query;

import com.holdingsledger.costbasis.engine.HoldingAggregator;
import com.holdingsledger.costbasis.engine.PortfolioSummary;
import com.holdingsledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Memoized average-cost summary for dashboard reads. The caller supplies an opaque version of its
 * transaction set; any change to the transactions must come with a new version. Never persists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PortfolioSummaryService {

    public static final String PORTFOLIO_SUMMARY_CACHE = "portfolioSummaryCache";

    private final HoldingAggregator holdingAggregator;

    /**
     * Cache key: owner + transaction-set version.
     */
    public static String cacheKey(String owner, String version) {
        return (owner != null ? owner : "") + "|" + (version != null ? version : "");
    }

    @Cacheable(cacheNames = PORTFOLIO_SUMMARY_CACHE,
            key = "T(com.holdingsledger.costbasis.query.PortfolioSummaryService).cacheKey(#owner, #version)")
    public PortfolioSummary summarize(String owner, String version, List<Transaction> transactions) {
        log.debug("Aggregating {} transactions for owner={} version={}", transactions.size(), owner, version);
        return holdingAggregator.aggregate(transactions);
    }
}
