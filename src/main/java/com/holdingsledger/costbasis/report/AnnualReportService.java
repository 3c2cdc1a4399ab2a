package com.holdingsledger.costbasis.report;

import com.holdingsledger.common.Decimals;
import com.holdingsledger.costbasis.engine.HoldingAggregator;
import com.holdingsledger.costbasis.engine.PortfolioSummary;
import com.holdingsledger.domain.Transaction;
import com.holdingsledger.domain.TransactionType;
import com.holdingsledger.pricing.PriceLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Calendar-year overview: trading activity, dividend income, FIFO realized gains and holdings valued
 * at the start and end of the year. Holdings use the average-cost aggregation; realized gains use lots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnnualReportService {

    private final HoldingAggregator holdingAggregator;
    private final RealizedGainReporter realizedGainReporter;
    private final PortfolioValuationService portfolioValuationService;

    public AnnualReport generate(List<Transaction> transactions, int year, PriceLookup prices) {
        LocalDate yearStart = LocalDate.of(year, 1, 1);
        LocalDate yearEnd = LocalDate.of(year, 12, 31);

        List<Transaction> beforeYear = transactions.stream()
                .filter(tx -> tx.getDate().isBefore(yearStart))
                .toList();
        List<Transaction> throughYearEnd = transactions.stream()
                .filter(tx -> !tx.getDate().isAfter(yearEnd))
                .toList();
        List<Transaction> inYear = throughYearEnd.stream()
                .filter(tx -> !tx.getDate().isBefore(yearStart))
                .toList();

        PortfolioSummary beginning = holdingAggregator.aggregate(beforeYear);
        PortfolioSummary ending = holdingAggregator.aggregate(throughYearEnd);
        // full list so December loss sales see January replacement buys
        RealizedGainReport realized = realizedGainReporter.generate(transactions, yearStart, yearEnd);

        BigDecimal dividendIncome = Decimals.sum(
                inYear.stream().filter(tx -> tx.getType() == TransactionType.DIVIDEND).toList(),
                Transaction::getAmount);

        AnnualReport report = new AnnualReport(
                year,
                activity(inYear),
                dividendIncome,
                realized,
                portfolioValuationService.value(beginning.openHoldings(), prices),
                portfolioValuationService.value(ending.openHoldings(), prices));
        log.info("Annual report {}: {} transactions in year, dividends={}, realized={}",
                year, inYear.size(), dividendIncome, realized.summary().totalGain());
        return report;
    }

    private static YearActivity activity(List<Transaction> inYear) {
        List<Transaction> buys = inYear.stream().filter(tx -> tx.getType() == TransactionType.BUY).toList();
        List<Transaction> sells = inYear.stream().filter(tx -> tx.getType() == TransactionType.SELL).toList();
        return new YearActivity(
                Decimals.sum(buys, Transaction::getAmount),
                Decimals.sum(sells, Transaction::getAmount),
                buys.size(),
                sells.size());
    }
}
