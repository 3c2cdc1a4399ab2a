package com.holdingsledger.costbasis.washsale;

import com.holdingsledger.common.DayCounts;
import com.holdingsledger.common.Decimals;
import com.holdingsledger.common.TickerSymbols;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wash-sale rule: a loss is (partly) disallowed when the same ticker is acquired within the window
 * (30 calendar days by default) before or after the loss sale. Disallowed loss is prorated by the
 * fraction of sold shares that were replaced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WashSaleDetector {

    private final CostBasisProperties properties;

    /**
     * Checks a sale against the surrounding history.
     *
     * @param sellLoss gain/loss of the sale; only negative values can be wash sales
     */
    public WashSaleResult detectWashSale(LocalDate sellDate, String symbol, BigDecimal sellLoss,
                                         BigDecimal sellQty, Collection<Transaction> allTransactions) {
        Objects.requireNonNull(sellDate, "sellDate");
        if (sellLoss == null || sellLoss.signum() >= 0) {
            return WashSaleResult.none();
        }
        String ticker = TickerSymbols.normalize(symbol);

        List<Transaction> candidates = allTransactions.stream()
                .filter(tx -> tx.getType().isAcquisition())
                .filter(tx -> ticker.equals(tx.getSymbol()))
                .filter(tx -> withinWindow(sellDate, tx.getDate()))
                .sorted(replacementPreference(sellDate))
                .toList();
        if (candidates.isEmpty()) {
            return WashSaleResult.none();
        }

        Transaction matchingBuy = candidates.get(0);
        List<Transaction> charged = properties.getWashSale().getMatchPolicy() == WashSaleMatchPolicy.ALL_IN_WINDOW
                ? candidates
                : List.of(matchingBuy);
        BigDecimal replacementQty = Decimals.sum(charged, Transaction::getQuantity);
        BigDecimal sharesReplaced = Decimals.min(replacementQty, sellQty);
        BigDecimal disallowedLoss = sellLoss.abs().multiply(Decimals.safeDivide(sharesReplaced, sellQty));

        log.debug("Wash sale on {} {}: {} of {} shares replaced, disallowed {}",
                ticker, sellDate, sharesReplaced, sellQty, disallowedLoss);
        return new WashSaleResult(
                true,
                disallowedLoss,
                matchingBuy.getId(),
                matchingBuy.getDate(),
                sharesReplaced,
                DayCounts.signedDaysBetween(sellDate, matchingBuy.getDate()),
                charged.stream().map(Transaction::getId).toList());
    }

    /**
     * Inverse check for a proposed buy: which recent loss sales of the same ticker fall inside its window.
     *
     * @param gainLossBySellId realized gain/loss per sell transaction id; missing ids count as zero
     */
    public WashSaleWarning wouldTriggerWashSale(LocalDate buyDate, String symbol, Collection<Transaction> recentSells,
                                                Map<String, BigDecimal> gainLossBySellId) {
        String ticker = TickerSymbols.normalize(symbol);
        List<String> affected = new ArrayList<>();
        for (Transaction sell : recentSells) {
            if (!sell.getType().isDisposal() || !ticker.equals(sell.getSymbol())) {
                continue;
            }
            if (!withinWindow(buyDate, sell.getDate())) {
                continue;
            }
            BigDecimal gainLoss = Decimals.nullToZero(gainLossBySellId.get(sell.getId()));
            if (gainLoss.signum() < 0) {
                affected.add(sell.getId());
            }
        }
        return new WashSaleWarning(!affected.isEmpty(), affected);
    }

    /** All transactions of {@code symbol}, of any type, inside the window around {@code centerDate}. */
    public List<Transaction> transactionsInWindow(LocalDate centerDate, String symbol,
                                                  Collection<Transaction> allTransactions) {
        String ticker = TickerSymbols.normalize(symbol);
        return allTransactions.stream()
                .filter(tx -> ticker.equals(tx.getSymbol()))
                .filter(tx -> withinWindow(centerDate, tx.getDate()))
                .toList();
    }

    private boolean withinWindow(LocalDate center, LocalDate other) {
        return DayCounts.daysApart(center, other) <= properties.getWashSale().getWindowDays();
    }

    /** Buys after the sale first; within each side, nearest to the sale first. */
    private static Comparator<Transaction> replacementPreference(LocalDate sellDate) {
        Comparator<Transaction> afterFirst = Comparator.comparing(tx -> !tx.getDate().isAfter(sellDate));
        return afterFirst.thenComparingLong(tx -> DayCounts.daysApart(sellDate, tx.getDate()));
    }
}
