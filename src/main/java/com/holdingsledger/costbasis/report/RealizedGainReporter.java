package com.holdingsledger.costbasis.report;

import com.holdingsledger.common.Decimals;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.costbasis.engine.SellAllocation;
import com.holdingsledger.costbasis.engine.SellResult;
import com.holdingsledger.costbasis.engine.TaxLotAllocator;
import com.holdingsledger.costbasis.engine.TaxLotBook;
import com.holdingsledger.costbasis.engine.TransactionTimeline;
import com.holdingsledger.costbasis.washsale.WashSaleDetector;
import com.holdingsledger.costbasis.washsale.WashSaleResult;
import com.holdingsledger.domain.CostBasisMethod;
import com.holdingsledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lot-exact realized gains for a reporting window, always FIFO.
 *
 * <p>The whole history is replayed so lots are in the right state when the window opens, but detail
 * records are emitted only for disposals dated inside [from, to]. Loss sales inside the window are
 * checked for wash sales against the full transaction list.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RealizedGainReporter {

    private static final CostBasisMethod REPORT_METHOD = CostBasisMethod.FIFO;

    private final TaxLotAllocator taxLotAllocator;
    private final WashSaleDetector washSaleDetector;
    private final CostBasisProperties properties;

    /** Calendar-year report, January 1 through December 31 inclusive. */
    public RealizedGainReport forTaxYear(List<Transaction> transactions, int year) {
        return generate(transactions, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    public RealizedGainReport generate(List<Transaction> transactions, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Report range is empty: " + from + " > " + to);
        }
        TaxLotBook book = new TaxLotBook(properties.getCloseEpsilon());
        List<RealizedGainDetail> details = new ArrayList<>();
        List<SaleWashSale> washSales = new ArrayList<>();

        for (Transaction tx : TransactionTimeline.chronological(transactions)) {
            switch (tx.getType()) {
                case BUY, TRANSFER_IN -> book.open(tx);
                case SELL, TRANSFER_OUT -> {
                    SellResult result = taxLotAllocator.allocateSell(book.availableLots(tx.getSymbol()),
                            tx.getQuantity(), tx.getPrice(), tx.getDate(), REPORT_METHOD);
                    if (result.quantityAllocated().compareTo(tx.getQuantity()) < 0) {
                        log.warn("{} {} of {} {}: only {} covered by lots",
                                tx.getType(), tx.getId(), tx.getQuantity(), tx.getSymbol(), result.quantityAllocated());
                    }
                    if (inRange(tx.getDate(), from, to)) {
                        emit(tx, result, details);
                        checkWashSale(tx, result, book, transactions, washSales);
                    }
                    book.commit(result);
                }
                case DIVIDEND -> {
                    // no lot effect
                }
            }
        }

        RealizedGainReport report = new RealizedGainReport(from, to, details, washSales,
                RealizedGainSummary.of(details, washSales));
        log.info("Realized gain report {}..{}: {} lot sales, totalGain={}, disallowedLoss={}",
                from, to, details.size(), report.summary().totalGain(), report.summary().totalDisallowedLoss());
        return report;
    }

    private static void emit(Transaction sale, SellResult result, List<RealizedGainDetail> details) {
        for (SellAllocation allocation : result.allocations()) {
            details.add(new RealizedGainDetail(
                    sale.getSymbol(),
                    sale.getId(),
                    allocation.lotId(),
                    sale.getDate(),
                    allocation.acquiredDate(),
                    allocation.holdingDays(),
                    allocation.isLongTerm(),
                    allocation.quantitySold(),
                    allocation.proceeds(),
                    allocation.costBasisAllocated(),
                    allocation.gainLoss(),
                    Decimals.percentOf(allocation.gainLoss(), allocation.costBasisAllocated())));
        }
    }

    /**
     * Shares this sale takes out of a lot are not replacement shares: each source acquisition is passed
     * to the detector reduced by what the sale drew from it, and dropped once nothing is left.
     */
    private void checkWashSale(Transaction sale, SellResult result, TaxLotBook book, List<Transaction> transactions,
                               List<SaleWashSale> washSales) {
        if (result.totalGainLoss().signum() >= 0) {
            return;
        }
        Map<Transaction, BigDecimal> soldBySource = new IdentityHashMap<>();
        for (SellAllocation allocation : result.allocations()) {
            book.acquisitionOf(allocation.lotId())
                    .ifPresent(source -> soldBySource.merge(source, allocation.quantitySold(), BigDecimal::add));
        }
        List<Transaction> history = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            BigDecimal sold = soldBySource.get(tx);
            if (sold == null) {
                history.add(tx);
                continue;
            }
            BigDecimal unsold = tx.getQuantity().subtract(sold);
            if (unsold.signum() > 0) {
                history.add(tx.toBuilder().quantity(unsold).build());
            }
        }
        WashSaleResult washSale = washSaleDetector.detectWashSale(sale.getDate(), sale.getSymbol(),
                result.totalGainLoss(), result.quantityAllocated(), history);
        if (washSale.isWashSale()) {
            washSales.add(new SaleWashSale(sale.getId(), sale.getSymbol(), sale.getDate(),
                    result.totalGainLoss(), washSale));
        }
    }

    private static boolean inRange(LocalDate date, LocalDate from, LocalDate to) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
