package com.holdingsledger.costbasis.engine;

import com.holdingsledger.common.DayCounts;
import com.holdingsledger.common.Decimals;
import com.holdingsledger.common.TickerSymbols;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.domain.CostBasisMethod;
import com.holdingsledger.domain.TaxLot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Exact per-lot cost basis for a sale. Lots are ordered by the selected method and depleted in that order:
 * <ul>
 *   <li>FIFO: oldest acquisition first</li>
 *   <li>LIFO: newest acquisition first</li>
 *   <li>HIFO: highest cost per share first, ties in input order</li>
 *   <li>SPECID: exactly the named lots, in the named order</li>
 * </ul>
 * Allocation never mutates the lots; the caller commits a {@link SellResult} through {@link TaxLotBook}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaxLotAllocator {

    private final CostBasisProperties properties;

    /** Allocates with the configured default method. */
    public SellResult allocateSell(List<TaxLot> lots, BigDecimal sellQty, BigDecimal sellPrice, LocalDate sellDate) {
        return allocateSell(lots, sellQty, sellPrice, sellDate, properties.getDefaultMethod());
    }

    public SellResult allocateSell(List<TaxLot> lots, BigDecimal sellQty, BigDecimal sellPrice,
                                   LocalDate sellDate, CostBasisMethod method) {
        return allocateSell(lots, sellQty, sellPrice, sellDate, LotSelection.of(method));
    }

    public SellResult allocateSell(List<TaxLot> lots, BigDecimal sellQty, BigDecimal sellPrice,
                                   LocalDate sellDate, CostBasisMethod method, List<String> specificLotIds) {
        return allocateSell(lots, sellQty, sellPrice, sellDate, new LotSelection(method, specificLotIds));
    }

    public SellResult allocateSell(List<TaxLot> lots, BigDecimal sellQty, BigDecimal sellPrice,
                                   LocalDate sellDate, LotSelection selection) {
        Objects.requireNonNull(sellQty, "sellQty");
        Objects.requireNonNull(sellPrice, "sellPrice");
        Objects.requireNonNull(sellDate, "sellDate");
        Objects.requireNonNull(selection, "selection");

        List<SellAllocation> allocations = new ArrayList<>();
        BigDecimal remainingToSell = sellQty;
        for (TaxLot lot : orderLots(lots, selection)) {
            if (remainingToSell.signum() <= 0) {
                break;
            }
            BigDecimal take = Decimals.min(remainingToSell, lot.getRemainingQty());
            // multiply before dividing so a whole-lot sale carries the exact original basis
            BigDecimal costBasisAllocated = Decimals.safeDivide(lot.getCostBasis().multiply(take), lot.getQuantity());
            BigDecimal proceeds = take.multiply(sellPrice);
            long holdingDays = DayCounts.daysApart(lot.getAcquiredDate(), sellDate);
            allocations.add(new SellAllocation(
                    lot.getId(),
                    take,
                    costBasisAllocated,
                    lot.getAcquiredDate(),
                    proceeds,
                    proceeds.subtract(costBasisAllocated),
                    DayCounts.isLongTerm(lot.getAcquiredDate(), sellDate, properties.getLongTermThresholdDays()),
                    holdingDays));
            remainingToSell = remainingToSell.subtract(take);
        }
        return summarize(allocations);
    }

    /**
     * Allocates against the symbol's available lots and reports any shortfall explicitly.
     */
    public SellPreview previewSellAllocation(List<TaxLot> lots, String symbol, BigDecimal sellQty,
                                             BigDecimal sellPrice, LocalDate sellDate, LotSelection selection) {
        List<TaxLot> symbolLots = availableLots(lots, symbol);
        BigDecimal totalAvailable = Decimals.sum(symbolLots, TaxLot::getRemainingQty);
        SellResult result = allocateSell(symbolLots, sellQty, sellPrice, sellDate, selection);
        BigDecimal shortfall = sellQty.subtract(totalAvailable).max(BigDecimal.ZERO);
        return new SellPreview(result, shortfall.signum() > 0, shortfall);
    }

    /** Lots of {@code symbol} with remaining quantity, oldest first. */
    public static List<TaxLot> availableLots(Collection<TaxLot> lots, String symbol) {
        String ticker = TickerSymbols.normalize(symbol);
        return lots.stream()
                .filter(lot -> ticker.equals(TickerSymbols.normalize(lot.getSymbol())))
                .filter(TaxLot::hasRemaining)
                .sorted(Comparator.comparing(TaxLot::getAcquiredDate))
                .toList();
    }

    public static BigDecimal totalAvailableQuantity(Collection<TaxLot> lots, String symbol) {
        return Decimals.sum(availableLots(lots, symbol), TaxLot::getRemainingQty);
    }

    /** Remaining-quantity weighted average of original cost per share; zero when nothing is available. */
    public static BigDecimal weightedAverageCost(Collection<TaxLot> lots, String symbol) {
        List<TaxLot> available = availableLots(lots, symbol);
        BigDecimal totalQty = Decimals.sum(available, TaxLot::getRemainingQty);
        BigDecimal totalCost = Decimals.sum(available, lot -> lot.costPerShare().multiply(lot.getRemainingQty()));
        return Decimals.safeDivide(totalCost, totalQty);
    }

    static List<TaxLot> orderLots(List<TaxLot> lots, LotSelection selection) {
        List<TaxLot> available = lots.stream().filter(TaxLot::hasRemaining).toList();
        // Stream.sorted is stable on ordered streams, so equal keys keep input order
        return switch (selection.method()) {
            case FIFO -> available.stream()
                    .sorted(Comparator.comparing(TaxLot::getAcquiredDate))
                    .toList();
            case LIFO -> available.stream()
                    .sorted(Comparator.comparing(TaxLot::getAcquiredDate).reversed())
                    .toList();
            case HIFO -> available.stream()
                    .sorted(Comparator.comparing(TaxLot::costPerShare).reversed())
                    .toList();
            case SPECID -> specificOrder(available, selection.specificLotIds());
        };
    }

    private static List<TaxLot> specificOrder(List<TaxLot> available, List<String> lotIds) {
        Map<String, TaxLot> byId = available.stream()
                .collect(Collectors.toMap(TaxLot::getId, Function.identity(), (a, b) -> a));
        List<TaxLot> ordered = new ArrayList<>();
        for (String id : new LinkedHashSet<>(lotIds)) {
            TaxLot lot = byId.get(id);
            if (lot == null) {
                log.debug("SPECID lot {} not available; skipped", id);
                continue;
            }
            ordered.add(lot);
        }
        return ordered;
    }

    private static SellResult summarize(List<SellAllocation> allocations) {
        BigDecimal quantity = Decimals.sum(allocations, SellAllocation::quantitySold);
        BigDecimal totalCostBasis = Decimals.sum(allocations, SellAllocation::costBasisAllocated);
        BigDecimal totalProceeds = Decimals.sum(allocations, SellAllocation::proceeds);
        BigDecimal longTermGain = Decimals.sum(
                allocations.stream().filter(SellAllocation::isLongTerm).toList(), SellAllocation::gainLoss);
        BigDecimal shortTermGain = Decimals.sum(
                allocations.stream().filter(a -> !a.isLongTerm()).toList(), SellAllocation::gainLoss);
        return new SellResult(allocations, quantity, totalCostBasis, totalProceeds,
                totalProceeds.subtract(totalCostBasis), longTermGain, shortTermGain);
    }
}
