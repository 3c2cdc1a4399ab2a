package com.holdingsledger.costbasis.engine;

import com.holdingsledger.common.Decimals;
import com.holdingsledger.common.TickerSymbols;
import com.holdingsledger.costbasis.CostBasisException;
import com.holdingsledger.domain.TaxLot;
import com.holdingsledger.domain.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Working set of tax lots for one replay. Opens a lot per acquisition and applies committed sales;
 * {@link TaxLotAllocator} only proposes allocations, this book is where remaining quantities change.
 * Not thread-safe; create one per replay.
 */
@Slf4j
public class TaxLotBook {

    private final BigDecimal closeEpsilon;
    private final Map<String, TaxLot> lotsById = new LinkedHashMap<>();
    private final Map<String, Transaction> acquisitionsByLotId = new HashMap<>();
    private int generatedIds;

    public TaxLotBook(BigDecimal closeEpsilon) {
        this.closeEpsilon = Objects.requireNonNull(closeEpsilon, "closeEpsilon");
    }

    /**
     * Opens a lot for a BUY or TRANSFER_IN. The transaction id becomes the lot id; a missing or already
     * used id gets a generated one, so imported data with duplicate or blank ids still replays.
     *
     * @throws IllegalArgumentException for non-acquisitions
     */
    public TaxLot open(Transaction acquisition) {
        String lotId = uniqueLotId(acquisition.getId());
        TaxLot lot = TaxLot.fromAcquisition(lotId, acquisition);
        lotsById.put(lotId, lot);
        acquisitionsByLotId.put(lotId, acquisition);
        return lot;
    }

    /** The transaction a lot was opened from. */
    public Optional<Transaction> acquisitionOf(String lotId) {
        return Optional.ofNullable(acquisitionsByLotId.get(lotId));
    }

    private String uniqueLotId(String transactionId) {
        if (transactionId != null && !lotsById.containsKey(transactionId)) {
            return transactionId;
        }
        String base = transactionId != null ? transactionId : "lot";
        String candidate;
        do {
            candidate = base + "#" + (++generatedIds);
        } while (lotsById.containsKey(candidate));
        if (transactionId != null) {
            log.warn("Duplicate transaction id {}; lot opened as {}", transactionId, candidate);
        }
        return candidate;
    }

    /**
     * Applies an allocation produced against this book's lots.
     *
     * @throws CostBasisException LOT_OVERDRAWN if an allocation names an unknown lot or takes more than remains
     */
    public void commit(SellResult result) {
        for (SellAllocation allocation : result.allocations()) {
            TaxLot lot = lotsById.get(allocation.lotId());
            if (lot == null) {
                throw new CostBasisException(CostBasisException.LOT_OVERDRAWN,
                        "Allocation references unknown lot: " + allocation.lotId());
            }
            if (allocation.quantitySold().compareTo(lot.getRemainingQty()) > 0) {
                throw new CostBasisException(CostBasisException.LOT_OVERDRAWN,
                        "Allocation of " + allocation.quantitySold() + " exceeds remaining "
                                + lot.getRemainingQty() + " in lot " + lot.getId());
            }
            lot.deplete(allocation.quantitySold());
            if (lot.hasRemaining() && Decimals.isEffectivelyZero(lot.getRemainingQty(), closeEpsilon)) {
                log.debug("Lot {} dust {} swept to zero", lot.getId(), lot.getRemainingQty());
                lot.exhaust();
            }
            log.debug("Lot {}: -{} -> remaining {}", lot.getId(), allocation.quantitySold(), lot.getRemainingQty());
        }
    }

    public List<TaxLot> availableLots(String symbol) {
        return TaxLotAllocator.availableLots(lotsById.values(), symbol);
    }

    public BigDecimal totalAvailableQuantity(String symbol) {
        return TaxLotAllocator.totalAvailableQuantity(lotsById.values(), symbol);
    }

    public BigDecimal weightedAverageCost(String symbol) {
        return TaxLotAllocator.weightedAverageCost(lotsById.values(), symbol);
    }

    /** Every lot ever opened for {@code symbol}, exhausted ones included, in opening order. */
    public List<TaxLot> lots(String symbol) {
        String ticker = TickerSymbols.normalize(symbol);
        List<TaxLot> lots = new ArrayList<>();
        for (TaxLot lot : lotsById.values()) {
            if (ticker.equals(lot.getSymbol())) {
                lots.add(lot);
            }
        }
        return lots;
    }

    public List<TaxLot> allLots() {
        return Collections.unmodifiableList(new ArrayList<>(lotsById.values()));
    }
}
