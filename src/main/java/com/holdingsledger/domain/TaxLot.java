package com.holdingsledger.domain;

import com.holdingsledger.common.Decimals;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One acquisition of shares. {@code quantity} and {@code costBasis} describe the original acquisition;
 * {@code remainingQty} only ever decreases and stays within [0, quantity].
 */
@Getter
@ToString
public class TaxLot {

    private final String id;
    private final String transactionId;
    private final String symbol;
    private final BigDecimal quantity;
    private final BigDecimal costBasis;
    private final LocalDate acquiredDate;
    private BigDecimal remainingQty;

    @Builder
    private TaxLot(String id, String transactionId, String symbol, BigDecimal quantity,
                   BigDecimal remainingQty, BigDecimal costBasis, LocalDate acquiredDate) {
        this.id = Objects.requireNonNull(id, "lot id must not be null");
        this.transactionId = transactionId;
        this.symbol = symbol;
        this.quantity = Objects.requireNonNull(quantity, "lot quantity must not be null");
        this.costBasis = Decimals.nullToZero(costBasis);
        this.acquiredDate = Objects.requireNonNull(acquiredDate, "acquiredDate must not be null");
        BigDecimal remaining = remainingQty != null ? remainingQty : quantity;
        if (quantity.signum() < 0 || remaining.signum() < 0 || remaining.compareTo(quantity) > 0) {
            throw new IllegalArgumentException(
                    "Lot " + id + " must satisfy 0 <= remainingQty <= quantity, got remaining=" + remaining
                            + " quantity=" + quantity);
        }
        this.remainingQty = remaining;
    }

    /** Opens a lot for an acquisition transaction, using the transaction id as lot id. */
    public static TaxLot fromAcquisition(Transaction tx) {
        return fromAcquisition(tx.getId(), tx);
    }

    /** Opens a lot for an acquisition transaction. Cost basis includes the acquisition fees. */
    public static TaxLot fromAcquisition(String lotId, Transaction tx) {
        if (!tx.getType().isAcquisition()) {
            throw new IllegalArgumentException("Only BUY/TRANSFER_IN open lots, got " + tx.getType());
        }
        return TaxLot.builder()
                .id(lotId)
                .transactionId(tx.getId())
                .symbol(tx.getSymbol())
                .quantity(tx.getQuantity())
                .costBasis(tx.getAmount().add(tx.getFees()))
                .acquiredDate(tx.getDate())
                .build();
    }

    /** Original cost per share; zero for a zero-quantity lot. */
    public BigDecimal costPerShare() {
        return Decimals.safeDivide(costBasis, quantity);
    }

    public boolean hasRemaining() {
        return remainingQty.signum() > 0;
    }

    /**
     * Removes {@code qty} shares from the lot.
     *
     * @throws IllegalArgumentException when qty is negative or exceeds the remaining quantity
     */
    public void deplete(BigDecimal qty) {
        if (qty.signum() < 0 || qty.compareTo(remainingQty) > 0) {
            throw new IllegalArgumentException(
                    "Cannot deplete " + qty + " from lot " + id + " with remaining " + remainingQty);
        }
        remainingQty = remainingQty.subtract(qty);
    }

    /** Marks a dust remainder as fully consumed. */
    public void exhaust() {
        remainingQty = BigDecimal.ZERO;
    }
}
