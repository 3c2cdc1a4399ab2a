package com.holdingsledger.domain;

import com.holdingsledger.common.TickerSymbols;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Immutable ledger event as supplied by the caller. Symbol is stored in canonical ticker form.
 * When {@code amount} is omitted it defaults to quantity × price; missing price and fees default to zero.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Transaction {

    @EqualsAndHashCode.Include
    private final String id;
    private final String symbol;
    private final TransactionType type;
    private final BigDecimal quantity;
    private final BigDecimal price;
    private final BigDecimal amount;
    private final BigDecimal fees;
    private final LocalDate date;

    @Builder(toBuilder = true)
    private Transaction(String id, String symbol, TransactionType type, BigDecimal quantity,
                        BigDecimal price, BigDecimal amount, BigDecimal fees, LocalDate date) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required (id=" + id + ")");
        }
        if (date == null) {
            throw new IllegalArgumentException("Transaction date is required (id=" + id + ")");
        }
        String ticker = TickerSymbols.normalize(symbol);
        if (ticker.isEmpty()) {
            throw new IllegalArgumentException("Transaction symbol is required (id=" + id + ")");
        }
        BigDecimal qty = quantity != null ? quantity : BigDecimal.ZERO;
        if (qty.signum() < 0) {
            throw new IllegalArgumentException("Transaction quantity must be non-negative, got: " + quantity);
        }
        this.id = id;
        this.symbol = ticker;
        this.type = type;
        this.quantity = qty;
        this.price = price != null ? price : BigDecimal.ZERO;
        this.amount = amount != null ? amount : qty.multiply(this.price);
        this.fees = fees != null ? fees : BigDecimal.ZERO;
        this.date = date;
    }
}
