package com.holdingsledger.domain;

/**
 * Lot selection order applied when a sale depletes tax lots.
 */
public enum CostBasisMethod {
    FIFO("First In, First Out (FIFO)", "Sells oldest shares first"),
    LIFO("Last In, First Out (LIFO)", "Sells newest shares first"),
    HIFO("Highest Cost First (HIFO)", "Sells highest-cost shares first to minimize taxable gains"),
    /** Caller names the lots, in order. */
    SPECID("Specific Identification", "Choose specific lots to sell");

    private final String displayName;
    private final String description;

    CostBasisMethod(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}
