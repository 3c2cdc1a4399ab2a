package com.holdingsledger.costbasis.washsale;

/**
 * Which replacement buys inside the window are charged against a loss sale.
 */
public enum WashSaleMatchPolicy {
    /** Only the preferred candidate (post-sale first, then nearest) counts toward replaced shares. */
    NEAREST_SINGLE,
    /** Every in-window replacement buy counts, capped at the sold quantity. */
    ALL_IN_WINDOW
}
