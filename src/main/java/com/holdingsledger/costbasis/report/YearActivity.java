package com.holdingsledger.costbasis.report;

import java.math.BigDecimal;

/**
 * BUY and SELL volume in a year. Transfers and dividends are not trading activity and are not counted.
 */
public record YearActivity(
        BigDecimal totalBought,
        BigDecimal totalSold,
        int buyCount,
        int sellCount
) {
}
