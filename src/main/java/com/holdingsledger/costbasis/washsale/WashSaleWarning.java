package com.holdingsledger.costbasis.washsale;

import java.util.List;

/**
 * Pre-trade check result: loss sales a proposed buy would retroactively turn into wash sales.
 */
public record WashSaleWarning(boolean wouldTrigger, List<String> affectedSellIds) {

    public WashSaleWarning {
        affectedSellIds = List.copyOf(affectedSellIds);
    }
}
