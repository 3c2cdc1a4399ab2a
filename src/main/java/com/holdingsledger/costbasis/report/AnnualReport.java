package com.holdingsledger.costbasis.report;

import java.math.BigDecimal;

public record AnnualReport(
        int year,
        YearActivity activity,
        BigDecimal dividendIncome,
        RealizedGainReport realizedGains,
        PortfolioValuation beginningValuation,
        PortfolioValuation endingValuation
) {
}
