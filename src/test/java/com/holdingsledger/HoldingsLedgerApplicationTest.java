package com.holdingsledger;

import com.holdingsledger.costbasis.engine.HoldingAggregator;
import com.holdingsledger.costbasis.engine.TaxLotAllocator;
import com.holdingsledger.costbasis.export.ClosedPositionExporter;
import com.holdingsledger.costbasis.query.PortfolioSummaryService;
import com.holdingsledger.costbasis.report.AnnualReportService;
import com.holdingsledger.costbasis.report.RealizedGainReporter;
import com.holdingsledger.costbasis.washsale.WashSaleDetector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class HoldingsLedgerApplicationTest {

    @Autowired
    ApplicationContext context;

    @Test
    void contextWiresEngineServices() {
        assertThat(context.getBean(HoldingAggregator.class)).isNotNull();
        assertThat(context.getBean(TaxLotAllocator.class)).isNotNull();
        assertThat(context.getBean(WashSaleDetector.class)).isNotNull();
        assertThat(context.getBean(RealizedGainReporter.class)).isNotNull();
        assertThat(context.getBean(AnnualReportService.class)).isNotNull();
        assertThat(context.getBean(PortfolioSummaryService.class)).isNotNull();
        assertThat(context.getBean(ClosedPositionExporter.class)).isNotNull();
    }
}
