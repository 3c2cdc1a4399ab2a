package com.holdingsledger.costbasis.engine;

import com.holdingsledger.costbasis.CostBasisException;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.domain.CostBasisMethod;
import com.holdingsledger.domain.Holding;
import com.holdingsledger.domain.TaxLot;
import com.holdingsledger.domain.Transaction;
import com.holdingsledger.domain.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.holdingsledger.costbasis.engine.HoldingAggregatorTest.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxLotBookTest {

    private static final BigDecimal EPSILON = new BigDecimal("0.0001");

    private final CostBasisProperties properties = new CostBasisProperties();
    private final TaxLotAllocator allocator = new TaxLotAllocator(properties);

    @Test
    void open_usesTransactionIdOrGeneratesOne() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        Transaction withoutId = tx(null, TransactionType.BUY, "AAPL", "1", "10", "2023-01-02");

        TaxLot first = book.open(tx("b1", TransactionType.BUY, "AAPL", "5", "10", "2023-01-01"));
        TaxLot second = book.open(withoutId);

        assertThat(first.getId()).isEqualTo("b1");
        assertThat(second.getId()).isEqualTo("lot#1");
        assertThat(second.getTransactionId()).isNull();
        assertThat(book.lots("aapl")).extracting(TaxLot::getId).containsExactly("b1", "lot#1");
    }

    @Test
    void open_duplicateIdGetsDistinctLot() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        Transaction original = tx("b1", TransactionType.BUY, "AAPL", "5", "10", "2023-01-01");
        Transaction duplicate = tx("b1", TransactionType.BUY, "AAPL", "3", "12", "2023-01-02");

        book.open(original);
        TaxLot second = book.open(duplicate);

        assertThat(second.getId()).isNotEqualTo("b1").startsWith("b1#");
        assertThat(book.lots("AAPL")).hasSize(2);
        assertThat(book.acquisitionOf("b1")).containsSame(original);
        assertThat(book.acquisitionOf(second.getId())).containsSame(duplicate);
    }

    @Test
    void open_generatedIdNeverShadowsRealId() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        book.open(tx("lot#1", TransactionType.BUY, "AAPL", "5", "10", "2023-01-01"));

        TaxLot generated = book.open(tx(null, TransactionType.BUY, "AAPL", "1", "10", "2023-01-02"));

        assertThat(generated.getId()).isEqualTo("lot#2");
        assertThat(book.lots("AAPL")).extracting(TaxLot::getId).containsExactly("lot#1", "lot#2");
    }

    @Test
    void open_rejectsDisposals() {
        TaxLotBook book = new TaxLotBook(EPSILON);

        assertThatThrownBy(() -> book.open(tx("s1", TransactionType.SELL, "AAPL", "5", "10", "2023-01-02")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void commit_depletesAllocatedLots() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        book.open(tx("b1", TransactionType.BUY, "AAPL", "10", "10", "2023-01-01"));
        book.open(tx("b2", TransactionType.BUY, "AAPL", "10", "20", "2023-02-01"));

        SellResult result = allocator.allocateSell(book.availableLots("AAPL"), new BigDecimal("12"),
                new BigDecimal("25"), LocalDate.of(2023, 3, 1), CostBasisMethod.FIFO);
        book.commit(result);

        assertThat(book.availableLots("AAPL")).extracting(TaxLot::getId).containsExactly("b2");
        assertThat(book.totalAvailableQuantity("AAPL")).isEqualByComparingTo("8");
        assertThat(book.weightedAverageCost("AAPL")).isEqualByComparingTo("20");
        assertThat(book.allLots()).hasSize(2);
    }

    @Test
    void commit_overdrawnOrUnknownLot_fails() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        book.open(tx("b1", TransactionType.BUY, "AAPL", "10", "10", "2023-01-01"));

        assertThatThrownBy(() -> book.commit(singleAllocation("b1", "11")))
                .isInstanceOf(CostBasisException.class)
                .extracting("errorCode").isEqualTo(CostBasisException.LOT_OVERDRAWN);
        assertThatThrownBy(() -> book.commit(singleAllocation("nope", "1")))
                .isInstanceOf(CostBasisException.class)
                .extracting("errorCode").isEqualTo(CostBasisException.LOT_OVERDRAWN);
        assertThat(book.totalAvailableQuantity("AAPL")).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("remainder within epsilon is swept to zero")
    void commit_sweepsDust() {
        TaxLotBook book = new TaxLotBook(EPSILON);
        book.open(tx("b1", TransactionType.BUY, "AAPL", "1", "10", "2023-01-01"));

        book.commit(singleAllocation("b1", "0.99995"));

        assertThat(book.availableLots("AAPL")).isEmpty();
        assertThat(book.lots("AAPL").get(0).getRemainingQty()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("lot remainders match the aggregator's open quantity after every prefix")
    void remainingLots_conserveAggregatorQuantity() {
        List<Transaction> history = List.of(
                tx("b1", TransactionType.BUY, "AAPL", "10", "100", "2023-01-01"),
                tx("b2", TransactionType.TRANSFER_IN, "AAPL", "5", "120", "2023-02-01"),
                tx("s1", TransactionType.SELL, "AAPL", "8", "130", "2023-03-01"),
                tx("s2", TransactionType.TRANSFER_OUT, "AAPL", "7", "125", "2023-04-01"),
                tx("b3", TransactionType.BUY, "AAPL", "3", "110", "2023-05-01"),
                tx("s3", TransactionType.SELL, "AAPL", "1", "140", "2023-06-01"));
        HoldingAggregator aggregator = new HoldingAggregator(properties);

        for (int n = 1; n <= history.size(); n++) {
            List<Transaction> prefix = history.subList(0, n);
            TaxLotBook book = new TaxLotBook(EPSILON);
            for (Transaction t : prefix) {
                if (t.getType().isAcquisition()) {
                    book.open(t);
                } else {
                    book.commit(allocator.allocateSell(book.availableLots(t.getSymbol()), t.getQuantity(),
                            t.getPrice(), t.getDate(), CostBasisMethod.FIFO));
                }
            }
            Holding holding = aggregator.aggregate(prefix).openHoldings().get("AAPL");
            BigDecimal expected = holding != null ? holding.quantity() : BigDecimal.ZERO;
            assertThat(book.totalAvailableQuantity("AAPL")).as("after %d transactions", n)
                    .isEqualByComparingTo(expected);
        }
    }

    private static SellResult singleAllocation(String lotId, String qty) {
        BigDecimal quantity = new BigDecimal(qty);
        SellAllocation allocation = new SellAllocation(lotId, quantity, BigDecimal.ZERO, LocalDate.of(2023, 1, 1),
                BigDecimal.ZERO, BigDecimal.ZERO, false, 0);
        return new SellResult(List.of(allocation), quantity, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
