package com.holdingsledger.costbasis.engine;

import com.holdingsledger.common.DayCounts;
import com.holdingsledger.common.Decimals;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.domain.ClosedPosition;
import com.holdingsledger.domain.Holding;
import com.holdingsledger.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running-balance aggregation of a transaction stream into open holdings and closed positions.
 * Sells reduce cost basis by average-cost proration, which is cheap and good enough for portfolio display;
 * per-lot realized gains come from {@link TaxLotAllocator}.
 *
 * <p>Noisy input is tolerated: a sell larger than the open quantity consumes the whole position
 * (ratio clamped to 1) and a sell with nothing open is ignored. Both are logged at WARN.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldingAggregator {

    private final CostBasisProperties properties;

    public PortfolioSummary aggregate(List<Transaction> transactions) {
        BigDecimal epsilon = properties.getCloseEpsilon();
        Map<String, RunningPosition> running = new LinkedHashMap<>();
        List<ClosedPosition> closedPositions = new ArrayList<>();

        for (Transaction tx : TransactionTimeline.chronological(transactions)) {
            String symbol = tx.getSymbol();
            RunningPosition position = running.computeIfAbsent(symbol, s -> new RunningPosition());
            position.transactions.add(tx);

            // switch expression so a new TransactionType fails compilation here
            boolean moved = switch (tx.getType()) {
                case BUY, TRANSFER_IN -> {
                    position.acquire(tx);
                    yield true;
                }
                case SELL, TRANSFER_OUT -> position.dispose(tx);
                case DIVIDEND -> false;
            };

            if (Decimals.isEffectivelyZero(position.quantity, epsilon)) {
                closeCycle(symbol, position).ifPresent(closedPositions::add);
                running.put(symbol, new RunningPosition());
            } else if (moved) {
                log.trace("{} {}: qty={} costBasis={}", tx.getType(), symbol, position.quantity, position.costBasis);
            }
        }

        Map<String, Holding> openHoldings = new LinkedHashMap<>();
        running.forEach((symbol, position) -> {
            if (position.quantity.compareTo(epsilon) > 0) {
                openHoldings.put(symbol, new Holding(symbol, position.quantity, position.costBasis,
                        Decimals.safeDivide(position.costBasis, position.quantity)));
            }
        });

        BigDecimal total = BigDecimal.ZERO;
        BigDecimal longTerm = BigDecimal.ZERO;
        BigDecimal shortTerm = BigDecimal.ZERO;
        for (ClosedPosition cp : closedPositions) {
            total = total.add(cp.realizedGain());
            if (cp.isLongTerm()) {
                longTerm = longTerm.add(cp.realizedGain());
            } else {
                shortTerm = shortTerm.add(cp.realizedGain());
            }
        }
        return new PortfolioSummary(Collections.unmodifiableMap(openHoldings), closedPositions, total, longTerm, shortTerm);
    }

    /**
     * Totals for one open-to-flat cycle. Empty when the cycle has no acquisition or no disposal
     * (e.g. a dividend or an orphan sell on an empty position).
     */
    private Optional<ClosedPosition> closeCycle(String symbol, RunningPosition position) {
        BigDecimal sharesBought = BigDecimal.ZERO;
        BigDecimal sharesSold = BigDecimal.ZERO;
        BigDecimal costBasis = BigDecimal.ZERO;
        BigDecimal proceeds = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        LocalDate lastSellDate = null;

        for (Transaction tx : position.transactions) {
            fees = fees.add(tx.getFees());
            if (tx.getType().isAcquisition()) {
                sharesBought = sharesBought.add(tx.getQuantity());
                costBasis = costBasis.add(tx.getAmount()).add(tx.getFees());
            } else if (tx.getType().isDisposal()) {
                sharesSold = sharesSold.add(tx.getQuantity());
                proceeds = proceeds.add(tx.getAmount()).subtract(tx.getFees());
                lastSellDate = tx.getDate();
            }
        }
        if (position.firstBuyDate == null || lastSellDate == null) {
            log.debug("Discarding {} cycle without both a buy and a sell ({} transactions)",
                    symbol, position.transactions.size());
            return Optional.empty();
        }

        BigDecimal realizedGain = proceeds.subtract(costBasis);
        long holdingPeriodDays = DayCounts.signedDaysBetween(position.firstBuyDate, lastSellDate);
        ClosedPosition closed = new ClosedPosition(
                symbol,
                sharesBought,
                sharesSold,
                costBasis,
                proceeds,
                fees,
                realizedGain,
                Decimals.percentOf(realizedGain, costBasis),
                position.firstBuyDate,
                lastSellDate,
                holdingPeriodDays,
                holdingPeriodDays > properties.getLongTermThresholdDays(),
                position.transactions);
        log.debug("Closed {} {} -> {}: realizedGain={}", symbol, position.firstBuyDate, lastSellDate, realizedGain);
        return Optional.of(closed);
    }

    private static final class RunningPosition {
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal costBasis = BigDecimal.ZERO;
        private LocalDate firstBuyDate;
        private final List<Transaction> transactions = new ArrayList<>();

        void acquire(Transaction tx) {
            if (quantity.signum() == 0) {
                firstBuyDate = tx.getDate();
            }
            quantity = quantity.add(tx.getQuantity());
            costBasis = costBasis.add(tx.getAmount()).add(tx.getFees());
        }

        boolean dispose(Transaction tx) {
            if (quantity.signum() <= 0) {
                log.warn("{} {} of {} {} with no open position; ignored",
                        tx.getType(), tx.getId(), tx.getQuantity(), tx.getSymbol());
                return false;
            }
            BigDecimal sellQty = tx.getQuantity();
            if (sellQty.compareTo(quantity) > 0) {
                log.warn("{} {} of {} {} exceeds open quantity {}; clamping to a full close",
                        tx.getType(), tx.getId(), sellQty, tx.getSymbol(), quantity);
            }
            BigDecimal sellRatio = Decimals.min(Decimals.safeDivide(sellQty, quantity), BigDecimal.ONE);
            costBasis = costBasis.subtract(costBasis.multiply(sellRatio))
                    .setScale(Decimals.SCALE, Decimals.ROUNDING);
            quantity = quantity.subtract(sellQty).max(BigDecimal.ZERO);
            return true;
        }
    }
}
