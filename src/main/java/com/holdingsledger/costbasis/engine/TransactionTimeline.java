package com.holdingsledger.costbasis.engine;

import com.holdingsledger.domain.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Replay order for ledger events: date ascending, same-date events keep the caller's insertion order.
 */
public final class TransactionTimeline {

    private TransactionTimeline() {
    }

    public static List<Transaction> chronological(Collection<Transaction> transactions) {
        List<Transaction> sorted = new ArrayList<>(transactions);
        // List.sort is a stable merge sort
        sorted.sort(Comparator.comparing(Transaction::getDate));
        return sorted;
    }
}
