package com.holdingsledger.domain;

/**
 * Kind of ledger event. Acquisitions open lots and raise quantity, disposals consume them,
 * DIVIDEND never touches quantity or cost basis.
 */
public enum TransactionType {
    BUY,
    SELL,
    DIVIDEND,
    TRANSFER_IN,
    TRANSFER_OUT;

    public boolean isAcquisition() {
        return switch (this) {
            case BUY, TRANSFER_IN -> true;
            case SELL, TRANSFER_OUT, DIVIDEND -> false;
        };
    }

    public boolean isDisposal() {
        return switch (this) {
            case SELL, TRANSFER_OUT -> true;
            case BUY, TRANSFER_IN, DIVIDEND -> false;
        };
    }
}
