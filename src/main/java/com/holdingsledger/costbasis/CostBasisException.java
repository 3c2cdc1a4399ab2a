package com.holdingsledger.costbasis;

import lombok.Getter;

/**
 * Thrown when a caller hands the engine a configuration it cannot act on, or a commit would break a lot invariant.
 * Expected conditions (insufficient shares, missing prices) are reported in result fields instead.
 */
@Getter
public class CostBasisException extends RuntimeException {

    public static final String INVALID_LOT_SELECTION = "INVALID_LOT_SELECTION";
    public static final String LOT_OVERDRAWN = "LOT_OVERDRAWN";

    private final String errorCode;

    public CostBasisException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
