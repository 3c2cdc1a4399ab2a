package com.holdingsledger.costbasis.engine;

import com.holdingsledger.costbasis.CostBasisException;
import com.holdingsledger.domain.CostBasisMethod;

import java.util.List;
import java.util.Objects;

/**
 * Validated choice of lot ordering. SPECID must name at least one lot; the other methods ignore lot ids.
 */
public record LotSelection(CostBasisMethod method, List<String> specificLotIds) {

    public LotSelection {
        Objects.requireNonNull(method, "cost basis method must not be null");
        specificLotIds = specificLotIds != null ? List.copyOf(specificLotIds) : List.of();
        if (method == CostBasisMethod.SPECID && specificLotIds.isEmpty()) {
            throw new CostBasisException(CostBasisException.INVALID_LOT_SELECTION,
                    "SPECID requires an explicit, non-empty list of lot ids");
        }
    }

    public static LotSelection of(CostBasisMethod method) {
        return new LotSelection(method, List.of());
    }

    public static LotSelection specific(List<String> lotIds) {
        return new LotSelection(CostBasisMethod.SPECID, lotIds);
    }
}
