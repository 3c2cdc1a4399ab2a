package com.holdingsledger.costbasis.engine;

import com.holdingsledger.costbasis.CostBasisException;
import com.holdingsledger.domain.CostBasisMethod;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LotSelectionTest {

    @Test
    void specificWithoutIds_isInvalid() {
        assertThatThrownBy(() -> LotSelection.specific(List.of()))
                .isInstanceOf(CostBasisException.class)
                .hasMessageContaining("SPECID")
                .extracting("errorCode").isEqualTo(CostBasisException.INVALID_LOT_SELECTION);
        assertThatThrownBy(() -> new LotSelection(CostBasisMethod.SPECID, null))
                .isInstanceOf(CostBasisException.class);
    }

    @Test
    void otherMethods_ignoreIds() {
        LotSelection selection = new LotSelection(CostBasisMethod.FIFO, null);
        assertThat(selection.specificLotIds()).isEmpty();
    }

    @Test
    void methodIsRequired() {
        assertThatThrownBy(() -> LotSelection.of(null)).isInstanceOf(NullPointerException.class);
    }
}
