package com.holdingsledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * BigDecimal helpers shared by the engines. Division by zero yields zero, never an exception.
 */
public final class Decimals {

    public static final int SCALE = 18;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private Decimals() {
    }

    public static BigDecimal nullToZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    /** numerator / denominator at {@link #SCALE}; zero when the denominator is null or zero. */
    public static BigDecimal safeDivide(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return nullToZero(numerator).divide(denominator, SCALE, ROUNDING);
    }

    /** (part / base) × 100; zero when base is not positive. */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal base) {
        if (base == null || base.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return safeDivide(part, base).multiply(HUNDRED);
    }

    /** True when |value| ≤ epsilon. */
    public static boolean isEffectivelyZero(BigDecimal value, BigDecimal epsilon) {
        return value == null || value.abs().compareTo(epsilon) <= 0;
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> field) {
        return items.stream()
                .map(field)
                .map(Decimals::nullToZero)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
