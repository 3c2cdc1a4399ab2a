package com.holdingsledger.common;

import java.util.Locale;

/**
 * Canonical ticker form: trimmed and upper-cased. Every symbol comparison in the engine goes through here.
 */
public final class TickerSymbols {

    private TickerSymbols() {
    }

    /**
     * Returns the canonical ticker, or an empty string for null/blank input.
     */
    public static String normalize(String symbol) {
        if (symbol == null) {
            return "";
        }
        return symbol.strip().toUpperCase(Locale.ROOT);
    }

    public static boolean sameTicker(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
