package com.zzf.cryptoagent.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validators for tool arguments. Every failure is an {@link IllegalArgumentException} whose
 * message is safe to show to the caller.
 */
public final class TradingInputs {
    public static final double MAX_AMOUNT = 1e15;
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9]+(/[A-Z0-9]+)?");

    private TradingInputs() {}

    /**
     * Upper-cases and validates a symbol, then appends {@code /quote} when it is not already a pair.
     */
    public static String normalizeSymbol(String raw, String quote) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Symbol must be a non-empty string");
        }
        String symbol = raw.trim().toUpperCase(Locale.ROOT);
        if (symbol.length() < 2) {
            throw new IllegalArgumentException("Symbol must be at least 2 characters long");
        }
        if (symbol.length() > 20) {
            throw new IllegalArgumentException("Symbol must be at most 20 characters long");
        }
        if (!SYMBOL.matcher(symbol).matches()) {
            throw new IllegalArgumentException("Invalid symbol format: " + symbol);
        }
        return symbol.indexOf('/') >= 0 ? symbol : symbol + "/" + quote;
    }

    public static String baseAsset(String pair) {
        int slash = pair.indexOf('/');
        return slash >= 0 ? pair.substring(0, slash) : pair;
    }

    public static double positiveAmount(Double value, String fieldName) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new IllegalArgumentException(fieldName + " must be a number");
        }
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be greater than 0");
        }
        if (value > MAX_AMOUNT) {
            throw new IllegalArgumentException(fieldName + " value is unreasonably large");
        }
        return value;
    }
}
