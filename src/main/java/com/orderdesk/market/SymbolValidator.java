package com.orderdesk.market;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes ticker symbols: trimmed, upper-cased, 1-10 characters of letters, digits and
 * dots (share classes such as BRK.B). Anything else is rejected before a channel name is
 * built from it.
 */
public final class SymbolValidator {

    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9][A-Z0-9.]{0,9}");

    private SymbolValidator() {}

    /**
     * @throws IllegalArgumentException if the symbol is empty or malformed
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Symbol must be a non-empty string");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid symbol: " + raw);
        }
        return normalized;
    }

    public static Optional<String> tryNormalize(String raw) {
        try {
            return Optional.of(normalize(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
