package com.orderdesk.market;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Optional;

/**
 * Exact decimal parsing that refuses non-finite input.
 *
 * <p>Prices and quantities arrive as JSON numbers or strings. NaN and Infinity (as doubles
 * or as text) are rejected, since a comparison against them would read as "within limit".
 * Values with more than {@link #MAX_DIGITS} integer or fractional digits are rejected too;
 * exponents like {@code 1E+999999999} cannot be rescaled or added in bounded time.
 */
public final class Decimals {

    /** Upper bound on integer digits and on fractional digits of an accepted amount. */
    public static final int MAX_DIGITS = 20;

    private Decimals() {}

    /** True when the value has at most {@link #MAX_DIGITS} integer and fractional digits. */
    public static boolean withinRange(BigDecimal value) {
        if (value == null) {
            return false;
        }
        if (value.signum() == 0) {
            return true;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        long integerDigits = (long) stripped.precision() - stripped.scale();
        return stripped.scale() <= MAX_DIGITS && integerDigits <= MAX_DIGITS;
    }

    public static Optional<BigDecimal> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return Optional.empty();
            }
            return Optional.of(node.decimalValue()).filter(Decimals::withinRange);
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return Optional.empty();
    }

    public static Optional<BigDecimal> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text.trim())).filter(Decimals::withinRange);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<BigDecimal> parsePositive(JsonNode node) {
        return parse(node).filter(value -> value.signum() > 0);
    }

    /**
     * Canonical form so equal amounts compare equal regardless of scale. Out-of-range values
     * keep their exponent form and are left for {@link #withinRange} checks to reject.
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() < 0 && stripped.scale() >= -MAX_DIGITS) {
            return stripped.setScale(0);
        }
        return stripped;
    }
}
