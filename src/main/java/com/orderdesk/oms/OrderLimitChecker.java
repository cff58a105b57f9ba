package com.orderdesk.oms;

import com.orderdesk.market.PositionBook;
import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Optional;

/**
 * Position, per-order notional and portfolio exposure limit checks.
 *
 * <p>Runs after the inputs have passed freshness checks. Every figure comes from the
 * supplied position book; nothing is extrapolated from earlier deltas.
 */
public final class OrderLimitChecker {

    private OrderLimitChecker() {}

    public static Optional<OrderBlock> check(
            OrderForm form, PositionBook positions, RiskLimits limits, BigDecimal effectivePrice) {
        BigDecimal currentPosition = positions.quantityOf(form.symbol());
        BigDecimal proposedPosition =
                ExposureCalculator.proposedPosition(currentPosition, form.side(), form.quantity());

        if (proposedPosition.abs().compareTo(limits.getMaxPositionPerSymbol()) > 0) {
            return Optional.of(OrderBlock.validation(
                    "POSITION_LIMIT_EXCEEDED",
                    "Order exceeds position limit (" + limits.getMaxPositionPerSymbol().toPlainString() + " shares)"));
        }

        BigDecimal notional = form.quantity().multiply(effectivePrice);
        if (notional.compareTo(limits.getMaxNotionalPerOrder()) > 0) {
            return Optional.of(OrderBlock.validation(
                    "NOTIONAL_LIMIT_EXCEEDED",
                    "Order exceeds max notional ($" + dollars(limits.getMaxNotionalPerOrder()) + ")"));
        }

        BigDecimal maxTotalExposure = limits.getMaxTotalExposure();
        if (maxTotalExposure != null) {
            Optional<BigDecimal> currentTotal = positions.totalExposure();
            Optional<BigDecimal> currentSymbolNotional = positions.symbolNotional(form.symbol());
            if (currentTotal.isEmpty() || currentSymbolNotional.isEmpty()) {
                return Optional.of(OrderBlock.validation("EXPOSURE_UNVERIFIED", "Cannot verify exposure limit"));
            }
            BigDecimal projected = ExposureCalculator.projectedExposure(
                    currentTotal.get(), currentSymbolNotional.get(), proposedPosition, effectivePrice);
            if (projected.compareTo(maxTotalExposure) > 0) {
                return Optional.of(OrderBlock.validation(
                        "EXPOSURE_LIMIT_EXCEEDED",
                        "Order exceeds total exposure limit ($" + dollars(maxTotalExposure) + ")"));
            }
        }
        return Optional.empty();
    }

    private static String dollars(BigDecimal amount) {
        return new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US)).format(amount);
    }
}
