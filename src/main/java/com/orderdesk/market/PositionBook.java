package com.orderdesk.market;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Full set of a user's positions at one server timestamp. Exposure figures are summed from
 * every row so they can be checked against a portfolio-wide limit.
 */
public record PositionBook(List<PositionEntry> entries) {

    public PositionBook {
        entries = List.copyOf(entries);
    }

    public static PositionBook empty() {
        return new PositionBook(List.of());
    }

    public Optional<PositionEntry> find(String symbol) {
        return entries.stream().filter(entry -> entry.symbol().equals(symbol)).findFirst();
    }

    public BigDecimal quantityOf(String symbol) {
        return find(symbol).map(PositionEntry::qty).orElse(BigDecimal.ZERO);
    }

    /** Absolute notional of {@code symbol}, zero when flat, empty when its price is unknown. */
    public Optional<BigDecimal> symbolNotional(String symbol) {
        Optional<PositionEntry> entry = find(symbol);
        if (entry.isEmpty()) {
            return Optional.of(BigDecimal.ZERO);
        }
        return Optional.ofNullable(entry.get().notional());
    }

    /** Sum of absolute notionals, empty if any row lacks a price. */
    public Optional<BigDecimal> totalExposure() {
        BigDecimal total = BigDecimal.ZERO;
        for (PositionEntry entry : entries) {
            BigDecimal notional = entry.notional();
            if (notional == null) {
                return Optional.empty();
            }
            total = total.add(notional);
        }
        return Optional.of(total);
    }

    /** Copy with {@code symbol} replaced (or added) at the given quantity and price. */
    public PositionBook withPosition(String symbol, BigDecimal qty, BigDecimal price) {
        List<PositionEntry> updated = new ArrayList<>();
        boolean replaced = false;
        for (PositionEntry entry : entries) {
            if (entry.symbol().equals(symbol)) {
                updated.add(new PositionEntry(symbol, qty, price, entry.updatedAt()));
                replaced = true;
            } else {
                updated.add(entry);
            }
        }
        if (!replaced) {
            updated.add(new PositionEntry(symbol, qty, price, null));
        }
        return new PositionBook(updated);
    }
}
