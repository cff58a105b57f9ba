package com.orderdesk.staleness;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Decides whether a timestamped value is recent enough to validate an order against.
 *
 * <p>All methods are pure. Missing data is reported as "not fresh", never as an exception.
 * The boundary is inclusive: a value whose age equals the threshold is still fresh.
 */
public class StalenessPolicy {

    private final Map<DataField, Duration> thresholds;

    public StalenessPolicy(Map<DataField, Duration> thresholds) {
        EnumMap<DataField, Duration> copy = new EnumMap<>(DataField.class);
        for (DataField field : DataField.values()) {
            Duration threshold = thresholds.get(field);
            if (threshold == null || threshold.isNegative()) {
                throw new IllegalArgumentException("Missing or negative staleness threshold for " + field);
            }
            copy.put(field, threshold);
        }
        this.thresholds = copy;
    }

    public static StalenessPolicy defaults() {
        Map<DataField, Duration> thresholds = new EnumMap<>(DataField.class);
        thresholds.put(DataField.POSITION, Duration.ofSeconds(30));
        thresholds.put(DataField.PRICE, Duration.ofSeconds(30));
        thresholds.put(DataField.BUYING_POWER, Duration.ofSeconds(60));
        thresholds.put(DataField.RISK_LIMITS, Duration.ofSeconds(300));
        return new StalenessPolicy(thresholds);
    }

    /**
     * Returns true when {@code snapshot} was observed no more than {@code maxAge} before {@code now}.
     * A snapshot observed in the future (clock skew) counts as fresh.
     */
    public static boolean isFresh(FieldSnapshot<?> snapshot, Duration maxAge, Instant now) {
        if (snapshot == null || snapshot.observedAt() == null) {
            return false;
        }
        Duration age = Duration.between(snapshot.observedAt(), now);
        return age.compareTo(maxAge) <= 0;
    }

    public boolean isFresh(DataField field, FieldSnapshot<?> snapshot, Instant now) {
        return isFresh(snapshot, thresholds.get(field), now);
    }

    /** Fresh and carrying a value. This is the check order validation uses. */
    public boolean isUsable(DataField field, FieldSnapshot<?> snapshot, Instant now) {
        return snapshot != null && snapshot.hasValue() && isFresh(field, snapshot, now);
    }

    public Duration threshold(DataField field) {
        return thresholds.get(field);
    }
}
