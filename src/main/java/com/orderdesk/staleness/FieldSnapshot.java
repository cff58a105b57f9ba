package com.orderdesk.staleness;

import java.time.Instant;

/**
 * A value paired with the server-assigned time it was observed.
 *
 * <p>{@code observedAt} is never filled in from the local clock. A snapshot with a null
 * {@code observedAt} is unusable regardless of its value.
 *
 * @param value the observed value, null when unknown or unparsable
 * @param observedAt server timestamp of the observation, null when absent
 */
public record FieldSnapshot<T>(T value, Instant observedAt) {

    private static final FieldSnapshot<?> EMPTY = new FieldSnapshot<>(null, null);

    @SuppressWarnings("unchecked")
    public static <T> FieldSnapshot<T> empty() {
        return (FieldSnapshot<T>) EMPTY;
    }

    public static <T> FieldSnapshot<T> of(T value, Instant observedAt) {
        return new FieldSnapshot<>(value, observedAt);
    }

    public boolean hasValue() {
        return value != null;
    }
}
