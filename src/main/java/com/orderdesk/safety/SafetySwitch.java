package com.orderdesk.safety;

import java.util.List;
import lombok.Getter;

/**
 * The two trading halts an order must clear, with the wire vocabulary each one uses.
 *
 * <p>Both switches share one shape: a safe state name, a confirmed unsafe state name, the
 * timestamp written when the switch returned to safe ({@code changedAt}) and the timestamp
 * written when it last left safe ({@code priorChangedAt}). Field names are accepted in
 * snake_case and camelCase.
 */
@Getter
public enum SafetySwitch {
    KILL_SWITCH(
            "Kill switch",
            "engaged",
            "ACTIVE",
            "ENGAGED",
            null,
            List.of("disengaged_at", "disengagedAt"),
            List.of("engaged_at", "engagedAt"),
            List.of("engagement_reason", "reason")),

    CIRCUIT_BREAKER(
            "Circuit breaker",
            "tripped",
            "OPEN",
            "TRIPPED",
            "QUIET_PERIOD",
            List.of("reset_at", "resetAt"),
            List.of("tripped_at", "trippedAt"),
            List.of("trip_reason", "reason"));

    private final String displayName;
    private final String blockedVerb;
    private final String safeState;
    private final String unsafeState;
    private final String transitionalState;
    private final List<String> changedAtFields;
    private final List<String> priorChangedAtFields;
    private final List<String> reasonFields;

    SafetySwitch(
            String displayName,
            String blockedVerb,
            String safeState,
            String unsafeState,
            String transitionalState,
            List<String> changedAtFields,
            List<String> priorChangedAtFields,
            List<String> reasonFields) {
        this.displayName = displayName;
        this.blockedVerb = blockedVerb;
        this.safeState = safeState;
        this.unsafeState = unsafeState;
        this.transitionalState = transitionalState;
        this.changedAtFields = changedAtFields;
        this.priorChangedAtFields = priorChangedAtFields;
        this.reasonFields = reasonFields;
    }

    /** Block code for a confirmed unsafe state, e.g. KILL_SWITCH_ENGAGED. */
    public String blockedCode() {
        return name() + "_" + blockedVerb.toUpperCase();
    }

    /** Block code when the state could not be verified, e.g. KILL_SWITCH_UNVERIFIED. */
    public String unverifiedCode() {
        return name() + "_UNVERIFIED";
    }
}
