package com.orderdesk.safety;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Fail-closed view of one safety switch.
 *
 * <p>{@code verified} separates a confirmed state read from a well-formed payload from a
 * state the tracker fell back to because it could not tell (timeout, malformed JSON, a safe
 * claim without its transition timestamp). An unverified state is always {@link SafetyStatus#UNSAFE}.
 */
@Getter
@Builder
@ToString
public class SafetyState {

    private final SafetySwitch safetySwitch;
    private final SafetyStatus status;
    private final Instant changedAt;
    private final Instant priorChangedAt;
    private final String reason;
    private final boolean verified;

    public static SafetyState unverified(SafetySwitch safetySwitch, String reason) {
        return SafetyState.builder()
                .safetySwitch(safetySwitch)
                .status(SafetyStatus.UNSAFE)
                .reason(reason)
                .verified(false)
                .build();
    }

    /** State before the first fetch or push has been applied. */
    public static SafetyState uninitialized(SafetySwitch safetySwitch) {
        return unverified(safetySwitch, safetySwitch.getDisplayName() + " state loading");
    }

    public boolean isSafe() {
        return status == SafetyStatus.SAFE;
    }

    public boolean isBlocking() {
        return status.isBlocking();
    }

    /** Trader-facing text that says whether the switch is confirmed unsafe or merely unverified. */
    public String describe() {
        if (isSafe()) {
            return safetySwitch.getDisplayName() + " clear";
        }
        if (!verified) {
            return "Unable to verify " + safetySwitch.getDisplayName().toLowerCase()
                    + (reason != null ? ": " + reason : "");
        }
        if (status == SafetyStatus.TRANSITIONAL) {
            return safetySwitch.getDisplayName() + " in quiet period";
        }
        return safetySwitch.getDisplayName() + " " + safetySwitch.getBlockedVerb()
                + (reason != null ? ": " + reason : "");
    }
}
