package com.orderdesk.oms;

import com.orderdesk.exception.ErrorCode;
import lombok.Builder;
import lombok.Getter;

/**
 * Why an order may not proceed.
 *
 * <p>Each block has a machine-readable code (e.g., KILL_SWITCH_ENGAGED, PRICE_STALE) and a
 * trader-facing message. Codes ending in {@code _UNVERIFIED} mean the state could not be
 * confirmed, as opposed to confirmed unsafe.
 */
@Getter
@Builder
public class OrderBlock {

    private final ErrorCode errorCode;

    private final String code;

    private final String message;

    public static OrderBlock validation(String code, String message) {
        return OrderBlock.builder().errorCode(ErrorCode.VALIDATION_FAILURE).code(code).message(message).build();
    }

    public static OrderBlock safety(String code, String message) {
        return OrderBlock.builder().errorCode(ErrorCode.SAFETY_BLOCKED).code(code).message(message).build();
    }

    public static OrderBlock transientIo(String code, String message) {
        return OrderBlock.builder().errorCode(ErrorCode.TRANSIENT_IO).code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
