package com.orderdesk.exception;

import java.util.Map;

/** Network or timeout failure on a bus subscription, state fetch or REST call. */
public class TransientIoException extends BaseException {

    public TransientIoException(String message) {
        super(ErrorCode.TRANSIENT_IO, message, null, null);
    }

    public TransientIoException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_IO, message, null, cause);
    }

    public TransientIoException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.TRANSIENT_IO, message, details, cause);
    }

    public static TransientIoException forChannel(String channel, Throwable cause) {
        return new TransientIoException("Subscribe failed for channel " + channel, Map.of("channel", channel), cause);
    }
}
