package com.orderdesk.exception;

import java.util.Map;

public class SessionDisposedException extends BaseException {

    public SessionDisposedException(String sessionId) {
        super(ErrorCode.SESSION_DISPOSED, "Order entry session disposed: " + sessionId, Map.of("sessionId", sessionId), null);
    }
}
