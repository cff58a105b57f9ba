package com.orderdesk.exception;

import java.util.Map;

/** Raised on caller bugs such as two owners of one channel supplying different handlers. */
public class ProgrammingInvariantException extends BaseException {

    public ProgrammingInvariantException(String message) {
        super(ErrorCode.PROGRAMMING_INVARIANT, message, null, null);
    }

    public ProgrammingInvariantException(String message, Map<String, Object> details) {
        super(ErrorCode.PROGRAMMING_INVARIANT, message, details, null);
    }
}
