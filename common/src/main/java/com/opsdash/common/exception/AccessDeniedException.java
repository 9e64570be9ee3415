package com.opsdash.common.exception;

/**
 * Exception thrown when a user tries to perform an action their role does not allow
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public final class AccessDeniedException extends OpsDashException {

    public AccessDeniedException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "ACCESS_DENIED";
    }
}
