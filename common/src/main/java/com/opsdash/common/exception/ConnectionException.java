package com.opsdash.common.exception;

/**
 * Exception raised when a change-feed channel or the row store cannot be reached.
 * HTTP Status: 503 Service Unavailable
 */
public final class ConnectionException extends OpsDashException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "CONNECTION_FAILED";
    }
}
