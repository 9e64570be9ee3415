package com.opsdash.common.exception;

/**
 * Root of the error taxonomy shared by the realtime layer and the notification inbox.
 *
 * Sealed so that code switching over an error (REST translation, dashboard status)
 * handles every kind explicitly.
 */
public abstract sealed class OpsDashException extends RuntimeException
        permits ConnectionException, SubscriptionTimeoutException, ValidationException,
        ResourceNotFoundException, PartialBatchException, AccessDeniedException {

    protected OpsDashException(String message) {
        super(message);
    }

    protected OpsDashException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code used in API error bodies and status pushes.
     */
    public abstract String getErrorCode();
}
