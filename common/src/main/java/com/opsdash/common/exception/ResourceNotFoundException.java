package com.opsdash.common.exception;

/**
 * Exception raised when an operation targets an id that does not exist.
 * HTTP Status: 404 Not Found
 */
public final class ResourceNotFoundException extends OpsDashException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "RESOURCE_NOT_FOUND";
    }
}
