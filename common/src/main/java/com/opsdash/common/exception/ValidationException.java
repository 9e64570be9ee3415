package com.opsdash.common.exception;

/**
 * Exception raised for malformed notification fields or query parameters.
 * HTTP Status: 400 Bad Request
 */
public final class ValidationException extends OpsDashException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }
}
