package com.opsdash.realtimeservice.exception;

import com.opsdash.common.exception.AccessDeniedException;
import com.opsdash.common.exception.ConnectionException;
import com.opsdash.common.exception.OpsDashException;
import com.opsdash.common.exception.PartialBatchException;
import com.opsdash.common.exception.ResourceNotFoundException;
import com.opsdash.common.exception.SubscriptionTimeoutException;
import com.opsdash.common.exception.ValidationException;
import io.micrometer.tracing.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Error bodies carry the trace id so a failed call can be found in the logs.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final Tracer tracer;

    public GlobalExceptionHandler(Tracer tracer) {
        this.tracer = tracer;
    }

    private String getTraceId() {
        return tracer.currentSpan() != null ? tracer.currentSpan().context().traceId() : "no-trace-id";
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(ValidationException ex) {
        String traceId = getTraceId();
        log.warn("[{}] Validation error: field={}, message={}", traceId, ex.getField(), ex.getMessage());

        Map<String, Object> body = errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), traceId);
        body.put("code", ex.getErrorCode());
        body.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String traceId = getTraceId();
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("[{}] Request validation failed: {}", traceId, message);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, message, traceId));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        return handleOpsDashException(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDeniedException(AccessDeniedException ex) {
        return handleOpsDashException(ex, HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<Map<String, Object>> handleConnectionException(ConnectionException ex) {
        return handleOpsDashException(ex, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(SubscriptionTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleSubscriptionTimeoutException(SubscriptionTimeoutException ex) {
        return handleOpsDashException(ex, HttpStatus.GATEWAY_TIMEOUT);
    }

    @ExceptionHandler(PartialBatchException.class)
    public ResponseEntity<Map<String, Object>> handlePartialBatchException(PartialBatchException ex) {
        String traceId = getTraceId();
        log.warn("[{}] Partial batch: {}", traceId, ex.getMessage());

        Map<String, Object> body = errorBody(HttpStatus.OK, ex.getMessage(), traceId);
        body.put("code", ex.getErrorCode());
        body.put("failedRecipientIds", ex.getFailedRecipientIds());
        return ResponseEntity.ok(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        String traceId = getTraceId();
        log.error("[{}] Bad request: {}", traceId, ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ex.getMessage(), traceId));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        String traceId = getTraceId();
        log.error("[{}] Type mismatch error: parameter={}, value={}, requiredType={}",
                traceId, ex.getName(), ex.getValue(), ex.getRequiredType());

        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, message, traceId));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        String traceId = getTraceId();
        log.error("[{}] Unexpected error: {}", traceId, ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", traceId));
    }

    private ResponseEntity<Map<String, Object>> handleOpsDashException(OpsDashException ex, HttpStatus status) {
        String traceId = getTraceId();
        log.warn("[{}] {}: {}", traceId, ex.getErrorCode(), ex.getMessage());

        Map<String, Object> body = errorBody(status, ex.getMessage(), traceId);
        body.put("code", ex.getErrorCode());
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> errorBody(HttpStatus status, String message, String traceId) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("traceId", traceId);
        return body;
    }
}
