package com.catalogiq.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller mistake detected by the engine. Never retried; carries enough context
 * (item id, aspect, parameter) to diagnose the request.
 */
public class EngineException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final Map<String, Object> context;

    public EngineException(String message, HttpStatus status, String errorCode, Map<String, Object> context) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public static EngineException dimensionMismatch(int expected, int actual) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("expected", expected);
        context.put("actual", actual);
        return new EngineException(
                String.format("Vector dimension mismatch: expected %d, got %d", expected, actual),
                HttpStatus.BAD_REQUEST, "DIMENSION_MISMATCH", context);
    }

    public static EngineException dimensionMismatch(String aspect, int expected, int actual) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("aspect", aspect);
        context.put("expected", expected);
        context.put("actual", actual);
        return new EngineException(
                String.format("Vector dimension mismatch for aspect %s: expected %d, got %d", aspect, expected, actual),
                HttpStatus.BAD_REQUEST, "DIMENSION_MISMATCH", context);
    }

    public static EngineException emptyInput(String what) {
        return new EngineException(
                String.format("Input must not be empty: %s", what),
                HttpStatus.BAD_REQUEST, "EMPTY_INPUT", Map.of("input", what));
    }

    public static EngineException invalidTopK(int topK) {
        return new EngineException(
                String.format("topK must be positive, got %d", topK),
                HttpStatus.BAD_REQUEST, "INVALID_TOP_K", Map.of("topK", topK));
    }

    public static EngineException unknownItem(String itemId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("itemId", itemId);
        return new EngineException("Item not found", HttpStatus.NOT_FOUND, "UNKNOWN_ITEM", context);
    }

    public static EngineException invalidParameter(String name, Object value) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("parameter", name);
        context.put("value", value);
        return new EngineException(
                String.format("Invalid value for %s: %s", name, value),
                HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", context);
    }

    public static EngineException detectionCancelled() {
        return new EngineException("Duplicate detection run was cancelled",
                HttpStatus.CONFLICT, "DETECTION_CANCELLED", Map.of());
    }
}
