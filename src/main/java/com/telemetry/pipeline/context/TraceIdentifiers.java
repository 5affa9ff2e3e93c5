package com.telemetry.pipeline.context;

import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Generation and validation of trace, span, tenant and operation identifiers.
 * Validation failures indicate a bug at the instrumentation call site and are
 * reported as {@link IllegalArgumentException}.
 */
public final class TraceIdentifiers {

    /** Maximum allowed length for trace and span identifiers. */
    public static final int MAX_ID_LENGTH = 128;

    /** Maximum allowed length for tenant and user identifiers. */
    public static final int MAX_PRINCIPAL_LENGTH = 128;

    /** Maximum allowed length for operation names. */
    public static final int MAX_OPERATION_NAME_LENGTH = 256;

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9-]+$");

    private TraceIdentifiers() {
        // utility class
    }

    /**
     * Generates a new trace identifier (32 lowercase hex characters).
     */
    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Generates a new span identifier (16 lowercase hex characters, never all zeros).
     */
    public static String newSpanId() {
        long value;
        do {
            value = ThreadLocalRandom.current().nextLong();
        } while (value == 0L);
        return String.format("%016x", value);
    }

    /**
     * Returns true if the value is a well-formed trace or span identifier.
     */
    public static boolean isValidId(String id) {
        return id != null && !id.isEmpty() && id.length() <= MAX_ID_LENGTH && ID_PATTERN.matcher(id).matches();
    }

    public static String validateTraceId(String traceId) {
        return validateId(traceId, "traceId");
    }

    public static String validateSpanId(String spanId) {
        return validateId(spanId, "spanId");
    }

    /**
     * Validates a tenant or user identifier: non-blank, bounded, without control characters.
     */
    public static String validatePrincipal(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
        if (value.length() > MAX_PRINCIPAL_LENGTH) {
            throw new IllegalArgumentException(
                    fieldName + " exceeds maximum length of " + MAX_PRINCIPAL_LENGTH + " characters");
        }
        if (containsControlCharacters(value)) {
            throw new IllegalArgumentException(fieldName + " must not contain control characters");
        }
        return value;
    }

    /**
     * Validates a span operation name: non-blank, bounded, without control characters.
     */
    public static String validateOperationName(String operationName) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be null or blank");
        }
        if (operationName.length() > MAX_OPERATION_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Operation name exceeds maximum length of " + MAX_OPERATION_NAME_LENGTH +
                            " characters (was " + operationName.length() + ")");
        }
        if (containsControlCharacters(operationName)) {
            throw new IllegalArgumentException("Operation name must not contain control characters");
        }
        return operationName;
    }

    private static String validateId(String id, String fieldName) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be null or empty");
        }
        if (id.length() > MAX_ID_LENGTH) {
            throw new IllegalArgumentException(
                    fieldName + " exceeds maximum length of " + MAX_ID_LENGTH + " characters");
        }
        if (!ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException(
                    fieldName + " must contain only alphanumeric characters and hyphens, got: '" + id + "'");
        }
        return id;
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isISOControl(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
