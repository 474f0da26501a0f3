/* (C)2026 */
package com.ammann.afoli.exception;

/**
 * Raised when a parameter or a dataset handed to the engine is malformed: unknown
 * center statistic, wrong number of sigma values, mismatched mask and frequency axis,
 * unparsable channel ranges.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for two inputs that must cover the same channels.
     */
    public static ValidationException lengthMismatch(String first, int firstLength, String second, int secondLength) {
        return new ValidationException(
                String.format("Length mismatch: %s has %d channels, %s has %d",
                        first, firstLength, second, secondLength));
    }
}
