/* (C)2026 */
package com.ammann.afoli.exception;

/**
 * Base unchecked exception for every error raised by the AFOLI processor.
 *
 * <p>Subclasses separate configuration and value errors, range errors and flag-file
 * failures; {@link GlobalExceptionHandler} maps each to an HTTP status.
 */
public class ApiException extends RuntimeException {

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
