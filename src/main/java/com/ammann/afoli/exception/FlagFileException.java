/* (C)2026 */
package com.ammann.afoli.exception;

import java.nio.file.Path;

/**
 * Raised when a channel or frequency flag file cannot be written or read back.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) with code {@code FLAG_FILE_ERROR}.
 */
public class FlagFileException extends ApiException {

    public FlagFileException(Path file, Throwable cause) {
        super("Flag file operation failed: " + file, cause);
    }

    public FlagFileException(String message) {
        super(message);
    }
}
