/* (C)2026 */
package com.ammann.afoli.service;

import org.jboss.logging.Logger;

/**
 * Logging capability handed to every engine entry point.
 *
 * <p>Messages are for observability only; nothing in the engine depends on where
 * they end up.
 */
@FunctionalInterface
public interface ProcessingLog {

    /** Discards every message. */
    ProcessingLog NONE = message -> { };

    void log(String message);

    /** Formats with {@link String#format} and logs the result. */
    default void logf(String format, Object... args) {
        log(String.format(format, args));
    }

    /** Forwards messages to a JBoss logger at INFO level. */
    static ProcessingLog jboss(Logger logger) {
        return logger::info;
    }

    /** Forwards messages to a JBoss logger, prefixing each with a spectrum name. */
    static ProcessingLog jboss(Logger logger, String spectrumName) {
        return message -> logger.infof("[%s] %s", spectrumName, message);
    }
}
