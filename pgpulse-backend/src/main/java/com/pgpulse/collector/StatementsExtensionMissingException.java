package com.pgpulse.collector;

/**
 * Thrown when the target database does not have the {@code pg_stat_statements} extension installed.
 */
public class StatementsExtensionMissingException extends CollectionException {
    public StatementsExtensionMissingException(String message) {
        super(message);
    }

    public StatementsExtensionMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
