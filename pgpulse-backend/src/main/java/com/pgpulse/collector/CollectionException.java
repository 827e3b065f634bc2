package com.pgpulse.collector;

/**
 * Thrown when the target database cannot be reached or one of the introspection queries fails.
 * A sampling cycle that raises it produces no sample and no candidates.
 */
public class CollectionException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying JDBC error
     */
    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public CollectionException(String message) {
        super(message);
    }
}
