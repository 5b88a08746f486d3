package com.ivamare.pgmq.exception;

/**
 * Thrown when an argument is rejected before any statement reaches the store.
 */
public class PgmqValidationException extends PgmqException {

    public PgmqValidationException(String message) {
        super(message);
    }
}
