package com.ivamare.pgmq.exception;

/**
 * Base exception for all PGMQ client errors.
 *
 * <p>Errors raised by PostgreSQL itself are not wrapped: they reach the caller as the
 * driver or Spring exception that carried them.
 */
public class PgmqException extends RuntimeException {

    public PgmqException(String message) {
        super(message);
    }

    public PgmqException(String message, Throwable cause) {
        super(message, cause);
    }
}
