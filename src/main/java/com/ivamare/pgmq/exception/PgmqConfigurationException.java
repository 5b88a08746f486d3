package com.ivamare.pgmq.exception;

/**
 * Thrown when a client cannot be built or used with the connection source it was given.
 */
public class PgmqConfigurationException extends PgmqException {

    public PgmqConfigurationException(String message) {
        super(message);
    }
}
