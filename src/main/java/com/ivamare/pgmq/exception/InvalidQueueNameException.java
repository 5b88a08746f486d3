package com.ivamare.pgmq.exception;

/**
 * Thrown when a queue name is empty, too long or contains unsupported characters.
 */
public class InvalidQueueNameException extends PgmqValidationException {

    private final String queueName;

    public InvalidQueueNameException(String queueName, String reason) {
        super("Invalid queue name '" + queueName + "': " + reason);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
