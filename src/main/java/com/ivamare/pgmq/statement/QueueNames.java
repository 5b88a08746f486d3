package com.ivamare.pgmq.statement;

import com.ivamare.pgmq.exception.InvalidQueueNameException;

import java.util.regex.Pattern;

/**
 * Queue naming rules and derived table names.
 *
 * <p>PGMQ stores each queue in {@code pgmq.q_<name>} and its archive in
 * {@code pgmq.a_<name>}; the name therefore has to be a safe identifier fragment
 * short enough for PostgreSQL's identifier limit once prefixes are added.
 */
public final class QueueNames {

    private QueueNames() {
        // Utility class - prevent instantiation
    }

    /** Longest accepted queue name */
    public static final int MAX_LENGTH = 48;

    /** Prefix of archive tables */
    public static final String ARCHIVE_TABLE_PREFIX = "pgmq.a_";

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_]+");

    /**
     * Check a queue name before it is used in any statement.
     *
     * @param queueName the queue name
     * @return the same name, for chaining
     * @throws InvalidQueueNameException if the name is empty, longer than 48 characters
     *         or contains characters other than letters, digits and underscores
     */
    public static String validate(String queueName) {
        if (queueName == null || queueName.isEmpty()) {
            throw new InvalidQueueNameException(queueName, "must not be empty");
        }
        if (queueName.length() > MAX_LENGTH) {
            throw new InvalidQueueNameException(queueName,
                "must be at most " + MAX_LENGTH + " characters, was " + queueName.length());
        }
        if (!VALID_NAME.matcher(queueName).matches()) {
            throw new InvalidQueueNameException(queueName,
                "only letters, digits and underscores are allowed");
        }
        return queueName;
    }

    /**
     * Get the archive table name for a queue.
     *
     * @param queueName The queue name
     * @return Archive table name in format pgmq.a_{queueName}
     */
    public static String archiveTable(String queueName) {
        return ARCHIVE_TABLE_PREFIX + validate(queueName);
    }
}
