package com.ivamare.pgmq.executor;

import java.sql.Connection;
import java.util.Objects;

/**
 * Caller-managed JDBC transaction.
 *
 * @param connection connection with a transaction begun by the caller
 */
public record JdbcSession(Connection connection) implements PgmqSession {

    public JdbcSession {
        Objects.requireNonNull(connection, "connection");
    }
}
