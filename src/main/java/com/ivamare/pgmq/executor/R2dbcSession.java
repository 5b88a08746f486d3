package com.ivamare.pgmq.executor;

import io.r2dbc.spi.Connection;

import java.util.Objects;

/**
 * Caller-managed R2DBC transaction.
 *
 * @param connection connection with a transaction begun by the caller
 */
public record R2dbcSession(Connection connection) implements PgmqSession {

    public R2dbcSession {
        Objects.requireNonNull(connection, "connection");
    }
}
