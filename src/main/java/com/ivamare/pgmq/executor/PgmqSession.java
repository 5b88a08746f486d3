package com.ivamare.pgmq.executor;

/**
 * A transaction scope owned by the caller.
 *
 * <p>Statements run inside it are neither committed nor rolled back by the client, and
 * the underlying connection is never closed. Use {@link JdbcSession} with a blocking
 * client and {@link R2dbcSession} with a suspending one.
 */
public interface PgmqSession {

    /**
     * @return the driver connection the statements run on
     */
    Object connection();
}
