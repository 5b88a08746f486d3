package com.ivamare.pgmq.exception;

import io.r2dbc.spi.R2dbcException;

import java.sql.SQLException;
import java.util.Set;

/**
 * Classifies errors raised by PostgreSQL through either JDBC or R2DBC.
 *
 * <p>The client never retries or swallows store errors. This classifier only lets a
 * caller tell a vanished queue apart from other failures, which {@code metricsAll}
 * needs while enumerating queues that may be dropped concurrently.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * SQL states raised when a queue's backing table or sequence is gone.
     */
    private static final Set<String> MISSING_QUEUE_SQL_STATES = Set.of(
        "42P01"  // undefined_table
    );

    /**
     * Message fragments used when a driver does not expose the SQL state.
     */
    private static final String[] QUEUE_RELATION_PATTERNS = {
        "relation \"pgmq.q_",
        "relation \"pgmq.a_"
    };

    private static final String DOES_NOT_EXIST = "does not exist";

    /**
     * Determine whether the exception says the targeted queue no longer exists.
     *
     * @param ex the exception to classify
     * @return true if the queue's table is missing
     */
    public static boolean isMissingQueue(Throwable ex) {
        if (ex == null) {
            return false;
        }

        String sqlState = getSqlState(ex);
        if (sqlState != null) {
            return MISSING_QUEUE_SQL_STATES.contains(sqlState);
        }

        // No state anywhere in the chain: fall back to the server message
        for (Throwable current = ex; current != null; current = nextCause(current)) {
            String message = current.getMessage();
            if (message == null) {
                continue;
            }
            String lowerMessage = message.toLowerCase();
            if (!lowerMessage.contains(DOES_NOT_EXIST)) {
                continue;
            }
            for (String pattern : QUEUE_RELATION_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Get the SQL state from an exception or any of its causes.
     *
     * <p>Understands JDBC {@link SQLException} (including those wrapped by Spring's
     * {@code DataAccessException}) and R2DBC {@link R2dbcException}.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        for (Throwable current = ex; current != null; current = nextCause(current)) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
            if (current instanceof R2dbcException r2dbcEx && r2dbcEx.getSqlState() != null) {
                return r2dbcEx.getSqlState();
            }
        }
        return null;
    }

    private static Throwable nextCause(Throwable ex) {
        Throwable cause = ex.getCause();
        return cause == ex ? null : cause;
    }
}
