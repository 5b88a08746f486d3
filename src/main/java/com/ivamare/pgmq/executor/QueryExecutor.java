package com.ivamare.pgmq.executor;

import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.statement.PgmqStatement;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runs statements against PostgreSQL in one fixed execution mode.
 *
 * <p>Every queue operation is written once against this interface; implementations
 * differ only in how the statement reaches the database. Calls always return
 * synchronously. Store errors propagate unchanged and are never retried here.
 */
public interface QueryExecutor extends AutoCloseable {

    /**
     * Execute a statement and collect its rows.
     *
     * @param statement statement to run
     * @param options commit behaviour and optional caller session
     * @return rows in the order the store produced them (empty if none)
     */
    List<ResultRow> execute(PgmqStatement statement, ExecutionOptions options);

    /**
     * Execute a statement expected to produce at most one row.
     *
     * @param statement statement to run
     * @param options commit behaviour and optional caller session
     * @return the first row, or empty if there was none
     */
    default Optional<ResultRow> executeScalarRow(PgmqStatement statement, ExecutionOptions options) {
        List<ResultRow> rows = execute(statement, options);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Wait between poll attempts without tying up resources other calls need.
     *
     * @param duration how long to wait
     */
    void pause(Duration duration);

    ExecutionMode mode();

    /**
     * Release resources owned by the executor. Connections supplied by callers are
     * never closed.
     */
    @Override
    void close();
}
