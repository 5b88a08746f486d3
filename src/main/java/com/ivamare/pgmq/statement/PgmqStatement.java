package com.ivamare.pgmq.statement;

import java.util.List;

/**
 * A parameterized statement ready for execution.
 *
 * <p>The SQL uses {@code ?} placeholders bound positionally from {@code params}.
 * Payloads and ids are always parameters; only validated queue names ever appear
 * in the SQL text itself.
 *
 * @param function the PGMQ primitive invoked
 * @param sql the statement template
 * @param params bound parameters in placeholder order
 */
public record PgmqStatement(
    PgmqFunction function,
    String sql,
    List<Object> params
) {
    public PgmqStatement {
        params = List.copyOf(params);
    }

    /**
     * Get a bound parameter by zero-based position.
     *
     * @param index parameter position
     * @return the bound value
     */
    public Object param(int index) {
        return params.get(index);
    }
}
