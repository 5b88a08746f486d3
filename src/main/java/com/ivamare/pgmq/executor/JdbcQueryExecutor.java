package com.ivamare.pgmq.executor;

import com.ivamare.pgmq.exception.PgmqConfigurationException;
import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.statement.PgmqStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocking executor: runs each statement through {@link JdbcTemplate} on the calling thread.
 *
 * <p>Transaction handling, in order of precedence:
 * <ol>
 *   <li>a caller {@link JdbcSession}: the statement runs on that connection, which is
 *       never committed, rolled back or closed here</li>
 *   <li>an active Spring-managed transaction on the thread: {@code JdbcTemplate} joins it
 *       and the caller owns the outcome</li>
 *   <li>otherwise a new transaction is opened and committed before returning, or rolled
 *       back when auto-commit is off</li>
 * </ol>
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, new DataSourceTransactionManager(requireDataSource(jdbcTemplate)));
    }

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public List<ResultRow> execute(PgmqStatement statement, ExecutionOptions options) {
        if (options.hasSession()) {
            Connection connection = sessionConnection(options.session());
            JdbcTemplate sessionTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            return run(sessionTemplate, statement);
        }

        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return run(jdbcTemplate, statement);
        }

        if (options.autocommit()) {
            return transactionTemplate.execute(status -> run(jdbcTemplate, statement));
        }

        return transactionTemplate.execute(status -> {
            status.setRollbackOnly();
            log.debug("Running {} without commit; changes will be rolled back", statement.function());
            return run(jdbcTemplate, statement);
        });
    }

    @Override
    public void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PgmqException("Interrupted while waiting to poll", e);
        }
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.BLOCKING;
    }

    @Override
    public void close() {
        // Connections belong to the DataSource
    }

    private List<ResultRow> run(JdbcTemplate template, PgmqStatement statement) {
        log.trace("Executing {}: {}", statement.function(), statement.sql());
        List<ResultRow> rows = template.execute(statement.sql(), (PreparedStatementCallback<List<ResultRow>>) ps -> {
            new ArgumentPreparedStatementSetter(statement.params().toArray()).setValues(ps);
            if (!ps.execute()) {
                return List.of();
            }
            try (ResultSet rs = ps.getResultSet()) {
                return readRows(rs);
            }
        });
        return rows == null ? List.of() : rows;
    }

    private static List<ResultRow> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<ResultRow> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> values = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                values.add(JdbcUtils.getResultSetValue(rs, i));
            }
            rows.add(new ResultRow(values));
        }
        return rows;
    }

    private static Connection sessionConnection(PgmqSession session) {
        if (session instanceof JdbcSession jdbcSession) {
            return jdbcSession.connection();
        }
        throw new PgmqConfigurationException(
            "A blocking client needs a JdbcSession but got " + session.getClass().getSimpleName());
    }

    private static DataSource requireDataSource(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null || jdbcTemplate.getDataSource() == null) {
            throw new PgmqConfigurationException("jdbcTemplate with a DataSource is required for blocking mode");
        }
        return jdbcTemplate.getDataSource();
    }
}
