package com.ivamare.pgmq.executor;

import com.ivamare.pgmq.exception.PgmqConfigurationException;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.statement.PgmqStatement;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import io.r2dbc.spi.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Suspending executor: runs each statement through R2DBC on a single scheduler owned
 * by this executor, and blocks the caller until the statement resolves.
 *
 * <p>All calls, from any thread, are subscribed on the same single-threaded scheduler,
 * so the I/O never blocks it and throughput is that of one event loop. Without a caller
 * {@link R2dbcSession} each call opens a connection, runs in its own transaction
 * (committed when auto-commit is on, rolled back otherwise) and closes the connection.
 */
public class R2dbcQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(R2dbcQueryExecutor.class);

    private final ConnectionFactory connectionFactory;
    private final Scheduler scheduler;

    public R2dbcQueryExecutor(ConnectionFactory connectionFactory) {
        this(connectionFactory, Schedulers.newSingle("pgmq-r2dbc", true));
    }

    R2dbcQueryExecutor(ConnectionFactory connectionFactory, Scheduler scheduler) {
        if (connectionFactory == null) {
            throw new PgmqConfigurationException("connectionFactory is required for suspending mode");
        }
        this.connectionFactory = connectionFactory;
        this.scheduler = scheduler;
    }

    @Override
    public List<ResultRow> execute(PgmqStatement statement, ExecutionOptions options) {
        String sql = toNativeSql(statement.sql());
        log.trace("Executing {}: {}", statement.function(), sql);

        Mono<List<ResultRow>> work;
        if (options.hasSession()) {
            work = run(sessionConnection(options.session()), sql, statement.params());
        } else {
            work = Mono.usingWhen(
                connectionFactory.create(),
                connection -> transactionally(connection, sql, statement.params(), options.autocommit()),
                Connection::close);
        }

        List<ResultRow> rows = work.subscribeOn(scheduler).block();
        return rows == null ? List.of() : rows;
    }

    @Override
    public void pause(Duration duration) {
        // Only the calling thread waits; the scheduler stays free for other calls
        Mono.delay(duration, scheduler).block();
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.SUSPENDING;
    }

    @Override
    public void close() {
        scheduler.dispose();
    }

    private Mono<List<ResultRow>> transactionally(
            Connection connection, String sql, List<Object> params, boolean autocommit) {
        return Mono.from(connection.beginTransaction())
            .then(run(connection, sql, params))
            .flatMap(rows -> Mono.from(autocommit
                    ? connection.commitTransaction()
                    : connection.rollbackTransaction())
                .thenReturn(rows))
            .onErrorResume(e -> Mono.from(connection.rollbackTransaction())
                .onErrorResume(rollbackError -> {
                    // Keep the statement error primary
                    e.addSuppressed(rollbackError);
                    return Mono.empty();
                })
                .then(Mono.error(e)));
    }

    private Mono<List<ResultRow>> run(Connection connection, String sql, List<Object> params) {
        return Mono.defer(() -> {
            Statement statement = connection.createStatement(sql);
            for (int i = 0; i < params.size(); i++) {
                statement.bind(i, params.get(i));
            }
            return Flux.from(statement.execute())
                .concatMap(result -> result.map(R2dbcQueryExecutor::toResultRow))
                .collectList();
        });
    }

    private static ResultRow toResultRow(Row row, RowMetadata metadata) {
        int columnCount = metadata.getColumnMetadatas().size();
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            values.add(row.get(i));
        }
        return new ResultRow(values);
    }

    private static Connection sessionConnection(PgmqSession session) {
        if (session instanceof R2dbcSession r2dbcSession) {
            return r2dbcSession.connection();
        }
        throw new PgmqConfigurationException(
            "A suspending client needs an R2dbcSession but got " + session.getClass().getSimpleName());
    }

    /**
     * Rewrite JDBC-style {@code ?} placeholders to PostgreSQL's {@code $n} form.
     * Statement templates never contain a literal question mark.
     *
     * @param sql statement template
     * @return native SQL
     */
    static String toNativeSql(String sql) {
        StringBuilder builder = new StringBuilder(sql.length() + 8);
        int paramIndex = 1;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '?') {
                builder.append('$').append(paramIndex++);
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
