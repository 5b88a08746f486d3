package com.ivamare.pgmq.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.api.impl.ClientDefaults;
import com.ivamare.pgmq.api.impl.DefaultPgmqClient;
import com.ivamare.pgmq.exception.PgmqConfigurationException;
import com.ivamare.pgmq.executor.JdbcQueryExecutor;
import com.ivamare.pgmq.executor.QueryExecutor;
import com.ivamare.pgmq.executor.R2dbcQueryExecutor;
import com.ivamare.pgmq.mapping.PgmqRowMapper;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.model.PollStrategy;
import com.ivamare.pgmq.statement.PayloadCodec;
import com.ivamare.pgmq.statement.PgmqStatements;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Builder for creating PgmqClient instances.
 *
 * <p>When no execution mode is set it is inferred: a JDBC source selects
 * {@link ExecutionMode#BLOCKING}, a lone R2DBC {@link ConnectionFactory} selects
 * {@link ExecutionMode#SUSPENDING}.
 */
public class PgmqClientBuilder {

    private JdbcTemplate jdbcTemplate;
    private DataSource dataSource;
    private PlatformTransactionManager transactionManager;
    private ConnectionFactory connectionFactory;
    private ExecutionMode executionMode;
    private ObjectMapper objectMapper;
    private int visibilityTimeout = ClientDefaults.DEFAULT_VISIBILITY_TIMEOUT;
    private int delay = ClientDefaults.DEFAULT_DELAY;
    private PollStrategy pollStrategy = PollStrategy.NATIVE;
    private int maxPollSeconds = ClientDefaults.DEFAULT_MAX_POLL_SECONDS;
    private int pollIntervalMs = ClientDefaults.DEFAULT_POLL_INTERVAL_MS;
    private Clock clock;

    /**
     * Set the JdbcTemplate for blocking mode.
     *
     * @param jdbcTemplate The JDBC template
     * @return this builder
     */
    public PgmqClientBuilder jdbcTemplate(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        return this;
    }

    /**
     * Set the DataSource for blocking mode. Ignored when a JdbcTemplate is set.
     *
     * @param dataSource The data source
     * @return this builder
     */
    public PgmqClientBuilder dataSource(DataSource dataSource) {
        this.dataSource = dataSource;
        return this;
    }

    /**
     * Set the transaction manager used for auto-committed calls in blocking mode.
     * Defaults to a {@code DataSourceTransactionManager} over the template's DataSource.
     *
     * @param transactionManager The transaction manager
     * @return this builder
     */
    public PgmqClientBuilder transactionManager(PlatformTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
        return this;
    }

    /**
     * Set the R2DBC connection factory for suspending mode.
     *
     * @param connectionFactory The connection factory
     * @return this builder
     */
    public PgmqClientBuilder connectionFactory(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        return this;
    }

    /**
     * Set the execution mode explicitly (default: inferred from the configured sources).
     *
     * @param executionMode The execution mode
     * @return this builder
     */
    public PgmqClientBuilder executionMode(ExecutionMode executionMode) {
        this.executionMode = executionMode;
        return this;
    }

    /**
     * Set the ObjectMapper for JSON serialization.
     *
     * @param objectMapper The object mapper
     * @return this builder
     */
    public PgmqClientBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /**
     * Set the default visibility timeout in seconds (default: 30).
     *
     * @param seconds Visibility timeout in seconds
     * @return this builder
     */
    public PgmqClientBuilder visibilityTimeout(int seconds) {
        this.visibilityTimeout = seconds;
        return this;
    }

    /**
     * Set the default send delay in seconds (default: 0).
     *
     * @param seconds Delay in seconds
     * @return this builder
     */
    public PgmqClientBuilder delay(int seconds) {
        this.delay = seconds;
        return this;
    }

    /**
     * Set where the long-poll wait runs (default: NATIVE).
     *
     * @param pollStrategy The poll strategy
     * @return this builder
     */
    public PgmqClientBuilder pollStrategy(PollStrategy pollStrategy) {
        this.pollStrategy = pollStrategy;
        return this;
    }

    /**
     * Set the default longest long-poll wait in seconds (default: 5).
     *
     * @param seconds Maximum wait in seconds
     * @return this builder
     */
    public PgmqClientBuilder maxPollSeconds(int seconds) {
        this.maxPollSeconds = seconds;
        return this;
    }

    /**
     * Set the default pause between poll attempts in milliseconds (default: 100).
     *
     * @param ms Poll interval in milliseconds
     * @return this builder
     */
    public PgmqClientBuilder pollIntervalMs(int ms) {
        this.pollIntervalMs = ms;
        return this;
    }

    /**
     * Set the clock measuring long-poll deadlines (default: system UTC).
     *
     * @param clock The clock
     * @return this builder
     */
    public PgmqClientBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Build the client instance.
     *
     * @return configured PgmqClient
     * @throws PgmqConfigurationException if no source is configured for the execution mode
     */
    public PgmqClient build() {
        ExecutionMode mode = resolveExecutionMode();
        ClientDefaults defaults = new ClientDefaults(
            visibilityTimeout, delay, pollStrategy, maxPollSeconds, pollIntervalMs);

        if (objectMapper == null) {
            objectMapper = new ObjectMapper().findAndRegisterModules();
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }

        QueryExecutor executor = mode == ExecutionMode.BLOCKING
            ? blockingExecutor()
            : suspendingExecutor();
        PayloadCodec payloadCodec = new PayloadCodec(objectMapper);

        return new DefaultPgmqClient(
            executor,
            new PgmqStatements(payloadCodec),
            new PgmqRowMapper(payloadCodec),
            defaults,
            clock
        );
    }

    ExecutionMode resolveExecutionMode() {
        if (executionMode != null) {
            return executionMode;
        }
        if (jdbcTemplate != null || dataSource != null) {
            return ExecutionMode.BLOCKING;
        }
        if (connectionFactory != null) {
            return ExecutionMode.SUSPENDING;
        }
        throw new PgmqConfigurationException(
            "jdbcTemplate, dataSource or connectionFactory is required");
    }

    private QueryExecutor blockingExecutor() {
        JdbcTemplate template = jdbcTemplate;
        if (template == null && dataSource != null) {
            template = new JdbcTemplate(dataSource);
        }
        if (template == null) {
            throw new PgmqConfigurationException("jdbcTemplate or dataSource is required for BLOCKING mode");
        }
        return transactionManager != null
            ? new JdbcQueryExecutor(template, transactionManager)
            : new JdbcQueryExecutor(template);
    }

    private QueryExecutor suspendingExecutor() {
        if (connectionFactory == null) {
            throw new PgmqConfigurationException("connectionFactory is required for SUSPENDING mode");
        }
        return new R2dbcQueryExecutor(connectionFactory);
    }
}
