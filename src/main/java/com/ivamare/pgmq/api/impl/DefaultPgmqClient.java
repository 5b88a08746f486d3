package com.ivamare.pgmq.api.impl;

import com.ivamare.pgmq.api.PgmqClient;
import com.ivamare.pgmq.exception.DatabaseExceptionClassifier;
import com.ivamare.pgmq.exception.PgmqConfigurationException;
import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.executor.ExecutionOptions;
import com.ivamare.pgmq.executor.JdbcSession;
import com.ivamare.pgmq.executor.PgmqSession;
import com.ivamare.pgmq.executor.QueryExecutor;
import com.ivamare.pgmq.executor.R2dbcSession;
import com.ivamare.pgmq.executor.ResultRow;
import com.ivamare.pgmq.mapping.PgmqRowMapper;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.model.PollStrategy;
import com.ivamare.pgmq.model.QueueMetrics;
import com.ivamare.pgmq.statement.PgmqStatement;
import com.ivamare.pgmq.statement.PgmqStatements;
import com.ivamare.pgmq.statement.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of PgmqClient.
 *
 * <p>Each operation builds a statement, hands it to the {@link QueryExecutor} and maps
 * the rows; nothing here depends on the execution mode. Views created by
 * {@link #withSession(PgmqSession)} and {@link #withoutCommit()} share the executor and
 * the pg_partman check with the client they come from.
 */
public class DefaultPgmqClient implements PgmqClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultPgmqClient.class);

    private final QueryExecutor executor;
    private final PgmqStatements statements;
    private final PgmqRowMapper rowMapper;
    private final LongPollLeaser leaser;
    private final ClientDefaults defaults;
    private final ExecutionOptions options;
    private final AtomicBoolean partmanChecked;

    /**
     * Creates a new DefaultPgmqClient.
     *
     * @param executor Executor fixing the execution mode
     * @param statements Statement builder
     * @param rowMapper Row mapper
     * @param defaults Values for omitted arguments
     * @param clock Clock measuring long-poll deadlines
     */
    public DefaultPgmqClient(
            QueryExecutor executor,
            PgmqStatements statements,
            PgmqRowMapper rowMapper,
            ClientDefaults defaults,
            Clock clock) {
        this(executor, statements, rowMapper,
            new LongPollLeaser(executor, statements, rowMapper, clock),
            defaults, ExecutionOptions.DEFAULT, new AtomicBoolean(false));
    }

    private DefaultPgmqClient(
            QueryExecutor executor,
            PgmqStatements statements,
            PgmqRowMapper rowMapper,
            LongPollLeaser leaser,
            ClientDefaults defaults,
            ExecutionOptions options,
            AtomicBoolean partmanChecked) {
        this.executor = executor;
        this.statements = statements;
        this.rowMapper = rowMapper;
        this.leaser = leaser;
        this.defaults = defaults;
        this.options = options;
        this.partmanChecked = partmanChecked;
    }

    // --- Queue lifecycle ---

    @Override
    public void ensureExtension() {
        executor.execute(statements.createExtension(), options);
        log.info("Ensured pgmq extension is installed");
    }

    @Override
    public void createQueue(String queueName) {
        createQueue(queueName, false);
    }

    @Override
    public void createQueue(String queueName, boolean unlogged) {
        executor.execute(statements.createQueue(queueName, unlogged), options);
        log.info("Created {}queue: {}", unlogged ? "unlogged " : "", queueName);
    }

    @Override
    public void createPartitionedQueue(String queueName, int partitionInterval, int retentionInterval) {
        PgmqStatement statement = statements.createPartitionedQueue(queueName, partitionInterval, retentionInterval);
        ensurePartmanExtension();
        executor.execute(statement, options);
        log.info("Created partitioned queue: {} (partition={}, retention={})",
            queueName, partitionInterval, retentionInterval);
    }

    @Override
    public boolean dropQueue(String queueName) {
        return dropQueue(queueName, false);
    }

    @Override
    public boolean dropQueue(String queueName, boolean partitioned) {
        boolean dropped = executor.executeScalarRow(statements.dropQueue(queueName, partitioned), options)
            .map(rowMapper::toBoolean)
            .orElse(false);
        log.info("Dropped queue {}: {}", queueName, dropped);
        return dropped;
    }

    @Override
    public List<String> listQueues() {
        return rowMapper.toStrings(executor.execute(statements.listQueues(), options));
    }

    @Override
    public void validateQueueName(String queueName) {
        executor.execute(statements.validateQueueName(queueName), options);
    }

    // --- Producing ---

    @Override
    public long send(String queueName, Object message) {
        return send(queueName, message, defaults.delay());
    }

    @Override
    public long send(String queueName, Object message, int delaySeconds) {
        Optional<ResultRow> row = executor.executeScalarRow(
            statements.send(queueName, message, delaySeconds), options);

        if (row.isEmpty() || row.get().size() == 0 || row.get().get(0) == null) {
            throw new PgmqException("Failed to send message to queue " + queueName + ": no message id returned");
        }

        long msgId = rowMapper.toLong(row.get());
        log.debug("Sent message to {}: msgId={}", queueName, msgId);
        return msgId;
    }

    @Override
    public List<Long> sendBatch(String queueName, List<?> messages) {
        return sendBatch(queueName, messages, defaults.delay());
    }

    @Override
    public List<Long> sendBatch(String queueName, List<?> messages, int delaySeconds) {
        QueueNames.validate(queueName);
        if (messages != null && messages.isEmpty()) {
            return List.of();
        }

        List<Long> msgIds = rowMapper.toIds(
            executor.execute(statements.sendBatch(queueName, messages, delaySeconds), options));

        log.debug("Sent {} messages to {}", msgIds.size(), queueName);
        return msgIds;
    }

    // --- Consuming ---

    @Override
    public Optional<PgmqMessage> read(String queueName) {
        return read(queueName, defaults.visibilityTimeout());
    }

    @Override
    public Optional<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds) {
        return executor.executeScalarRow(statements.read(queueName, visibilityTimeoutSeconds, 1), options)
            .map(rowMapper::toMessage);
    }

    @Override
    public List<PgmqMessage> readBatch(String queueName, int qty) {
        return readBatch(queueName, defaults.visibilityTimeout(), qty);
    }

    @Override
    public List<PgmqMessage> readBatch(String queueName, int visibilityTimeoutSeconds, int qty) {
        return rowMapper.toMessages(
            executor.execute(statements.read(queueName, visibilityTimeoutSeconds, qty), options));
    }

    @Override
    public List<PgmqMessage> readWithPoll(String queueName, int qty) {
        return readWithPoll(queueName, defaults.visibilityTimeout(), qty,
            defaults.maxPollSeconds(), defaults.pollIntervalMs());
    }

    @Override
    public List<PgmqMessage> readWithPoll(String queueName, int visibilityTimeoutSeconds, int qty,
                                          int maxPollSeconds, int pollIntervalMs) {
        if (defaults.pollStrategy() == PollStrategy.CLIENT) {
            return leaser.lease(queueName, visibilityTimeoutSeconds, qty, maxPollSeconds, pollIntervalMs, options);
        }

        List<PgmqMessage> messages = rowMapper.toMessages(executor.execute(
            statements.readWithPoll(queueName, visibilityTimeoutSeconds, qty, maxPollSeconds, pollIntervalMs),
            options));
        log.debug("Leased {} of {} messages from {}", messages.size(), qty, queueName);
        return messages;
    }

    @Override
    public Optional<PgmqMessage> pop(String queueName) {
        return executor.executeScalarRow(statements.pop(queueName), options)
            .map(rowMapper::toMessage);
    }

    @Override
    public Optional<PgmqMessage> setVisibilityTimeout(String queueName, long msgId, int vtOffsetSeconds) {
        return executor.executeScalarRow(statements.setVisibilityTimeout(queueName, msgId, vtOffsetSeconds), options)
            .map(rowMapper::toMessage);
    }

    // --- Acknowledging ---

    @Override
    public boolean delete(String queueName, long msgId) {
        return executor.executeScalarRow(statements.delete(queueName, msgId), options)
            .map(rowMapper::toBoolean)
            .orElse(false);
    }

    @Override
    public List<Long> deleteBatch(String queueName, Collection<Long> msgIds) {
        QueueNames.validate(queueName);
        if (msgIds != null && msgIds.isEmpty()) {
            return List.of();
        }
        List<Long> deleted = rowMapper.toIds(executor.execute(statements.deleteBatch(queueName, msgIds), options));
        log.debug("Deleted {} of {} messages from {}", deleted.size(), msgIds.size(), queueName);
        return deleted;
    }

    @Override
    public boolean archive(String queueName, long msgId) {
        return executor.executeScalarRow(statements.archive(queueName, msgId), options)
            .map(rowMapper::toBoolean)
            .orElse(false);
    }

    @Override
    public List<Long> archiveBatch(String queueName, Collection<Long> msgIds) {
        QueueNames.validate(queueName);
        if (msgIds != null && msgIds.isEmpty()) {
            return List.of();
        }
        List<Long> archived = rowMapper.toIds(executor.execute(statements.archiveBatch(queueName, msgIds), options));
        log.debug("Archived {} of {} messages from {}", archived.size(), msgIds.size(), queueName);
        return archived;
    }

    @Override
    public Optional<PgmqMessage> readArchived(String queueName, long msgId) {
        return executor.executeScalarRow(statements.readArchive(queueName, msgId), options)
            .map(rowMapper::toMessage);
    }

    @Override
    public long purge(String queueName) {
        long purged = executor.executeScalarRow(statements.purge(queueName), options)
            .map(rowMapper::toLong)
            .orElse(0L);
        log.debug("Purged {} messages from {}", purged, queueName);
        return purged;
    }

    // --- Metrics ---

    @Override
    public Optional<QueueMetrics> metrics(String queueName) {
        return executor.executeScalarRow(statements.metrics(queueName), options)
            .map(rowMapper::toMetrics);
    }

    @Override
    public List<QueueMetrics> metricsAll() {
        try {
            return executor.execute(statements.metricsAll(), options).stream()
                .map(rowMapper::toMetrics)
                .toList();
        } catch (RuntimeException e) {
            if (!DatabaseExceptionClassifier.isMissingQueue(e)) {
                throw e;
            }
            log.warn("metrics_all failed on a dropped queue, reading metrics per queue: {}", e.getMessage());
        }
        return metricsPerQueue();
    }

    private List<QueueMetrics> metricsPerQueue() {
        List<String> queueNames = listQueues();
        List<QueueMetrics> result = new ArrayList<>(queueNames.size());

        // A queue listed here may be dropped before its metrics are read
        for (String queueName : queueNames) {
            try {
                Optional<QueueMetrics> metrics = metrics(queueName);
                if (metrics.isPresent()) {
                    result.add(metrics.get());
                } else {
                    log.debug("Queue {} was dropped before its metrics were read", queueName);
                }
            } catch (RuntimeException e) {
                if (!DatabaseExceptionClassifier.isMissingQueue(e)) {
                    throw e;
                }
                log.warn("Skipping metrics for queue {}: queue no longer exists", queueName);
            }
        }
        return result;
    }

    // --- Transaction scope ---

    @Override
    public PgmqClient withSession(PgmqSession session) {
        if (session == null) {
            throw new PgmqConfigurationException("session is required");
        }
        ExecutionMode mode = executor.mode();
        boolean matches = mode == ExecutionMode.BLOCKING
            ? session instanceof JdbcSession
            : session instanceof R2dbcSession;
        if (!matches) {
            throw new PgmqConfigurationException(
                "Session " + session.getClass().getSimpleName() + " cannot be used in " + mode + " mode");
        }
        return new DefaultPgmqClient(executor, statements, rowMapper, leaser, defaults,
            ExecutionOptions.inSession(session), partmanChecked);
    }

    @Override
    public PgmqClient withoutCommit() {
        return new DefaultPgmqClient(executor, statements, rowMapper, leaser, defaults,
            options.withAutocommit(false), partmanChecked);
    }

    @Override
    public ExecutionMode executionMode() {
        return executor.mode();
    }

    @Override
    public void close() {
        executor.close();
    }

    // --- Helper Methods ---

    private void ensurePartmanExtension() {
        if (partmanChecked.get()) {
            return;
        }
        synchronized (partmanChecked) {
            if (!partmanChecked.get()) {
                executor.execute(statements.createPartmanExtension(), options);
                partmanChecked.set(true);
                log.info("Ensured pg_partman extension is installed");
            }
        }
    }
}
