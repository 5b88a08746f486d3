package com.ivamare.pgmq.statement;

import com.ivamare.pgmq.exception.PgmqValidationException;
import com.ivamare.pgmq.mapping.MessageColumn;
import com.ivamare.pgmq.mapping.MetricsColumn;

import java.util.Collection;
import java.util.List;

/**
 * Builds the statements that invoke PGMQ's SQL functions.
 *
 * <p>Pure and stateless apart from the payload codec: no statement is executed here.
 * Every method that targets a queue validates the name first, so an invalid name never
 * reaches the store.
 */
public class PgmqStatements {

    private static final String MESSAGE_COLUMNS = MessageColumn.selectList();

    private final PayloadCodec payloadCodec;

    public PgmqStatements(PayloadCodec payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    // --- Lifecycle ---

    public PgmqStatement createExtension() {
        return new PgmqStatement(PgmqFunction.CREATE_EXTENSION,
            "CREATE EXTENSION IF NOT EXISTS pgmq CASCADE", List.of());
    }

    public PgmqStatement createPartmanExtension() {
        return new PgmqStatement(PgmqFunction.CREATE_PARTMAN_EXTENSION,
            "CREATE EXTENSION IF NOT EXISTS pg_partman CASCADE", List.of());
    }

    /**
     * Create a queue, optionally backed by an unlogged table.
     *
     * @param queueName queue to create
     * @param unlogged true for {@code pgmq.create_unlogged}
     * @return the statement
     */
    public PgmqStatement createQueue(String queueName, boolean unlogged) {
        QueueNames.validate(queueName);
        if (unlogged) {
            return new PgmqStatement(PgmqFunction.CREATE_UNLOGGED,
                "SELECT pgmq.create_unlogged(?)", List.of(queueName));
        }
        return new PgmqStatement(PgmqFunction.CREATE, "SELECT pgmq.create(?)", List.of(queueName));
    }

    /**
     * Create a queue partitioned by message id.
     *
     * @param queueName queue to create
     * @param partitionInterval messages per partition
     * @param retentionInterval messages retained; older partitions are dropped
     * @return the statement
     */
    public PgmqStatement createPartitionedQueue(String queueName, int partitionInterval, int retentionInterval) {
        QueueNames.validate(queueName);
        requirePositive("partitionInterval", partitionInterval);
        requirePositive("retentionInterval", retentionInterval);
        // pgmq takes both intervals as text so it can also accept time intervals
        return new PgmqStatement(PgmqFunction.CREATE_PARTITIONED,
            "SELECT pgmq.create_partitioned(?, ?, ?)",
            List.of(queueName, Integer.toString(partitionInterval), Integer.toString(retentionInterval)));
    }

    public PgmqStatement dropQueue(String queueName, boolean partitioned) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.DROP_QUEUE,
            "SELECT pgmq.drop_queue(?, ?)", List.of(queueName, partitioned));
    }

    public PgmqStatement listQueues() {
        return new PgmqStatement(PgmqFunction.LIST_QUEUES,
            "SELECT queue_name FROM pgmq.list_queues()", List.of());
    }

    public PgmqStatement validateQueueName(String queueName) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.VALIDATE_QUEUE_NAME,
            "SELECT pgmq.validate_queue_name(?)", List.of(queueName));
    }

    // --- Producing ---

    public PgmqStatement send(String queueName, Object payload, int delaySeconds) {
        QueueNames.validate(queueName);
        requireNonNegative("delay", delaySeconds);
        return new PgmqStatement(PgmqFunction.SEND,
            "SELECT * FROM pgmq.send(?, CAST(? AS jsonb), ?)",
            List.of(queueName, payloadCodec.toJson(payload), delaySeconds));
    }

    /**
     * Send several payloads in one statement. Returned ids follow input order.
     *
     * @param queueName target queue
     * @param payloads payloads, at least one
     * @param delaySeconds initial invisibility
     * @return the statement
     */
    public PgmqStatement sendBatch(String queueName, List<?> payloads, int delaySeconds) {
        QueueNames.validate(queueName);
        requireNonNegative("delay", delaySeconds);
        requireNotEmpty("payloads", payloads);
        return new PgmqStatement(PgmqFunction.SEND_BATCH,
            "SELECT * FROM pgmq.send_batch(?, CAST(? AS jsonb[]), ?)",
            List.of(queueName, payloadCodec.toJsonArrayLiteral(payloads), delaySeconds));
    }

    // --- Consuming ---

    public PgmqStatement read(String queueName, int visibilityTimeoutSeconds, int qty) {
        QueueNames.validate(queueName);
        requireNonNegative("vt", visibilityTimeoutSeconds);
        requirePositive("qty", qty);
        return new PgmqStatement(PgmqFunction.READ,
            "SELECT " + MESSAGE_COLUMNS + " FROM pgmq.read(?, ?, ?)",
            List.of(queueName, visibilityTimeoutSeconds, qty));
    }

    /**
     * Read with the wait loop running inside the store.
     *
     * @param queueName queue to read
     * @param visibilityTimeoutSeconds visibility timeout applied to leased messages
     * @param qty maximum number of messages
     * @param maxPollSeconds longest time the store waits for messages
     * @param pollIntervalMs pause between store-side attempts
     * @return the statement
     */
    public PgmqStatement readWithPoll(String queueName, int visibilityTimeoutSeconds, int qty,
                                      int maxPollSeconds, int pollIntervalMs) {
        QueueNames.validate(queueName);
        requireNonNegative("vt", visibilityTimeoutSeconds);
        requirePositive("qty", qty);
        requireNonNegative("maxPollSeconds", maxPollSeconds);
        requirePositive("pollIntervalMs", pollIntervalMs);
        return new PgmqStatement(PgmqFunction.READ_WITH_POLL,
            "SELECT " + MESSAGE_COLUMNS + " FROM pgmq.read_with_poll(?, ?, ?, ?, ?)",
            List.of(queueName, visibilityTimeoutSeconds, qty, maxPollSeconds, pollIntervalMs));
    }

    public PgmqStatement pop(String queueName) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.POP,
            "SELECT " + MESSAGE_COLUMNS + " FROM pgmq.pop(?)", List.of(queueName));
    }

    public PgmqStatement setVisibilityTimeout(String queueName, long msgId, int vtOffsetSeconds) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.SET_VT,
            "SELECT " + MESSAGE_COLUMNS + " FROM pgmq.set_vt(?, ?, ?)",
            List.of(queueName, msgId, vtOffsetSeconds));
    }

    // --- Acknowledging ---

    public PgmqStatement delete(String queueName, long msgId) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.DELETE,
            "SELECT pgmq.delete(?, CAST(? AS bigint))", List.of(queueName, msgId));
    }

    public PgmqStatement deleteBatch(String queueName, Collection<Long> msgIds) {
        QueueNames.validate(queueName);
        requireNotEmpty("msgIds", msgIds);
        return new PgmqStatement(PgmqFunction.DELETE_BATCH,
            "SELECT * FROM pgmq.delete(?, CAST(? AS bigint[]))",
            List.of(queueName, payloadCodec.toIdArrayLiteral(msgIds)));
    }

    public PgmqStatement archive(String queueName, long msgId) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.ARCHIVE,
            "SELECT pgmq.archive(?, CAST(? AS bigint))", List.of(queueName, msgId));
    }

    public PgmqStatement archiveBatch(String queueName, Collection<Long> msgIds) {
        QueueNames.validate(queueName);
        requireNotEmpty("msgIds", msgIds);
        return new PgmqStatement(PgmqFunction.ARCHIVE_BATCH,
            "SELECT * FROM pgmq.archive(?, CAST(? AS bigint[]))",
            List.of(queueName, payloadCodec.toIdArrayLiteral(msgIds)));
    }

    /**
     * Look up an archived message. The archive table name is derived from the
     * validated queue name; the id is bound.
     *
     * @param queueName queue the message was archived from
     * @param msgId message id
     * @return the statement
     */
    public PgmqStatement readArchive(String queueName, long msgId) {
        String archiveTable = QueueNames.archiveTable(queueName);
        return new PgmqStatement(PgmqFunction.READ_ARCHIVE,
            "SELECT " + MESSAGE_COLUMNS + " FROM " + archiveTable + " WHERE msg_id = ?",
            List.of(msgId));
    }

    public PgmqStatement purge(String queueName) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.PURGE_QUEUE, "SELECT pgmq.purge_queue(?)", List.of(queueName));
    }

    // --- Metrics ---

    /**
     * Metrics for one queue. Joining {@code pgmq.meta} first means an unknown queue
     * yields no row instead of an undefined-table error.
     *
     * @param queueName queue to inspect
     * @return the statement
     */
    public PgmqStatement metrics(String queueName) {
        QueueNames.validate(queueName);
        return new PgmqStatement(PgmqFunction.METRICS,
            "SELECT " + MetricsColumn.selectList("m")
                + " FROM pgmq.meta q CROSS JOIN LATERAL pgmq.metrics(q.queue_name) m"
                + " WHERE q.queue_name = ?",
            List.of(queueName));
    }

    public PgmqStatement metricsAll() {
        return new PgmqStatement(PgmqFunction.METRICS_ALL,
            "SELECT " + MetricsColumn.selectList("m") + " FROM pgmq.metrics_all() m",
            List.of());
    }

    // --- Argument checks ---

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new PgmqValidationException(name + " must not be negative, was " + value);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new PgmqValidationException(name + " must be at least 1, was " + value);
        }
    }

    private static void requireNotEmpty(String name, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            throw new PgmqValidationException(name + " must not be empty");
        }
    }
}
