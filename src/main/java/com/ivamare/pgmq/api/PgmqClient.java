package com.ivamare.pgmq.api;

import com.ivamare.pgmq.executor.PgmqSession;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.model.QueueMetrics;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Client for interacting with PGMQ queues.
 *
 * <p>Wraps PGMQ SQL functions for queue operations. Every method has one signature
 * regardless of {@link ExecutionMode}; whether a call goes through JDBC or R2DBC is
 * decided once, when the client is built. Calls auto-commit unless the client is a
 * {@link #withSession(PgmqSession)} or {@link #withoutCommit()} view.
 *
 * <p>Absence is reported as a value: an empty {@link Optional}, an empty list or
 * {@code false}. Errors from PostgreSQL propagate unchanged.
 */
public interface PgmqClient extends AutoCloseable {

    // --- Queue lifecycle ---

    /**
     * Install the pgmq extension if it is not installed yet.
     */
    void ensureExtension();

    /**
     * Create a queue if it doesn't exist.
     *
     * @param queueName Name of the queue to create
     */
    void createQueue(String queueName);

    /**
     * Create a queue, optionally backed by an unlogged table.
     *
     * <p>Unlogged queues are faster but lose their contents on a crash.
     *
     * @param queueName Name of the queue to create
     * @param unlogged true to skip write-ahead logging
     */
    void createQueue(String queueName, boolean unlogged);

    /**
     * Create a queue partitioned by message id.
     *
     * <p>Requires pg_partman; the extension is created on first use.
     *
     * @param queueName Name of the queue to create
     * @param partitionInterval Messages per partition
     * @param retentionInterval Messages to retain before old partitions are dropped
     */
    void createPartitionedQueue(String queueName, int partitionInterval, int retentionInterval);

    /**
     * Drop a queue and its archive.
     *
     * @param queueName Name of the queue
     * @return true if the queue was dropped
     */
    boolean dropQueue(String queueName);

    /**
     * Drop a queue and its archive.
     *
     * @param queueName Name of the queue
     * @param partitioned true if the queue was created partitioned
     * @return true if the queue was dropped
     */
    boolean dropQueue(String queueName, boolean partitioned);

    /**
     * @return names of all queues
     */
    List<String> listQueues();

    /**
     * Check a queue name locally, then against the store's own rules.
     *
     * @param queueName Name to check
     * @throws com.ivamare.pgmq.exception.InvalidQueueNameException if the name is rejected locally
     */
    void validateQueueName(String queueName);

    // --- Producing ---

    /**
     * Send a message to a queue.
     *
     * @param queueName Name of the queue
     * @param message Message payload, any value Jackson serializes to JSON (object, array or scalar)
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Object message);

    /**
     * Send a message to a queue with delay.
     *
     * @param queueName Name of the queue
     * @param message Message payload, any value Jackson serializes to JSON (object, array or scalar)
     * @param delaySeconds Delay in seconds before message becomes visible
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Object message, int delaySeconds);

    /**
     * Send multiple messages to a queue in a single operation.
     *
     * @param queueName Name of the queue
     * @param messages List of message payloads
     * @return Message IDs in the order of {@code messages}; empty if no messages were given
     */
    List<Long> sendBatch(String queueName, List<?> messages);

    /**
     * Send multiple messages with delay.
     *
     * @param queueName Name of the queue
     * @param messages List of message payloads
     * @param delaySeconds Delay in seconds
     * @return Message IDs in input order
     */
    List<Long> sendBatch(String queueName, List<?> messages, int delaySeconds);

    // --- Consuming ---

    /**
     * Lease one message using the default visibility timeout.
     *
     * @param queueName Name of the queue
     * @return Optional message (empty if nothing is visible)
     */
    Optional<PgmqMessage> read(String queueName);

    /**
     * Lease one message.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Seconds before message becomes visible again
     * @return Optional message (empty if nothing is visible)
     */
    Optional<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds);

    /**
     * Lease up to {@code qty} messages using the default visibility timeout.
     *
     * @param queueName Name of the queue
     * @param qty Maximum number of messages to read
     * @return List of messages (may be empty)
     */
    List<PgmqMessage> readBatch(String queueName, int qty);

    /**
     * Lease up to {@code qty} messages.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Seconds before message becomes visible again
     * @param qty Maximum number of messages to read
     * @return List of messages (may be empty)
     */
    List<PgmqMessage> readBatch(String queueName, int visibilityTimeoutSeconds, int qty);

    /**
     * Lease up to {@code qty} messages, waiting with the client's default poll settings.
     *
     * @param queueName Name of the queue
     * @param qty Maximum number of messages to read
     * @return List of messages (may be empty)
     */
    List<PgmqMessage> readWithPoll(String queueName, int qty);

    /**
     * Lease up to {@code qty} messages, waiting up to {@code maxPollSeconds} for them.
     *
     * <p>Returns as soon as {@code qty} messages are leased, or with whatever was leased
     * when the wait ends. {@code maxPollSeconds == 0} makes exactly one attempt.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds Visibility timeout applied to leased messages
     * @param qty Maximum number of messages to read
     * @param maxPollSeconds Longest time to wait
     * @param pollIntervalMs Pause between attempts
     * @return List of messages (may be empty)
     */
    List<PgmqMessage> readWithPoll(String queueName, int visibilityTimeoutSeconds, int qty,
                                   int maxPollSeconds, int pollIntervalMs);

    /**
     * Read and delete one message in a single step.
     *
     * @param queueName Name of the queue
     * @return Optional message (empty if nothing is visible)
     */
    Optional<PgmqMessage> pop(String queueName);

    /**
     * Set visibility timeout for a message.
     *
     * <p>Used for extending visibility timeout for long-running handlers
     * or implementing backoff delays.
     *
     * @param queueName Name of the queue
     * @param msgId Message ID
     * @param vtOffsetSeconds New visibility timeout in seconds from now
     * @return the updated message, empty if no such message exists
     */
    Optional<PgmqMessage> setVisibilityTimeout(String queueName, long msgId, int vtOffsetSeconds);

    // --- Acknowledging ---

    /**
     * Delete a message from a queue.
     *
     * @param queueName Name of the queue
     * @param msgId Message ID to delete
     * @return true if message was deleted, false if not found
     */
    boolean delete(String queueName, long msgId);

    /**
     * Delete several messages.
     *
     * @param queueName Name of the queue
     * @param msgIds Message IDs to delete
     * @return IDs that were actually deleted
     */
    List<Long> deleteBatch(String queueName, Collection<Long> msgIds);

    /**
     * Archive a message (move to archive table).
     *
     * @param queueName Name of the queue
     * @param msgId Message ID to archive
     * @return true if message was archived
     */
    boolean archive(String queueName, long msgId);

    /**
     * Archive several messages.
     *
     * @param queueName Name of the queue
     * @param msgIds Message IDs to archive
     * @return IDs that were actually archived
     */
    List<Long> archiveBatch(String queueName, Collection<Long> msgIds);

    /**
     * Get an archived message by id.
     *
     * @param queueName Name of the queue the message was archived from
     * @param msgId Message ID
     * @return Optional archived message
     */
    Optional<PgmqMessage> readArchived(String queueName, long msgId);

    /**
     * Remove every message from a queue.
     *
     * @param queueName Name of the queue
     * @return number of messages removed
     */
    long purge(String queueName);

    // --- Metrics ---

    /**
     * @param queueName Name of the queue
     * @return metrics snapshot, empty if the queue does not exist
     */
    Optional<QueueMetrics> metrics(String queueName);

    /**
     * Metrics for every queue.
     *
     * <p>Issues a single {@code pgmq.metrics_all()} call. If a queue is dropped while that
     * call runs it fails with an undefined-table error; the queues are then listed and
     * inspected one by one, leaving out any that no longer exist.
     *
     * @return one snapshot per queue still present
     */
    List<QueueMetrics> metricsAll();

    // --- Transaction scope ---

    /**
     * A view of this client whose calls run in the caller's transaction.
     *
     * <p>The session's connection is used as is: the client never commits, rolls back or
     * closes it.
     *
     * @param session caller-managed session matching this client's execution mode
     * @return client view bound to the session
     */
    PgmqClient withSession(PgmqSession session);

    /**
     * A view of this client whose calls are not committed.
     *
     * <p>Each call runs in its own transaction which is rolled back afterwards.
     *
     * @return client view without auto-commit
     */
    PgmqClient withoutCommit();

    ExecutionMode executionMode();

    /**
     * Release resources owned by the client, such as the suspending-mode scheduler.
     * Views share those resources with the client they were derived from.
     */
    @Override
    void close();
}
