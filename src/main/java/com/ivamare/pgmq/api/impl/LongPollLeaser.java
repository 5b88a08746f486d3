package com.ivamare.pgmq.api.impl;

import com.ivamare.pgmq.exception.PgmqValidationException;
import com.ivamare.pgmq.executor.ExecutionOptions;
import com.ivamare.pgmq.executor.QueryExecutor;
import com.ivamare.pgmq.mapping.PgmqRowMapper;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.statement.PgmqStatements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client-side bounded long poll.
 *
 * <p>Repeats {@code pgmq.read} until {@code qty} messages are leased or the deadline
 * passes, pausing through the executor between attempts. Messages leased in earlier
 * attempts are kept; each attempt only asks for the remainder. Returning fewer than
 * {@code qty} messages, or none, at the deadline is a normal outcome. A failed read
 * aborts the loop and propagates.
 */
public class LongPollLeaser {

    private static final Logger log = LoggerFactory.getLogger(LongPollLeaser.class);

    private final QueryExecutor executor;
    private final PgmqStatements statements;
    private final PgmqRowMapper rowMapper;
    private final Clock clock;

    public LongPollLeaser(QueryExecutor executor, PgmqStatements statements,
                          PgmqRowMapper rowMapper, Clock clock) {
        this.executor = executor;
        this.statements = statements;
        this.rowMapper = rowMapper;
        this.clock = clock;
    }

    /**
     * Lease up to {@code qty} messages, waiting at most {@code maxPollSeconds}.
     *
     * @param queueName queue to read
     * @param visibilityTimeoutSeconds visibility timeout applied to each leased message
     * @param qty maximum number of messages
     * @param maxPollSeconds longest wait; 0 makes exactly one attempt
     * @param pollIntervalMs pause between attempts
     * @param options execution options forwarded to every read
     * @return leased messages in lease order, possibly empty
     */
    public List<PgmqMessage> lease(String queueName, int visibilityTimeoutSeconds, int qty,
                                   int maxPollSeconds, int pollIntervalMs, ExecutionOptions options) {
        if (qty < 1) {
            throw new PgmqValidationException("qty must be at least 1, was " + qty);
        }
        if (maxPollSeconds < 0) {
            throw new PgmqValidationException("maxPollSeconds must not be negative, was " + maxPollSeconds);
        }
        if (pollIntervalMs < 1) {
            throw new PgmqValidationException("pollIntervalMs must be at least 1, was " + pollIntervalMs);
        }

        long deadline = clock.millis() + maxPollSeconds * 1000L;
        List<PgmqMessage> leased = new ArrayList<>();
        int attempts = 0;

        while (true) {
            attempts++;
            List<PgmqMessage> batch = rowMapper.toMessages(executor.execute(
                statements.read(queueName, visibilityTimeoutSeconds, qty - leased.size()), options));
            leased.addAll(batch);

            if (leased.size() >= qty) {
                break;
            }
            long remaining = deadline - clock.millis();
            if (remaining <= 0) {
                break;
            }
            executor.pause(Duration.ofMillis(Math.min(pollIntervalMs, remaining)));
        }

        log.debug("Leased {} of {} messages from {} in {} attempts", leased.size(), qty, queueName, attempts);
        return leased;
    }
}
