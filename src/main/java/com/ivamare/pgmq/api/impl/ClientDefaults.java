package com.ivamare.pgmq.api.impl;

import com.ivamare.pgmq.exception.PgmqConfigurationException;
import com.ivamare.pgmq.model.PollStrategy;

/**
 * Values used by the client overloads that omit them.
 *
 * @param visibilityTimeout Default visibility timeout in seconds
 * @param delay Default send delay in seconds
 * @param pollStrategy Where the long-poll wait runs
 * @param maxPollSeconds Default longest wait for {@code readWithPoll}
 * @param pollIntervalMs Default pause between poll attempts
 */
public record ClientDefaults(
    int visibilityTimeout,
    int delay,
    PollStrategy pollStrategy,
    int maxPollSeconds,
    int pollIntervalMs
) {
    public static final int DEFAULT_VISIBILITY_TIMEOUT = 30;
    public static final int DEFAULT_DELAY = 0;
    public static final int DEFAULT_MAX_POLL_SECONDS = 5;
    public static final int DEFAULT_POLL_INTERVAL_MS = 100;

    public ClientDefaults {
        if (pollStrategy == null) {
            pollStrategy = PollStrategy.NATIVE;
        }
        if (visibilityTimeout < 0 || delay < 0 || maxPollSeconds < 0) {
            throw new PgmqConfigurationException(
                "visibilityTimeout, delay and maxPollSeconds must not be negative");
        }
        if (pollIntervalMs < 1) {
            throw new PgmqConfigurationException("pollIntervalMs must be at least 1, was " + pollIntervalMs);
        }
    }

    public static ClientDefaults standard() {
        return new ClientDefaults(DEFAULT_VISIBILITY_TIMEOUT, DEFAULT_DELAY, PollStrategy.NATIVE,
            DEFAULT_MAX_POLL_SECONDS, DEFAULT_POLL_INTERVAL_MS);
    }
}
