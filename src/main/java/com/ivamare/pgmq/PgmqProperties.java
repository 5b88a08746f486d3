package com.ivamare.pgmq;

import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.model.PollStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the PGMQ client.
 *
 * <p>Example configuration:
 * <pre>
 * pgmq:
 *   enabled: true
 *   execution-mode: blocking
 *   visibility-timeout: 30
 *   delay: 0
 *   create-extension: false
 *   poll:
 *     strategy: native
 *     max-poll-seconds: 5
 *     poll-interval-ms: 100
 * </pre>
 */
@ConfigurationProperties(prefix = "pgmq")
public class PgmqProperties {

    /**
     * Enable/disable PGMQ client auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Execution mode. When unset it is inferred from the available beans: a
     * JdbcTemplate selects blocking, a lone R2DBC ConnectionFactory suspending.
     */
    private ExecutionMode executionMode;

    /**
     * Default visibility timeout in seconds.
     */
    private int visibilityTimeout = 30;

    /**
     * Default send delay in seconds.
     */
    private int delay = 0;

    /**
     * Run CREATE EXTENSION IF NOT EXISTS pgmq when the client is created.
     */
    private boolean createExtension = false;

    /**
     * Long-poll configuration.
     */
    private PollProperties poll = new PollProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    public void setExecutionMode(ExecutionMode executionMode) {
        this.executionMode = executionMode;
    }

    public int getVisibilityTimeout() {
        return visibilityTimeout;
    }

    public void setVisibilityTimeout(int visibilityTimeout) {
        this.visibilityTimeout = visibilityTimeout;
    }

    public int getDelay() {
        return delay;
    }

    public void setDelay(int delay) {
        this.delay = delay;
    }

    public boolean isCreateExtension() {
        return createExtension;
    }

    public void setCreateExtension(boolean createExtension) {
        this.createExtension = createExtension;
    }

    public PollProperties getPoll() {
        return poll;
    }

    public void setPoll(PollProperties poll) {
        this.poll = poll;
    }

    /**
     * Long-poll configuration.
     */
    public static class PollProperties {

        /**
         * Where the wait loop runs: inside the store (native) or in the client.
         */
        private PollStrategy strategy = PollStrategy.NATIVE;

        /**
         * Longest time readWithPoll waits for messages, in seconds.
         */
        private int maxPollSeconds = 5;

        /**
         * Pause between poll attempts in milliseconds.
         */
        private int pollIntervalMs = 100;

        public PollStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(PollStrategy strategy) {
            this.strategy = strategy;
        }

        public int getMaxPollSeconds() {
            return maxPollSeconds;
        }

        public void setMaxPollSeconds(int maxPollSeconds) {
            this.maxPollSeconds = maxPollSeconds;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }
    }
}
