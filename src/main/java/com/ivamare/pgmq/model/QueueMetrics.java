package com.ivamare.pgmq.model;

import java.time.Instant;

/**
 * Point-in-time metrics for one queue, as reported by {@code pgmq.metrics}.
 *
 * @param queueName Name of the queue
 * @param queueLength Messages currently in the queue, visible or not
 * @param newestMsgAgeSec Age of the newest message in seconds, null when the queue is empty
 * @param oldestMsgAgeSec Age of the oldest message in seconds, null when the queue is empty
 * @param totalMessages Number of messages ever enqueued
 * @param scrapeTime When the snapshot was taken (store clock)
 */
public record QueueMetrics(
    String queueName,
    long queueLength,
    Long newestMsgAgeSec,
    Long oldestMsgAgeSec,
    long totalMessages,
    Instant scrapeTime
) {

    /**
     * Check whether the queue held no messages when scraped.
     *
     * @return true if the queue length is zero
     */
    public boolean isEmpty() {
        return queueLength == 0;
    }
}
