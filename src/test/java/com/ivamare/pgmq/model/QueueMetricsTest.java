package com.ivamare.pgmq.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QueueMetricsTest {

    private static final Instant SCRAPED = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void shouldReportEmptyQueue() {
        QueueMetrics metrics = new QueueMetrics("jobs", 0, null, null, 42, SCRAPED);

        assertTrue(metrics.isEmpty());
        assertNull(metrics.newestMsgAgeSec());
        assertEquals(42, metrics.totalMessages());
    }

    @Test
    void shouldReportNonEmptyQueue() {
        QueueMetrics metrics = new QueueMetrics("jobs", 3, 1L, 20L, 3, SCRAPED);

        assertFalse(metrics.isEmpty());
        assertEquals(20L, metrics.oldestMsgAgeSec());
        assertEquals(SCRAPED, metrics.scrapeTime());
    }
}
