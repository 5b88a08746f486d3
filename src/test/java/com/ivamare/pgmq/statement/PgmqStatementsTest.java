package com.ivamare.pgmq.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.exception.InvalidQueueNameException;
import com.ivamare.pgmq.exception.PgmqValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PgmqStatementsTest {

    private PgmqStatements statements;

    @BeforeEach
    void setUp() {
        statements = new PgmqStatements(new PayloadCodec(new ObjectMapper()));
    }

    private static int placeholders(PgmqStatement statement) {
        return (int) statement.sql().chars().filter(c -> c == '?').count();
    }

    private static void assertWellFormed(PgmqStatement statement) {
        assertEquals(placeholders(statement), statement.params().size(),
            "placeholder count must match bound parameters for " + statement.function());
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldCreateExtensionsIdempotently() {
            assertEquals("CREATE EXTENSION IF NOT EXISTS pgmq CASCADE", statements.createExtension().sql());
            assertEquals("CREATE EXTENSION IF NOT EXISTS pg_partman CASCADE",
                statements.createPartmanExtension().sql());
        }

        @Test
        void shouldPickCreateFunctionByDurability() {
            PgmqStatement logged = statements.createQueue("jobs", false);
            PgmqStatement unlogged = statements.createQueue("jobs", true);

            assertEquals(PgmqFunction.CREATE, logged.function());
            assertEquals("SELECT pgmq.create(?)", logged.sql());
            assertEquals(PgmqFunction.CREATE_UNLOGGED, unlogged.function());
            assertEquals("SELECT pgmq.create_unlogged(?)", unlogged.sql());
            assertEquals(List.of("jobs"), unlogged.params());
        }

        @Test
        void shouldBindPartitionIntervalsAsText() {
            PgmqStatement statement = statements.createPartitionedQueue("jobs", 10000, 100000);

            assertEquals(PgmqFunction.CREATE_PARTITIONED, statement.function());
            assertEquals(List.of("jobs", "10000", "100000"), statement.params());
            assertWellFormed(statement);
        }

        @Test
        void shouldRejectNonPositivePartitionIntervals() {
            assertThrows(PgmqValidationException.class, () -> statements.createPartitionedQueue("jobs", 0, 10));
            assertThrows(PgmqValidationException.class, () -> statements.createPartitionedQueue("jobs", 10, 0));
        }

        @Test
        void shouldPassPartitionedFlagToDrop() {
            PgmqStatement statement = statements.dropQueue("jobs", true);

            assertEquals("SELECT pgmq.drop_queue(?, ?)", statement.sql());
            assertEquals(List.of("jobs", true), statement.params());
        }

        @Test
        void shouldListQueueNamesOnly() {
            PgmqStatement statement = statements.listQueues();

            assertEquals("SELECT queue_name FROM pgmq.list_queues()", statement.sql());
            assertTrue(statement.params().isEmpty());
        }
    }

    @Nested
    class Producing {

        @Test
        void shouldBindPayloadAsJsonText() {
            PgmqStatement statement = statements.send("jobs", Map.of("id", 1), 5);

            assertEquals(PgmqFunction.SEND, statement.function());
            assertEquals("SELECT * FROM pgmq.send(?, CAST(? AS jsonb), ?)", statement.sql());
            assertEquals(List.of("jobs", "{\"id\":1}", 5), statement.params());
        }

        @Test
        void shouldKeepPayloadOutOfSqlText() {
            PgmqStatement statement = statements.send("jobs", Map.of("evil", "'); DROP TABLE pgmq.meta; --"), 0);

            assertFalse(statement.sql().contains("DROP"));
            assertWellFormed(statement);
        }

        @Test
        void shouldSendBatchAsSingleArrayParameter() {
            PgmqStatement statement = statements.sendBatch("jobs", List.of(Map.of("a", 1), Map.of("b", 2)), 0);

            assertEquals(PgmqFunction.SEND_BATCH, statement.function());
            assertEquals("SELECT * FROM pgmq.send_batch(?, CAST(? AS jsonb[]), ?)", statement.sql());
            assertEquals("{\"{\\\"a\\\":1}\",\"{\\\"b\\\":2}\"}", statement.param(1));
        }

        @Test
        void shouldRejectNegativeDelay() {
            assertThrows(PgmqValidationException.class, () -> statements.send("jobs", Map.of(), -1));
        }

        @Test
        void shouldRejectEmptyBatch() {
            assertThrows(PgmqValidationException.class, () -> statements.sendBatch("jobs", List.of(), 0));
        }
    }

    @Nested
    class Consuming {

        @Test
        void shouldSelectMessageColumnsInMapperOrder() {
            PgmqStatement statement = statements.read("jobs", 30, 10);

            assertEquals("SELECT msg_id, read_ct, enqueued_at, vt, message::text FROM pgmq.read(?, ?, ?)",
                statement.sql());
            assertEquals(List.of("jobs", 30, 10), statement.params());
        }

        @Test
        void shouldBindAllPollArguments() {
            PgmqStatement statement = statements.readWithPoll("jobs", 30, 1, 5, 100);

            assertEquals(PgmqFunction.READ_WITH_POLL, statement.function());
            assertEquals(List.of("jobs", 30, 1, 5, 100), statement.params());
            assertWellFormed(statement);
        }

        @Test
        void shouldRejectInvalidReadArguments() {
            assertThrows(PgmqValidationException.class, () -> statements.read("jobs", -1, 1));
            assertThrows(PgmqValidationException.class, () -> statements.read("jobs", 30, 0));
            assertThrows(PgmqValidationException.class, () -> statements.readWithPoll("jobs", 30, 1, -1, 100));
            assertThrows(PgmqValidationException.class, () -> statements.readWithPoll("jobs", 30, 1, 5, 0));
        }

        @Test
        void shouldPopAndSetVisibilityTimeout() {
            assertEquals(List.of("jobs"), statements.pop("jobs").params());

            PgmqStatement setVt = statements.setVisibilityTimeout("jobs", 42L, 60);
            assertEquals(PgmqFunction.SET_VT, setVt.function());
            assertEquals(List.of("jobs", 42L, 60), setVt.params());
        }

        @Test
        void shouldAllowNegativeVisibilityOffset() {
            PgmqStatement setVt = statements.setVisibilityTimeout("jobs", 1L, -5);

            assertEquals(List.of("jobs", 1L, -5), setVt.params());
        }
    }

    @Nested
    class Acknowledging {

        @Test
        void shouldCastSingleIdToBigint() {
            PgmqStatement delete = statements.delete("jobs", 7L);
            PgmqStatement archive = statements.archive("jobs", 7L);

            assertEquals("SELECT pgmq.delete(?, CAST(? AS bigint))", delete.sql());
            assertEquals("SELECT pgmq.archive(?, CAST(? AS bigint))", archive.sql());
            assertEquals(List.of("jobs", 7L), archive.params());
        }

        @Test
        void shouldBindIdBatchAsArrayLiteral() {
            PgmqStatement delete = statements.deleteBatch("jobs", List.of(1L, 2L, 3L));
            PgmqStatement archive = statements.archiveBatch("jobs", List.of(4L));

            assertEquals(PgmqFunction.DELETE_BATCH, delete.function());
            assertEquals(List.of("jobs", "{1,2,3}"), delete.params());
            assertEquals(PgmqFunction.ARCHIVE_BATCH, archive.function());
            assertEquals(List.of("jobs", "{4}"), archive.params());
        }

        @Test
        void shouldRejectEmptyIdBatch() {
            assertThrows(PgmqValidationException.class, () -> statements.deleteBatch("jobs", List.of()));
            assertThrows(PgmqValidationException.class, () -> statements.archiveBatch("jobs", List.of()));
        }

        @Test
        void shouldReadArchiveFromArchiveTable() {
            PgmqStatement statement = statements.readArchive("jobs", 9L);

            assertEquals("SELECT msg_id, read_ct, enqueued_at, vt, message::text FROM pgmq.a_jobs WHERE msg_id = ?",
                statement.sql());
            assertEquals(List.of(9L), statement.params());
        }

        @Test
        void shouldPurge() {
            assertEquals("SELECT pgmq.purge_queue(?)", statements.purge("jobs").sql());
        }
    }

    @Test
    void metricsShouldJoinMetaSoUnknownQueuesYieldNoRow() {
        PgmqStatement statement = statements.metrics("jobs");

        assertTrue(statement.sql().contains("FROM pgmq.meta q"));
        assertTrue(statement.sql().startsWith(
            "SELECT m.queue_name, m.queue_length, m.newest_msg_age_sec, m.oldest_msg_age_sec,"
                + " m.total_messages, m.scrape_time"));
        assertEquals(List.of("jobs"), statement.params());
    }

    @Test
    void metricsAllShouldCallTheStoreOnce() {
        PgmqStatement statement = statements.metricsAll();

        assertEquals(PgmqFunction.METRICS_ALL, statement.function());
        assertEquals("SELECT m.queue_name, m.queue_length, m.newest_msg_age_sec, m.oldest_msg_age_sec,"
            + " m.total_messages, m.scrape_time FROM pgmq.metrics_all() m", statement.sql());
        assertEquals(List.of(), statement.params());
    }

    @Test
    void everyQueueOperationShouldValidateTheNameFirst() {
        String bad = "jobs; DROP TABLE x";

        assertThrows(InvalidQueueNameException.class, () -> statements.createQueue(bad, false));
        assertThrows(InvalidQueueNameException.class, () -> statements.createPartitionedQueue(bad, 1, 1));
        assertThrows(InvalidQueueNameException.class, () -> statements.dropQueue(bad, false));
        assertThrows(InvalidQueueNameException.class, () -> statements.validateQueueName(bad));
        assertThrows(InvalidQueueNameException.class, () -> statements.send(bad, Map.of(), 0));
        assertThrows(InvalidQueueNameException.class, () -> statements.sendBatch(bad, List.of(Map.of()), 0));
        assertThrows(InvalidQueueNameException.class, () -> statements.read(bad, 30, 1));
        assertThrows(InvalidQueueNameException.class, () -> statements.readWithPoll(bad, 30, 1, 5, 100));
        assertThrows(InvalidQueueNameException.class, () -> statements.pop(bad));
        assertThrows(InvalidQueueNameException.class, () -> statements.setVisibilityTimeout(bad, 1L, 1));
        assertThrows(InvalidQueueNameException.class, () -> statements.delete(bad, 1L));
        assertThrows(InvalidQueueNameException.class, () -> statements.deleteBatch(bad, List.of(1L)));
        assertThrows(InvalidQueueNameException.class, () -> statements.archive(bad, 1L));
        assertThrows(InvalidQueueNameException.class, () -> statements.archiveBatch(bad, List.of(1L)));
        assertThrows(InvalidQueueNameException.class, () -> statements.readArchive(bad, 1L));
        assertThrows(InvalidQueueNameException.class, () -> statements.purge(bad));
        assertThrows(InvalidQueueNameException.class, () -> statements.metrics(bad));
    }
}
