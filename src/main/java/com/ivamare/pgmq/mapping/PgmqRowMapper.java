package com.ivamare.pgmq.mapping;

import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.executor.ResultRow;
import com.ivamare.pgmq.model.PgmqMessage;
import com.ivamare.pgmq.model.QueueMetrics;
import com.ivamare.pgmq.statement.PayloadCodec;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Maps raw rows to typed records by column position.
 *
 * <p>Positions come from {@link MessageColumn} and {@link MetricsColumn}, the same
 * contracts the statement builder selects with. Value conversion tolerates the types
 * either driver produces: JDBC hands back {@link Timestamp} for {@code timestamptz},
 * R2DBC an {@link OffsetDateTime}.
 */
public class PgmqRowMapper {

    private final PayloadCodec payloadCodec;

    public PgmqRowMapper(PayloadCodec payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public PgmqMessage toMessage(ResultRow row) {
        requireWidth(row, MessageColumn.width(), "message");

        Object payload = row.get(MessageColumn.MESSAGE.index());
        Object message = payloadCodec.fromJson(payload == null ? null : payload.toString());

        return new PgmqMessage(
            longValue(row.get(MessageColumn.MSG_ID.index())),
            intValue(row.get(MessageColumn.READ_CT.index())),
            toInstant(row.get(MessageColumn.ENQUEUED_AT.index())),
            toInstant(row.get(MessageColumn.VT.index())),
            message
        );
    }

    public List<PgmqMessage> toMessages(List<ResultRow> rows) {
        List<PgmqMessage> messages = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            messages.add(toMessage(row));
        }
        return messages;
    }

    public QueueMetrics toMetrics(ResultRow row) {
        requireWidth(row, MetricsColumn.width(), "metrics");

        Object newest = row.get(MetricsColumn.NEWEST_MSG_AGE_SEC.index());
        Object oldest = row.get(MetricsColumn.OLDEST_MSG_AGE_SEC.index());

        return new QueueMetrics(
            (String) row.get(MetricsColumn.QUEUE_NAME.index()),
            longValue(row.get(MetricsColumn.QUEUE_LENGTH.index())),
            newest == null ? null : longValue(newest),
            oldest == null ? null : longValue(oldest),
            longValue(row.get(MetricsColumn.TOTAL_MESSAGES.index())),
            toInstant(row.get(MetricsColumn.SCRAPE_TIME.index()))
        );
    }

    /**
     * Read the first column of each row as a message id.
     *
     * @param rows rows from send_batch, delete or archive
     * @return ids in row order
     */
    public List<Long> toIds(List<ResultRow> rows) {
        List<Long> ids = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            ids.add(longValue(firstColumn(row)));
        }
        return ids;
    }

    public List<String> toStrings(List<ResultRow> rows) {
        List<String> values = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            Object value = firstColumn(row);
            values.add(value == null ? null : value.toString());
        }
        return values;
    }

    /**
     * Read a single-column boolean result, treating SQL NULL as false.
     *
     * @param row the row
     * @return the boolean value
     */
    public boolean toBoolean(ResultRow row) {
        Object value = firstColumn(row);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw unexpected(value, "boolean");
    }

    public long toLong(ResultRow row) {
        return longValue(firstColumn(row));
    }

    // --- Value conversion ---

    static long longValue(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        throw unexpected(value, "number");
    }

    static int intValue(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        throw unexpected(value, "number");
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        // Timestamp before Date: Timestamp is a Date subclass with nanos
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        throw unexpected(value, "timestamp");
    }

    private static Object firstColumn(ResultRow row) {
        requireWidth(row, 1, "scalar");
        return row.get(0);
    }

    private static void requireWidth(ResultRow row, int width, String shape) {
        if (row.size() < width) {
            throw new PgmqException("Expected a " + shape + " row with at least " + width
                + " columns but got " + row.size() + ": " + row);
        }
    }

    private static PgmqException unexpected(Object value, String expected) {
        String type = value == null ? "null" : value.getClass().getName();
        return new PgmqException("Expected " + expected + " column value but got " + type);
    }
}
