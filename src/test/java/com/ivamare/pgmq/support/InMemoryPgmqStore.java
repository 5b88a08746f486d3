package com.ivamare.pgmq.support;

import com.ivamare.pgmq.executor.ExecutionOptions;
import com.ivamare.pgmq.executor.QueryExecutor;
import com.ivamare.pgmq.executor.ResultRow;
import com.ivamare.pgmq.model.ExecutionMode;
import com.ivamare.pgmq.statement.PgmqFunction;
import com.ivamare.pgmq.statement.PgmqStatement;
import org.springframework.jdbc.BadSqlGrammarException;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory stand-in for PostgreSQL with the pgmq extension.
 *
 * <p>Interprets the statements the client builds by their {@link PgmqFunction} and bound
 * parameters, applying pgmq's visibility rules against a {@link MutableClock}. Rows come
 * back in the shapes the real drivers produce, so the client's row mapping is exercised
 * too. Every executed statement and pause is recorded for assertions.
 */
public class InMemoryPgmqStore implements QueryExecutor {

    private static final Pattern ARCHIVE_TABLE = Pattern.compile("FROM pgmq\\.a_(\\w+) ");

    private final MutableClock clock;
    private final Map<String, StoredQueue> queues = new LinkedHashMap<>();
    private final List<PgmqStatement> statements = new ArrayList<>();
    private final List<ExecutionOptions> options = new ArrayList<>();
    private final List<Duration> pauses = new ArrayList<>();
    private final Map<PgmqFunction, RuntimeException> failures = new EnumMap<>(PgmqFunction.class);
    private Consumer<PgmqStatement> beforeExecute = statement -> { };
    private Consumer<Duration> onPause = duration -> { };
    private boolean closed;

    public InMemoryPgmqStore(MutableClock clock) {
        this.clock = clock;
    }

    // --- Test hooks ---

    public void failOn(PgmqFunction function, RuntimeException failure) {
        failures.put(function, failure);
    }

    public void beforeExecute(Consumer<PgmqStatement> hook) {
        this.beforeExecute = hook;
    }

    public void onPause(Consumer<Duration> hook) {
        this.onPause = hook;
    }

    public List<PgmqStatement> statements() {
        return statements;
    }

    public List<ExecutionOptions> options() {
        return options;
    }

    public List<Duration> pauses() {
        return pauses;
    }

    public long count(PgmqFunction function) {
        return statements.stream().filter(s -> s.function() == function).count();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean hasQueue(String queueName) {
        return queues.containsKey(queueName);
    }

    /** Drop a queue behind the client's back, as a concurrent session would. */
    public void dropExternally(String queueName) {
        queues.remove(queueName);
    }

    /** Enqueue directly, bypassing the client. */
    public long enqueueExternally(String queueName, String json) {
        return requireQueue(queueName).add(json, clock.instant(), clock.instant());
    }

    // --- QueryExecutor ---

    @Override
    public List<ResultRow> execute(PgmqStatement statement, ExecutionOptions executionOptions) {
        statements.add(statement);
        options.add(executionOptions);
        beforeExecute.accept(statement);

        RuntimeException failure = failures.remove(statement.function());
        if (failure != null) {
            throw failure;
        }

        return switch (statement.function()) {
            case CREATE_EXTENSION, CREATE_PARTMAN_EXTENSION -> List.of();
            case CREATE, CREATE_UNLOGGED, CREATE_PARTITIONED -> {
                queues.putIfAbsent(name(statement), new StoredQueue());
                yield List.of(nullRow());
            }
            case DROP_QUEUE -> List.of(ResultRow.of(queues.remove(name(statement)) != null));
            case LIST_QUEUES -> queues.keySet().stream().map(name -> ResultRow.of(name)).toList();
            case VALIDATE_QUEUE_NAME -> List.of(nullRow());
            case SEND -> {
                Instant visibleAt = clock.instant().plusSeconds((Integer) statement.param(2));
                long msgId = requireQueue(name(statement)).add((String) statement.param(1), clock.instant(), visibleAt);
                yield List.of(ResultRow.of(msgId));
            }
            case SEND_BATCH -> {
                StoredQueue queue = requireQueue(name(statement));
                Instant visibleAt = clock.instant().plusSeconds((Integer) statement.param(2));
                List<ResultRow> rows = new ArrayList<>();
                for (String json : parseJsonArray((String) statement.param(1))) {
                    rows.add(ResultRow.of(queue.add(json, clock.instant(), visibleAt)));
                }
                yield rows;
            }
            case READ -> read(name(statement), (Integer) statement.param(1), (Integer) statement.param(2));
            case READ_WITH_POLL -> {
                List<ResultRow> rows = read(name(statement), (Integer) statement.param(1), (Integer) statement.param(2));
                if (rows.isEmpty()) {
                    // The store waits the full poll window before giving up
                    clock.advanceSeconds((Integer) statement.param(3));
                    rows = read(name(statement), (Integer) statement.param(1), (Integer) statement.param(2));
                }
                yield rows;
            }
            case POP -> {
                StoredQueue queue = requireQueue(name(statement));
                Optional<StoredMessage> visible = queue.visible(clock.instant()).stream().findFirst();
                visible.ifPresent(message -> queue.messages.remove(message.msgId));
                yield visible.map(message -> List.of(message.toRow())).orElse(List.of());
            }
            case SET_VT -> {
                StoredMessage message = requireQueue(name(statement)).messages.get((Long) statement.param(1));
                if (message == null) {
                    yield List.of();
                }
                message.vt = clock.instant().plusSeconds((Integer) statement.param(2));
                yield List.of(message.toRow());
            }
            case DELETE -> List.of(ResultRow.of(
                requireQueue(name(statement)).messages.remove((Long) statement.param(1)) != null));
            case DELETE_BATCH -> {
                StoredQueue queue = requireQueue(name(statement));
                List<ResultRow> rows = new ArrayList<>();
                for (long msgId : parseIdArray((String) statement.param(1))) {
                    if (queue.messages.remove(msgId) != null) {
                        rows.add(ResultRow.of(msgId));
                    }
                }
                yield rows;
            }
            case ARCHIVE -> List.of(ResultRow.of(
                requireQueue(name(statement)).archive((Long) statement.param(1))));
            case ARCHIVE_BATCH -> {
                StoredQueue queue = requireQueue(name(statement));
                List<ResultRow> rows = new ArrayList<>();
                for (long msgId : parseIdArray((String) statement.param(1))) {
                    if (queue.archive(msgId)) {
                        rows.add(ResultRow.of(msgId));
                    }
                }
                yield rows;
            }
            case READ_ARCHIVE -> {
                Matcher matcher = ARCHIVE_TABLE.matcher(statement.sql());
                if (!matcher.find()) {
                    throw new IllegalStateException("No archive table in " + statement.sql());
                }
                StoredMessage archived = requireQueue(matcher.group(1)).archived.get((Long) statement.param(0));
                yield archived == null ? List.of() : List.of(archived.toRow());
            }
            case PURGE_QUEUE -> {
                StoredQueue queue = requireQueue(name(statement));
                long purged = queue.messages.size();
                queue.messages.clear();
                yield List.of(ResultRow.of(purged));
            }
            case METRICS -> {
                StoredQueue queue = queues.get(name(statement));
                yield queue == null ? List.of() : List.of(queue.metricsRow(name(statement), clock.instant()));
            }
            case METRICS_ALL -> queues.entrySet().stream()
                .map(entry -> entry.getValue().metricsRow(entry.getKey(), clock.instant()))
                .toList();
        };
    }

    @Override
    public void pause(Duration duration) {
        pauses.add(duration);
        clock.advance(duration);
        onPause.accept(duration);
    }

    @Override
    public ExecutionMode mode() {
        return ExecutionMode.BLOCKING;
    }

    @Override
    public void close() {
        closed = true;
    }

    // --- Emulation ---

    private List<ResultRow> read(String queueName, int vtSeconds, int qty) {
        Instant now = clock.instant();
        List<ResultRow> rows = new ArrayList<>();
        for (StoredMessage message : requireQueue(queueName).visible(now)) {
            if (rows.size() == qty) {
                break;
            }
            message.readCt++;
            message.vt = now.plusSeconds(vtSeconds);
            rows.add(message.toRow());
        }
        return rows;
    }

    private StoredQueue requireQueue(String queueName) {
        StoredQueue queue = queues.get(queueName);
        if (queue == null) {
            throw missingQueue(queueName);
        }
        return queue;
    }

    public static BadSqlGrammarException missingQueue(String queueName) {
        return new BadSqlGrammarException("pgmq", "SELECT ...",
            new SQLException("ERROR: relation \"pgmq.q_" + queueName + "\" does not exist", "42P01"));
    }

    private static String name(PgmqStatement statement) {
        return (String) statement.param(0);
    }

    private static ResultRow nullRow() {
        return new ResultRow(Collections.singletonList(null));
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static List<String> parseJsonArray(String literal) {
        List<String> elements = new ArrayList<>();
        StringBuilder current = null;
        for (int i = 1; i < literal.length() - 1; i++) {
            char c = literal.charAt(i);
            if (current == null) {
                if (c == '"') {
                    current = new StringBuilder();
                }
            } else if (c == '\\') {
                current.append(literal.charAt(++i));
            } else if (c == '"') {
                elements.add(current.toString());
                current = null;
            } else {
                current.append(c);
            }
        }
        return elements;
    }

    static List<Long> parseIdArray(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        List<Long> ids = new ArrayList<>();
        if (!body.isEmpty()) {
            for (String id : body.split(",")) {
                ids.add(Long.parseLong(id));
            }
        }
        return ids;
    }

    private static final class StoredQueue {
        private final Map<Long, StoredMessage> messages = new LinkedHashMap<>();
        private final Map<Long, StoredMessage> archived = new LinkedHashMap<>();
        private long nextId = 1;
        private long totalMessages;

        long add(String json, Instant enqueuedAt, Instant visibleAt) {
            long msgId = nextId++;
            totalMessages++;
            messages.put(msgId, new StoredMessage(msgId, json, enqueuedAt, visibleAt));
            return msgId;
        }

        List<StoredMessage> visible(Instant now) {
            List<StoredMessage> visible = new ArrayList<>();
            for (StoredMessage message : messages.values()) {
                if (!message.vt.isAfter(now)) {
                    visible.add(message);
                }
            }
            return visible;
        }

        boolean archive(long msgId) {
            StoredMessage message = messages.remove(msgId);
            if (message == null) {
                return false;
            }
            archived.put(msgId, message);
            return true;
        }

        ResultRow metricsRow(String queueName, Instant now) {
            Long newest = null;
            Long oldest = null;
            for (StoredMessage message : messages.values()) {
                long age = Duration.between(message.enqueuedAt, now).getSeconds();
                newest = newest == null ? age : Math.min(newest, age);
                oldest = oldest == null ? age : Math.max(oldest, age);
            }
            return new ResultRow(Arrays.asList(
                queueName, (long) messages.size(), newest, oldest, totalMessages, timestamp(now)));
        }
    }

    private static final class StoredMessage {
        private final long msgId;
        private final String json;
        private final Instant enqueuedAt;
        private Instant vt;
        private int readCt;

        StoredMessage(long msgId, String json, Instant enqueuedAt, Instant vt) {
            this.msgId = msgId;
            this.json = json;
            this.enqueuedAt = enqueuedAt;
            this.vt = vt;
        }

        ResultRow toRow() {
            return ResultRow.of(msgId, readCt, timestamp(enqueuedAt), timestamp(vt), json);
        }
    }
}
