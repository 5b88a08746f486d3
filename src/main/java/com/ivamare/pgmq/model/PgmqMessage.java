package com.ivamare.pgmq.model;

import com.ivamare.pgmq.exception.PgmqException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A message leased from, or archived in, a PGMQ queue.
 *
 * <p>The payload is whatever JSON document the producer stored: an object maps to
 * {@code Map<String, Object>}, an array to {@code List<Object>}, a scalar to its
 * boxed value. Top-level maps and lists are copied into unmodifiable views; nested
 * values are kept as parsed.
 *
 * @param msgId id assigned by pgmq on send
 * @param readCount times the message has been leased, including this lease
 * @param enqueuedAt when the message was sent
 * @param visibilityTimeout when the message becomes readable again
 * @param message the payload, null when the stored document is null
 */
public record PgmqMessage(
    long msgId,
    int readCount,
    Instant enqueuedAt,
    Instant visibilityTimeout,
    Object message
) {
    public PgmqMessage {
        if (message instanceof Map<?, ?> map) {
            message = Collections.unmodifiableMap(new LinkedHashMap<>(map));
        } else if (message instanceof List<?> list) {
            message = Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    /**
     * The payload as a JSON object.
     *
     * @return the payload map
     * @throws PgmqException if the stored document is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> messageAsMap() {
        if (message instanceof Map<?, ?>) {
            return (Map<String, Object>) message;
        }
        String type = message == null ? "null" : message.getClass().getSimpleName();
        throw new PgmqException("Message " + msgId + " payload is not a JSON object but " + type);
    }
}
