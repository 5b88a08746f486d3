package com.ivamare.pgmq.statement;

import com.ivamare.pgmq.exception.PgmqException;
import com.ivamare.pgmq.exception.PgmqValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collection;
import java.util.List;

/**
 * Converts payloads and id lists to the text forms PostgreSQL accepts as bound
 * parameters, and payload text back to plain Java values.
 *
 * <p>Batches are encoded as array literals ({@code {"{\"a\":1}","{\"b\":2}"}}) so a
 * whole batch travels as one parameter cast to {@code jsonb[]} or {@code bigint[]}.
 * Element order is preserved.
 */
public class PayloadCodec {

    private final ObjectMapper objectMapper;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize one payload to JSON text.
     *
     * @param payload message payload: a map, list, string, number or boolean
     * @return JSON text
     * @throws PgmqValidationException if the payload is null or cannot be serialized
     */
    public String toJson(Object payload) {
        if (payload == null) {
            throw new PgmqValidationException("Message payload must not be null");
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PgmqValidationException("Failed to serialize message to JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Encode payloads as a PostgreSQL array literal of JSON documents.
     *
     * @param payloads message payloads in send order
     * @return array literal suitable for {@code CAST(? AS jsonb[])}
     */
    public String toJsonArrayLiteral(List<?> payloads) {
        StringBuilder literal = new StringBuilder("{");
        for (int i = 0; i < payloads.size(); i++) {
            if (i > 0) literal.append(',');
            literal.append('"');
            appendEscaped(literal, toJson(payloads.get(i)));
            literal.append('"');
        }
        return literal.append('}').toString();
    }

    /**
     * Encode message ids as a PostgreSQL array literal.
     *
     * @param msgIds message ids
     * @return array literal suitable for {@code CAST(? AS bigint[])}
     */
    public String toIdArrayLiteral(Collection<Long> msgIds) {
        StringBuilder literal = new StringBuilder("{");
        boolean first = true;
        for (Long msgId : msgIds) {
            if (msgId == null) {
                throw new PgmqValidationException("Message ids must not contain null");
            }
            if (!first) literal.append(',');
            literal.append(msgId.longValue());
            first = false;
        }
        return literal.append('}').toString();
    }

    /**
     * Parse payload text returned by the store.
     *
     * <p>A jsonb column may hold any JSON document. Objects come back as
     * {@code Map<String, Object>}, arrays as {@code List<Object>}, scalars as
     * {@code String}, {@code Number} or {@code Boolean}.
     *
     * @param json JSON text, may be null
     * @return the payload, null for a null or blank document or a JSON {@code null}
     */
    public Object fromJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new PgmqException("Failed to deserialize message from JSON", e);
        }
    }

    // Inside a double-quoted array element only backslash and double quote are special
    private static void appendEscaped(StringBuilder target, String element) {
        for (int i = 0; i < element.length(); i++) {
            char c = element.charAt(i);
            if (c == '\\' || c == '"') {
                target.append('\\');
            }
            target.append(c);
        }
    }
}
