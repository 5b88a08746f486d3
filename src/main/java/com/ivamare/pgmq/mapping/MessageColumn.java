package com.ivamare.pgmq.mapping;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Column contract for rows of type {@code pgmq.message_record}.
 *
 * <p>Statements select exactly these expressions in this order and the row mapper reads
 * them by position. The payload is cast to text so both drivers hand back a plain string.
 */
public enum MessageColumn {

    MSG_ID("msg_id"),
    READ_CT("read_ct"),
    ENQUEUED_AT("enqueued_at"),
    VT("vt"),
    MESSAGE("message::text");

    private static final String SELECT_LIST = Arrays.stream(values())
        .map(MessageColumn::expression)
        .collect(Collectors.joining(", "));

    private final String expression;

    MessageColumn(String expression) {
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }

    public int index() {
        return ordinal();
    }

    /**
     * @return the comma separated select list, e.g. {@code msg_id, read_ct, ...}
     */
    public static String selectList() {
        return SELECT_LIST;
    }

    public static int width() {
        return values().length;
    }
}
