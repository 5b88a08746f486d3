package com.ivamare.pgmq.mapping;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Column contract for rows of type {@code pgmq.metrics_result}.
 */
public enum MetricsColumn {

    QUEUE_NAME("queue_name"),
    QUEUE_LENGTH("queue_length"),
    NEWEST_MSG_AGE_SEC("newest_msg_age_sec"),
    OLDEST_MSG_AGE_SEC("oldest_msg_age_sec"),
    TOTAL_MESSAGES("total_messages"),
    SCRAPE_TIME("scrape_time");

    private final String column;

    MetricsColumn(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public int index() {
        return ordinal();
    }

    /**
     * Build the select list with every column qualified by a table alias.
     *
     * @param alias alias of the metrics row source
     * @return e.g. {@code m.queue_name, m.queue_length, ...}
     */
    public static String selectList(String alias) {
        return Arrays.stream(values())
            .map(c -> alias + "." + c.column)
            .collect(Collectors.joining(", "));
    }

    public static int width() {
        return values().length;
    }
}
