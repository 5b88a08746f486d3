package com.ivamare.pgmq.executor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row returned by a {@link QueryExecutor}, as raw column values in select-list order.
 *
 * <p>Values are whatever the driver produced (JDBC {@code getObject} or R2DBC
 * {@code Row.get}); turning them into typed records is the row mapper's job.
 */
public final class ResultRow {

    private final List<Object> values;

    public ResultRow(List<?> values) {
        // Columns may be SQL NULL, so List.copyOf is not an option
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ResultRow of(Object... values) {
        return new ResultRow(Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    /**
     * Get a column value by zero-based position.
     *
     * @param index column position
     * @return the raw value, possibly null
     */
    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResultRow other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "ResultRow" + values;
    }
}
