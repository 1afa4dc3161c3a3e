package com.amblue.agent.sql;

import java.util.List;

/**
 * Rows of a read-only query, in column order. {@code truncated} is set when the
 * row cap cut the result short.
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, boolean truncated) {

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
