package com.scheduler.lifecycle.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Helpers for reading values out of graph query rows.
 */
final class GraphRows {

    private GraphRows() {
    }

    static long count(List<Map<String, Object>> results, String column) {
        if (results.isEmpty()) return 0;
        return longValue(results.get(0).get(column));
    }

    static long longValue(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isEmpty()) {
            return Long.parseLong(s);
        }
        return 0;
    }

    static Instant instant(Object epochMillis) {
        return Instant.ofEpochMilli(longValue(epochMillis));
    }

    static String string(Object value) {
        return value != null ? value.toString() : null;
    }
}
