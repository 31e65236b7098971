package io.schemawatch.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Number of objects per type in a monitored schema.
 */
public record ObjectCounts(int tables, int views, int procedures, int functions) {

    public static ObjectCounts empty() {
        return new ObjectCounts(0, 0, 0, 0);
    }

    public Map<String, Integer> asMap() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("tables", tables);
        m.put("views", views);
        m.put("procedures", procedures);
        m.put("functions", functions);
        return m;
    }

    /**
     * Non-zero deltas against {@code previous}, e.g. {@code "tables: +2"}, in type order.
     */
    public List<String> deltasSince(ObjectCounts previous) {
        ObjectCounts before = previous == null ? empty() : previous;
        Map<String, Integer> now = asMap();
        Map<String, Integer> then = before.asMap();

        List<String> deltas = new ArrayList<>(4);
        for (var e : now.entrySet()) {
            int diff = e.getValue() - then.getOrDefault(e.getKey(), 0);
            if (diff != 0) {
                deltas.add(e.getKey() + ": " + (diff > 0 ? "+" : "") + diff);
            }
        }
        return deltas;
    }
}
