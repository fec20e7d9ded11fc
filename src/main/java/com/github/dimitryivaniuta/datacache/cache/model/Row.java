package com.github.dimitryivaniuta.datacache.cache.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One tabular record: column name -> value, in source column order.
 *
 * <p>Values are {@code String}, {@code Long}, {@code Double}, {@code LocalDate},
 * {@code LocalDateTime} or {@code null} (empty cell).
 */
public record Row(@JsonValue Map<String, Object> values) {

    public Row {
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Builds a row from alternating column/value arguments: {@code Row.of("A", 1L, "B", "x")}.
     */
    public static Row of(Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("columnsAndValues must come in pairs");
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            m.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new Row(m);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }
}
