package com.chemdata.dwar.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column name to {@link ColumnProperties}, in declaration order.
 * A name declared twice keeps only its last declaration.
 */
public class ColumnMetadata {

    private final Map<String, ColumnProperties> columns = new LinkedHashMap<>();

    /**
     * Starts a fresh attribute set for the column, replacing any earlier declaration.
     */
    public ColumnProperties declare(String columnName) {
        ColumnProperties props = new ColumnProperties();
        columns.remove(columnName);
        columns.put(columnName, props);
        return props;
    }

    public Optional<ColumnProperties> get(String columnName) {
        return Optional.ofNullable(columns.get(columnName));
    }

    public boolean contains(String columnName) {
        return columns.containsKey(columnName);
    }

    public Map<String, ColumnProperties> asMap() {
        return Collections.unmodifiableMap(columns);
    }

    public List<String> getIdcodeColumns() {
        return columns.entrySet().stream()
                .filter(e -> e.getValue().isIdcode())
                .map(Map.Entry::getKey)
                .toList();
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
