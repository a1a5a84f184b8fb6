package com.chemdata.dwar.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.HashSet;

/**
 * Named, positionally aligned rows of text cells. A {@code null} cell means no value.
 *
 * Every row is exactly as wide as the column name list. Column names may repeat:
 * lookups by name see the first copy, {@link #dropColumns} removes every copy.
 */
public class DwarTable {

    private final List<String> columnNames;
    private final List<List<String>> rows;

    public DwarTable(List<String> columnNames, List<List<String>> rows) {
        this.columnNames = new ArrayList<>(columnNames);
        this.rows = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            this.rows.add(fitToWidth(row, this.columnNames.size()));
        }
    }

    public static DwarTable empty() {
        return new DwarTable(List.of(), List.of());
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(columnNames);
    }

    public List<List<String>> getRows() {
        return rows.stream().map(Collections::unmodifiableList).toList();
    }

    public List<String> getRow(int index) {
        return Collections.unmodifiableList(rows.get(index));
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columnNames.contains(name);
    }

    /**
     * Cell values of the first column with the given name, one per row.
     */
    public List<String> getColumn(String name) {
        int index = requireIndex(name);
        List<String> values = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public String getValue(int row, String column) {
        return rows.get(row).get(requireIndex(column));
    }

    /**
     * Sets a column, replacing an existing one of the same name or appending a new one.
     */
    public void putColumn(String name, List<String> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Column " + name + " has " + values.size()
                    + " values but the table has " + rows.size() + " rows");
        }
        int index = columnNames.indexOf(name);
        if (index < 0) {
            columnNames.add(name);
            for (int i = 0; i < rows.size(); i++) {
                rows.get(i).add(values.get(i));
            }
        } else {
            for (int i = 0; i < rows.size(); i++) {
                rows.get(i).set(index, values.get(i));
            }
        }
    }

    /**
     * Removes every column whose name is in {@code names}. Unknown names are ignored.
     *
     * @return the names actually removed, in table order
     */
    public List<String> dropColumns(Collection<String> names) {
        Set<String> wanted = new HashSet<>(names);
        List<String> removed = new ArrayList<>();
        for (int i = columnNames.size() - 1; i >= 0; i--) {
            String name = columnNames.get(i);
            if (wanted.contains(name)) {
                columnNames.remove(i);
                for (List<String> row : rows) {
                    row.remove(i);
                }
                removed.add(0, name);
            }
        }
        return removed;
    }

    /**
     * Drops rows in which no cell holds a non-blank value.
     *
     * @return number of rows removed
     */
    public int dropEmptyRows() {
        int before = rows.size();
        rows.removeIf(DwarTable::isBlankRow);
        return before - rows.size();
    }

    private static boolean isBlankRow(List<String> row) {
        return row.stream().allMatch(cell -> cell == null || cell.isBlank());
    }

    private int requireIndex(String name) {
        int index = columnNames.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No such column: " + name);
        }
        return index;
    }

    private static List<String> fitToWidth(List<String> row, int width) {
        List<String> fitted = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            fitted.add(i < row.size() ? row.get(i) : null);
        }
        return fitted;
    }

    @Override
    public String toString() {
        return "DwarTable[" + rows.size() + " rows x " + columnNames.size() + " columns " + columnNames + "]";
    }
}
