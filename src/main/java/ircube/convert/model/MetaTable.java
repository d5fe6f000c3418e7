package ircube.convert.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of named per-pixel columns that all share one row count.
 *
 * <p>Tables are immutable; {@link #concat(MetaTable)} returns a new table with the
 * other table's columns appended after this one's.</p>
 */
public final class MetaTable {

    private final int rowCount;
    private final List<MetaColumn> columns;

    private MetaTable(int rowCount, List<MetaColumn> columns) {
        this.rowCount = rowCount;
        this.columns = columns;
    }

    public static MetaTable empty(int rowCount) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count must not be negative: " + rowCount);
        }
        return new MetaTable(rowCount, List.of());
    }

    /**
     * @throws IllegalArgumentException if a column length differs from {@code rowCount}
     *         or two columns share a name
     */
    public static MetaTable of(int rowCount, List<MetaColumn> columns) {
        MetaTable table = empty(rowCount);
        if (columns == null || columns.isEmpty()) {
            return table;
        }
        Set<String> names = new HashSet<>();
        for (MetaColumn column : columns) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException(String.format(
                        "Column '%s' has %d rows, expected %d", column.name(), column.size(), rowCount));
            }
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
        return new MetaTable(rowCount, Collections.unmodifiableList(new ArrayList<>(columns)));
    }

    /**
     * Appends the columns of {@code other} after the columns of this table.
     *
     * @throws IllegalArgumentException if the row counts differ or a column name repeats
     */
    public MetaTable concat(MetaTable other) {
        if (other.rowCount != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "Cannot concatenate tables with %d and %d rows", rowCount, other.rowCount));
        }
        List<MetaColumn> merged = new ArrayList<>(columns);
        merged.addAll(other.columns);
        return of(rowCount, merged);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<MetaColumn> getColumns() {
        return columns;
    }

    public MetaColumn getColumn(int index) {
        return columns.get(index);
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (MetaColumn column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public double get(int row, int column) {
        return columns.get(column).get(row);
    }

    @Override
    public String toString() {
        return "MetaTable[" + rowCount + " rows, columns=" + getColumnNames() + "]";
    }
}
