package gr.imsi.athenarc.pipeline.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * Column-typed, row-oriented data. Every row holds exactly one value per column;
 * the constructor rejects anything else, so the invariant holds after every
 * transformation that produces a new instance.
 */
public final class TabularResult {

    private final List<String> columns;
    private final List<ColumnType> types;
    private final List<List<Object>> rows;

    public TabularResult(List<String> columns, List<ColumnType> types, List<? extends List<?>> rows) {
        if (columns.size() != types.size()) {
            throw new IllegalArgumentException("Got " + columns.size() + " columns but " + types.size() + " type tags");
        }
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (column == null) {
                throw new IllegalArgumentException("Column names must not be null");
            }
            if (!seen.add(column)) {
                throw new IllegalArgumentException("Duplicate column name: " + column);
            }
        }
        this.columns = ImmutableList.copyOf(columns);
        this.types = ImmutableList.copyOf(types);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<?> row = rows.get(i);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size() + " values, expected " + columns.size());
            }
            // rows may legitimately contain nulls, so no ImmutableList here
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TabularResult empty(List<String> columns, List<ColumnType> types) {
        return new TabularResult(columns, types, List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<ColumnType> getTypes() {
        return types;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * @return the position of the column, or -1 if absent
     */
    public int indexOf(String column) {
        return columns.indexOf(column);
    }

    public ColumnType getType(String column) {
        int index = requireColumn(column);
        return types.get(index);
    }

    public Object getValue(int row, String column) {
        return rows.get(row).get(requireColumn(column));
    }

    /**
     * @return all values of one column, top to bottom
     */
    public List<Object> getColumnValues(String column) {
        int index = requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public int requireColumn(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column '" + column + "', available columns are " + columns);
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TabularResult)) return false;
        TabularResult that = (TabularResult) o;
        return columns.equals(that.columns) && types.equals(that.types) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, types, rows);
    }

    @Override
    public String toString() {
        return "TabularResult{columns=" + columns + ", types=" + types + ", rows=" + rows.size() + '}';
    }

    /**
     * Incremental construction of a result, column definitions first.
     */
    public static class Builder {
        private final List<String> columns = new ArrayList<>();
        private final List<ColumnType> types = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        public Builder column(String name, ColumnType type) {
            columns.add(name);
            types.add(type);
            return this;
        }

        public Builder row(Object... values) {
            List<Object> row = new ArrayList<>(values.length);
            Collections.addAll(row, values);
            rows.add(row);
            return this;
        }

        public Builder row(List<?> values) {
            rows.add(new ArrayList<>(values));
            return this;
        }

        public TabularResult build() {
            return new TabularResult(columns, types, rows);
        }
    }
}
