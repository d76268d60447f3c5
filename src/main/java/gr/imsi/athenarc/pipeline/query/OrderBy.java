package gr.imsi.athenarc.pipeline.query;

import java.util.Objects;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

public final class OrderBy {

    private final String column;
    private final SortDirection direction;

    public OrderBy(String column, SortDirection direction) {
        if (column == null || column.isBlank()) {
            throw new QueryValidationException("Ordering column is required");
        }
        this.column = column;
        this.direction = direction == null ? SortDirection.ASC : direction;
    }

    public static OrderBy asc(String column) {
        return new OrderBy(column, SortDirection.ASC);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, SortDirection.DESC);
    }

    public String getColumn() {
        return column;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderBy)) return false;
        OrderBy orderBy = (OrderBy) o;
        return column.equals(orderBy.column) && direction == orderBy.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, direction);
    }

    @Override
    public String toString() {
        return column + " " + direction;
    }
}
