package gr.imsi.athenarc.pipeline.datasource;

import java.util.Objects;
import java.util.Optional;

import gr.imsi.athenarc.pipeline.domain.ColumnType;

/**
 * A column a datasource exposes. A column may be backed by a SQL expression
 * instead of a physical column of the same name.
 */
public final class ColumnDefinition {

    private final String name;
    private final ColumnType type;
    private final String expression;

    public ColumnDefinition(String name, ColumnType type, String expression) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type == null ? ColumnType.UNKNOWN : type;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    public Optional<String> getExpression() {
        return Optional.ofNullable(expression);
    }

    public boolean isTemporal() {
        return type == ColumnType.TIMESTAMP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDefinition)) return false;
        ColumnDefinition that = (ColumnDefinition) o;
        return name.equals(that.name) && type == that.type && Objects.equals(expression, that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, expression);
    }

    @Override
    public String toString() {
        return name + ":" + type + (expression == null ? "" : "=" + expression);
    }
}
