package gr.imsi.athenarc.pipeline.datasource;

import java.util.Objects;

/**
 * A saved metric: a named aggregate SQL expression such as {@code SUM(amount)}.
 */
public final class MetricDefinition {

    private final String name;
    private final String expression;

    public MetricDefinition(String name, String expression) {
        this.name = Objects.requireNonNull(name, "name");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public String getName() {
        return name;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricDefinition)) return false;
        MetricDefinition that = (MetricDefinition) o;
        return name.equals(that.name) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expression);
    }

    @Override
    public String toString() {
        return name + "=" + expression;
    }
}
