package gr.imsi.athenarc.pipeline.query;

import java.util.Collection;
import java.util.Objects;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * A {column, operator, value} predicate. Row-level predicates injected from a
 * policy are carried as pre-rendered {@link FilterOperator#EXPRESSION} filters
 * tagged with the policy name.
 */
public final class Filter {

    private final String column;
    private final FilterOperator operator;
    private final Object value;
    private final String policyName;

    private Filter(String column, FilterOperator operator, Object value, String policyName) {
        this.column = column;
        this.operator = operator;
        this.value = value;
        this.policyName = policyName;
    }

    public static Filter of(String column, FilterOperator operator, Object value) {
        if (column == null || column.isBlank()) {
            throw new QueryValidationException("Filter column is required");
        }
        if (operator == null) {
            throw new QueryValidationException("Filter operator is required for column " + column);
        }
        if (operator == FilterOperator.EXPRESSION) {
            throw new QueryValidationException("Expression filters can only be produced by row-level policies");
        }
        if (operator.takesCollection() && !(value instanceof Collection || value instanceof Object[])) {
            throw new QueryValidationException("Operator " + operator.getSymbol() + " on column " + column + " requires a list of values");
        }
        return new Filter(column, operator, operator.takesValue() ? ImmutableValues.copyOf(value) : null, null);
    }

    public static Filter of(String column, FilterOperator operator) {
        return of(column, operator, null);
    }

    public static Filter rowLevel(String policyName, String clause) {
        if (clause == null || clause.isBlank()) {
            throw new IllegalArgumentException("Row-level clause of policy " + policyName + " is empty");
        }
        return new Filter(null, FilterOperator.EXPRESSION, clause, policyName);
    }

    public String getColumn() {
        return column;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * @return the policy this predicate was injected from, or null for caller filters
     */
    public String getPolicyName() {
        return policyName;
    }

    public boolean isRowLevel() {
        return operator == FilterOperator.EXPRESSION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Filter)) return false;
        Filter filter = (Filter) o;
        return Objects.equals(column, filter.column)
            && operator == filter.operator
            && Objects.equals(value, filter.value)
            && Objects.equals(policyName, filter.policyName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, value, policyName);
    }

    @Override
    public String toString() {
        if (isRowLevel()) {
            return "RowLevel{" + policyName + "}";
        }
        return column + " " + operator.getSymbol() + (operator.takesValue() ? " " + value : "");
    }
}
