package gr.imsi.athenarc.pipeline.query;

import java.util.Locale;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * Fixed set of operators a filter predicate may use.
 */
public enum FilterOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    IN("IN"),
    NOT_IN("NOT IN"),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUALS("<="),
    LIKE("LIKE"),
    ILIKE("ILIKE"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL"),
    /** Already rendered predicate produced by a row-level policy. Not accepted from callers. */
    EXPRESSION("EXPRESSION");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean takesValue() {
        return this != IS_NULL && this != IS_NOT_NULL;
    }

    public boolean takesCollection() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Resolves an operator from its symbol ("==", "NOT IN") or its constant name ("NOT_IN").
     */
    public static FilterOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new QueryValidationException("Missing filter operator");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if ("=".equals(normalized)) {
            return EQUALS;
        }
        if ("<>".equals(normalized)) {
            return NOT_EQUALS;
        }
        for (FilterOperator operator : values()) {
            if (operator == EXPRESSION) {
                continue;
            }
            if (operator.symbol.equals(normalized) || operator.name().equals(normalized)) {
                return operator;
            }
        }
        throw new QueryValidationException("Unsupported filter operator: " + symbol);
    }
}
