package gr.imsi.athenarc.pipeline.datasource.dialect;

import gr.imsi.athenarc.pipeline.query.TimeGrain;

/**
 * ANSI defaults shared by the supported backends: double-quoted identifiers,
 * single-quoted strings and {@code DATE_TRUNC} time buckets.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    @Override
    public String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    @Override
    public String stringLiteral(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    @Override
    public String truncateTime(String expression, TimeGrain grain) {
        return "DATE_TRUNC('" + grain.getUnit() + "', " + expression + ")";
    }

    @Override
    public String toString() {
        return getName();
    }
}
