package gr.imsi.athenarc.pipeline.datasource.dialect;

import java.time.Instant;

import gr.imsi.athenarc.pipeline.query.TimeGrain;

/**
 * Backend-specific rendering rules used by the query compiler.
 */
public interface SqlDialect {

    /**
     * @return the language tag reported with compiled queries, e.g. {@code postgresql}
     */
    String getName();

    String quoteIdentifier(String identifier);

    String stringLiteral(String value);

    String timestampLiteral(Instant instant);

    /**
     * @return an expression truncating {@code expression} to the start of its grain bucket
     */
    String truncateTime(String expression, TimeGrain grain);

    /**
     * @return the row-window clause, or an empty string when neither bound is set
     */
    String limitOffset(Integer limit, Integer offset);
}
