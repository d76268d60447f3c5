package gr.imsi.athenarc.pipeline.datasource.dialect;

import java.time.Instant;

/**
 * Trino places OFFSET before LIMIT and reads instants through
 * {@code from_iso8601_timestamp}.
 */
public class TrinoDialect extends AbstractSqlDialect {

    public static final String NAME = "trino";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String timestampLiteral(Instant instant) {
        return "from_iso8601_timestamp(" + stringLiteral(instant.toString()) + ")";
    }

    @Override
    public String limitOffset(Integer limit, Integer offset) {
        StringBuilder clause = new StringBuilder();
        if (offset != null && offset > 0) {
            clause.append("OFFSET ").append(offset);
        }
        if (limit != null) {
            if (clause.length() > 0) {
                clause.append(' ');
            }
            clause.append("LIMIT ").append(limit);
        }
        return clause.toString();
    }
}
