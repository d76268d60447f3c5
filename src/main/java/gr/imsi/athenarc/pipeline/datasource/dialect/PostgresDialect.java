package gr.imsi.athenarc.pipeline.datasource.dialect;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class PostgresDialect extends AbstractSqlDialect {

    public static final String NAME = "postgresql";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String timestampLiteral(Instant instant) {
        return "TIMESTAMP '" + TIMESTAMP_FORMAT.format(instant) + "'";
    }

    @Override
    public String limitOffset(Integer limit, Integer offset) {
        StringBuilder clause = new StringBuilder();
        if (limit != null) {
            clause.append("LIMIT ").append(limit);
        }
        if (offset != null && offset > 0) {
            if (clause.length() > 0) {
                clause.append(' ');
            }
            clause.append("OFFSET ").append(offset);
        }
        return clause.toString();
    }
}
