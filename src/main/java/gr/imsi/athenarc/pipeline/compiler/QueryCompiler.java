package gr.imsi.athenarc.pipeline.compiler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.pipeline.datasource.ColumnDefinition;
import gr.imsi.athenarc.pipeline.datasource.DatasourceSchema;
import gr.imsi.athenarc.pipeline.datasource.MetricDefinition;
import gr.imsi.athenarc.pipeline.datasource.dialect.SqlDialect;
import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryValidationException;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.Metric;
import gr.imsi.athenarc.pipeline.query.OrderBy;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.query.SortDirection;
import gr.imsi.athenarc.pipeline.query.TimeGrain;
import gr.imsi.athenarc.pipeline.query.TimeRange;

/**
 * Compiles a policy-augmented descriptor into a single SQL statement:
 *
 * <pre>
 * SELECT [time bucket AS "__timestamp",] dimensions, metrics
 * FROM source
 * WHERE (where) AND filters AND time range
 * GROUP BY bucket, dimensions      -- only when metrics are requested
 * HAVING ...
 * ORDER BY ...
 * LIMIT / OFFSET                   -- dialect specific
 * </pre>
 *
 * Every column and saved metric is resolved through the datasource schema, so a
 * name the schema does not know is rejected before anything reaches the backend.
 */
public class QueryCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(QueryCompiler.class);

    public static final String TIMESTAMP_LABEL = QueryDescriptor.TIMESTAMP_LABEL;

    private final int maxRowLimit;

    public QueryCompiler(int maxRowLimit) {
        Preconditions.checkArgument(maxRowLimit > 0, "maxRowLimit must be positive");
        this.maxRowLimit = maxRowLimit;
    }

    public NativeQuery compile(QueryDescriptor descriptor, DatasourceSchema schema, SqlDialect dialect) {
        Compilation compilation = new Compilation(descriptor, schema, dialect);
        String sql = compilation.render();
        LOG.debug("Compiled {} query for {}:\n{}", dialect.getName(), schema.getDatasourceId(), sql);
        return new NativeQuery(schema.getDatasourceId(), sql, dialect.getName());
    }

    public int getMaxRowLimit() {
        return maxRowLimit;
    }

    private static QueryValidationException invalid(String message) {
        return new QueryValidationException(PipelineStage.COMPILED, message);
    }

    /**
     * State of a single compile call.
     */
    private final class Compilation {
        private final QueryDescriptor descriptor;
        private final DatasourceSchema schema;
        private final SqlDialect dialect;

        private Compilation(QueryDescriptor descriptor, DatasourceSchema schema, SqlDialect dialect) {
            this.descriptor = descriptor;
            this.schema = schema;
            this.dialect = dialect;
        }

        private String render() {
            List<String> projection = new ArrayList<>();
            List<String> groupBy = new ArrayList<>();

            Optional<TimeGrain> grain = descriptor.getTimeGrain();
            if (grain.isPresent()) {
                String bucket = dialect.truncateTime(timeColumnExpression("A time grain"), grain.get());
                projection.add(bucket + " AS " + dialect.quoteIdentifier(TIMESTAMP_LABEL));
                groupBy.add(bucket);
            }
            for (String dimension : descriptor.getDimensions()) {
                String expression = columnExpression(dimension);
                projection.add(aliased(expression, dimension));
                groupBy.add(expression);
            }
            for (Metric metric : descriptor.getMetrics()) {
                projection.add(metricExpression(metric) + " AS " + dialect.quoteIdentifier(metric.getLabel()));
            }

            StringBuilder sql = new StringBuilder();
            sql.append("SELECT ").append(String.join(", ", projection)).append('\n');
            sql.append("FROM ").append(schema.getSource());

            List<String> conditions = whereConditions();
            if (!conditions.isEmpty()) {
                sql.append('\n').append("WHERE ").append(String.join(" AND ", conditions));
            }

            boolean aggregated = !descriptor.getMetrics().isEmpty();
            if (aggregated && !groupBy.isEmpty()) {
                sql.append('\n').append("GROUP BY ").append(String.join(", ", groupBy));
            }

            if (!descriptor.getHaving().isEmpty()) {
                if (!aggregated) {
                    throw invalid("HAVING predicates require at least one metric");
                }
                List<String> having = new ArrayList<>();
                for (Filter filter : descriptor.getHaving()) {
                    having.add(predicate(postAggregationExpression(filter.getColumn()), filter, null));
                }
                sql.append('\n').append("HAVING ").append(String.join(" AND ", having));
            }

            if (!descriptor.getOrderBy().isEmpty()) {
                List<String> orderBy = new ArrayList<>();
                for (OrderBy order : descriptor.getOrderBy()) {
                    orderBy.add(orderExpression(order.getColumn())
                        + (order.getDirection() == SortDirection.DESC ? " DESC" : " ASC"));
                }
                sql.append('\n').append("ORDER BY ").append(String.join(", ", orderBy));
            }

            int limit = Math.min(descriptor.getRowLimit().orElse(maxRowLimit), maxRowLimit);
            String window = dialect.limitOffset(limit, descriptor.getRowOffset().orElse(null));
            if (!window.isEmpty()) {
                sql.append('\n').append(window);
            }
            return sql.toString();
        }

        private List<String> whereConditions() {
            List<String> conditions = new ArrayList<>();
            descriptor.getWhere()
                .filter(where -> !where.isBlank())
                .ifPresent(where -> conditions.add("(" + where + ")"));
            for (Filter filter : descriptor.getFilters()) {
                if (filter.isRowLevel()) {
                    conditions.add("(" + filter.getValue() + ")");
                } else {
                    ColumnType type = schema.getColumn(filter.getColumn()).map(ColumnDefinition::getType).orElse(null);
                    conditions.add(predicate(columnExpression(filter.getColumn()), filter, type));
                }
            }
            Optional<TimeRange> range = descriptor.getTimeRange();
            if (range.isPresent() && (range.get().getFrom() != null || range.get().getTo() != null)) {
                String column = timeColumnExpression("A time range");
                if (range.get().getFrom() != null) {
                    conditions.add(column + " >= " + dialect.timestampLiteral(range.get().getFrom()));
                }
                if (range.get().getTo() != null) {
                    conditions.add(column + " < " + dialect.timestampLiteral(range.get().getTo()));
                }
            }
            return conditions;
        }

        private String predicate(String expression, Filter filter, ColumnType columnType) {
            Object value = filter.getValue();
            switch (filter.getOperator()) {
                case EQUALS:
                    return value == null ? expression + " IS NULL" : expression + " = " + literal(value, columnType, filter);
                case NOT_EQUALS:
                    return value == null ? expression + " IS NOT NULL" : expression + " <> " + literal(value, columnType, filter);
                case GREATER_THAN:
                    return expression + " > " + requiredLiteral(value, columnType, filter);
                case GREATER_THAN_OR_EQUALS:
                    return expression + " >= " + requiredLiteral(value, columnType, filter);
                case LESS_THAN:
                    return expression + " < " + requiredLiteral(value, columnType, filter);
                case LESS_THAN_OR_EQUALS:
                    return expression + " <= " + requiredLiteral(value, columnType, filter);
                case LIKE:
                    return expression + " LIKE " + pattern(value, filter);
                case ILIKE:
                    return "UPPER(" + expression + ") LIKE UPPER(" + pattern(value, filter) + ")";
                case IS_NULL:
                    return expression + " IS NULL";
                case IS_NOT_NULL:
                    return expression + " IS NOT NULL";
                case IN:
                    return membership(expression, filter, columnType, false);
                case NOT_IN:
                    return membership(expression, filter, columnType, true);
                default:
                    throw invalid("Operator " + filter.getOperator().getSymbol() + " cannot be applied to column " + filter.getColumn());
            }
        }

        private String membership(String expression, Filter filter, ColumnType columnType, boolean negated) {
            if (!(filter.getValue() instanceof Collection) || ((Collection<?>) filter.getValue()).isEmpty()) {
                throw invalid("Operator " + filter.getOperator().getSymbol() + " on column " + filter.getColumn()
                    + " requires a non-empty list of values");
            }
            List<String> literals = new ArrayList<>();
            boolean withNull = false;
            for (Object element : (Collection<?>) filter.getValue()) {
                if (element == null) {
                    withNull = true;
                } else {
                    literals.add(literal(element, columnType, filter));
                }
            }
            if (literals.isEmpty()) {
                return expression + (negated ? " IS NOT NULL" : " IS NULL");
            }
            String in = expression + " IN (" + String.join(", ", literals) + ")";
            if (!withNull) {
                return negated ? expression + " NOT IN (" + String.join(", ", literals) + ")" : in;
            }
            String either = in + " OR " + expression + " IS NULL";
            return negated ? "NOT (" + either + ")" : "(" + either + ")";
        }

        private String pattern(Object value, Filter filter) {
            if (!(value instanceof String)) {
                throw invalid("Operator " + filter.getOperator().getSymbol() + " on column " + filter.getColumn()
                    + " requires a string pattern");
            }
            return dialect.stringLiteral((String) value);
        }

        private String requiredLiteral(Object value, ColumnType columnType, Filter filter) {
            if (value == null) {
                throw invalid("Operator " + filter.getOperator().getSymbol() + " on column " + filter.getColumn()
                    + " requires a value");
            }
            return literal(value, columnType, filter);
        }

        private String literal(Object value, ColumnType columnType, Filter filter) {
            if (value instanceof String) {
                if (columnType == ColumnType.TIMESTAMP) {
                    Optional<Instant> instant = parseInstant((String) value);
                    if (instant.isPresent()) {
                        return dialect.timestampLiteral(instant.get());
                    }
                }
                return dialect.stringLiteral((String) value);
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
                return value.toString();
            }
            if (value instanceof Double || value instanceof Float) {
                double number = ((Number) value).doubleValue();
                if (Double.isNaN(number) || Double.isInfinite(number)) {
                    throw invalid("Value " + value + " of column " + filter.getColumn() + " cannot be rendered");
                }
                return BigDecimal.valueOf(number).toPlainString();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).toPlainString();
            }
            if (value instanceof Boolean) {
                return ((Boolean) value) ? "TRUE" : "FALSE";
            }
            if (value instanceof Instant) {
                return dialect.timestampLiteral((Instant) value);
            }
            throw invalid("Value of type " + value.getClass().getSimpleName() + " for column " + filter.getColumn()
                + " cannot be rendered");
        }

        private String columnExpression(String name) {
            ColumnDefinition column = schema.getColumn(name)
                .orElseThrow(() -> invalid("Unknown column '" + name + "' in datasource " + schema.getDatasourceId()));
            return column.getExpression().orElseGet(() -> dialect.quoteIdentifier(column.getName()));
        }

        private String timeColumnExpression(String requester) {
            String name = descriptor.getTimeColumn()
                .or(schema::getMainTemporalColumn)
                .orElseThrow(() -> invalid(requester + " requires a time column but datasource "
                    + schema.getDatasourceId() + " has none"));
            return columnExpression(name);
        }

        private String metricExpression(Metric metric) {
            if (metric.isSaved()) {
                return schema.getMetric(metric.getLabel())
                    .map(MetricDefinition::getExpression)
                    .orElseThrow(() -> invalid("Unknown metric '" + metric.getLabel() + "' in datasource "
                        + schema.getDatasourceId()));
            }
            String argument = metric.getColumn() == null ? "*" : columnExpression(metric.getColumn());
            switch (metric.getAggregation()) {
                case COUNT:
                    return "COUNT(" + argument + ")";
                case COUNT_DISTINCT:
                    return "COUNT(DISTINCT " + argument + ")";
                case SUM:
                    return "SUM(" + argument + ")";
                case AVG:
                    return "AVG(" + argument + ")";
                case MIN:
                    return "MIN(" + argument + ")";
                case MAX:
                    return "MAX(" + argument + ")";
                default:
                    throw invalid("Unsupported aggregate " + metric.getAggregation());
            }
        }

        private String postAggregationExpression(String name) {
            for (Metric metric : descriptor.getMetrics()) {
                if (metric.getLabel().equals(name)) {
                    return metricExpression(metric);
                }
            }
            Optional<MetricDefinition> saved = schema.getMetric(name);
            if (saved.isPresent()) {
                return saved.get().getExpression();
            }
            return columnExpression(name);
        }

        private String orderExpression(String name) {
            if (descriptor.getMetricLabels().contains(name) || TIMESTAMP_LABEL.equals(name)) {
                return dialect.quoteIdentifier(name);
            }
            if (schema.getColumn(name).isEmpty() && schema.getMetric(name).isPresent()) {
                return schema.getMetric(name).get().getExpression();
            }
            return columnExpression(name);
        }

        private String aliased(String expression, String label) {
            String quoted = dialect.quoteIdentifier(label);
            return expression.equals(quoted) ? quoted : expression + " AS " + quoted;
        }
    }

    private static Optional<Instant> parseInstant(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(Instant.parse(value));
            } catch (DateTimeParseException inner) {
                return Optional.empty();
            }
        }
    }
}
