package gr.imsi.athenarc.pipeline.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * Builder class for creating QueryDescriptor objects using a fluent interface.
 */
public class QueryDescriptorBuilder {
    private DatasourceRef datasource;
    private final List<String> dimensions = new ArrayList<>();
    private final List<Metric> metrics = new ArrayList<>();
    private final List<Filter> filters = new ArrayList<>();
    private String where;
    private final List<Filter> having = new ArrayList<>();
    private final List<OrderBy> orderBy = new ArrayList<>();
    private Integer rowLimit;
    private Integer rowOffset;
    private String timeColumn;
    private TimeGrain timeGrain;
    private TimeRange timeRange;
    private final Map<String, Object> extras = new LinkedHashMap<>();
    private final List<PostProcessingOperation> postProcessing = new ArrayList<>();
    private ResultFormat resultFormat = ResultFormat.JSON;
    private ResultType resultType = ResultType.FULL;

    public QueryDescriptorBuilder() {
    }

    QueryDescriptorBuilder(QueryDescriptor descriptor) {
        this.datasource = descriptor.getDatasource();
        this.dimensions.addAll(descriptor.getDimensions());
        this.metrics.addAll(descriptor.getMetrics());
        this.filters.addAll(descriptor.getFilters());
        this.where = descriptor.getWhere().orElse(null);
        this.having.addAll(descriptor.getHaving());
        this.orderBy.addAll(descriptor.getOrderBy());
        this.rowLimit = descriptor.getRowLimit().orElse(null);
        this.rowOffset = descriptor.getRowOffset().orElse(null);
        this.timeColumn = descriptor.getTimeColumn().orElse(null);
        this.timeGrain = descriptor.getTimeGrain().orElse(null);
        this.timeRange = descriptor.getTimeRange().orElse(null);
        this.extras.putAll(descriptor.getExtras());
        this.postProcessing.addAll(descriptor.getPostProcessing());
        this.resultFormat = descriptor.getResultFormat();
        this.resultType = descriptor.getResultType();
    }

    public QueryDescriptorBuilder withDatasource(DatasourceRef datasource) {
        this.datasource = datasource;
        return this;
    }

    public QueryDescriptorBuilder withDatasource(String id) {
        return withDatasource(DatasourceRef.of(id));
    }

    /**
     * Add dimension columns. Their order is the output column order.
     */
    public QueryDescriptorBuilder withDimensions(String... columns) {
        this.dimensions.addAll(Arrays.asList(columns));
        return this;
    }

    public QueryDescriptorBuilder withDimensions(List<String> columns) {
        this.dimensions.addAll(columns);
        return this;
    }

    public QueryDescriptorBuilder withMetric(Metric metric) {
        this.metrics.add(metric);
        return this;
    }

    /**
     * Add saved metrics by name.
     */
    public QueryDescriptorBuilder withMetrics(String... names) {
        for (String name : names) {
            this.metrics.add(Metric.saved(name));
        }
        return this;
    }

    public QueryDescriptorBuilder withMetrics(List<Metric> metrics) {
        this.metrics.addAll(metrics);
        return this;
    }

    public QueryDescriptorBuilder withFilter(String column, FilterOperator operator, Object value) {
        this.filters.add(Filter.of(column, operator, value));
        return this;
    }

    public QueryDescriptorBuilder withFilter(Filter filter) {
        this.filters.add(filter);
        return this;
    }

    public QueryDescriptorBuilder withFilters(List<Filter> filters) {
        this.filters.addAll(filters);
        return this;
    }

    /**
     * Set a free-form predicate. It is passed to the backend as is.
     */
    public QueryDescriptorBuilder withWhere(String where) {
        this.where = where == null || where.isBlank() ? null : where;
        return this;
    }

    public QueryDescriptorBuilder withHaving(String column, FilterOperator operator, Object value) {
        this.having.add(Filter.of(column, operator, value));
        return this;
    }

    public QueryDescriptorBuilder withHaving(List<Filter> having) {
        this.having.addAll(having);
        return this;
    }

    public QueryDescriptorBuilder withOrderBy(String column, SortDirection direction) {
        this.orderBy.add(new OrderBy(column, direction));
        return this;
    }

    public QueryDescriptorBuilder withOrderBy(List<OrderBy> orderBy) {
        this.orderBy.addAll(orderBy);
        return this;
    }

    public QueryDescriptorBuilder withRowLimit(Integer rowLimit) {
        this.rowLimit = rowLimit;
        return this;
    }

    public QueryDescriptorBuilder withRowOffset(Integer rowOffset) {
        this.rowOffset = rowOffset;
        return this;
    }

    /**
     * Set the temporal column the time range and time grain apply to.
     */
    public QueryDescriptorBuilder withTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
        return this;
    }

    public QueryDescriptorBuilder withTimeGrain(TimeGrain timeGrain) {
        this.timeGrain = timeGrain;
        return this;
    }

    public QueryDescriptorBuilder withTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
        return this;
    }

    /**
     * Set both ends of the [from, to) time range in a single call. Either may be null.
     */
    public QueryDescriptorBuilder withTimeRange(Instant from, Instant to) {
        this.timeRange = new TimeRange(from, to);
        return this;
    }

    public QueryDescriptorBuilder withExtra(String key, Object value) {
        this.extras.put(key, value);
        return this;
    }

    public QueryDescriptorBuilder withExtras(Map<String, ?> extras) {
        this.extras.putAll(extras);
        return this;
    }

    public QueryDescriptorBuilder withPostProcessing(String operation, Map<String, ?> options) {
        this.postProcessing.add(new PostProcessingOperation(operation, options));
        return this;
    }

    public QueryDescriptorBuilder withPostProcessing(List<PostProcessingOperation> operations) {
        this.postProcessing.addAll(operations);
        return this;
    }

    public QueryDescriptorBuilder withResultFormat(ResultFormat resultFormat) {
        this.resultFormat = resultFormat;
        return this;
    }

    public QueryDescriptorBuilder withResultType(ResultType resultType) {
        this.resultType = resultType;
        return this;
    }

    /**
     * Build the QueryDescriptor with the configured parameters.
     *
     * @return A new QueryDescriptor instance
     * @throws QueryValidationException if the configuration is not a valid query
     */
    public QueryDescriptor build() {
        validateState();
        return new QueryDescriptor(datasource, dimensions, metrics, filters, where, having, orderBy,
            rowLimit, rowOffset, timeColumn, timeGrain, timeRange, extras, postProcessing,
            resultFormat, resultType);
    }

    private void validateState() {
        List<String> missingParams = new ArrayList<>();

        if (datasource == null) {
            missingParams.add("datasource");
        }
        if (dimensions.isEmpty() && metrics.isEmpty() && timeGrain == null) {
            missingParams.add("at least one dimension or metric");
        }
        if (resultFormat == null) {
            missingParams.add("result format");
        }
        if (resultType == null) {
            missingParams.add("result type");
        }

        if (!missingParams.isEmpty()) {
            throw new QueryValidationException("Cannot build QueryDescriptor: missing " + String.join(", ", missingParams));
        }

        if (rowLimit != null && rowLimit < 0) {
            throw new QueryValidationException("Row limit must be non-negative: " + rowLimit);
        }
        if (rowOffset != null && rowOffset < 0) {
            throw new QueryValidationException("Row offset must be non-negative: " + rowOffset);
        }
        if (dimensions.stream().anyMatch(d -> d == null || d.isBlank())) {
            throw new QueryValidationException("Dimension names must not be blank");
        }
        if (dimensions.stream().distinct().count() != dimensions.size()) {
            throw new QueryValidationException("Duplicate dimension in " + dimensions);
        }
        if (metrics.stream().map(Metric::getLabel).distinct().count() != metrics.size()) {
            throw new QueryValidationException("Duplicate metric label in " + metrics);
        }
        Set<String> outputLabels = new HashSet<>(dimensions);
        if (timeGrain != null && outputLabels.contains(QueryDescriptor.TIMESTAMP_LABEL)) {
            throw new QueryValidationException("Dimension " + QueryDescriptor.TIMESTAMP_LABEL
                + " clashes with the time bucket of grain " + timeGrain);
        }
        for (Metric metric : metrics) {
            if (outputLabels.contains(metric.getLabel())) {
                throw new QueryValidationException("Metric label '" + metric.getLabel() + "' clashes with a dimension");
            }
            if (timeGrain != null && QueryDescriptor.TIMESTAMP_LABEL.equals(metric.getLabel())) {
                throw new QueryValidationException("Metric label " + QueryDescriptor.TIMESTAMP_LABEL
                    + " clashes with the time bucket of grain " + timeGrain);
            }
        }
        for (Filter filter : having) {
            if (filter.isRowLevel()) {
                throw new QueryValidationException("Row-level predicates cannot be applied after aggregation");
            }
        }
        validateExtra(QueryDescriptor.EXTRA_TIMEOUT);
        validateExtra(QueryDescriptor.EXTRA_CACHE_TIMEOUT);
    }

    private void validateExtra(String key) {
        Object value = extras.get(key);
        if (value != null && (!(value instanceof Number) || ((Number) value).doubleValue() <= 0)) {
            throw new QueryValidationException("Extra '" + key + "' must be a positive number of seconds");
        }
    }
}
