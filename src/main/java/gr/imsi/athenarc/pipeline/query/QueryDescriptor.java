package gr.imsi.athenarc.pipeline.query;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * Immutable description of what to fetch. Stages of the pipeline never modify
 * a descriptor; they derive new ones through {@link #toBuilder()}, so the same
 * instance can be read concurrently by the key deriver and the compiler.
 * Instances are created with {@link QueryDescriptorBuilder}.
 */
public final class QueryDescriptor {

    /** Extras key overriding the engine timeout, in seconds. */
    public static final String EXTRA_TIMEOUT = "timeout";
    /** Extras key overriding the computed cache time-to-live, in seconds. */
    public static final String EXTRA_CACHE_TIMEOUT = "cache_timeout";
    /** Label of the time bucket column produced by a time grain. */
    public static final String TIMESTAMP_LABEL = "__timestamp";

    private final DatasourceRef datasource;
    private final List<String> dimensions;
    private final List<Metric> metrics;
    private final List<Filter> filters;
    private final String where;
    private final List<Filter> having;
    private final List<OrderBy> orderBy;
    private final Integer rowLimit;
    private final Integer rowOffset;
    private final String timeColumn;
    private final TimeGrain timeGrain;
    private final TimeRange timeRange;
    private final Map<String, Object> extras;
    private final List<PostProcessingOperation> postProcessing;
    private final ResultFormat resultFormat;
    private final ResultType resultType;

    QueryDescriptor(DatasourceRef datasource, List<String> dimensions, List<Metric> metrics,
                    List<Filter> filters, String where, List<Filter> having, List<OrderBy> orderBy,
                    Integer rowLimit, Integer rowOffset, String timeColumn, TimeGrain timeGrain,
                    TimeRange timeRange, Map<String, ?> extras, List<PostProcessingOperation> postProcessing,
                    ResultFormat resultFormat, ResultType resultType) {
        this.datasource = datasource;
        this.dimensions = ImmutableList.copyOf(dimensions);
        this.metrics = ImmutableList.copyOf(metrics);
        this.filters = ImmutableList.copyOf(filters);
        this.where = where;
        this.having = ImmutableList.copyOf(having);
        this.orderBy = ImmutableList.copyOf(orderBy);
        this.rowLimit = rowLimit;
        this.rowOffset = rowOffset;
        this.timeColumn = timeColumn;
        this.timeGrain = timeGrain;
        this.timeRange = timeRange;
        this.extras = ImmutableValues.copyOfMap(extras);
        this.postProcessing = ImmutableList.copyOf(postProcessing);
        this.resultFormat = resultFormat;
        this.resultType = resultType;
    }

    public static QueryDescriptorBuilder builder() {
        return new QueryDescriptorBuilder();
    }

    /**
     * @return a builder pre-populated with every field of this descriptor
     */
    public QueryDescriptorBuilder toBuilder() {
        return new QueryDescriptorBuilder(this);
    }

    /**
     * Derives a descriptor whose filter list is this one's followed by {@code additional}.
     */
    public QueryDescriptor withAdditionalFilters(List<Filter> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        return toBuilder().withFilters(additional).build();
    }

    public DatasourceRef getDatasource() {
        return datasource;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<Metric> getMetrics() {
        return metrics;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public Optional<String> getWhere() {
        return Optional.ofNullable(where);
    }

    public List<Filter> getHaving() {
        return having;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Optional<Integer> getRowLimit() {
        return Optional.ofNullable(rowLimit);
    }

    public Optional<Integer> getRowOffset() {
        return Optional.ofNullable(rowOffset);
    }

    public Optional<String> getTimeColumn() {
        return Optional.ofNullable(timeColumn);
    }

    public Optional<TimeGrain> getTimeGrain() {
        return Optional.ofNullable(timeGrain);
    }

    public Optional<TimeRange> getTimeRange() {
        return Optional.ofNullable(timeRange);
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    public List<PostProcessingOperation> getPostProcessing() {
        return postProcessing;
    }

    public ResultFormat getResultFormat() {
        return resultFormat;
    }

    public ResultType getResultType() {
        return resultType;
    }

    /**
     * @return labels of every requested metric, in request order
     */
    public List<String> getMetricLabels() {
        ImmutableList.Builder<String> labels = ImmutableList.builder();
        for (Metric metric : metrics) {
            labels.add(metric.getLabel());
        }
        return labels.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryDescriptor)) return false;
        QueryDescriptor that = (QueryDescriptor) o;
        return datasource.equals(that.datasource)
            && dimensions.equals(that.dimensions)
            && metrics.equals(that.metrics)
            && filters.equals(that.filters)
            && Objects.equals(where, that.where)
            && having.equals(that.having)
            && orderBy.equals(that.orderBy)
            && Objects.equals(rowLimit, that.rowLimit)
            && Objects.equals(rowOffset, that.rowOffset)
            && Objects.equals(timeColumn, that.timeColumn)
            && timeGrain == that.timeGrain
            && Objects.equals(timeRange, that.timeRange)
            && extras.equals(that.extras)
            && postProcessing.equals(that.postProcessing)
            && resultFormat == that.resultFormat
            && resultType == that.resultType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasource, dimensions, metrics, filters, where, having, orderBy, rowLimit,
            rowOffset, timeColumn, timeGrain, timeRange, extras, postProcessing, resultFormat, resultType);
    }

    @Override
    public String toString() {
        return "QueryDescriptor{" +
            "datasource=" + datasource +
            ", dimensions=" + dimensions +
            ", metrics=" + metrics +
            ", filters=" + filters.size() +
            ", timeRange=" + timeRange +
            ", postProcessing=" + postProcessing.size() +
            ", format=" + resultFormat +
            '}';
    }
}
