package gr.imsi.athenarc.pipeline.datasource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import gr.imsi.athenarc.pipeline.domain.ColumnType;

/**
 * What a datasource exposes to queries: the relation to select from, its columns,
 * its saved metrics and the temporal column used when a query names none.
 * Every schema defines the saved metric {@value #COUNT_METRIC} as {@code COUNT(*)}.
 */
public final class DatasourceSchema {

    public static final String COUNT_METRIC = "count";

    private final String datasourceId;
    private final String source;
    private final Map<String, ColumnDefinition> columns;
    private final Map<String, MetricDefinition> metrics;
    private final String mainTemporalColumn;

    private DatasourceSchema(Builder builder) {
        this.datasourceId = builder.datasourceId;
        this.source = builder.source;
        this.columns = ImmutableMap.copyOf(builder.columns);
        this.metrics = ImmutableMap.copyOf(builder.metrics);
        this.mainTemporalColumn = builder.mainTemporalColumn;
    }

    public static Builder builder(String datasourceId) {
        return new Builder(datasourceId);
    }

    public String getDatasourceId() {
        return datasourceId;
    }

    /**
     * @return the FROM expression, already quoted for the backend
     */
    public String getSource() {
        return source;
    }

    public Map<String, ColumnDefinition> getColumns() {
        return columns;
    }

    public Map<String, MetricDefinition> getMetrics() {
        return metrics;
    }

    public Optional<ColumnDefinition> getColumn(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public Optional<MetricDefinition> getMetric(String name) {
        return Optional.ofNullable(metrics.get(name));
    }

    public Optional<String> getMainTemporalColumn() {
        return Optional.ofNullable(mainTemporalColumn);
    }

    @Override
    public String toString() {
        return "DatasourceSchema{" + datasourceId + ", source=" + source + ", columns=" + columns.values()
            + ", metrics=" + metrics.keySet() + ", temporal=" + mainTemporalColumn + '}';
    }

    public static class Builder {
        private final String datasourceId;
        private String source;
        private final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
        private final Map<String, MetricDefinition> metrics = new LinkedHashMap<>();
        private String mainTemporalColumn;

        private Builder(String datasourceId) {
            this.datasourceId = datasourceId;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder column(String name, ColumnType type) {
            return column(new ColumnDefinition(name, type, null));
        }

        public Builder column(String name, ColumnType type, String expression) {
            return column(new ColumnDefinition(name, type, expression));
        }

        public Builder column(ColumnDefinition column) {
            columns.put(column.getName(), column);
            return this;
        }

        public Builder metric(String name, String expression) {
            metrics.put(name, new MetricDefinition(name, expression));
            return this;
        }

        public Builder mainTemporalColumn(String mainTemporalColumn) {
            this.mainTemporalColumn = mainTemporalColumn;
            return this;
        }

        public DatasourceSchema build() {
            Preconditions.checkState(datasourceId != null, "Schema has no datasource id");
            Preconditions.checkState(source != null, "Schema of %s has no source relation", datasourceId);
            if (mainTemporalColumn != null) {
                Preconditions.checkState(columns.containsKey(mainTemporalColumn),
                    "Main temporal column %s is not a column of %s", mainTemporalColumn, datasourceId);
            } else {
                columns.values().stream()
                    .filter(ColumnDefinition::isTemporal)
                    .findFirst()
                    .ifPresent(column -> mainTemporalColumn = column.getName());
            }
            metrics.put(COUNT_METRIC, new MetricDefinition(COUNT_METRIC, "COUNT(*)"));
            return new DatasourceSchema(this);
        }
    }
}
