package gr.imsi.athenarc.pipeline.query;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A requested metric. Either a bare name referring to a metric saved on the
 * datasource, or an ad-hoc expression aggregating a column under a label.
 */
public final class Metric {

    private final String label;
    private final String column;
    private final AggregationType aggregation;

    private Metric(String label, String column, AggregationType aggregation) {
        this.label = label;
        this.column = column;
        this.aggregation = aggregation;
    }

    public static Metric saved(String name) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "Metric name is required");
        return new Metric(name, null, null);
    }

    public static Metric adhoc(String label, String column, AggregationType aggregation) {
        Preconditions.checkArgument(label != null && !label.isBlank(), "Metric label is required");
        Preconditions.checkNotNull(aggregation, "Aggregation is required for ad-hoc metric %s", label);
        // COUNT may omit its column and count rows
        Preconditions.checkArgument(column != null || aggregation == AggregationType.COUNT,
            "Column is required for ad-hoc metric %s", label);
        return new Metric(label, column, aggregation);
    }

    /**
     * @return the output column name of this metric
     */
    public String getLabel() {
        return label;
    }

    public String getColumn() {
        return column;
    }

    public AggregationType getAggregation() {
        return aggregation;
    }

    public boolean isSaved() {
        return aggregation == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Metric)) return false;
        Metric metric = (Metric) o;
        return label.equals(metric.label)
            && Objects.equals(column, metric.column)
            && aggregation == metric.aggregation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, column, aggregation);
    }

    @Override
    public String toString() {
        return isSaved() ? label : label + "=" + aggregation + "(" + (column == null ? "*" : column) + ")";
    }
}
