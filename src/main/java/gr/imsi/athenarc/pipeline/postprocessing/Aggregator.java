package gr.imsi.athenarc.pipeline.postprocessing;

import java.util.List;
import java.util.Locale;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import gr.imsi.athenarc.pipeline.domain.ColumnType;

/**
 * Reductions available to the pivot, aggregate and rolling operations. Null values
 * are skipped. Over no values {@code sum} yields 0, {@code count} yields 0 and every
 * other reduction yields null; {@code std} and {@code var} are sample statistics
 * and need at least two values.
 */
public enum Aggregator {
    SUM,
    MEAN,
    MEDIAN,
    MIN,
    MAX,
    COUNT,
    STD,
    VAR;

    public static Aggregator fromName(String name) {
        if (name == null) {
            throw new PostProcessingException("Missing aggregation operator");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("NP.")) {
            normalized = normalized.substring(3);
        }
        if ("AVG".equals(normalized) || "AVERAGE".equals(normalized)) {
            return MEAN;
        }
        for (Aggregator aggregator : values()) {
            if (aggregator.name().equals(normalized)) {
                return aggregator;
            }
        }
        throw new PostProcessingException("Unsupported aggregation operator: " + name);
    }

    public ColumnType getResultType() {
        return this == COUNT ? ColumnType.INTEGER : ColumnType.FLOAT;
    }

    /**
     * @param column the column the values come from, used in error messages
     * @throws PostProcessingException if a non-null value is not a number and this is not {@code count}
     */
    public Object apply(List<?> values, String column) {
        if (this == COUNT) {
            return values.stream().filter(value -> value != null).count();
        }
        DescriptiveStatistics statistics = new DescriptiveStatistics();
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                throw new PostProcessingException("Cannot apply " + name().toLowerCase(Locale.ROOT)
                    + " to non-numeric value in column " + column);
            }
            statistics.addValue(((Number) value).doubleValue());
        }
        long n = statistics.getN();
        switch (this) {
            case SUM:
                return n == 0 ? 0.0 : statistics.getSum();
            case MEAN:
                return n == 0 ? null : statistics.getMean();
            case MEDIAN:
                return n == 0 ? null : statistics.getPercentile(50);
            case MIN:
                return n == 0 ? null : statistics.getMin();
            case MAX:
                return n == 0 ? null : statistics.getMax();
            case STD:
                return n < 2 ? null : statistics.getStandardDeviation();
            case VAR:
                return n < 2 ? null : statistics.getVariance();
            default:
                throw new IllegalStateException("Unhandled aggregator " + this);
        }
    }
}
