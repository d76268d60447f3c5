package gr.imsi.athenarc.pipeline.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Natural ordering over the loosely typed cell values of a {@link TabularResult}.
 * Numbers compare numerically across types, nulls sort last.
 */
public final class ValueComparator implements Comparator<Object> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    /** Lexicographic ordering of value tuples, element by element. */
    public static final Comparator<List<Object>> TUPLES = (left, right) -> {
        int size = Math.min(left.size(), right.size());
        for (int i = 0; i < size; i++) {
            int cmp = INSTANCE.compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    private ValueComparator() {}

    @Override
    public int compare(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        if (left == null) {
            return 1;
        }
        if (right == null) {
            return -1;
        }
        if (left instanceof Number && right instanceof Number) {
            if (left instanceof BigDecimal && right instanceof BigDecimal) {
                return ((BigDecimal) left).compareTo((BigDecimal) right);
            }
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof Instant && right instanceof Instant) {
            return ((Instant) left).compareTo((Instant) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return ((Boolean) left).compareTo((Boolean) right);
        }
        // mixed or unknown kinds compare by their string form
        return left.toString().compareTo(right.toString());
    }
}
