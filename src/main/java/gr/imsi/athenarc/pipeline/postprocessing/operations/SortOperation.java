package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.domain.ValueComparator;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Stable multi-key sort. {@code columns} maps each key column to true for
 * ascending or false for descending; nulls sort last in both directions.
 */
public class SortOperation extends AbstractPostProcessor {

    public static final String KIND = "sort";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        Map<String, Object> keys = options.getMap("columns");
        if (keys.isEmpty()) {
            throw options.malformed("columns", "a non-empty object of {column: ascending}");
        }
        Comparator<List<Object>> comparator = null;
        for (Map.Entry<String, Object> key : keys.entrySet()) {
            if (!(key.getValue() instanceof Boolean)) {
                throw options.malformed("columns", "an object of {column: ascending} booleans");
            }
            Comparator<List<Object>> next = keyComparator(column(input, key.getKey()), (Boolean) key.getValue());
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }

        List<List<Object>> rows = new ArrayList<>(input.getRows());
        // List.sort is a stable merge sort
        rows.sort(comparator);
        return new TabularResult(input.getColumns(), input.getTypes(), rows);
    }

    private static Comparator<List<Object>> keyComparator(int index, boolean ascending) {
        return (left, right) -> {
            Object a = left.get(index);
            Object b = right.get(index);
            if (a == null || b == null) {
                // nulls last regardless of direction
                return ValueComparator.INSTANCE.compare(a, b);
            }
            int cmp = ValueComparator.INSTANCE.compare(a, b);
            return ascending ? cmp : -cmp;
        };
    }
}
