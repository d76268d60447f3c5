package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.domain.ValueComparator;
import gr.imsi.athenarc.pipeline.postprocessing.Aggregator;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Trailing-window reduction. For every row, {@code rolling_type} is applied to the
 * last {@code window} values (the row included) of each source column in
 * {@code columns {source: destination}}; rows whose window holds fewer than
 * {@code min_periods} non-null values get null. With {@code order_by} the rows are
 * first sorted by those columns, otherwise the input order is the window order.
 */
public class RollingOperation extends AbstractPostProcessor {

    public static final String KIND = "rolling";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        Map<String, String> mapping = options.getColumnMapping("columns");
        Aggregator aggregator = Aggregator.fromName(options.getString("rolling_type"));
        int window = options.getInt("window");
        if (window < 1) {
            throw options.malformed("window", "a positive integer");
        }
        int minPeriods = options.getInt("min_periods", window);
        if (minPeriods < 0) {
            throw options.malformed("min_periods", "a non-negative integer");
        }

        List<List<Object>> rows = new ArrayList<>(input.getRows());
        List<String> orderBy = options.getOptionalStringList("order_by").orElse(List.of());
        if (!orderBy.isEmpty()) {
            int[] keys = columns(input, orderBy);
            Comparator<List<Object>> byKeys = (left, right) -> ValueComparator.TUPLES.compare(project(left, keys), project(right, keys));
            rows.sort(byKeys);
        }

        List<String> names = new ArrayList<>(input.getColumns());
        List<ColumnType> types = new ArrayList<>(input.getTypes());
        List<List<Object>> output = new ArrayList<>(rows.size());
        rows.forEach(row -> output.add(copy(row)));

        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            int source = column(input, entry.getKey());
            int target = targetColumn(names, types, entry.getValue(), aggregator.getResultType());
            for (int i = 0; i < rows.size(); i++) {
                List<Object> values = new ArrayList<>(window);
                int observed = 0;
                for (int j = Math.max(0, i - window + 1); j <= i; j++) {
                    Object value = number(rows.get(j).get(source), entry.getKey());
                    if (value != null) {
                        observed++;
                    }
                    values.add(value);
                }
                Object result = observed >= minPeriods ? aggregator.apply(values, entry.getKey()) : null;
                setOrAppend(output.get(i), target, result);
            }
        }
        return new TabularResult(names, types, output);
    }

    /**
     * Resolves the output position of a destination column, registering it when new
     * and retyping it when it overwrites an existing column.
     */
    static int targetColumn(List<String> names, List<ColumnType> types, String name, ColumnType type) {
        int index = names.indexOf(name);
        if (index >= 0) {
            types.set(index, type);
            return index;
        }
        names.add(name);
        types.add(type);
        return names.size() - 1;
    }

    static void setOrAppend(List<Object> row, int index, Object value) {
        if (index < row.size()) {
            row.set(index, value);
        } else {
            row.add(value);
        }
    }
}
