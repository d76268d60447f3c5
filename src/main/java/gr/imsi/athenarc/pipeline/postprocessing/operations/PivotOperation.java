package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.domain.ValueComparator;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingException;

/**
 * Reshapes long data to wide: one output row per distinct {@code index} tuple,
 * one output column per aggregate and distinct {@code columns} tuple, named
 * {@code "<aggregate>, <value 1>, <value 2>"}. Index tuples and pivot tuples are
 * both emitted in sorted order. A cell without source rows is null.
 */
public class PivotOperation extends AbstractPostProcessor {

    public static final String KIND = "pivot";

    static final String NULL_LABEL = "<NULL>";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        List<String> index = options.getStringList("index");
        if (index.isEmpty()) {
            throw options.malformed("index", "a non-empty list of columns");
        }
        List<String> pivotColumns = options.getOptionalStringList("columns").orElse(List.of());
        int[] indexIndices = columns(input, index);
        int[] pivotIndices = columns(input, pivotColumns);
        List<AggregateSpec> specs = aggregates(input, options);

        Map<List<Object>, Map<List<Object>, List<List<Object>>>> cells = new TreeMap<>(ValueComparator.TUPLES);
        TreeSet<List<Object>> pivotKeys = new TreeSet<>(ValueComparator.TUPLES);
        for (List<Object> row : input.getRows()) {
            List<Object> pivotKey = project(row, pivotIndices);
            pivotKeys.add(pivotKey);
            cells.computeIfAbsent(project(row, indexIndices), key -> new TreeMap<>(ValueComparator.TUPLES))
                .computeIfAbsent(pivotKey, key -> new ArrayList<>())
                .add(row);
        }

        List<String> names = new ArrayList<>(index);
        List<ColumnType> types = new ArrayList<>();
        for (int i : indexIndices) {
            types.add(input.getTypes().get(i));
        }
        for (AggregateSpec spec : specs) {
            for (List<Object> pivotKey : pivotKeys) {
                names.add(columnName(spec.name, pivotKey));
                types.add(spec.aggregator.getResultType());
            }
        }
        if (names.stream().distinct().count() != names.size()) {
            throw new PostProcessingException("Pivot would produce duplicate columns: " + names);
        }

        TabularResult.Builder builder = builderWithColumns(names, types);
        for (Map.Entry<List<Object>, Map<List<Object>, List<List<Object>>>> entry : cells.entrySet()) {
            List<Object> row = new ArrayList<>(entry.getKey());
            for (AggregateSpec spec : specs) {
                for (List<Object> pivotKey : pivotKeys) {
                    List<List<Object>> cell = entry.getValue().get(pivotKey);
                    row.add(cell == null ? null : spec.reduce(cell));
                }
            }
            builder.row(row);
        }
        return builder.build();
    }

    static String columnName(String aggregate, List<Object> pivotKey) {
        if (pivotKey.isEmpty()) {
            return aggregate;
        }
        return aggregate + ", " + pivotKey.stream()
            .map(value -> value == null ? NULL_LABEL : value.toString())
            .collect(Collectors.joining(", "));
    }
}
