package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.domain.ValueComparator;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Groups rows by the {@code groupby} columns and reduces each group with the
 * {@code aggregates} definitions. Output groups are sorted by their key; without
 * group columns the whole result is reduced to a single row.
 */
public class AggregateOperation extends AbstractPostProcessor {

    public static final String KIND = "aggregate";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        List<String> groupBy = options.getOptionalStringList("groupby").orElse(List.of());
        int[] keyIndices = columns(input, groupBy);
        List<AggregateSpec> specs = aggregates(input, options);

        Map<List<Object>, List<List<Object>>> groups = new TreeMap<>(ValueComparator.TUPLES);
        for (List<Object> row : input.getRows()) {
            groups.computeIfAbsent(project(row, keyIndices), key -> new ArrayList<>()).add(row);
        }
        if (groupBy.isEmpty() && groups.isEmpty()) {
            groups.put(List.of(), List.of());
        }

        List<String> names = new ArrayList<>(groupBy);
        List<ColumnType> types = new ArrayList<>();
        for (int index : keyIndices) {
            types.add(input.getTypes().get(index));
        }
        for (AggregateSpec spec : specs) {
            names.add(spec.name);
            types.add(spec.aggregator.getResultType());
        }

        TabularResult.Builder builder = builderWithColumns(names, types);
        for (Map.Entry<List<Object>, List<List<Object>>> group : groups.entrySet()) {
            List<Object> row = new ArrayList<>(group.getKey());
            for (AggregateSpec spec : specs) {
                row.add(spec.reduce(group.getValue()));
            }
            builder.row(row);
        }
        return builder.build();
    }
}
