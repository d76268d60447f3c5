package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Compares pairs of columns row by row. For each pair of {@code source_columns}
 * and {@code compare_columns} a column {@code <type>__<source>__<compare>} is
 * added holding the difference, the relative change ({@code percentage}) or the
 * ratio. Division by zero and null operands yield null.
 */
public class CompareOperation extends AbstractPostProcessor {

    public static final String KIND = "compare";

    enum CompareType {
        DIFFERENCE,
        PERCENTAGE,
        RATIO;

        Double compute(double source, double compare) {
            switch (this) {
                case DIFFERENCE:
                    return source - compare;
                case PERCENTAGE:
                    return compare == 0 ? null : (source - compare) / compare;
                default:
                    return compare == 0 ? null : source / compare;
            }
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        List<String> sources = options.getStringList("source_columns");
        List<String> compares = options.getStringList("compare_columns");
        if (sources.size() != compares.size() || sources.isEmpty()) {
            throw options.malformed("compare_columns", "a list as long as source_columns");
        }
        String typeName = options.getString("compare_type");
        CompareType type;
        try {
            type = CompareType.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw options.malformed("compare_type", "one of difference, percentage, ratio");
        }
        boolean dropOriginal = options.getBoolean("drop_original_columns", false);
        int[] sourceIndices = columns(input, sources);
        int[] compareIndices = columns(input, compares);

        List<String> names = new ArrayList<>(input.getColumns());
        List<ColumnType> types = new ArrayList<>(input.getTypes());
        List<List<Object>> rows = new ArrayList<>();
        input.getRows().forEach(row -> rows.add(copy(row)));

        for (int pair = 0; pair < sources.size(); pair++) {
            String name = type.name().toLowerCase(Locale.ROOT) + "__" + sources.get(pair) + "__" + compares.get(pair);
            int target = RollingOperation.targetColumn(names, types, name, ColumnType.FLOAT);
            for (int i = 0; i < rows.size(); i++) {
                List<Object> original = input.getRows().get(i);
                Double source = number(original.get(sourceIndices[pair]), sources.get(pair));
                Double compare = number(original.get(compareIndices[pair]), compares.get(pair));
                Double value = source == null || compare == null ? null : type.compute(source, compare);
                RollingOperation.setOrAppend(rows.get(i), target, value);
            }
        }

        if (!dropOriginal) {
            return new TabularResult(names, types, rows);
        }
        Set<String> dropped = new HashSet<>(sources);
        dropped.addAll(compares);
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            if (!dropped.contains(names.get(i))) {
                kept.add(i);
            }
        }
        int[] keptIndices = kept.stream().mapToInt(Integer::intValue).toArray();
        List<String> keptNames = new ArrayList<>();
        List<ColumnType> keptTypes = new ArrayList<>();
        for (int index : keptIndices) {
            keptNames.add(names.get(index));
            keptTypes.add(types.get(index));
        }
        List<List<Object>> keptRows = new ArrayList<>(rows.size());
        rows.forEach(row -> keptRows.add(project(row, keptIndices)));
        return new TabularResult(keptNames, keptTypes, keptRows);
    }
}
