package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Share of each value in its column total ({@code orientation: column}, the
 * default) or in its row total across the selected columns ({@code row}).
 * {@code columns} defaults to every numeric column; with {@code rename_columns}
 * the shares are added as new columns instead of replacing the originals.
 * Null cells count as zero in totals and stay null; a zero total yields null.
 */
public class ContributionOperation extends AbstractPostProcessor {

    public static final String KIND = "contribution";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        String orientation = options.getOptionalString("orientation").orElse("column").toLowerCase(Locale.ROOT);
        if (!"column".equals(orientation) && !"row".equals(orientation)) {
            throw options.malformed("orientation", "either column or row");
        }
        List<String> selected = options.getOptionalStringList("columns").orElseGet(() -> numericColumns(input));
        List<String> renamed = options.getOptionalStringList("rename_columns").orElse(selected);
        if (renamed.size() != selected.size()) {
            throw options.malformed("rename_columns", "a list as long as columns");
        }
        int[] sources = columns(input, selected);

        double[] totals = new double[input.getRowCount()];
        double[] columnTotals = new double[sources.length];
        for (int i = 0; i < input.getRowCount(); i++) {
            List<Object> row = input.getRows().get(i);
            for (int c = 0; c < sources.length; c++) {
                Double value = number(row.get(sources[c]), selected.get(c));
                if (value != null) {
                    totals[i] += value;
                    columnTotals[c] += value;
                }
            }
        }

        List<String> names = new ArrayList<>(input.getColumns());
        List<ColumnType> types = new ArrayList<>(input.getTypes());
        List<List<Object>> rows = new ArrayList<>();
        input.getRows().forEach(row -> rows.add(copy(row)));
        for (int c = 0; c < sources.length; c++) {
            int target = RollingOperation.targetColumn(names, types, renamed.get(c), ColumnType.FLOAT);
            for (int i = 0; i < rows.size(); i++) {
                Double value = number(input.getRows().get(i).get(sources[c]), selected.get(c));
                double total = "row".equals(orientation) ? totals[i] : columnTotals[c];
                RollingOperation.setOrAppend(rows.get(i), target, value == null || total == 0 ? null : value / total);
            }
        }
        return new TabularResult(names, types, rows);
    }

    private static List<String> numericColumns(TabularResult input) {
        List<String> numeric = new ArrayList<>();
        for (int i = 0; i < input.getColumnCount(); i++) {
            if (input.getTypes().get(i).isNumeric()) {
                numeric.add(input.getColumns().get(i));
            }
        }
        return numeric;
    }
}
