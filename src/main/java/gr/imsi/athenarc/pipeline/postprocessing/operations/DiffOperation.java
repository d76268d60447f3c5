package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Difference between each row and the row {@code periods} positions earlier
 * (later, for a negative period) for every source column of
 * {@code columns {source: destination}}. Rows without a partner get null.
 */
public class DiffOperation extends AbstractPostProcessor {

    public static final String KIND = "diff";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        Map<String, String> mapping = options.getColumnMapping("columns");
        int periods = options.getInt("periods", 1);

        List<String> names = new ArrayList<>(input.getColumns());
        List<ColumnType> types = new ArrayList<>(input.getTypes());
        List<List<Object>> rows = new ArrayList<>();
        input.getRows().forEach(row -> rows.add(copy(row)));

        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            int source = column(input, entry.getKey());
            boolean integral = input.getTypes().get(source) == ColumnType.INTEGER;
            int target = RollingOperation.targetColumn(names, types, entry.getValue(),
                integral ? ColumnType.INTEGER : ColumnType.FLOAT);
            for (int i = 0; i < rows.size(); i++) {
                int partner = i - periods;
                Object value = null;
                if (partner >= 0 && partner < rows.size()) {
                    Object current = input.getRows().get(i).get(source);
                    Object previous = input.getRows().get(partner).get(source);
                    if (current != null && previous != null) {
                        value = integral
                            ? (Object) (((Number) current).longValue() - ((Number) previous).longValue())
                            : (Object) (number(current, entry.getKey()) - number(previous, entry.getKey()));
                    }
                }
                RollingOperation.setOrAppend(rows.get(i), target, value);
            }
        }
        return new TabularResult(names, types, rows);
    }
}
