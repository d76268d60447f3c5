package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;

/**
 * Keeps, reorders, drops and renames columns. {@code columns} selects and orders
 * (all columns when absent), {@code exclude} then drops, {@code rename} maps old
 * names to new ones.
 */
public class SelectOperation extends AbstractPostProcessor {

    public static final String KIND = "select";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public TabularResult apply(TabularResult input, OperationOptions options) {
        List<String> selected = options.getOptionalStringList("columns").orElse(input.getColumns());
        Set<String> excluded = new HashSet<>(options.getOptionalStringList("exclude").orElse(List.of()));
        columns(input, new ArrayList<>(excluded));
        Map<String, Object> rename = options.getOptionalMap("rename").orElse(Map.of());

        List<String> kept = new ArrayList<>();
        for (String name : selected) {
            if (!excluded.contains(name)) {
                kept.add(name);
            }
        }
        int[] indices = columns(input, kept);

        List<String> names = new ArrayList<>(kept.size());
        List<ColumnType> types = new ArrayList<>(kept.size());
        for (int i = 0; i < indices.length; i++) {
            Object newName = rename.getOrDefault(kept.get(i), kept.get(i));
            if (!(newName instanceof String)) {
                throw options.malformed("rename", "an object of {old: new} column names");
            }
            names.add((String) newName);
            types.add(input.getTypes().get(indices[i]));
        }
        for (String renamed : rename.keySet()) {
            column(input, renamed);
        }

        List<List<Object>> rows = new ArrayList<>(input.getRowCount());
        input.getRows().forEach(row -> rows.add(project(row, indices)));
        return new TabularResult(names, types, rows);
    }
}
