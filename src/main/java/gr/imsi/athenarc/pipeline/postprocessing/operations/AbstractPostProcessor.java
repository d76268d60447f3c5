package gr.imsi.athenarc.pipeline.postprocessing.operations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.Aggregator;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingException;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessor;

/**
 * Column lookup and numeric coercion shared by the built-in operations.
 */
abstract class AbstractPostProcessor implements PostProcessor {

    protected int column(TabularResult input, String name) {
        int index = input.indexOf(name);
        if (index < 0) {
            throw new PostProcessingException("Operation " + getKind() + " references unknown column '" + name
                + "', available columns are " + input.getColumns());
        }
        return index;
    }

    protected int[] columns(TabularResult input, List<String> names) {
        int[] indices = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            indices[i] = column(input, names.get(i));
        }
        return indices;
    }

    /**
     * @return the value as a double, or null for a null value
     */
    protected Double number(Object value, String column) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new PostProcessingException("Operation " + getKind() + " requires numeric values in column '"
                + column + "', got " + value.getClass().getSimpleName());
        }
        return ((Number) value).doubleValue();
    }

    protected static List<Object> project(List<Object> row, int[] indices) {
        List<Object> values = new ArrayList<>(indices.length);
        for (int index : indices) {
            values.add(row.get(index));
        }
        return values;
    }

    protected static List<Object> copy(List<Object> row) {
        return new ArrayList<>(row);
    }

    protected static TabularResult.Builder builderWithColumns(List<String> names, List<ColumnType> types) {
        TabularResult.Builder builder = TabularResult.builder();
        for (int i = 0; i < names.size(); i++) {
            builder.column(names.get(i), types.get(i));
        }
        return builder;
    }

    /**
     * Reads the {@code aggregates} option: {@code {name: {column, operator}}}, the
     * column defaulting to the name.
     */
    protected List<AggregateSpec> aggregates(TabularResult input, OperationOptions options) {
        Map<String, Object> definitions = options.getMap("aggregates");
        if (definitions.isEmpty()) {
            throw options.malformed("aggregates", "a non-empty object");
        }
        List<AggregateSpec> specs = new ArrayList<>();
        for (Map.Entry<String, Object> definition : definitions.entrySet()) {
            if (!(definition.getValue() instanceof Map)) {
                throw options.malformed("aggregates", "an object of {column, operator} definitions");
            }
            Map<?, ?> body = (Map<?, ?>) definition.getValue();
            Object source = body.get("column");
            Object operator = body.get("operator");
            if (source != null && !(source instanceof String) || operator != null && !(operator instanceof String)) {
                throw options.malformed("aggregates", "an object of {column, operator} definitions");
            }
            String columnName = source == null ? definition.getKey() : (String) source;
            specs.add(new AggregateSpec(definition.getKey(), columnName, column(input, columnName),
                Aggregator.fromName(operator == null ? "sum" : (String) operator)));
        }
        return specs;
    }

    /**
     * One named reduction of one source column.
     */
    protected static final class AggregateSpec {
        final String name;
        final String column;
        final int index;
        final Aggregator aggregator;

        AggregateSpec(String name, String column, int index, Aggregator aggregator) {
            this.name = name;
            this.column = column;
            this.index = index;
            this.aggregator = aggregator;
        }

        Object reduce(List<List<Object>> rows) {
            List<Object> values = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                values.add(row.get(index));
            }
            return aggregator.apply(values, column);
        }
    }
}
