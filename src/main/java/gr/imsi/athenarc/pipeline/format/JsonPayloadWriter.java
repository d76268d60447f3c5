package gr.imsi.athenarc.pipeline.format;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Writes the record-oriented JSON document:
 *
 * <pre>
 * {"cache_key": ..., "is_cached": false, "cached_dttm": null,
 *  "columns": [...], "coltypes": [...], "rowcount": 2,
 *  "data": [{"country": "GR", "count": 3}, ...],
 *  "applied_filters": [{"col": "status", "op": "IN", "val": [...]}],
 *  "warnings": []}
 * </pre>
 *
 * Timestamps are written as ISO-8601 strings, non-finite numbers as null.
 */
public class JsonPayloadWriter implements PayloadWriter {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper mapper;

    public JsonPayloadWriter() {
        this(new ObjectMapper());
    }

    public JsonPayloadWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ResultFormat getFormat() {
        return ResultFormat.JSON;
    }

    @Override
    public String getContentType() {
        return CONTENT_TYPE;
    }

    @Override
    public void write(TabularResult result, ResultMetadata metadata, OutputStream output) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("cache_key", metadata.getCacheKey().orElse(null));
        root.put("is_cached", metadata.isCached());
        root.put("cached_dttm", metadata.getCachedAt().map(Instant::toString).orElse(null));

        ArrayNode columns = root.putArray("columns");
        result.getColumns().forEach(columns::add);
        ArrayNode types = root.putArray("coltypes");
        result.getTypes().forEach(type -> types.add(type.name()));
        root.put("rowcount", result.getRowCount());

        ArrayNode data = root.putArray("data");
        for (List<Object> row : result.getRows()) {
            ObjectNode record = data.addObject();
            for (int i = 0; i < row.size(); i++) {
                record.set(result.getColumns().get(i), mapper.valueToTree(jsonValue(row.get(i))));
            }
        }

        ArrayNode filters = root.putArray("applied_filters");
        for (Filter filter : metadata.getAppliedFilters()) {
            if (filter.isRowLevel()) {
                continue;
            }
            ObjectNode node = filters.addObject();
            node.put("col", filter.getColumn());
            node.put("op", filter.getOperator().getSymbol());
            if (filter.getOperator().takesValue()) {
                node.set("val", mapper.valueToTree(jsonValue(filter.getValue())));
            }
        }

        ArrayNode warnings = root.putArray("warnings");
        metadata.getWarnings().forEach(warnings::add);

        mapper.writeValue(output, root);
    }

    static Object jsonValue(Object value) {
        if (value instanceof Instant) {
            return value.toString();
        }
        if (value instanceof Double && !Double.isFinite((Double) value)) {
            return null;
        }
        if (value instanceof Float && !Float.isFinite((Float) value)) {
            return null;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream().map(JsonPayloadWriter::jsonValue).collect(Collectors.toList());
        }
        if (value instanceof BigDecimal || value instanceof Number || value instanceof Boolean || value instanceof String || value == null) {
            return value;
        }
        return value.toString();
    }
}
