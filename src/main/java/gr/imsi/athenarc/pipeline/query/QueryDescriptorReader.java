package gr.imsi.athenarc.pipeline.query;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * Reads query descriptors from their JSON request representation:
 *
 * <pre>
 * {
 *   "datasource": {"id": "sales", "kind": "table"},
 *   "columns": ["country"],
 *   "metrics": ["count", {"label": "revenue", "column": "amount", "aggregate": "SUM"}],
 *   "filters": [{"col": "status", "op": "IN", "val": ["active", "pending"]}],
 *   "where": "...", "having": [...],
 *   "orderby": [{"column": "revenue", "direction": "desc"}],
 *   "row_limit": 100, "row_offset": 0,
 *   "granularity": "created_at", "time_grain": "P1D",
 *   "time_range": {"from": "2024-01-01T00:00:00Z", "to": "2024-02-01T00:00:00Z"},
 *   "extras": {"timeout": 30},
 *   "post_processing": [{"operation": "sort", "options": {"columns": {"revenue": false}}}],
 *   "result_format": "json", "result_type": "full"
 * }
 * </pre>
 */
public class QueryDescriptorReader {

    private static final Logger LOG = LoggerFactory.getLogger(QueryDescriptorReader.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public QueryDescriptorReader() {
        this(new ObjectMapper());
    }

    public QueryDescriptorReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public QueryDescriptor read(String json) {
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new QueryValidationException("Malformed query descriptor JSON: " + e.getOriginalMessage());
        }
    }

    public QueryDescriptor read(InputStream input) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new QueryValidationException("Malformed query descriptor JSON: " + e.getOriginalMessage());
        }
        return read(root);
    }

    public QueryDescriptor read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new QueryValidationException("Query descriptor must be a JSON object");
        }
        QueryDescriptorBuilder builder = QueryDescriptor.builder();

        builder.withDatasource(readDatasource(root.get("datasource")));

        for (JsonNode column : iterable(root, "columns")) {
            builder.withDimensions(column.asText());
        }
        for (JsonNode metric : iterable(root, "metrics")) {
            builder.withMetric(readMetric(metric));
        }
        builder.withFilters(readFilters(root, "filters"));
        builder.withHaving(readFilters(root, "having"));
        builder.withWhere(text(root, "where"));

        for (JsonNode order : iterable(root, "orderby")) {
            builder.withOrderBy(text(order, "column"), SortDirection.fromName(text(order, "direction")));
        }

        builder.withRowLimit(integer(root, "row_limit"));
        builder.withRowOffset(integer(root, "row_offset"));
        builder.withTimeColumn(text(root, "granularity"));
        builder.withTimeGrain(TimeGrain.fromName(text(root, "time_grain")));

        JsonNode timeRange = root.get("time_range");
        if (timeRange != null && !timeRange.isNull()) {
            builder.withTimeRange(instant(timeRange, "from"), instant(timeRange, "to"));
        }

        JsonNode extras = root.get("extras");
        if (extras != null && extras.isObject()) {
            builder.withExtras(mapper.convertValue(extras, MAP_TYPE));
        }

        for (JsonNode operation : iterable(root, "post_processing")) {
            JsonNode options = operation.get("options");
            Map<String, Object> optionMap = options == null || options.isNull()
                ? Map.of()
                : mapper.convertValue(options, MAP_TYPE);
            builder.withPostProcessing(text(operation, "operation"), optionMap);
        }

        builder.withResultFormat(ResultFormat.fromName(text(root, "result_format")));
        builder.withResultType(ResultType.fromName(text(root, "result_type")));

        QueryDescriptor descriptor = builder.build();
        LOG.debug("Read {}", descriptor);
        return descriptor;
    }

    private DatasourceRef readDatasource(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new QueryValidationException("Query descriptor has no datasource");
        }
        if (node.isTextual()) {
            return DatasourceRef.of(node.asText());
        }
        String id = text(node, "id");
        if (id == null) {
            throw new QueryValidationException("Datasource id is required");
        }
        return new DatasourceRef(id, text(node, "kind"));
    }

    private Metric readMetric(JsonNode node) {
        if (node.isTextual()) {
            return Metric.saved(node.asText());
        }
        String label = text(node, "label");
        String aggregate = text(node, "aggregate");
        if (label == null || aggregate == null) {
            throw new QueryValidationException("Ad-hoc metric requires a label and an aggregate: " + node);
        }
        try {
            return Metric.adhoc(label, text(node, "column"), AggregationType.fromName(aggregate));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new QueryValidationException("Invalid ad-hoc metric " + label + ": " + e.getMessage());
        }
    }

    private List<Filter> readFilters(JsonNode root, String field) {
        List<Filter> filters = new ArrayList<>();
        for (JsonNode node : iterable(root, field)) {
            FilterOperator operator = FilterOperator.fromSymbol(text(node, "op"));
            JsonNode value = node.get("val");
            Object converted = value == null || value.isNull() ? null : mapper.convertValue(value, Object.class);
            filters.add(Filter.of(text(node, "col"), operator, converted));
        }
        return filters;
    }

    private static Iterable<JsonNode> iterable(JsonNode node, String field) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new QueryValidationException("Field '" + field + "' must be a list");
        }
        return array::elements;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt()) {
            throw new QueryValidationException("Field '" + field + "' must be an integer");
        }
        return value.asInt();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException inner) {
                throw new QueryValidationException("Time bound '" + field + "' is not an ISO-8601 instant: " + value);
            }
        }
    }
}
