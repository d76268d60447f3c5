package gr.imsi.athenarc.pipeline.cache;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;

/**
 * Serializes post-processed results for the cache. The payload is a JSON
 * document holding the column names, the type tags, the rows as arrays and the
 * warnings produced while the result was computed. Decoding restores every value
 * to the Java type its column tag prescribes.
 */
public class TabularResultCodec {

    public static final String FORMAT = "tabular-json/1";

    private final ObjectMapper mapper;

    public TabularResultCodec() {
        this(new ObjectMapper());
    }

    public TabularResultCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String getFormat() {
        return FORMAT;
    }

    public byte[] encode(TabularResult result, List<String> warnings) {
        ObjectNode root = mapper.createObjectNode();
        root.put("codec", FORMAT);
        ArrayNode columns = root.putArray("columns");
        result.getColumns().forEach(columns::add);
        ArrayNode types = root.putArray("types");
        result.getTypes().forEach(type -> types.add(type.name()));
        ArrayNode rows = root.putArray("rows");
        for (List<Object> row : result.getRows()) {
            ArrayNode node = rows.addArray();
            for (int i = 0; i < row.size(); i++) {
                addValue(node, result.getTypes().get(i), row.get(i));
            }
        }
        ArrayNode warningNodes = root.putArray("warnings");
        warnings.forEach(warningNodes::add);
        try {
            return mapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new CacheException("Could not encode result " + result, e);
        }
    }

    /**
     * @throws CacheException if the payload was not written by this codec or is corrupt
     */
    public Decoded decode(byte[] payload) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new CacheException("Corrupt cache payload", e);
        }
        if (root == null || !FORMAT.equals(root.path("codec").asText())) {
            throw new CacheException("Unsupported cache payload codec " + (root == null ? null : root.path("codec").asText()));
        }
        try {
            TabularResult.Builder builder = TabularResult.builder();
            List<ColumnType> types = new ArrayList<>();
            JsonNode columns = root.path("columns");
            JsonNode typeNodes = root.path("types");
            for (int i = 0; i < columns.size(); i++) {
                ColumnType type = ColumnType.valueOf(typeNodes.path(i).asText());
                types.add(type);
                builder.column(columns.get(i).asText(), type);
            }
            for (JsonNode rowNode : root.path("rows")) {
                List<Object> row = new ArrayList<>(rowNode.size());
                for (int i = 0; i < rowNode.size(); i++) {
                    row.add(readValue(rowNode.get(i), i < types.size() ? types.get(i) : ColumnType.UNKNOWN));
                }
                builder.row(row);
            }
            List<String> warnings = new ArrayList<>();
            root.path("warnings").forEach(node -> warnings.add(node.asText()));
            return new Decoded(builder.build(), warnings);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new CacheException("Corrupt cache payload", e);
        }
    }

    private static void addValue(ArrayNode node, ColumnType type, Object value) {
        if (value == null) {
            node.addNull();
            return;
        }
        switch (type) {
            case INTEGER:
                node.add(((Number) value).longValue());
                break;
            case FLOAT:
                node.add(((Number) value).doubleValue());
                break;
            case DECIMAL:
                // as text, so the scale survives
                node.add(value.toString());
                break;
            case BOOLEAN:
                node.add((Boolean) value);
                break;
            default:
                node.add(value.toString());
        }
    }

    private static Object readValue(JsonNode node, ColumnType type) {
        if (node == null || node.isNull()) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return node.asLong();
            case FLOAT:
                return node.isNumber() ? node.asDouble() : Double.valueOf(node.asText());
            case DECIMAL:
                return new BigDecimal(node.asText());
            case BOOLEAN:
                return node.asBoolean();
            case TIMESTAMP:
                return Instant.parse(node.asText());
            default:
                return node.asText();
        }
    }

    /**
     * A decoded payload: the result and the warnings stored with it.
     */
    public static final class Decoded {
        private final TabularResult result;
        private final List<String> warnings;

        Decoded(TabularResult result, List<String> warnings) {
            this.result = result;
            this.warnings = List.copyOf(warnings);
        }

        public TabularResult getResult() {
            return result;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
