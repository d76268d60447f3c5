package gr.imsi.athenarc.pipeline.format;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryExecutionException;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

/**
 * Turns a final tabular result into the payload of the requested format.
 */
public class ResultFormatter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultFormatter.class);

    private final Map<ResultFormat, PayloadWriter> writers = new EnumMap<>(ResultFormat.class);
    private final ObjectMapper mapper;

    public ResultFormatter(List<? extends PayloadWriter> writers, ObjectMapper mapper) {
        for (PayloadWriter writer : writers) {
            this.writers.put(writer.getFormat(), writer);
        }
        this.mapper = mapper;
    }

    public static ResultFormatter withDefaultWriters() {
        ObjectMapper mapper = new ObjectMapper();
        return new ResultFormatter(List.of(new JsonPayloadWriter(mapper), new CsvPayloadWriter(), new XlsxPayloadWriter()), mapper);
    }

    public FormattedPayload format(TabularResult result, ResultMetadata metadata, ResultFormat format) {
        PayloadWriter writer = writers.get(format);
        if (writer == null) {
            throw new QueryExecutionException(PipelineStage.FORMATTED, "No writer registered for result format " + format);
        }
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try {
            writer.write(result, metadata, output);
        } catch (IOException | RuntimeException e) {
            throw new QueryExecutionException(PipelineStage.FORMATTED, "Could not write " + format + " payload: " + e.getMessage(), e);
        }
        FormattedPayload payload = new FormattedPayload(format, writer.getContentType(), output.toByteArray(), result.getRowCount(), result.getColumns());
        LOG.debug("Formatted {}", payload);
        return payload;
    }

    /**
     * Payload for the query-only result type: the compiled statement instead of rows.
     */
    public FormattedPayload formatQuery(NativeQuery query) {
        ObjectNode root = mapper.createObjectNode();
        root.put("query", query.getText());
        root.put("language", query.getLanguage());
        try {
            byte[] body = mapper.writeValueAsBytes(root);
            return new FormattedPayload(ResultFormat.JSON, JsonPayloadWriter.CONTENT_TYPE, body, 0, List.of());
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException(PipelineStage.FORMATTED, "Could not write query payload", e);
        }
    }
}
