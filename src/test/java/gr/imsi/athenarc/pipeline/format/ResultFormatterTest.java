package gr.imsi.athenarc.pipeline.format;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryExecutionException;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.FilterOperator;
import gr.imsi.athenarc.pipeline.query.ResultFormat;

public class ResultFormatterTest {

    private static final Instant CACHED_AT = Instant.parse("2024-06-01T11:30:00Z");

    private final ResultFormatter formatter = ResultFormatter.withDefaultWriters();
    private final ObjectMapper mapper = new ObjectMapper();

    private final TabularResult result = TabularResult.builder()
        .column("day", ColumnType.TIMESTAMP)
        .column("country", ColumnType.STRING)
        .column("revenue", ColumnType.DECIMAL)
        .column("ratio", ColumnType.FLOAT)
        .row(Instant.parse("2024-05-01T00:00:00Z"), "GR", new BigDecimal("120.50"), 0.25)
        .row(Instant.parse("2024-05-02T00:00:00Z"), "Bosnia, Herzegovina", null, Double.NaN)
        .build();

    private final ResultMetadata metadata = new ResultMetadata("qp:table:sales:abc", true, CACHED_AT,
        List.of(Filter.of("status", FilterOperator.IN, List.of("paid")),
            Filter.of("refunded_at", FilterOperator.IS_NULL),
            Filter.rowLevel("tenant", "\"tenant_id\" = 'acme'")),
        List.of("Unknown post-processing operation 'x' at position 0 was skipped"));

    @Test
    public void testJsonDocument() throws IOException {
        FormattedPayload payload = formatter.format(result, metadata, ResultFormat.JSON);

        assertEquals(ResultFormat.JSON, payload.getFormat());
        assertEquals("application/json", payload.getContentType());
        assertEquals(2, payload.getRowCount());

        JsonNode root = mapper.readTree(payload.getBody());
        assertEquals("qp:table:sales:abc", root.get("cache_key").asText());
        assertTrue(root.get("is_cached").asBoolean());
        assertEquals("2024-06-01T11:30:00Z", root.get("cached_dttm").asText());
        assertEquals(2, root.get("rowcount").asInt());
        assertEquals("TIMESTAMP", root.get("coltypes").get(0).asText());

        JsonNode first = root.get("data").get(0);
        assertEquals("2024-05-01T00:00:00Z", first.get("day").asText());
        assertEquals(120.5, first.get("revenue").asDouble(), 1e-9);
        JsonNode second = root.get("data").get(1);
        assertTrue(second.get("revenue").isNull());
        assertTrue(second.get("ratio").isNull());

        JsonNode filters = root.get("applied_filters");
        assertEquals(2, filters.size());
        assertEquals("IN", filters.get(0).get("op").asText());
        assertEquals("paid", filters.get(0).get("val").get(0).asText());
        assertEquals("IS NULL", filters.get(1).get("op").asText());
        assertFalse(filters.get(1).has("val"));

        assertEquals(1, root.get("warnings").size());
    }

    @Test
    public void testJsonForFreshResult() throws IOException {
        JsonNode root = mapper.readTree(formatter.format(result, ResultMetadata.empty(), ResultFormat.JSON).getBody());

        assertTrue(root.get("cache_key").isNull());
        assertFalse(root.get("is_cached").asBoolean());
        assertTrue(root.get("cached_dttm").isNull());
    }

    @Test
    public void testCsv() {
        FormattedPayload payload = formatter.format(result, metadata, ResultFormat.CSV);

        assertEquals("text/csv; charset=utf-8", payload.getContentType());
        List<String[]> lines = new CsvParser(new CsvParserSettings()).parseAll(new StringReader(payload.getBodyAsString()));
        assertEquals(3, lines.size());
        assertArrayEquals(new String[] {"day", "country", "revenue", "ratio"}, lines.get(0));
        assertArrayEquals(new String[] {"2024-05-01T00:00:00Z", "GR", "120.50", "0.25"}, lines.get(1));
        assertEquals("Bosnia, Herzegovina", lines.get(2)[1]);
        assertNull(lines.get(2)[2]);
    }

    @Test
    public void testXlsx() throws IOException {
        FormattedPayload payload = formatter.format(result, metadata, ResultFormat.XLSX);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(payload.getBody()))) {
            Sheet sheet = workbook.getSheet(XlsxPayloadWriter.SHEET_NAME);
            assertEquals(2, sheet.getLastRowNum());
            assertEquals("revenue", sheet.getRow(0).getCell(2).getStringCellValue());
            assertTrue(workbook.getFontAt(sheet.getRow(0).getCell(0).getCellStyle().getFontIndex()).getBold());

            Row first = sheet.getRow(1);
            assertEquals(LocalDateTime.of(2024, 5, 1, 0, 0), first.getCell(0).getLocalDateTimeCellValue());
            assertEquals("GR", first.getCell(1).getStringCellValue());
            assertEquals(120.5, first.getCell(2).getNumericCellValue(), 1e-9);

            Row second = sheet.getRow(2);
            assertNull(second.getCell(2));
        }
    }

    @Test
    public void testOverlongXlsxCellIsRejectedWithItsColumn() {
        TabularResult notes = TabularResult.builder()
            .column("country", ColumnType.STRING)
            .column("note", ColumnType.STRING)
            .row("GR", "x".repeat(32768))
            .build();

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> formatter.format(notes, metadata, ResultFormat.XLSX));
        assertEquals(PipelineStage.FORMATTED, e.getStage());
        assertTrue(e.getMessage().contains("column note"), e.getMessage());

        // the other formats carry the value unchanged
        assertEquals(1, formatter.format(notes, metadata, ResultFormat.CSV).getRowCount());
    }

    @Test
    public void testWriterFailureIsAFormattingError() {
        PayloadWriter broken = new PayloadWriter() {
            @Override
            public ResultFormat getFormat() {
                return ResultFormat.CSV;
            }

            @Override
            public String getContentType() {
                return "text/csv";
            }

            @Override
            public void write(TabularResult result, ResultMetadata metadata, OutputStream output) throws IOException {
                throw new IOException("disk full");
            }
        };
        ResultFormatter csvOnly = new ResultFormatter(List.of(broken), mapper);

        QueryExecutionException e = assertThrows(QueryExecutionException.class,
            () -> csvOnly.format(result, metadata, ResultFormat.CSV));
        assertEquals(PipelineStage.FORMATTED, e.getStage());
        assertThrows(QueryExecutionException.class, () -> csvOnly.format(result, metadata, ResultFormat.XLSX));
    }

    @Test
    public void testQueryPayload() throws IOException {
        FormattedPayload payload = formatter.formatQuery(new NativeQuery("sales", "SELECT 1", "postgresql"));

        JsonNode root = mapper.readTree(payload.getBody());
        assertEquals("SELECT 1", root.get("query").asText());
        assertEquals("postgresql", root.get("language").asText());
        assertEquals(0, payload.getRowCount());
    }
}
