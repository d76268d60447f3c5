package gr.imsi.athenarc.pipeline.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

public class QueryDescriptorReaderTest {

    private final QueryDescriptorReader reader = new QueryDescriptorReader();

    @Test
    public void testReadsFullDescriptor() {
        String json = "{"
            + "\"datasource\": {\"id\": \"sales\", \"kind\": \"table\"},"
            + "\"columns\": [\"country\"],"
            + "\"metrics\": [\"count\", {\"label\": \"revenue\", \"column\": \"amount\", \"aggregate\": \"sum\"}],"
            + "\"filters\": [{\"col\": \"status\", \"op\": \"IN\", \"val\": [\"paid\", \"shipped\"]},"
            + "              {\"col\": \"refunded_at\", \"op\": \"IS NULL\"}],"
            + "\"having\": [{\"col\": \"revenue\", \"op\": \">\", \"val\": 100}],"
            + "\"orderby\": [{\"column\": \"revenue\", \"direction\": \"desc\"}],"
            + "\"row_limit\": 25,"
            + "\"granularity\": \"created_at\", \"time_grain\": \"P1D\","
            + "\"time_range\": {\"from\": \"2024-01-01T00:00:00+02:00\", \"to\": \"2024-02-01T00:00:00Z\"},"
            + "\"extras\": {\"timeout\": 30},"
            + "\"post_processing\": [{\"operation\": \"sort\", \"options\": {\"columns\": {\"revenue\": false}}}],"
            + "\"result_format\": \"csv\""
            + "}";

        QueryDescriptor descriptor = reader.read(json);

        assertEquals(new DatasourceRef("sales", "table"), descriptor.getDatasource());
        assertEquals(List.of("country"), descriptor.getDimensions());
        assertEquals(List.of(Metric.saved("count"), Metric.adhoc("revenue", "amount", AggregationType.SUM)),
            descriptor.getMetrics());
        assertEquals(Filter.of("status", FilterOperator.IN, List.of("paid", "shipped")), descriptor.getFilters().get(0));
        assertEquals(Filter.of("refunded_at", FilterOperator.IS_NULL), descriptor.getFilters().get(1));
        assertEquals(List.of(Filter.of("revenue", FilterOperator.GREATER_THAN, 100)), descriptor.getHaving());
        assertEquals(List.of(OrderBy.desc("revenue")), descriptor.getOrderBy());
        assertEquals(25, descriptor.getRowLimit().get());
        assertEquals(TimeGrain.DAY, descriptor.getTimeGrain().get());
        assertEquals(new TimeRange(Instant.parse("2023-12-31T22:00:00Z"), Instant.parse("2024-02-01T00:00:00Z")),
            descriptor.getTimeRange().get());
        assertEquals(30, descriptor.getExtras().get("timeout"));
        assertEquals(List.of(PostProcessingOperation.of("sort", Map.of("columns", Map.of("revenue", false)))),
            descriptor.getPostProcessing());
        assertEquals(ResultFormat.CSV, descriptor.getResultFormat());
        assertEquals(ResultType.FULL, descriptor.getResultType());
    }

    @Test
    public void testDatasourceMayBeAPlainId() {
        QueryDescriptor descriptor = reader.read("{\"datasource\": \"events\", \"metrics\": [\"count\"]}");

        assertEquals(DatasourceRef.of("events"), descriptor.getDatasource());
    }

    @Test
    public void testRejectsMalformedInput() {
        assertThrows(QueryValidationException.class, () -> reader.read("{\"datasource\": "));
        assertThrows(QueryValidationException.class, () -> reader.read("[]"));
        assertThrows(QueryValidationException.class, () -> reader.read("{\"metrics\": [\"count\"]}"));
        assertThrows(QueryValidationException.class,
            () -> reader.read("{\"datasource\": \"sales\", \"columns\": \"country\"}"));
        assertThrows(QueryValidationException.class,
            () -> reader.read("{\"datasource\": \"sales\", \"metrics\": [{\"label\": \"x\", \"aggregate\": \"SUM\"}]}"));
        assertThrows(QueryValidationException.class,
            () -> reader.read("{\"datasource\": \"sales\", \"metrics\": [\"count\"], \"row_limit\": \"ten\"}"));
        assertThrows(QueryValidationException.class, () -> reader.read(
            "{\"datasource\": \"sales\", \"metrics\": [\"count\"], \"time_range\": {\"from\": \"yesterday\", \"to\": null}}"));
    }
}
