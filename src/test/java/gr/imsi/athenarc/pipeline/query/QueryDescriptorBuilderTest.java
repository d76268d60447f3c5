package gr.imsi.athenarc.pipeline.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

public class QueryDescriptorBuilderTest {

    private static QueryDescriptorBuilder salesByCountry() {
        return QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withMetrics("revenue");
    }

    @Test
    public void testDefaults() {
        QueryDescriptor descriptor = salesByCountry().build();

        assertEquals(DatasourceRef.of("sales"), descriptor.getDatasource());
        assertEquals(ResultFormat.JSON, descriptor.getResultFormat());
        assertEquals(ResultType.FULL, descriptor.getResultType());
        assertFalse(descriptor.getRowLimit().isPresent());
        assertFalse(descriptor.getTimeRange().isPresent());
        assertEquals(List.of("revenue"), descriptor.getMetricLabels());
    }

    @Test
    public void testDescriptorIsImmutable() {
        List<String> values = new ArrayList<>(List.of("paid"));
        QueryDescriptor descriptor = salesByCountry()
            .withFilter("status", FilterOperator.IN, values)
            .build();
        values.add("refunded");

        assertEquals(List.of("paid"), descriptor.getFilters().get(0).getValue());
        assertThrows(UnsupportedOperationException.class, () -> descriptor.getDimensions().add("region"));
    }

    @Test
    public void testRequiresDatasourceAndSomethingToSelect() {
        assertThrows(QueryValidationException.class, () -> QueryDescriptor.builder().withDimensions("country").build());
        assertThrows(QueryValidationException.class, () -> QueryDescriptor.builder().withDatasource("sales").build());
        // a time grain alone is enough
        QueryDescriptor.builder().withDatasource("sales").withTimeColumn("created_at").withTimeGrain(TimeGrain.DAY).build();
    }

    @Test
    public void testRejectsInvalidPaging() {
        assertThrows(QueryValidationException.class, () -> salesByCountry().withRowLimit(-1).build());
        assertThrows(QueryValidationException.class, () -> salesByCountry().withRowOffset(-5).build());
        assertEquals(0, salesByCountry().withRowLimit(0).build().getRowLimit().get());
    }

    @Test
    public void testRejectsDuplicates() {
        assertThrows(QueryValidationException.class, () -> salesByCountry().withDimensions("country").build());
        assertThrows(QueryValidationException.class, () -> salesByCountry()
            .withMetric(Metric.adhoc("revenue", "amount", AggregationType.SUM))
            .build());
    }

    @Test
    public void testRejectsClashingOutputLabels() {
        QueryValidationException e = assertThrows(QueryValidationException.class, () -> salesByCountry()
            .withMetric(Metric.adhoc("country", "amount", AggregationType.COUNT_DISTINCT))
            .build());
        assertTrue(e.getMessage().contains("country"), e.getMessage());

        assertThrows(QueryValidationException.class, () -> QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions(QueryDescriptor.TIMESTAMP_LABEL)
            .withTimeGrain(TimeGrain.DAY)
            .build());
        assertThrows(QueryValidationException.class, () -> salesByCountry()
            .withMetric(Metric.adhoc(QueryDescriptor.TIMESTAMP_LABEL, null, AggregationType.COUNT))
            .withTimeGrain(TimeGrain.HOUR)
            .build());

        // without a grain there is no bucket column to clash with
        QueryDescriptor plain = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions(QueryDescriptor.TIMESTAMP_LABEL)
            .build();
        assertEquals(List.of(QueryDescriptor.TIMESTAMP_LABEL), plain.getDimensions());
    }

    @Test
    public void testRejectsNonPositiveTimeouts() {
        assertThrows(QueryValidationException.class, () -> salesByCountry().withExtra("timeout", 0).build());
        assertThrows(QueryValidationException.class, () -> salesByCountry().withExtra("cache_timeout", "soon").build());
        assertEquals(2.5, salesByCountry().withExtra("timeout", 2.5).build().getExtras().get("timeout"));
    }

    @Test
    public void testTimeRangeMustBeOrdered() {
        Instant now = Instant.parse("2024-06-01T00:00:00Z");
        assertThrows(QueryValidationException.class, () -> salesByCountry().withTimeRange(now, now));
        assertThrows(QueryValidationException.class, () -> salesByCountry().withTimeRange(now, now.minusSeconds(1)));
    }

    @Test
    public void testFilterOperandsAreChecked() {
        assertThrows(QueryValidationException.class, () -> Filter.of("status", FilterOperator.IN, "paid"));
        assertThrows(QueryValidationException.class, () -> Filter.of("status", FilterOperator.EXPRESSION, "1 = 1"));
        assertThrows(QueryValidationException.class, () -> salesByCountry()
            .withHaving(List.of(Filter.rowLevel("tenant", "\"tenant_id\" = 1")))
            .build());
        assertTrue(Filter.rowLevel("tenant", "\"tenant_id\" = 1").isRowLevel());
    }

    @Test
    public void testToBuilderAndAdditionalFilters() {
        QueryDescriptor original = salesByCountry()
            .withPostProcessing("sort", Map.of("columns", Map.of("revenue", false)))
            .build();

        assertEquals(original, original.toBuilder().build());

        QueryDescriptor restricted = original.withAdditionalFilters(List.of(Filter.rowLevel("tenant", "\"tenant_id\" = 1")));
        assertEquals(1, restricted.getFilters().size());
        assertTrue(original.getFilters().isEmpty());
        assertNotEquals(original, restricted);
        assertEquals(original.getPostProcessing(), restricted.getPostProcessing());
    }

    @Test
    public void testOperatorLookup() {
        assertEquals(FilterOperator.NOT_IN, FilterOperator.fromSymbol("not in"));
        assertEquals(FilterOperator.NOT_IN, FilterOperator.fromSymbol("NOT_IN"));
        assertEquals(FilterOperator.EQUALS, FilterOperator.fromSymbol("="));
        assertThrows(QueryValidationException.class, () -> FilterOperator.fromSymbol("~"));
        assertEquals(TimeGrain.DAY, TimeGrain.fromName("P1D"));
        assertEquals(TimeGrain.WEEK, TimeGrain.fromName("week"));
    }
}
