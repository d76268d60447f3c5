package gr.imsi.athenarc.pipeline.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.datasource.DatasourceSchema;
import gr.imsi.athenarc.pipeline.datasource.dialect.PostgresDialect;
import gr.imsi.athenarc.pipeline.datasource.dialect.TrinoDialect;
import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.exception.QueryValidationException;
import gr.imsi.athenarc.pipeline.query.AggregationType;
import gr.imsi.athenarc.pipeline.query.Filter;
import gr.imsi.athenarc.pipeline.query.FilterOperator;
import gr.imsi.athenarc.pipeline.query.Metric;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.query.SortDirection;
import gr.imsi.athenarc.pipeline.query.TimeGrain;

public class QueryCompilerTest {

    private final QueryCompiler compiler = new QueryCompiler(1000);

    private final DatasourceSchema schema = DatasourceSchema.builder("sales")
        .source("\"public\".\"orders\"")
        .column("country", ColumnType.STRING)
        .column("status", ColumnType.STRING)
        .column("amount", ColumnType.FLOAT)
        .column("quantity", ColumnType.INTEGER)
        .column("year", ColumnType.INTEGER, "EXTRACT(YEAR FROM \"created_at\")")
        .column("created_at", ColumnType.TIMESTAMP)
        .metric("revenue", "SUM(\"amount\")")
        .build();

    private String compile(QueryDescriptor descriptor) {
        return compiler.compile(descriptor, schema, new PostgresDialect()).getText();
    }

    @Test
    public void testGroupedQueryWithFiltersAndOrdering() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withMetrics("revenue")
            .withMetric(Metric.adhoc("orders", null, AggregationType.COUNT))
            .withFilter("status", FilterOperator.IN, List.of("paid", "shipped"))
            .withFilter("amount", FilterOperator.GREATER_THAN, 10.5)
            .withOrderBy("revenue", SortDirection.DESC)
            .withRowLimit(50)
            .build();

        NativeQuery query = compiler.compile(descriptor, schema, new PostgresDialect());

        assertEquals("SELECT \"country\", SUM(\"amount\") AS \"revenue\", COUNT(*) AS \"orders\"\n"
            + "FROM \"public\".\"orders\"\n"
            + "WHERE \"status\" IN ('paid', 'shipped') AND \"amount\" > 10.5\n"
            + "GROUP BY \"country\"\n"
            + "ORDER BY \"revenue\" DESC\n"
            + "LIMIT 50", query.getText());
        assertEquals("sales", query.getDatasourceId());
        assertEquals("postgresql", query.getLanguage());
    }

    @Test
    public void testTimeBucketAndRangeOnPostgres() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withMetrics("count")
            .withTimeGrain(TimeGrain.DAY)
            .withTimeRange(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T00:00:00Z"))
            .withOrderBy(QueryCompiler.TIMESTAMP_LABEL, SortDirection.ASC)
            .build();

        assertEquals("SELECT DATE_TRUNC('day', \"created_at\") AS \"__timestamp\", COUNT(*) AS \"count\"\n"
            + "FROM \"public\".\"orders\"\n"
            + "WHERE \"created_at\" >= TIMESTAMP '2024-01-01 00:00:00.000000'"
            + " AND \"created_at\" < TIMESTAMP '2024-02-01 00:00:00.000000'\n"
            + "GROUP BY DATE_TRUNC('day', \"created_at\")\n"
            + "ORDER BY \"__timestamp\" ASC\n"
            + "LIMIT 1000", compile(descriptor));
    }

    @Test
    public void testTrinoDialectLiteralsAndPaging() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withTimeRange(Instant.parse("2024-01-01T00:00:00Z"), null)
            .withRowLimit(10)
            .withRowOffset(20)
            .build();

        NativeQuery query = compiler.compile(descriptor, schema, new TrinoDialect());

        assertEquals("SELECT \"country\"\n"
            + "FROM \"public\".\"orders\"\n"
            + "WHERE \"created_at\" >= from_iso8601_timestamp('2024-01-01T00:00:00Z')\n"
            + "OFFSET 20 LIMIT 10", query.getText());
        assertEquals("trino", query.getLanguage());
    }

    @Test
    public void testRowLimitIsCappedAtMaximum() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withRowLimit(1_000_000)
            .build();

        assertTrue(compile(descriptor).endsWith("\nLIMIT 1000"));
    }

    @Test
    public void testWhereClauseAndRowLevelPredicatesAreParenthesized() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withWhere("\"amount\" > 0 OR \"quantity\" > 0")
            .build()
            .withAdditionalFilters(List.of(Filter.rowLevel("tenant", "\"country\" = 'GR' OR \"country\" = 'CY'")));

        assertEquals("SELECT \"country\"\n"
            + "FROM \"public\".\"orders\"\n"
            + "WHERE (\"amount\" > 0 OR \"quantity\" > 0) AND (\"country\" = 'GR' OR \"country\" = 'CY')\n"
            + "LIMIT 1000", compile(descriptor));
    }

    @Test
    public void testComputedColumnIsAliased() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("year")
            .withMetric(Metric.adhoc("total", "quantity", AggregationType.SUM))
            .build();

        assertEquals("SELECT EXTRACT(YEAR FROM \"created_at\") AS \"year\", SUM(\"quantity\") AS \"total\"\n"
            + "FROM \"public\".\"orders\"\n"
            + "GROUP BY EXTRACT(YEAR FROM \"created_at\")\n"
            + "LIMIT 1000", compile(descriptor));
    }

    @Test
    public void testHavingResolvesMetricLabels() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withMetric(Metric.adhoc("buyers", "status", AggregationType.COUNT_DISTINCT))
            .withHaving("buyers", FilterOperator.GREATER_THAN_OR_EQUALS, 3)
            .withHaving("revenue", FilterOperator.LESS_THAN, 1000)
            .build();

        String sql = compile(descriptor);

        assertTrue(sql.contains("\nHAVING COUNT(DISTINCT \"status\") >= 3 AND SUM(\"amount\") < 1000\n"), sql);
    }

    @Test
    public void testNullAwarePredicates() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("status", FilterOperator.EQUALS, null)
            .withFilter("country", FilterOperator.NOT_IN, Arrays.asList("GR", null))
            .withFilter("amount", FilterOperator.IS_NOT_NULL, null)
            .build();

        String sql = compile(descriptor);

        assertTrue(sql.contains("WHERE \"status\" IS NULL AND NOT (\"country\" IN ('GR') OR \"country\" IS NULL)"
            + " AND \"amount\" IS NOT NULL\n"), sql);
    }

    @Test
    public void testStringLiteralsAreEscaped() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("country", FilterOperator.EQUALS, "O'Brien'; DROP TABLE orders; --")
            .withFilter("status", FilterOperator.ILIKE, "%ship%")
            .build();

        String sql = compile(descriptor);

        assertTrue(sql.contains("\"country\" = 'O''Brien''; DROP TABLE orders; --'"), sql);
        assertTrue(sql.contains("UPPER(\"status\") LIKE UPPER('%ship%')"), sql);
    }

    @Test
    public void testPatternsArePassedThroughWithoutAddedWildcards() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("status", FilterOperator.LIKE, "ship")
            .withFilter("country", FilterOperator.ILIKE, "g_")
            .build();

        String sql = compile(descriptor);

        // callers choose the wildcards; a bare word matches the whole value only
        assertTrue(sql.contains("\"status\" LIKE 'ship'"), sql);
        assertTrue(sql.contains("UPPER(\"country\") LIKE UPPER('g_')"), sql);
    }

    @Test
    public void testTimestampColumnParsesIsoStrings() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("created_at", FilterOperator.LESS_THAN, "2024-03-01T10:15:30+02:00")
            .build();

        assertTrue(compile(descriptor).contains("\"created_at\" < TIMESTAMP '2024-03-01 08:15:30.000000'"));
    }

    @Test
    public void testUnknownColumnIsRejected() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("salary")
            .build();

        QueryValidationException e = assertThrows(QueryValidationException.class, () -> compile(descriptor));
        assertTrue(e.getMessage().contains("salary"));
    }

    @Test
    public void testUnknownSavedMetricIsRejected() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withMetrics("margin")
            .build();

        assertThrows(QueryValidationException.class, () -> compile(descriptor));
    }

    @Test
    public void testHavingWithoutMetricsIsRejected() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withHaving("amount", FilterOperator.GREATER_THAN, 1)
            .build();

        assertThrows(QueryValidationException.class, () -> compile(descriptor));
    }

    @Test
    public void testEmptyInListIsRejected() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("country", FilterOperator.IN, List.of())
            .build();

        assertThrows(QueryValidationException.class, () -> compile(descriptor));
    }

    @Test
    public void testNonFiniteNumberIsRejected() {
        QueryDescriptor descriptor = QueryDescriptor.builder()
            .withDatasource("sales")
            .withDimensions("country")
            .withFilter("amount", FilterOperator.GREATER_THAN, Double.NaN)
            .build();

        assertThrows(QueryValidationException.class, () -> compile(descriptor));
    }
}
