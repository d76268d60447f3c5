package gr.imsi.athenarc.pipeline.postprocessing.operations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingException;

public class PivotOperationTest {

    private final PivotOperation pivot = new PivotOperation();

    private final TabularResult sales = TabularResult.builder()
        .column("country", ColumnType.STRING)
        .column("product", ColumnType.STRING)
        .column("sales", ColumnType.INTEGER)
        .row("GR", "a", 10L)
        .row("GR", "b", 5L)
        .row("FR", "a", 7L)
        .row("GR", "a", 3L)
        .row("FR", null, 1L)
        .build();

    private static OperationOptions options(Map<String, Object> options) {
        return new OperationOptions(PivotOperation.KIND, options);
    }

    @Test
    public void testPivotsLongToWideWithNullValuesLast() {
        TabularResult result = pivot.apply(sales, options(Map.of(
            "index", List.of("country"),
            "columns", List.of("product"),
            "aggregates", Map.of("sales", Map.of("operator", "sum")))));

        assertEquals(List.of("country", "sales, a", "sales, b", "sales, <NULL>"), result.getColumns());
        assertEquals(List.of(ColumnType.STRING, ColumnType.FLOAT, ColumnType.FLOAT, ColumnType.FLOAT), result.getTypes());
        assertEquals(Arrays.asList("FR", 7.0, null, 1.0), result.getRows().get(0));
        assertEquals(Arrays.asList("GR", 13.0, 5.0, null), result.getRows().get(1));
    }

    @Test
    public void testWithoutPivotColumnsUsesAggregateName() {
        TabularResult result = pivot.apply(sales, options(Map.of(
            "index", "country",
            "aggregates", Map.of("orders", Map.of("column", "sales", "operator", "count")))));

        assertEquals(List.of("country", "orders"), result.getColumns());
        assertEquals(List.of(2L, 3L), result.getColumnValues("orders"));
    }

    @Test
    public void testIndexIsRequired() {
        assertThrows(PostProcessingException.class, () -> pivot.apply(sales, options(Map.of(
            "aggregates", Map.of("sales", Map.of("operator", "sum"))))));
        assertThrows(PostProcessingException.class, () -> pivot.apply(sales, options(Map.of(
            "index", List.of(),
            "aggregates", Map.of("sales", Map.of("operator", "sum"))))));
    }

    @Test
    public void testColumnNameJoinsPivotValues() {
        assertEquals("sum, GR, <NULL>", PivotOperation.columnName("sum", Arrays.asList("GR", null)));
        assertEquals("sum", PivotOperation.columnName("sum", List.of()));
    }
}
