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

public class CumulativeOperationTest {

    private final CumulativeOperation cum = new CumulativeOperation();

    private final TabularResult series = TabularResult.builder()
        .column("orders", ColumnType.INTEGER)
        .column("revenue", ColumnType.FLOAT)
        .row(2L, 1.5)
        .row(null, 2.5)
        .row(3L, 0.5)
        .build();

    @Test
    public void testIntegerSumStaysIntegral() {
        TabularResult result = cum.apply(series, new OperationOptions("cum", Map.of(
            "columns", Map.of("orders", "orders_total"),
            "operator", "sum")));

        assertEquals(ColumnType.INTEGER, result.getType("orders_total"));
        assertEquals(Arrays.asList(2L, null, 5L), result.getColumnValues("orders_total"));
        assertEquals(Arrays.asList(2L, null, 3L), result.getColumnValues("orders"));
    }

    @Test
    public void testRunningMaxOverwritesSource() {
        TabularResult result = cum.apply(series, new OperationOptions("cum", Map.of(
            "columns", Map.of("revenue", "revenue"),
            "operator", "max")));

        assertEquals(List.of("orders", "revenue"), result.getColumns());
        assertEquals(List.of(1.5, 2.5, 2.5), result.getColumnValues("revenue"));
    }

    @Test
    public void testUnknownOperator() {
        assertThrows(PostProcessingException.class, () -> cum.apply(series, new OperationOptions("cum", Map.of(
            "columns", Map.of("revenue", "revenue"),
            "operator", "mean"))));
    }
}
