package gr.imsi.athenarc.pipeline.postprocessing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.query.PostProcessingOperation;

public class PostProcessingPipelineTest {

    private final PostProcessingPipeline pipeline = PostProcessingPipeline.withDefaultOperations();

    private final TabularResult sales = TabularResult.builder()
        .column("country", ColumnType.STRING)
        .column("product", ColumnType.STRING)
        .column("sales", ColumnType.INTEGER)
        .row("GR", "a", 10L)
        .row("GR", "b", 5L)
        .row("FR", "a", 7L)
        .row("GR", "a", 3L)
        .build();

    @Test
    public void testRegistersAllBuiltInOperations() {
        assertEquals(9, pipeline.getSupportedKinds().size());
        assertTrue(pipeline.getSupportedKinds().containsAll(
            List.of("pivot", "aggregate", "sort", "rolling", "compare", "cum", "diff", "contribution", "select")));
    }

    @Test
    public void testNoOperationsReturnsInputUnchanged() {
        PostProcessingResult result = pipeline.apply(sales, List.of());

        assertSame(sales, result.getResult());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void testUnknownOperationIsSkippedWithWarning() {
        PostProcessingResult result = pipeline.apply(sales, List.of(
            PostProcessingOperation.of("prophet", Map.of("periods", 7)),
            PostProcessingOperation.of("sort", Map.of("columns", Map.of("sales", true)))));

        assertEquals(List.of("Unknown post-processing operation 'prophet' at position 0 was skipped"), result.getWarnings());
        assertEquals(List.of(3L, 5L, 7L, 10L), result.getResult().getColumnValues("sales"));
    }

    @Test
    public void testOperationsAreChainedInOrder() {
        PostProcessingResult result = pipeline.apply(sales, List.of(
            PostProcessingOperation.of("aggregate", Map.of(
                "groupby", List.of("country"),
                "aggregates", Map.of("total", Map.of("column", "sales", "operator", "sum")))),
            PostProcessingOperation.of("sort", Map.of("columns", Map.of("total", false)))));

        TabularResult output = result.getResult();
        assertEquals(List.of("country", "total"), output.getColumns());
        assertEquals(List.of("GR", "FR"), output.getColumnValues("country"));
        assertEquals(List.of(18.0, 7.0), output.getColumnValues("total"));
    }

    @Test
    public void testSortIsIdempotent() {
        List<PostProcessingOperation> sort = List.of(
            PostProcessingOperation.of("sort", Map.of("columns", Map.of("country", true))));

        TabularResult once = pipeline.apply(sales, sort).getResult();
        TabularResult twice = pipeline.apply(once, sort).getResult();

        assertEquals(once, twice);
    }

    @Test
    public void testMalformedOptionsAbortWithValidationError() {
        PostProcessingException e = assertThrows(PostProcessingException.class, () -> pipeline.apply(sales, List.of(
            PostProcessingOperation.of("rolling", Map.of("columns", Map.of("sales", "sales_avg"), "rolling_type", "mean")))));

        assertEquals(PipelineStage.POST_PROCESSED, e.getStage());
        assertTrue(e.getMessage().contains("window"), e.getMessage());
    }

    @Test
    public void testUnknownColumnIsReported() {
        PostProcessingException e = assertThrows(PostProcessingException.class, () -> pipeline.apply(sales, List.of(
            PostProcessingOperation.of("sort", Map.of("columns", Map.of("revenue", true))))));

        assertTrue(e.getMessage().contains("revenue"));
    }
}
