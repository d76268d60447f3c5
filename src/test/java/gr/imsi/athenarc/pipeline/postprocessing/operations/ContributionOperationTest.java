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

public class ContributionOperationTest {

    private final ContributionOperation contribution = new ContributionOperation();

    private final TabularResult shares = TabularResult.builder()
        .column("country", ColumnType.STRING)
        .column("web", ColumnType.INTEGER)
        .column("store", ColumnType.FLOAT)
        .row("GR", 1L, 0.0)
        .row("FR", 3L, 0.0)
        .row("DE", null, 0.0)
        .build();

    @Test
    public void testColumnOrientationOverNumericColumns() {
        TabularResult result = contribution.apply(shares, new OperationOptions("contribution", Map.of()));

        assertEquals(List.of("country", "web", "store"), result.getColumns());
        assertEquals(ColumnType.FLOAT, result.getType("web"));
        assertEquals(Arrays.asList(0.25, 0.75, null), result.getColumnValues("web"));
        // zero column total
        assertEquals(Arrays.asList(null, null, null), result.getColumnValues("store"));
    }

    @Test
    public void testRowOrientationWithRenamedColumns() {
        TabularResult result = contribution.apply(shares, new OperationOptions("contribution", Map.of(
            "orientation", "row",
            "columns", List.of("web", "store"),
            "rename_columns", List.of("web_share", "store_share"))));

        assertEquals(List.of("country", "web", "store", "web_share", "store_share"), result.getColumns());
        assertEquals(Arrays.asList(1.0, 1.0, null), result.getColumnValues("web_share"));
        assertEquals(Arrays.asList(0.0, 0.0, null), result.getColumnValues("store_share"));
    }

    @Test
    public void testRejectsUnknownOrientation() {
        assertThrows(PostProcessingException.class, () -> contribution.apply(shares,
            new OperationOptions("contribution", Map.of("orientation", "diagonal"))));
        assertThrows(PostProcessingException.class, () -> contribution.apply(shares,
            new OperationOptions("contribution", Map.of("columns", List.of("web"), "rename_columns", List.of()))));
    }
}
