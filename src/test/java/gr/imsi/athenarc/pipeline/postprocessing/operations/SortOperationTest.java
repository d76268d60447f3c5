package gr.imsi.athenarc.pipeline.postprocessing.operations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.domain.ColumnType;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.postprocessing.OperationOptions;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingException;

public class SortOperationTest {

    private final SortOperation sort = new SortOperation();

    private final TabularResult rows = TabularResult.builder()
        .column("id", ColumnType.INTEGER)
        .column("group", ColumnType.STRING)
        .column("score", ColumnType.FLOAT)
        .row(1L, "b", 2.0)
        .row(2L, "a", null)
        .row(3L, "b", 9.5)
        .row(4L, "a", 2.0)
        .row(5L, "b", 2.0)
        .build();

    @Test
    public void testDescendingKeepsNullsLast() {
        TabularResult result = sort.apply(rows, new OperationOptions("sort", Map.of("columns", Map.of("score", false))));

        assertEquals(Arrays.asList(9.5, 2.0, 2.0, 2.0, null), result.getColumnValues("score"));
    }

    @Test
    public void testSortIsStableAcrossKeys() {
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("group", true);
        keys.put("score", true);

        TabularResult result = sort.apply(rows, new OperationOptions("sort", Map.of("columns", keys)));

        assertEquals(List.of(4L, 2L, 1L, 5L, 3L), result.getColumnValues("id"));
    }

    @Test
    public void testDirectionMustBeBoolean() {
        assertThrows(PostProcessingException.class,
            () -> sort.apply(rows, new OperationOptions("sort", Map.of("columns", Map.of("score", "desc")))));
    }
}
