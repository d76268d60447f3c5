package gr.imsi.athenarc.pipeline.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ValueComparatorTest {

    private final ValueComparator comparator = ValueComparator.INSTANCE;

    @Test
    public void testNumbersCompareAcrossTypes() {
        assertTrue(comparator.compare(2L, 2.5) < 0);
        assertTrue(comparator.compare(new BigDecimal("10.10"), new BigDecimal("9.9")) > 0);
        assertEquals(0, comparator.compare(new BigDecimal("1.0"), new BigDecimal("1.00")));
        assertEquals(0, comparator.compare(3L, 3.0));
    }

    @Test
    public void testTypedValues() {
        assertTrue(comparator.compare("DE", "FR") < 0);
        assertTrue(comparator.compare(Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z")) > 0);
        assertTrue(comparator.compare(false, true) < 0);
    }

    @Test
    public void testNullsSortLast() {
        List<Object> values = new ArrayList<>(Arrays.asList(null, "b", null, "a"));
        values.sort(comparator);

        assertEquals(Arrays.asList("a", "b", null, null), values);
    }

    @Test
    public void testMixedKindsUseStringForm() {
        assertTrue(comparator.compare("10", true) < 0);
        assertEquals(0, comparator.compare("true", true));
    }
}
