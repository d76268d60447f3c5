package gr.imsi.athenarc.pipeline.datasource.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.datasource.DatasourceException;
import gr.imsi.athenarc.pipeline.domain.ColumnType;

public class SQLQueryExecutorTest {

    private static final Instant NOON = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    public void testNormalizesNumbers() {
        assertEquals(42L, SQLQueryExecutor.normalize(42, ColumnType.INTEGER));
        assertEquals(42L, SQLQueryExecutor.normalize((short) 42, ColumnType.INTEGER));
        assertEquals(1.5, SQLQueryExecutor.normalize(1.5f, ColumnType.FLOAT));
        assertEquals(new BigDecimal("12"), SQLQueryExecutor.normalize(BigInteger.valueOf(12), ColumnType.DECIMAL));
        assertEquals(new BigDecimal("0.10"), SQLQueryExecutor.normalize(new BigDecimal("0.10"), ColumnType.DECIMAL));
        assertEquals(true, SQLQueryExecutor.normalize("true", ColumnType.BOOLEAN));
        assertNull(SQLQueryExecutor.normalize(null, ColumnType.INTEGER));
    }

    @Test
    public void testNormalizesTemporalValuesToUtcInstants() {
        assertEquals(NOON, SQLQueryExecutor.normalize(Timestamp.valueOf(LocalDateTime.of(2024, 6, 1, 12, 0)), ColumnType.TIMESTAMP));
        assertEquals(NOON, SQLQueryExecutor.normalize(OffsetDateTime.of(2024, 6, 1, 14, 0, 0, 0, ZoneOffset.ofHours(2)), ColumnType.TIMESTAMP));
        assertEquals(NOON, SQLQueryExecutor.normalize(LocalDateTime.of(2024, 6, 1, 12, 0), ColumnType.TIMESTAMP));
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), SQLQueryExecutor.normalize(LocalDate.of(2024, 6, 1), ColumnType.TIMESTAMP));
        assertThrows(DatasourceException.class, () -> SQLQueryExecutor.normalize("yesterday", ColumnType.TIMESTAMP));
    }

    @Test
    public void testOtherTypesBecomeStrings() {
        assertEquals("[1, 2]", SQLQueryExecutor.normalize(List.of(1, 2), ColumnType.UNKNOWN));
    }

    @Test
    public void testTimeoutIsRoundedUpToWholeSeconds() {
        assertEquals(1, SQLQueryExecutor.toSeconds(Duration.ofMillis(1)));
        assertEquals(2, SQLQueryExecutor.toSeconds(Duration.ofMillis(1500)));
        assertEquals(30, SQLQueryExecutor.toSeconds(Duration.ofSeconds(30)));
        assertEquals(1, SQLQueryExecutor.toSeconds(Duration.ZERO));
    }
}
