package gr.imsi.athenarc.pipeline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.pipeline.datasource.config.DatasourceConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.TrinoConfiguration;

public class PipelineConfigTest {

    private static Properties testProperties() throws IOException {
        Properties properties = new Properties();
        try (InputStream input = PipelineConfigTest.class.getResourceAsStream("/pipeline-test.properties")) {
            assertNotNull(input, "pipeline-test.properties is missing");
            properties.load(input);
        }
        return properties;
    }

    @Test
    public void testReadsPipelineSettings() throws IOException {
        PipelineConfig config = PipelineConfig.fromProperties(testProperties());

        assertEquals(3, config.getVersion());
        assertEquals(Duration.ofMinutes(30), config.getBaseTtl());
        assertEquals(Duration.ofMinutes(1), config.getMinTtl());
        assertEquals(Duration.ofHours(2), config.getMaxTtl());
        assertEquals(250, config.getCacheMaxEntries());
        assertEquals(Duration.ofSeconds(10), config.getDefaultTimeout());
        assertEquals(500, config.getMaxRowLimit());
        assertEquals(2, config.getExecutorThreads());
    }

    @Test
    public void testReadsDatasources() throws IOException {
        List<DatasourceConfiguration> datasources = PipelineConfig.fromProperties(testProperties()).getDatasources();

        assertEquals(2, datasources.size());

        SQLConfiguration sales = (SQLConfiguration) datasources.get(0);
        assertEquals("sales", sales.getId());
        assertEquals("jdbc:postgresql://localhost:5432/shop", sales.getUrl());
        assertEquals("orders", sales.getTableName());
        assertEquals("created_at", sales.getTimestampColumn());
        assertEquals(4, sales.getMaxPoolSize());
        assertEquals(List.of("avg_amount", "revenue"), List.copyOf(sales.getMetrics().keySet()));
        assertEquals("SUM(amount)", sales.getMetrics().get("revenue"));

        assertTrue(datasources.get(1) instanceof TrinoConfiguration);
        TrinoConfiguration events = (TrinoConfiguration) datasources.get(1);
        assertEquals("hive", events.getCatalog());
        assertEquals("web", events.getSchemaName());
        assertEquals(10, events.getMaxPoolSize());
    }

    @Test
    public void testMissingKeysUseDefaults() {
        PipelineConfig config = PipelineConfig.fromProperties(new Properties());

        assertEquals(1, config.getVersion());
        assertEquals(Duration.ofHours(1), config.getBaseTtl());
        assertEquals(Duration.ofMinutes(5), config.getMinTtl());
        assertEquals(Duration.ofHours(24), config.getMaxTtl());
        assertEquals(10000, config.getCacheMaxEntries());
        assertEquals(Duration.ofSeconds(30), config.getDefaultTimeout());
        assertEquals(100000, config.getMaxRowLimit());
        assertTrue(config.getDatasources().isEmpty());
    }

    @Test
    public void testClasspathDefaultsLoad() {
        PipelineConfig config = PipelineConfig.load();

        assertTrue(config.getDatasources().isEmpty());
        assertTrue(config.getExecutorThreads() >= 2);
    }

    @Test
    public void testRejectsInvalidValues() {
        Properties badDuration = new Properties();
        badDuration.setProperty("pipeline.cache.base-ttl", "one hour");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(badDuration));

        Properties inverted = new Properties();
        inverted.setProperty("pipeline.cache.min-ttl", "PT2H");
        inverted.setProperty("pipeline.cache.max-ttl", "PT1H");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(inverted));

        Properties noCache = new Properties();
        noCache.setProperty("pipeline.cache.max-entries", "0");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(noCache));

        Properties unknownType = new Properties();
        unknownType.setProperty("datasource.ids", "logs");
        unknownType.setProperty("datasource.logs.type", "influx");
        assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(unknownType));

        Properties incomplete = new Properties();
        incomplete.setProperty("datasource.ids", "logs");
        assertThrows(IllegalStateException.class, () -> PipelineConfig.fromProperties(incomplete));
    }
}
