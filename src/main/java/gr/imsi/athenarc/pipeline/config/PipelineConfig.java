package gr.imsi.athenarc.pipeline.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.pipeline.datasource.config.DatasourceConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.SQLConfiguration;
import gr.imsi.athenarc.pipeline.datasource.config.TrinoConfiguration;

/**
 * Pipeline settings read from {@code application.properties}.
 *
 * <pre>
 * pipeline.version=1
 * pipeline.cache.base-ttl=PT1H
 * pipeline.cache.min-ttl=PT5M
 * pipeline.cache.max-ttl=PT24H
 * pipeline.cache.max-entries=10000
 * pipeline.query.default-timeout=PT30S
 * pipeline.query.max-row-limit=100000
 * pipeline.executor.threads=8
 *
 * datasource.ids=sales
 * datasource.sales.type=postgresql
 * datasource.sales.url=jdbc:postgresql://localhost:5432/shop
 * datasource.sales.username=reader
 * datasource.sales.password=secret
 * datasource.sales.schema=public
 * datasource.sales.table=orders
 * datasource.sales.timestamp-column=created_at
 * datasource.sales.metric.revenue=SUM(amount)
 * </pre>
 *
 * Trino datasources use {@code type=trino} and add {@code catalog}.
 */
public class PipelineConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String RESOURCE = "/application.properties";

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final int version;
    private final Duration baseTtl;
    private final Duration minTtl;
    private final Duration maxTtl;
    private final int cacheMaxEntries;
    private final Duration defaultTimeout;
    private final int maxRowLimit;
    private final int executorThreads;
    private final List<DatasourceConfiguration> datasources;

    private PipelineConfig(Builder builder) {
        this.version = builder.version;
        this.baseTtl = builder.baseTtl;
        this.minTtl = builder.minTtl;
        this.maxTtl = builder.maxTtl;
        this.cacheMaxEntries = builder.cacheMaxEntries;
        this.defaultTimeout = builder.defaultTimeout;
        this.maxRowLimit = builder.maxRowLimit;
        this.executorThreads = builder.executorThreads;
        this.datasources = ImmutableList.copyOf(builder.datasources);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads the classpath {@code application.properties}, falling back to the
     * defaults when the resource is absent.
     */
    public static PipelineConfig load() {
        Properties properties = readProperties();
        return fromProperties(properties);
    }

    public static Properties readProperties() {
        Properties properties = new Properties();
        try (InputStream input = PipelineConfig.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOG.warn("Unable to find {} on the classpath, using defaults", RESOURCE);
                return properties;
            }
            properties.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE, e);
        }
        return properties;
    }

    public static PipelineConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String version = properties.getProperty("pipeline.version");
        if (version != null) {
            builder.version(parseInt("pipeline.version", version));
        }
        String baseTtl = properties.getProperty("pipeline.cache.base-ttl");
        if (baseTtl != null) {
            builder.baseTtl(parseDuration("pipeline.cache.base-ttl", baseTtl));
        }
        String minTtl = properties.getProperty("pipeline.cache.min-ttl");
        if (minTtl != null) {
            builder.minTtl(parseDuration("pipeline.cache.min-ttl", minTtl));
        }
        String maxTtl = properties.getProperty("pipeline.cache.max-ttl");
        if (maxTtl != null) {
            builder.maxTtl(parseDuration("pipeline.cache.max-ttl", maxTtl));
        }
        String maxEntries = properties.getProperty("pipeline.cache.max-entries");
        if (maxEntries != null) {
            builder.cacheMaxEntries(parseInt("pipeline.cache.max-entries", maxEntries));
        }
        String timeout = properties.getProperty("pipeline.query.default-timeout");
        if (timeout != null) {
            builder.defaultTimeout(parseDuration("pipeline.query.default-timeout", timeout));
        }
        String rowLimit = properties.getProperty("pipeline.query.max-row-limit");
        if (rowLimit != null) {
            builder.maxRowLimit(parseInt("pipeline.query.max-row-limit", rowLimit));
        }
        String threads = properties.getProperty("pipeline.executor.threads");
        if (threads != null) {
            builder.executorThreads(parseInt("pipeline.executor.threads", threads));
        }
        for (String id : LIST_SPLITTER.split(properties.getProperty("datasource.ids", ""))) {
            builder.datasource(readDatasource(properties, id));
        }
        PipelineConfig config = builder.build();
        LOG.info("Loaded {}", config);
        return config;
    }

    private static DatasourceConfiguration readDatasource(Properties properties, String id) {
        String prefix = "datasource." + id + ".";
        String type = properties.getProperty(prefix + "type", "postgresql");
        SQLConfiguration.AbstractBuilder<?, ?> builder;
        if (type.equalsIgnoreCase("trino")) {
            builder = TrinoConfiguration.builder().catalog(properties.getProperty(prefix + "catalog"));
        } else if (type.equalsIgnoreCase("postgresql")) {
            builder = SQLConfiguration.builder();
        } else {
            throw new IllegalArgumentException("Unsupported datasource type '" + type + "' for " + id);
        }
        builder.id(id)
            .url(properties.getProperty(prefix + "url"))
            .username(properties.getProperty(prefix + "username"))
            .password(properties.getProperty(prefix + "password"))
            .schemaName(properties.getProperty(prefix + "schema"))
            .tableName(properties.getProperty(prefix + "table"))
            .timestampColumn(properties.getProperty(prefix + "timestamp-column"));
        String poolSize = properties.getProperty(prefix + "max-pool-size");
        if (poolSize != null) {
            builder.maxPoolSize(parseInt(prefix + "max-pool-size", poolSize));
        }
        String metricPrefix = prefix + "metric.";
        properties.stringPropertyNames().stream()
            .filter(key -> key.startsWith(metricPrefix))
            .sorted()
            .forEach(key -> builder.metric(key.substring(metricPrefix.length()), properties.getProperty(key)));
        return builder.build();
    }

    private static Duration parseDuration(String key, String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Property " + key + " is not an ISO-8601 duration: " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    public int getVersion() {
        return version;
    }

    public Duration getBaseTtl() {
        return baseTtl;
    }

    public Duration getMinTtl() {
        return minTtl;
    }

    public Duration getMaxTtl() {
        return maxTtl;
    }

    /**
     * Size limit of the in-memory cache store the pipeline creates when no
     * store is supplied.
     */
    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public int getMaxRowLimit() {
        return maxRowLimit;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public List<DatasourceConfiguration> getDatasources() {
        return datasources;
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
            "version=" + version +
            ", baseTtl=" + baseTtl +
            ", minTtl=" + minTtl +
            ", maxTtl=" + maxTtl +
            ", cacheMaxEntries=" + cacheMaxEntries +
            ", defaultTimeout=" + defaultTimeout +
            ", maxRowLimit=" + maxRowLimit +
            ", executorThreads=" + executorThreads +
            ", datasources=" + datasources.size() +
            '}';
    }

    public static class Builder {
        private int version = 1;
        private Duration baseTtl = Duration.ofHours(1);
        private Duration minTtl = Duration.ofMinutes(5);
        private Duration maxTtl = Duration.ofHours(24);
        private int cacheMaxEntries = 10_000;
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private int maxRowLimit = 100_000;
        private int executorThreads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private final List<DatasourceConfiguration> datasources = new ArrayList<>();

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder baseTtl(Duration baseTtl) {
            this.baseTtl = baseTtl;
            return this;
        }

        public Builder minTtl(Duration minTtl) {
            this.minTtl = minTtl;
            return this;
        }

        public Builder maxTtl(Duration maxTtl) {
            this.maxTtl = maxTtl;
            return this;
        }

        public Builder cacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder maxRowLimit(int maxRowLimit) {
            this.maxRowLimit = maxRowLimit;
            return this;
        }

        public Builder executorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
            return this;
        }

        public Builder datasource(DatasourceConfiguration datasource) {
            this.datasources.add(datasource);
            return this;
        }

        public PipelineConfig build() {
            Preconditions.checkArgument(version > 0, "pipeline version must be positive");
            Preconditions.checkArgument(!minTtl.isNegative() && minTtl.compareTo(maxTtl) <= 0,
                "min TTL %s must not exceed max TTL %s", minTtl, maxTtl);
            Preconditions.checkArgument(!defaultTimeout.isZero() && !defaultTimeout.isNegative(),
                "default timeout must be positive");
            Preconditions.checkArgument(cacheMaxEntries > 0, "cache max entries must be positive");
            Preconditions.checkArgument(maxRowLimit > 0, "max row limit must be positive");
            Preconditions.checkArgument(executorThreads > 0, "executor threads must be positive");
            return new PipelineConfig(this);
        }
    }
}
