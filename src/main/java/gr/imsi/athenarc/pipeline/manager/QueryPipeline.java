package gr.imsi.athenarc.pipeline.manager;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import gr.imsi.athenarc.pipeline.cache.CacheEntry;
import gr.imsi.athenarc.pipeline.cache.CacheException;
import gr.imsi.athenarc.pipeline.cache.CacheKeyDeriver;
import gr.imsi.athenarc.pipeline.cache.CachePolicyEngine;
import gr.imsi.athenarc.pipeline.cache.CacheStore;
import gr.imsi.athenarc.pipeline.cache.InMemoryCacheStore;
import gr.imsi.athenarc.pipeline.cache.TabularResultCodec;
import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.compiler.QueryCompiler;
import gr.imsi.athenarc.pipeline.config.PipelineConfig;
import gr.imsi.athenarc.pipeline.datasource.DatasourceAdapter;
import gr.imsi.athenarc.pipeline.datasource.DatasourceFactory;
import gr.imsi.athenarc.pipeline.datasource.DatasourceSchema;
import gr.imsi.athenarc.pipeline.datasource.DatasourceTimeoutException;
import gr.imsi.athenarc.pipeline.datasource.config.DatasourceConfiguration;
import gr.imsi.athenarc.pipeline.domain.TabularResult;
import gr.imsi.athenarc.pipeline.exception.PipelineException;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.exception.QueryCancelledException;
import gr.imsi.athenarc.pipeline.exception.QueryExecutionException;
import gr.imsi.athenarc.pipeline.exception.QueryForbiddenException;
import gr.imsi.athenarc.pipeline.exception.QueryValidationException;
import gr.imsi.athenarc.pipeline.format.FormattedPayload;
import gr.imsi.athenarc.pipeline.format.ResultFormatter;
import gr.imsi.athenarc.pipeline.format.ResultMetadata;
import gr.imsi.athenarc.pipeline.policy.InMemoryPolicyStore;
import gr.imsi.athenarc.pipeline.policy.PolicyStore;
import gr.imsi.athenarc.pipeline.policy.RowLevelPolicy;
import gr.imsi.athenarc.pipeline.policy.RowLevelPolicyInjector;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingPipeline;
import gr.imsi.athenarc.pipeline.postprocessing.PostProcessingResult;
import gr.imsi.athenarc.pipeline.query.DatasourceRef;
import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.query.ResultType;
import gr.imsi.athenarc.pipeline.security.AccessControlGate;
import gr.imsi.athenarc.pipeline.security.PermissionStore;
import gr.imsi.athenarc.pipeline.security.SecurityContext;

/**
 * Runs query descriptors through authorization, row-level policies, the result
 * cache, the datasource, post-processing and formatting.
 *
 * <p>Calls are independent of each other; the cache store is the only state they
 * share. The schema lookup, the cache round trips and the datasource call run
 * on the pipeline's executor while the caller waits with a deadline derived
 * from its timeout.
 */
public class QueryPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(QueryPipeline.class);

    private final AccessControlGate gate;
    private final PolicyStore policyStore;
    private final RowLevelPolicyInjector policyInjector;
    private final CacheStore cacheStore;
    private final CacheKeyDeriver keyDeriver;
    private final CachePolicyEngine cachePolicy;
    private final TabularResultCodec codec;
    private final QueryCompiler compiler;
    private final PostProcessingPipeline postProcessing;
    private final ResultFormatter formatter;
    private final Map<String, DatasourceAdapter> adapters;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final PipelineConfig config;
    private final Clock clock;

    private QueryPipeline(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.gate = new AccessControlGate(builder.permissionStore);
        this.policyStore = builder.policyStore;
        this.policyInjector = new RowLevelPolicyInjector();
        this.cacheStore = builder.cacheStore != null ? builder.cacheStore : new InMemoryCacheStore(clock, config.getCacheMaxEntries());
        this.keyDeriver = new CacheKeyDeriver();
        this.cachePolicy = new CachePolicyEngine(config.getBaseTtl(), config.getMinTtl(), config.getMaxTtl(), clock);
        this.codec = new TabularResultCodec();
        this.compiler = new QueryCompiler(config.getMaxRowLimit());
        this.postProcessing = builder.postProcessing;
        this.formatter = builder.formatter;
        this.adapters = Map.copyOf(builder.adapters);
        this.ownsExecutor = builder.executor == null;
        this.executor = ownsExecutor
            ? Executors.newFixedThreadPool(config.getExecutorThreads(), new ThreadFactoryBuilder()
                .setNameFormat("query-pipeline-%d")
                .setDaemon(true)
                .build())
            : builder.executor;
    }

    public static Builder builder(PermissionStore permissionStore) {
        return new Builder(permissionStore);
    }

    /**
     * Creates a pipeline with a JDBC adapter for every datasource of the configuration.
     */
    public static QueryPipeline fromConfig(PipelineConfig config, PermissionStore permissionStore, PolicyStore policyStore) {
        Builder builder = builder(permissionStore).withConfig(config).withPolicyStore(policyStore);
        for (DatasourceConfiguration datasource : config.getDatasources()) {
            builder.withDatasource(datasource.getId(), DatasourceFactory.createAdapter(datasource));
        }
        return builder.build();
    }

    /**
     * Runs one query.
     *
     * @param descriptor the caller's query
     * @param context identity and roles of the caller
     * @param timeout budget for the whole call, cache round trips included
     * @return the formatted payload with its cache status
     * @throws QueryValidationException if the descriptor or its options are malformed
     * @throws QueryForbiddenException if the caller may not read what the query touches
     * @throws QueryExecutionException if the datasource fails, times out or the result cannot be formatted
     * @throws QueryCancelledException if the calling thread is interrupted
     */
    public QueryResponse runQuery(QueryDescriptor descriptor, SecurityContext context, Duration timeout) {
        Preconditions.checkNotNull(descriptor, "descriptor");
        Preconditions.checkNotNull(context, "context");
        Preconditions.checkArgument(timeout != null && !timeout.isNegative() && !timeout.isZero(),
            "timeout must be positive, was %s", timeout);

        long deadline = System.nanoTime() + timeout.toNanos();
        List<PipelineStage> stages = new ArrayList<>();
        stages.add(PipelineStage.RECEIVED);
        String datasourceId = descriptor.getDatasource().getId();
        LOG.info("Query on {} received from {}", datasourceId, context.getPrincipalId());

        gate.authorize(descriptor, context).throwIfDenied();
        DatasourceAdapter adapter = adapters.get(datasourceId);
        if (adapter == null) {
            throw new QueryValidationException(PipelineStage.AUTHORIZED, "Unknown datasource: " + datasourceId);
        }
        DatasourceSchema schema = describeSchema(adapter, datasourceId, timeout, deadline);
        gate.authorizeImplicitTimeColumn(descriptor, schema, context).throwIfDenied();
        stages.add(PipelineStage.AUTHORIZED);

        QueryDescriptor effective = policyInjector.apply(descriptor, context, listPolicies(datasourceId));
        stages.add(PipelineStage.POLICY_APPLIED);

        if (effective.getResultType() == ResultType.QUERY) {
            NativeQuery query = compiler.compile(effective, schema, adapter.getDialect());
            stages.add(PipelineStage.COMPILED);
            LOG.info("Returning compiled query for {} without execution", datasourceId);
            return new QueryResponse(formatter.formatQuery(query), null, CacheStatus.BYPASSED, List.of(), stages, query, null);
        }

        String fingerprint = keyDeriver.deriveKey(effective, effective.getDatasource(), context, config.getVersion());
        Optional<CacheEntry> cached = readCache(fingerprint, deadline);
        stages.add(PipelineStage.CACHE_CHECKED);

        if (cached.isPresent()) {
            Optional<TabularResultCodec.Decoded> decoded = decode(cached.get());
            if (decoded.isPresent()) {
                stages.add(PipelineStage.CACHE_HIT);
                List<String> warnings = decoded.get().getWarnings();
                ResultMetadata metadata = new ResultMetadata(fingerprint, true, cached.get().getProducedAt(),
                    effective.getFilters(), warnings);
                FormattedPayload payload = formatter.format(decoded.get().getResult(), metadata, effective.getResultFormat());
                stages.add(PipelineStage.FORMATTED);
                LOG.info("Cache hit for {} on {}", fingerprint, datasourceId);
                return new QueryResponse(payload, fingerprint, CacheStatus.HIT, warnings, stages, null, null);
            }
        }

        NativeQuery query = compiler.compile(effective, schema, adapter.getDialect());
        stages.add(PipelineStage.COMPILED);
        stages.add(PipelineStage.EXECUTING);
        Stopwatch stopwatch = Stopwatch.createStarted();
        TabularResult raw = execute(adapter, query, effective, timeout, deadline);
        Duration executionTime = stopwatch.elapsed();
        LOG.debug("Datasource {} returned {} rows in {} ms", datasourceId, raw.getRowCount(), executionTime.toMillis());

        PostProcessingResult processed = postProcessing.apply(raw, effective.getPostProcessing());
        stages.add(PipelineStage.POST_PROCESSED);

        ResultMetadata metadata = new ResultMetadata(fingerprint, false, null, effective.getFilters(), processed.getWarnings());
        FormattedPayload payload = formatter.format(processed.getResult(), metadata, effective.getResultFormat());
        stages.add(PipelineStage.FORMATTED);

        CacheStatus cacheStatus = writeCache(fingerprint, effective, processed, executionTime, deadline);
        if (cacheStatus == CacheStatus.STORED) {
            stages.add(PipelineStage.CACHE_WRITTEN);
        }
        LOG.info("Query on {} completed with {} rows, cache {}", datasourceId, processed.getResult().getRowCount(), cacheStatus);
        return new QueryResponse(payload, fingerprint, cacheStatus, processed.getWarnings(), stages, query, executionTime);
    }

    /**
     * Deletes every cache entry whose key starts with the pattern. A failing
     * cache store is logged and reported as nothing deleted.
     */
    public int invalidateCache(String pattern) {
        Preconditions.checkNotNull(pattern, "pattern");
        try {
            int deleted = cacheStore.deleteByPrefix(pattern);
            LOG.info("Invalidated {} cache entries matching '{}'", deleted, pattern);
            return deleted;
        } catch (CacheException e) {
            LOG.warn("Cache invalidation for '{}' failed", pattern, e);
            return 0;
        }
    }

    /**
     * Invalidates every cached result of one datasource.
     */
    public int invalidateDatasource(DatasourceRef datasource) {
        return invalidateCache(CacheKeyDeriver.prefixOf(datasource) + "*");
    }

    private List<RowLevelPolicy> listPolicies(String datasourceId) {
        try {
            return policyStore.listPolicies(datasourceId);
        } catch (RuntimeException e) {
            throw new QueryForbiddenException(PipelineStage.POLICY_APPLIED, "datasource:" + datasourceId,
                "Row-level policies of " + datasourceId + " could not be loaded", e);
        }
    }

    /**
     * Describes the datasource on the executor, bounded by the caller's deadline.
     * The schema is needed to authorize the implicit time column.
     */
    private DatasourceSchema describeSchema(DatasourceAdapter adapter, String datasourceId, Duration timeout, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new QueryExecutionException(PipelineStage.AUTHORIZED, "Query timed out after " + timeout);
        }
        Future<DatasourceSchema> future = executor.submit(() -> adapter.describeSchema(datasourceId));
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Schema of {} was not described within {}", datasourceId, timeout);
            throw new QueryExecutionException(PipelineStage.AUTHORIZED, "Query timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(PipelineStage.AUTHORIZED, "Query on " + datasourceId + " was cancelled", e);
        } catch (ExecutionException e) {
            LOG.warn("Schema of {} could not be described", datasourceId, e.getCause());
            throw new QueryExecutionException(PipelineStage.AUTHORIZED, "Schema of datasource " + datasourceId + " is unavailable");
        }
    }

    private TabularResult execute(DatasourceAdapter adapter, NativeQuery query, QueryDescriptor descriptor,
                                  Duration timeout, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new QueryExecutionException(PipelineStage.EXECUTING, "Query timed out after " + timeout);
        }
        Duration engineTimeout = engineTimeout(descriptor);
        Duration adapterTimeout = engineTimeout.compareTo(Duration.ofNanos(remaining)) < 0 ? engineTimeout : Duration.ofNanos(remaining);

        Future<TabularResult> future = executor.submit(() -> adapter.execute(query, adapterTimeout));
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Query on {} timed out after {}:\n{}", query.getDatasourceId(), timeout, query.getText());
            throw new QueryExecutionException(PipelineStage.EXECUTING, "Query timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(PipelineStage.EXECUTING, "Query on " + query.getDatasourceId() + " was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOG.warn("Query on {} failed:\n{}", query.getDatasourceId(), query.getText(), cause);
            if (cause instanceof DatasourceTimeoutException) {
                throw new QueryExecutionException(PipelineStage.EXECUTING, "Query exceeded the datasource timeout of " + adapterTimeout);
            }
            if (cause instanceof PipelineException) {
                throw (PipelineException) cause;
            }
            throw new QueryExecutionException(PipelineStage.EXECUTING, "Query failed on datasource " + query.getDatasourceId());
        }
    }

    private Duration engineTimeout(QueryDescriptor descriptor) {
        Object value = descriptor.getExtras().get(QueryDescriptor.EXTRA_TIMEOUT);
        if (value instanceof Number) {
            return Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000));
        }
        return config.getDefaultTimeout();
    }

    private Optional<CacheEntry> readCache(String fingerprint, long deadline) {
        Future<Optional<CacheEntry>> future = executor.submit(() -> cacheStore.get(fingerprint));
        try {
            Optional<CacheEntry> entry = future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (entry.isPresent() && entry.get().getPolicyVersion() != config.getVersion()) {
                LOG.debug("Ignoring cache entry {} written by pipeline version {}", fingerprint, entry.get().getPolicyVersion());
                return Optional.empty();
            }
            return entry;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Cache lookup for {} timed out, treating it as a miss", fingerprint);
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.warn("Cache lookup for {} failed, treating it as a miss", fingerprint, e.getCause());
            return Optional.empty();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(PipelineStage.CACHE_CHECKED, "Query was cancelled during cache lookup", e);
        }
    }

    private Optional<TabularResultCodec.Decoded> decode(CacheEntry entry) {
        if (!codec.getFormat().equals(entry.getFormat())) {
            LOG.debug("Ignoring cache entry {} in format {}", entry.getFingerprint(), entry.getFormat());
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(entry.getPayload()));
        } catch (CacheException e) {
            LOG.warn("Cache entry {} could not be decoded, treating it as a miss", entry.getFingerprint(), e);
            return Optional.empty();
        }
    }

    private CacheStatus writeCache(String fingerprint, QueryDescriptor descriptor, PostProcessingResult processed,
                                   Duration executionTime, long deadline) {
        if (!cachePolicy.shouldCache(descriptor, executionTime)) {
            return CacheStatus.NOT_CACHED;
        }
        if (Thread.currentThread().isInterrupted()) {
            LOG.debug("Not caching {}, the caller was interrupted", fingerprint);
            return CacheStatus.NOT_CACHED;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            LOG.debug("Not caching {}, the deadline has passed", fingerprint);
            return CacheStatus.NOT_CACHED;
        }
        Duration ttl = cachePolicy.computeTtl(descriptor);
        CacheEntry entry;
        try {
            entry = new CacheEntry(fingerprint, codec.encode(processed.getResult(), processed.getWarnings()),
                clock.instant(), ttl, codec.getFormat(), config.getVersion());
        } catch (CacheException e) {
            LOG.warn("Result for {} could not be encoded for the cache", fingerprint, e);
            return CacheStatus.WRITE_FAILED;
        }

        Future<?> future = executor.submit(() -> cacheStore.set(fingerprint, entry, ttl));
        try {
            future.get(remaining, TimeUnit.NANOSECONDS);
            LOG.debug("Cached {} for {}", fingerprint, ttl);
            return CacheStatus.STORED;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Cache write for {} timed out, dropping it", fingerprint);
            return CacheStatus.WRITE_FAILED;
        } catch (ExecutionException e) {
            LOG.warn("Cache write for {} failed", fingerprint, e.getCause());
            return CacheStatus.WRITE_FAILED;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOG.warn("Cache write for {} was interrupted", fingerprint);
            return CacheStatus.WRITE_FAILED;
        }
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public CacheStore getCacheStore() {
        return cacheStore;
    }

    @Override
    public void close() {
        for (Map.Entry<String, DatasourceAdapter> entry : adapters.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                LOG.warn("Datasource adapter {} did not close cleanly", entry.getKey(), e);
            }
        }
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    public static class Builder {
        private final PermissionStore permissionStore;
        private PolicyStore policyStore = InMemoryPolicyStore.empty();
        private CacheStore cacheStore;
        private PostProcessingPipeline postProcessing = PostProcessingPipeline.withDefaultOperations();
        private ResultFormatter formatter = ResultFormatter.withDefaultWriters();
        private final Map<String, DatasourceAdapter> adapters = new HashMap<>();
        private ExecutorService executor;
        private PipelineConfig config = PipelineConfig.defaults();
        private Clock clock = Clock.systemUTC();

        public Builder(PermissionStore permissionStore) {
            this.permissionStore = Preconditions.checkNotNull(permissionStore, "permissionStore");
        }

        public Builder withPolicyStore(PolicyStore policyStore) {
            this.policyStore = policyStore;
            return this;
        }

        public Builder withCacheStore(CacheStore cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        public Builder withPostProcessing(PostProcessingPipeline postProcessing) {
            this.postProcessing = postProcessing;
            return this;
        }

        public Builder withFormatter(ResultFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder withDatasource(String datasourceId, DatasourceAdapter adapter) {
            this.adapters.put(datasourceId, adapter);
            return this;
        }

        /**
         * Runs cache and datasource calls on the given executor; the pipeline
         * will not shut it down on close.
         */
        public Builder withExecutor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder withConfig(PipelineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public QueryPipeline build() {
            Preconditions.checkNotNull(policyStore, "policyStore");
            Preconditions.checkNotNull(config, "config");
            return new QueryPipeline(this);
        }
    }
}
