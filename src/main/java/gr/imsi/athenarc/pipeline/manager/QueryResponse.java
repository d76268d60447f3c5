package gr.imsi.athenarc.pipeline.manager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.pipeline.compiler.NativeQuery;
import gr.imsi.athenarc.pipeline.exception.PipelineStage;
import gr.imsi.athenarc.pipeline.format.FormattedPayload;

/**
 * Outcome of a successful {@link QueryPipeline#runQuery} call.
 */
public final class QueryResponse {

    private final FormattedPayload payload;
    private final String fingerprint;
    private final CacheStatus cacheStatus;
    private final List<String> warnings;
    private final List<PipelineStage> stages;
    private final NativeQuery nativeQuery;
    private final Duration executionTime;

    QueryResponse(FormattedPayload payload, String fingerprint, CacheStatus cacheStatus, List<String> warnings,
                  List<PipelineStage> stages, NativeQuery nativeQuery, Duration executionTime) {
        this.payload = payload;
        this.fingerprint = fingerprint;
        this.cacheStatus = cacheStatus;
        this.warnings = ImmutableList.copyOf(warnings);
        this.stages = ImmutableList.copyOf(stages);
        this.nativeQuery = nativeQuery;
        this.executionTime = executionTime;
    }

    public FormattedPayload getPayload() {
        return payload;
    }

    /**
     * @return the cache key of the request; absent for query-only requests
     */
    public Optional<String> getFingerprint() {
        return Optional.ofNullable(fingerprint);
    }

    public CacheStatus getCacheStatus() {
        return cacheStatus;
    }

    public boolean isCached() {
        return cacheStatus == CacheStatus.HIT;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * @return the stages passed through, in order
     */
    public List<PipelineStage> getStages() {
        return stages;
    }

    /**
     * @return the compiled query; absent on cache hits
     */
    public Optional<NativeQuery> getNativeQuery() {
        return Optional.ofNullable(nativeQuery);
    }

    /**
     * @return time spent in the datasource adapter; absent when it was not called
     */
    public Optional<Duration> getExecutionTime() {
        return Optional.ofNullable(executionTime);
    }

    @Override
    public String toString() {
        return "QueryResponse{" +
            "cacheStatus=" + cacheStatus +
            ", fingerprint=" + fingerprint +
            ", stages=" + stages +
            ", payload=" + payload +
            '}';
    }
}
