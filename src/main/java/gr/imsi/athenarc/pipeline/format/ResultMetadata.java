package gr.imsi.athenarc.pipeline.format;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.pipeline.query.Filter;

/**
 * Request-level facts written next to the rows of a JSON payload.
 */
public final class ResultMetadata {

    private final String cacheKey;
    private final boolean cached;
    private final Instant cachedAt;
    private final List<Filter> appliedFilters;
    private final List<String> warnings;

    public ResultMetadata(String cacheKey, boolean cached, Instant cachedAt, List<Filter> appliedFilters, List<String> warnings) {
        this.cacheKey = cacheKey;
        this.cached = cached;
        this.cachedAt = cachedAt;
        this.appliedFilters = ImmutableList.copyOf(appliedFilters);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public static ResultMetadata empty() {
        return new ResultMetadata(null, false, null, List.of(), List.of());
    }

    public Optional<String> getCacheKey() {
        return Optional.ofNullable(cacheKey);
    }

    public boolean isCached() {
        return cached;
    }

    /**
     * @return when the served result was computed, present only for cache hits
     */
    public Optional<Instant> getCachedAt() {
        return Optional.ofNullable(cachedAt);
    }

    /**
     * @return the caller's filters; row-level predicates are never listed
     */
    public List<Filter> getAppliedFilters() {
        return appliedFilters;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
