package gr.imsi.athenarc.pipeline.manager;

/**
 * What happened to the cache during one pipeline call.
 */
public enum CacheStatus {
    /** served from a live cache entry */
    HIT,
    /** computed and written to the cache */
    STORED,
    /** computed, but the result was not eligible for caching */
    NOT_CACHED,
    /** computed, but the cache write failed or timed out */
    WRITE_FAILED,
    /** the cache was not consulted, e.g. for query-only requests */
    BYPASSED
}
