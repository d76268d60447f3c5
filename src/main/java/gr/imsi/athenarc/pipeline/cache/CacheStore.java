package gr.imsi.athenarc.pipeline.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store shared by all pipeline calls. Implementations must make
 * {@link #get} and {@link #set} atomic with respect to each other; concurrent
 * writes of the same fingerprint resolve as last-write-wins. Any operation may
 * fail with {@link CacheException}.
 */
public interface CacheStore {

    /**
     * @return the live entry stored under the fingerprint, if any
     */
    Optional<CacheEntry> get(String fingerprint);

    void set(String fingerprint, CacheEntry entry, Duration ttl);

    /**
     * Deletes every entry whose fingerprint starts with the pattern. A single
     * trailing {@code *} is accepted and ignored.
     *
     * @return the number of deleted entries
     */
    int deleteByPrefix(String pattern);
}
