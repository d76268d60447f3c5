package gr.imsi.athenarc.pipeline.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Process-local cache store. Entries are kept sorted by fingerprint so prefix
 * invalidation only visits the matching range. A write into a full store first
 * evicts the entry that expires soonest. Expired entries are also swept on the
 * first write after each {@link #SWEEP_INTERVAL}.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCacheStore.class);

    public static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final NavigableMap<String, StoredEntry> entries = new TreeMap<>();
    private final ReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final int maxEntries;
    private Instant nextSweep;

    public InMemoryCacheStore() {
        this(Clock.systemUTC(), 10_000);
    }

    public InMemoryCacheStore(Clock clock, int maxEntries) {
        Preconditions.checkArgument(maxEntries > 0, "maxEntries must be positive");
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.nextSweep = clock.instant().plus(SWEEP_INTERVAL);
    }

    @Override
    public Optional<CacheEntry> get(String fingerprint) {
        try {
            cacheLock.readLock().lock();
            StoredEntry stored = entries.get(fingerprint);
            if (stored == null || stored.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(stored.entry);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    @Override
    public void set(String fingerprint, CacheEntry entry, Duration ttl) {
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
        Instant now = clock.instant();
        try {
            cacheLock.writeLock().lock();
            if (!now.isBefore(nextSweep)) {
                int removed = removeExpired(now);
                nextSweep = now.plus(SWEEP_INTERVAL);
                LOG.debug("Swept {} expired entries", removed);
            }
            if (!entries.containsKey(fingerprint) && entries.size() >= maxEntries) {
                removeExpired(now);
                if (entries.size() >= maxEntries) {
                    evictSoonestExpiring();
                }
            }
            entries.put(fingerprint, new StoredEntry(entry, now.plus(ttl)));
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    @Override
    public int deleteByPrefix(String pattern) {
        String prefix = pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
        try {
            cacheLock.writeLock().lock();
            if (prefix.isEmpty()) {
                int size = entries.size();
                entries.clear();
                return size;
            }
            int deleted = 0;
            Iterator<String> keys = entries.tailMap(prefix, true).keySet().iterator();
            while (keys.hasNext()) {
                if (!keys.next().startsWith(prefix)) {
                    break;
                }
                keys.remove();
                deleted++;
            }
            LOG.debug("Deleted {} entries with prefix {}", deleted, prefix);
            return deleted;
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    /**
     * Drops every expired entry.
     *
     * @return the number of dropped entries
     */
    public int purgeExpired() {
        try {
            cacheLock.writeLock().lock();
            return removeExpired(clock.instant());
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    public int size() {
        try {
            cacheLock.readLock().lock();
            return entries.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    private int removeExpired(Instant now) {
        int removed = 0;
        Iterator<StoredEntry> values = entries.values().iterator();
        while (values.hasNext()) {
            if (values.next().isExpired(now)) {
                values.remove();
                removed++;
            }
        }
        return removed;
    }

    private void evictSoonestExpiring() {
        Map.Entry<String, StoredEntry> victim = null;
        for (Map.Entry<String, StoredEntry> candidate : entries.entrySet()) {
            if (victim == null || candidate.getValue().expiresAt.isBefore(victim.getValue().expiresAt)) {
                victim = candidate;
            }
        }
        if (victim != null) {
            LOG.debug("Evicting {} to make room", victim.getKey());
            entries.remove(victim.getKey());
        }
    }

    private static final class StoredEntry {
        private final CacheEntry entry;
        private final Instant expiresAt;

        private StoredEntry(CacheEntry entry, Instant expiresAt) {
            this.entry = entry;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
