package gr.imsi.athenarc.pipeline.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.pipeline.query.QueryDescriptor;
import gr.imsi.athenarc.pipeline.query.TimeRange;

/**
 * Decides whether a result is worth caching and for how long. The lifetime grows
 * with the queried time span, with the complexity of the query and for ranges
 * that ended in the past, and is always clamped to the configured bounds.
 */
public class CachePolicyEngine {

    static final Duration HISTORICAL_THRESHOLD = Duration.ofDays(7);
    static final Duration SLOW_EXECUTION = Duration.ofSeconds(1);
    static final Duration FAST_EXECUTION = Duration.ofMillis(100);

    private final Duration baseTtl;
    private final Duration minTtl;
    private final Duration maxTtl;
    private final Clock clock;

    public CachePolicyEngine(Duration baseTtl, Duration minTtl, Duration maxTtl, Clock clock) {
        Preconditions.checkArgument(!minTtl.isNegative() && minTtl.compareTo(maxTtl) <= 0,
            "Invalid TTL bounds [%s, %s]", minTtl, maxTtl);
        this.baseTtl = baseTtl;
        this.minTtl = minTtl;
        this.maxTtl = maxTtl;
        this.clock = clock;
    }

    public static CachePolicyEngine withDefaults(Clock clock) {
        return new CachePolicyEngine(Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofHours(24), clock);
    }

    public Duration computeTtl(QueryDescriptor descriptor) {
        Optional<Duration> override = cacheTimeoutOverride(descriptor);
        if (override.isPresent()) {
            return clamp(override.get());
        }
        double factor = spanFactor(descriptor) * complexityFactor(complexityScore(descriptor));
        if (isHistorical(descriptor)) {
            factor *= 4;
        }
        return clamp(Duration.ofMillis(Math.round(baseTtl.toMillis() * factor)));
    }

    public boolean shouldCache(QueryDescriptor descriptor, Duration executionDuration) {
        double complexity = complexityScore(descriptor);
        if (executionDuration.compareTo(SLOW_EXECUTION) > 0 || complexity > 0.5 || isHistorical(descriptor)) {
            return true;
        }
        return !(executionDuration.compareTo(FAST_EXECUTION) < 0 && complexity < 0.2);
    }

    /**
     * Scores a descriptor in [0, 1] from the number of grouping columns, metrics,
     * predicates and post-processing operations it carries.
     */
    public double complexityScore(QueryDescriptor descriptor) {
        int grouping = descriptor.getDimensions().size() + (descriptor.getTimeGrain().isPresent() ? 1 : 0);
        int predicates = descriptor.getFilters().size() + descriptor.getHaving().size();
        double score = Math.min(grouping / 10.0, 1.0) * 0.3
            + Math.min(descriptor.getMetrics().size() / 5.0, 1.0) * 0.25
            + Math.min(predicates / 5.0, 1.0) * 0.25
            + Math.min(descriptor.getPostProcessing().size() / 3.0, 1.0) * 0.2;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * @return true if the queried range ended more than seven days ago
     */
    public boolean isHistorical(QueryDescriptor descriptor) {
        return descriptor.getTimeRange()
            .map(TimeRange::getTo)
            .map(to -> to.isBefore(clock.instant().minus(HISTORICAL_THRESHOLD)))
            .orElse(false);
    }

    private double spanFactor(QueryDescriptor descriptor) {
        Optional<Duration> span = descriptor.getTimeRange().flatMap(range -> {
            if (range.getFrom() == null) {
                return Optional.empty();
            }
            Instant to = range.getTo() != null ? range.getTo() : clock.instant();
            return Optional.of(Duration.between(range.getFrom(), to));
        });
        if (span.isEmpty()) {
            return 1.0;
        }
        long days = span.get().toDays();
        Duration value = span.get();
        if (value.compareTo(Duration.ofDays(1)) < 0) {
            return 0.5;
        } else if (days < 7) {
            return 1.0;
        } else if (days < 30) {
            return 2.0;
        } else if (days < 90) {
            return 4.0;
        }
        return 6.0;
    }

    private static double complexityFactor(double complexity) {
        if (complexity > 0.8) {
            return 2.0;
        } else if (complexity < 0.3) {
            return 0.5;
        }
        return 1.0;
    }

    private static Optional<Duration> cacheTimeoutOverride(QueryDescriptor descriptor) {
        Object value = descriptor.getExtras().get(QueryDescriptor.EXTRA_CACHE_TIMEOUT);
        if (value instanceof Number) {
            return Optional.of(Duration.ofMillis(Math.round(((Number) value).doubleValue() * 1000)));
        }
        return Optional.empty();
    }

    private Duration clamp(Duration ttl) {
        if (ttl.compareTo(minTtl) < 0) {
            return minTtl;
        }
        if (ttl.compareTo(maxTtl) > 0) {
            return maxTtl;
        }
        return ttl;
    }

    public Duration getMinTtl() {
        return minTtl;
    }

    public Duration getMaxTtl() {
        return maxTtl;
    }
}
