package gr.imsi.athenarc.pipeline.query;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import gr.imsi.athenarc.pipeline.exception.QueryValidationException;

/**
 * A half-open [from, to) interval of UTC instants. Either bound may be open.
 */
public final class TimeRange {

    private final Instant from;
    private final Instant to;

    public TimeRange(Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new QueryValidationException("Invalid time range: 'from' (" + from + ") must be before 'to' (" + to + ")");
        }
        this.from = from;
        this.to = to;
    }

    public static TimeRange between(Instant from, Instant to) {
        return new TimeRange(from, to);
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public boolean isBounded() {
        return from != null && to != null;
    }

    /**
     * @return the span of the range, when both bounds are set
     */
    public Optional<Duration> getSpan() {
        return isBounded() ? Optional.of(Duration.between(from, to)) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) o;
        return Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return "[" + (from == null ? "-inf" : from) + ", " + (to == null ? "+inf" : to) + ")";
    }
}
