package gr.imsi.athenarc.pipeline.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A stored, already post-processed result. Entries are never mutated; an entry
 * is replaced by a later write with the same fingerprint or removed by invalidation.
 */
public final class CacheEntry {

    private final String fingerprint;
    private final byte[] payload;
    private final Instant producedAt;
    private final Duration ttl;
    private final String format;
    private final int policyVersion;

    public CacheEntry(String fingerprint, byte[] payload, Instant producedAt, Duration ttl, String format, int policyVersion) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.payload = payload.clone();
        this.producedAt = Objects.requireNonNull(producedAt, "producedAt");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.format = Objects.requireNonNull(format, "format");
        this.policyVersion = policyVersion;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public int getPayloadSize() {
        return payload.length;
    }

    public Instant getProducedAt() {
        return producedAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public Instant getExpiresAt() {
        return producedAt.plus(ttl);
    }

    /**
     * @return the id of the codec the payload was written with
     */
    public String getFormat() {
        return format;
    }

    public int getPolicyVersion() {
        return policyVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheEntry)) return false;
        CacheEntry that = (CacheEntry) o;
        return policyVersion == that.policyVersion && fingerprint.equals(that.fingerprint)
            && Arrays.equals(payload, that.payload) && producedAt.equals(that.producedAt)
            && ttl.equals(that.ttl) && format.equals(that.format);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, Arrays.hashCode(payload), producedAt, ttl, format, policyVersion);
    }

    @Override
    public String toString() {
        return "CacheEntry{" + fingerprint + ", " + payload.length + " bytes, producedAt=" + producedAt + ", ttl=" + ttl + '}';
    }
}
