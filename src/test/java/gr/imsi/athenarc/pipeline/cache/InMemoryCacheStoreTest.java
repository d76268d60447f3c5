package gr.imsi.athenarc.pipeline.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryCacheStoreTest {

    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryCacheStore store;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryCacheStore(clock, 3);
    }

    private static CacheEntry entry(String fingerprint, String payload) {
        return new CacheEntry(fingerprint, payload.getBytes(StandardCharsets.UTF_8), START, Duration.ofMinutes(10),
            TabularResultCodec.FORMAT, 1);
    }

    @Test
    public void testEntriesExpire() {
        store.set("qp:table:sales:a", entry("qp:table:sales:a", "a"), Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(9));
        assertArrayEquals("a".getBytes(StandardCharsets.UTF_8), store.get("qp:table:sales:a").get().getPayload());

        clock.advance(Duration.ofMinutes(1));
        assertFalse(store.get("qp:table:sales:a").isPresent());
        assertEquals(1, store.purgeExpired());
        assertEquals(0, store.size());
    }

    @Test
    public void testDeleteByPrefix() {
        store.set("qp:table:sales:a", entry("qp:table:sales:a", "a"), Duration.ofMinutes(10));
        store.set("qp:table:sales:b", entry("qp:table:sales:b", "b"), Duration.ofMinutes(10));
        store.set("qp:table:salesforce:c", entry("qp:table:salesforce:c", "c"), Duration.ofMinutes(10));

        assertEquals(2, store.deleteByPrefix("qp:table:sales:*"));
        assertEquals(1, store.size());
        assertTrue(store.get("qp:table:salesforce:c").isPresent());
        assertEquals(0, store.deleteByPrefix("qp:table:events:*"));
        assertEquals(1, store.deleteByPrefix("*"));
    }

    @Test
    public void testEvictsSoonestExpiringWhenFull() {
        store.set("k1", entry("k1", "1"), Duration.ofMinutes(30));
        store.set("k2", entry("k2", "2"), Duration.ofMinutes(5));
        store.set("k3", entry("k3", "3"), Duration.ofMinutes(60));

        store.set("k4", entry("k4", "4"), Duration.ofMinutes(1));

        assertEquals(3, store.size());
        assertFalse(store.get("k2").isPresent());
        assertTrue(store.get("k1").isPresent());
        assertTrue(store.get("k4").isPresent());

        // overwriting an existing key never evicts
        store.set("k4", entry("k4", "4b"), Duration.ofMinutes(1));
        assertEquals(3, store.size());
    }

    @Test
    public void testExpiredEntriesAreDroppedBeforeEvicting() {
        store.set("k1", entry("k1", "1"), Duration.ofMinutes(1));
        store.set("k2", entry("k2", "2"), Duration.ofMinutes(30));
        store.set("k3", entry("k3", "3"), Duration.ofMinutes(2));
        clock.advance(Duration.ofMinutes(5));

        store.set("k4", entry("k4", "4"), Duration.ofMinutes(10));

        assertEquals(2, store.size());
        assertTrue(store.get("k2").isPresent());
    }

    @Test
    public void testWritesSweepExpiredEntriesBelowCapacity() {
        InMemoryCacheStore large = new InMemoryCacheStore(clock, 1000);
        large.set("k1", entry("k1", "1"), Duration.ofSeconds(30));
        large.set("k2", entry("k2", "2"), Duration.ofSeconds(30));
        assertEquals(2, large.size());

        clock.advance(InMemoryCacheStore.SWEEP_INTERVAL);
        large.set("k3", entry("k3", "3"), Duration.ofMinutes(10));

        assertEquals(1, large.size());
        assertTrue(large.get("k3").isPresent());
    }

    @Test
    public void testRejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> store.set("k", entry("k", "v"), Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryCacheStore(clock, 0));
    }
}
