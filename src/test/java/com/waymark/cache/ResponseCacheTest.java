package com.waymark.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waymark.model.dto.CacheStatistics;
import com.waymark.support.FakeTicker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseCache.
 */
class ResponseCacheTest {

    private FakeTicker ticker;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        cache = newCache(10);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private ResponseCache newCache(int maxSize) {
        return new ResponseCache(Duration.ofSeconds(60), maxSize, Duration.ZERO, ticker, new ObjectMapper());
    }

    @Test
    void testMissOnUnknownKey() {
        CacheResult result = cache.get("unknown");

        assertTrue(result.isMiss());
        assertEquals(1, cache.getStats().getMisses());
    }

    @Test
    void testSetAndGet() {
        cache.set("key", "value");

        CacheResult result = cache.get("key");

        assertTrue(result.isHit());
        assertEquals("value", result.getValue());
    }

    @Test
    void testNullValueIsAHit() {
        cache.set("empty", null);

        CacheResult result = cache.get("empty");

        assertTrue(result.isHit());
        assertNull(result.getValue());
        assertEquals(1, cache.getStats().getHits());
    }

    @Test
    void testExpiredEntryIsMissWithoutCleanup() {
        cache.set("key", "value");

        ticker.advance(Duration.ofSeconds(59));
        assertTrue(cache.get("key").isHit());

        ticker.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("key").isMiss());
        assertEquals(0, cache.getStats().getSize());
    }

    @Test
    void testExpiryAcrossTickerWrapAround() {
        FakeTicker wrapping = new FakeTicker(Long.MAX_VALUE - Duration.ofSeconds(30).toNanos());
        ResponseCache wrapped = new ResponseCache(Duration.ofSeconds(60), 10, Duration.ZERO,
                wrapping, new ObjectMapper());
        wrapped.set("key", "value");

        wrapping.advance(Duration.ofSeconds(59));
        assertTrue(wrapped.get("key").isHit());

        wrapping.advance(Duration.ofSeconds(1));
        assertTrue(wrapped.get("key").isMiss());
    }

    @Test
    void testTtlOverride() {
        cache.set("short", "value", Duration.ofSeconds(5));
        cache.set("default", "value");

        ticker.advance(Duration.ofSeconds(10));

        assertTrue(cache.get("short").isMiss());
        assertTrue(cache.get("default").isHit());
    }

    @Test
    void testSetReplacesValueAndExpiry() {
        cache.set("key", "old", Duration.ofSeconds(5));
        ticker.advance(Duration.ofSeconds(4));
        cache.set("key", "new");
        ticker.advance(Duration.ofSeconds(10));

        assertEquals("new", cache.get("key").getValue());
    }

    @Test
    void testDelete() {
        cache.set("key", "value");

        assertTrue(cache.delete("key"));
        assertFalse(cache.delete("key"));
        assertTrue(cache.get("key").isMiss());
    }

    @Test
    void testClearResetsEntriesAndCounters() {
        cache.set("a", 1);
        cache.set("b", 2);
        cache.get("a");
        cache.get("missing");

        cache.clear();

        CacheStatistics stats = cache.getStats();
        assertEquals(0, stats.getSize());
        assertEquals(0, stats.getHits());
        assertEquals(0, stats.getMisses());
    }

    @Test
    void testInsertingBeyondMaxSizeEvictsFirstInserted() {
        ResponseCache small = newCache(3);
        small.set("k1", 1);
        small.set("k2", 2);
        small.set("k3", 3);

        small.set("k4", 4);

        assertEquals(3, small.getStats().getSize());
        assertTrue(small.get("k1").isMiss());
        assertTrue(small.get("k2").isHit());
        assertTrue(small.get("k3").isHit());
        assertTrue(small.get("k4").isHit());
    }

    @Test
    void testGetProtectsEntryFromEviction() {
        ResponseCache small = newCache(3);
        small.set("k1", 1);
        small.set("k2", 2);
        small.set("k3", 3);
        small.get("k1");

        small.set("k4", 4);

        assertTrue(small.get("k1").isHit());
        assertTrue(small.get("k2").isMiss());
    }

    @Test
    void testUpdatingExistingKeyInFullCacheEvictsNothing() {
        ResponseCache small = newCache(2);
        small.set("k1", 1);
        small.set("k2", 2);

        small.set("k1", 10);

        assertEquals(2, small.getStats().getSize());
        assertEquals(10, small.get("k1").getValue());
        assertEquals(2, small.get("k2").getValue());
    }

    @Test
    void testCleanupExpiredRemovesOnlyExpiredEntries() {
        cache.set("short1", 1, Duration.ofSeconds(1));
        cache.set("short2", 2, Duration.ofSeconds(1));
        cache.set("long", 3, Duration.ofSeconds(100));

        ticker.advance(Duration.ofSeconds(2));

        assertEquals(2, cache.cleanupExpired());
        assertEquals(1, cache.getStats().getSize());
        assertEquals(0, cache.cleanupExpired());
    }

    @Test
    void testStats() {
        cache.set("a", 1);
        cache.get("a");
        cache.get("a");
        cache.get("b");

        CacheStatistics stats = cache.getStats();

        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(3, stats.getTotalRequests());
        assertEquals(2.0 / 3.0, stats.getHitRate(), 1e-9);
        assertEquals(1, stats.getSize());
        assertEquals(10, stats.getMaxSize());
    }

    @Test
    void testHitRateIsZeroWithoutLookups() {
        assertEquals(0.0, cache.getStats().getHitRate());
    }

    @Test
    void testGenerateKeyIsOrderIndependent() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("lat", 35.0);
        first.put("lng", 139.0);
        first.put("radius", 5);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("radius", 5);
        second.put("lng", 139.0);
        second.put("lat", 35.0);

        assertEquals(cache.generateKey("/near", first), cache.generateKey("/near", second));
    }

    @Test
    void testGenerateKeyDistinguishesEndpointsAndValues() {
        String base = cache.generateKey("https://api.example.com/near", Map.of("lat", 35.0));

        assertNotEquals(base, cache.generateKey("https://api.example.com/far", Map.of("lat", 35.0)));
        assertNotEquals(base, cache.generateKey("https://api.example.com/near", Map.of("lat", 36.0)));
        assertNotEquals(base, cache.generateKey("https://api.example.com/near", null));
    }

    @Test
    void testGenerateKeyFormat() {
        String key = cache.generateKey("https://api.example.com/v1/near", Map.of("q", "tokyo"));

        assertTrue(key.startsWith("near_"));
        assertEquals("near_".length() + 16, key.length());
        assertEquals(key, cache.generateKey("https://api.example.com/v1/near", Map.of("q", "tokyo")));
    }

    @Test
    void testGenerateKeyWithNestedMapsIsStable() {
        Map<String, Object> nestedA = new LinkedHashMap<>();
        nestedA.put("x", 1);
        nestedA.put("y", 2);
        Map<String, Object> nestedB = new LinkedHashMap<>();
        nestedB.put("y", 2);
        nestedB.put("x", 1);

        assertEquals(cache.generateKey("/e", Map.of("filter", nestedA)),
                cache.generateKey("/e", Map.of("filter", nestedB)));
    }

    @Test
    void testCachedOperationRunsOncePerKey() {
        AtomicInteger calls = new AtomicInteger();
        Function<String, Mono<String>> lookup = cache.cached("geocode", null,
                address -> Map.of("address", address),
                address -> Mono.fromCallable(() -> {
                    calls.incrementAndGet();
                    return address.toUpperCase();
                }));

        assertEquals("TOKYO", lookup.apply("tokyo").block());
        assertEquals("TOKYO", lookup.apply("tokyo").block());
        assertEquals("KYOTO", lookup.apply("kyoto").block());

        assertEquals(2, calls.get());
    }

    @Test
    void testCachedOperationHonoursTtl() {
        AtomicInteger calls = new AtomicInteger();
        Function<Integer, Mono<Integer>> square = cache.cached("square", Duration.ofSeconds(1),
                n -> Map.of("n", n),
                n -> Mono.fromCallable(() -> {
                    calls.incrementAndGet();
                    return n * n;
                }));

        square.apply(3).block();
        ticker.advance(Duration.ofSeconds(2));
        assertEquals(9, square.apply(3).block());

        assertEquals(2, calls.get());
    }

    @Test
    void testCachedOperationDoesNotCacheEmptyResults() {
        AtomicInteger calls = new AtomicInteger();
        Function<String, Mono<String>> lookup = cache.cached("empty", null,
                key -> Map.of("key", key),
                key -> Mono.<String>empty().doOnSubscribe(s -> calls.incrementAndGet()));

        assertNull(lookup.apply("a").block());
        assertNull(lookup.apply("a").block());

        assertEquals(2, calls.get());
    }

    @Test
    void testConcurrentAccessKeepsSizeBound() throws Exception {
        ResponseCache bounded = newCache(50);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = "k" + thread + "-" + i;
                        bounded.set(key, i);
                        bounded.get(key);
                        bounded.get("k0-" + i);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        CacheStatistics stats = bounded.getStats();
        assertEquals(50, stats.getSize());
        assertEquals(8 * 500 * 2, stats.getTotalRequests());
    }

    @Test
    void testBackgroundCleanupStartsAndStops() {
        ResponseCache sweeping = new ResponseCache(Duration.ofSeconds(60), 10, Duration.ofMillis(50),
                ticker, new ObjectMapper());
        sweeping.startCleanup();
        assertTrue(sweeping.isCleanupRunning());

        sweeping.close();
        assertFalse(sweeping.isCleanupRunning());
    }

    @Test
    void testBackgroundCleanupRemovesExpiredEntries() throws InterruptedException {
        ResponseCache sweeping = new ResponseCache(Duration.ofSeconds(1), 10, Duration.ofMillis(20),
                ticker, new ObjectMapper());
        sweeping.set("key", "value");
        ticker.advance(Duration.ofSeconds(2));

        sweeping.startCleanup();
        long deadline = System.currentTimeMillis() + 2000;
        while (sweeping.getStats().getSize() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        sweeping.close();

        assertEquals(0, sweeping.getStats().getSize());
        // The sweep never touches the hit/miss counters.
        assertEquals(0, sweeping.getStats().getTotalRequests());
    }

    @Test
    void testInvalidMaxSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseCache(Duration.ofSeconds(1), 0));
    }
}
