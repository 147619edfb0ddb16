package com.waymark.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Ticker;
import com.waymark.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory response cache with per-entry TTL and LRU eviction.
 *
 * <p>Entries live in an access-ordered {@link LinkedHashMap}; every {@code get} hit and
 * every {@code set} moves the entry to the most-recently-used end. All access goes through
 * one lock, so the size bound and the recency order hold under concurrent callers.
 *
 * <p>Expiry is checked lazily on {@link #get(String)}. The periodic sweep started by
 * {@link #startCleanup()} only reclaims memory for keys nobody reads any more.
 */
@Slf4j
public class ResponseCache implements AutoCloseable {

    private static final int KEY_HASH_LENGTH = 16;

    private final Duration defaultTtl;
    private final int maxSize;
    private final Duration cleanupInterval;
    private final Ticker ticker;
    private final ObjectMapper keyMapper;

    private final LinkedHashMap<String, CacheEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;

    private volatile Disposable cleanupTask;

    public ResponseCache(Duration defaultTtl, int maxSize) {
        this(defaultTtl, maxSize, Duration.ZERO, Ticker.systemTicker(), new ObjectMapper());
    }

    public ResponseCache(Duration defaultTtl, int maxSize, Duration cleanupInterval,
                         Ticker ticker, ObjectMapper objectMapper) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (defaultTtl == null || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must not be negative: " + defaultTtl);
        }
        this.defaultTtl = defaultTtl;
        this.maxSize = maxSize;
        this.cleanupInterval = cleanupInterval == null ? Duration.ZERO : cleanupInterval;
        this.ticker = ticker;
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.entries = new LinkedHashMap<>(16, 0.75f, true);

        log.info("Cache initialized: defaultTtl={} maxSize={} cleanupInterval={}",
                defaultTtl, maxSize, this.cleanupInterval);
    }

    /**
     * Look up a key, treating expired entries as absent.
     */
    public CacheResult get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                log.debug("Cache miss: key={}", key);
                return CacheResult.miss();
            }
            if (entry.isExpired(ticker.read())) {
                entries.remove(key);
                misses++;
                log.debug("Cache expired: key={}", key);
                return CacheResult.miss();
            }
            hits++;
            log.debug("Cache hit: key={}", key);
            return CacheResult.hit(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    public void set(String key, Object value) {
        set(key, value, null);
    }

    /**
     * Store a value, evicting the least recently used entry first if a new key would
     * overflow the cache.
     *
     * @param ttl time to live, or {@code null} for the default
     */
    public void set(String key, Object value, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        lock.lock();
        try {
            long storedAt = ticker.read();
            if (entries.size() >= maxSize && !entries.containsKey(key)) {
                evictLeastRecentlyUsed();
            }
            entries.put(key, new CacheEntry(value, storedAt, effectiveTtl.toNanos()));
            log.debug("Cache set: key={} ttl={}", key, effectiveTtl);
        } finally {
            lock.unlock();
        }
    }

    public boolean delete(String key) {
        lock.lock();
        try {
            boolean removed = entries.remove(key) != null;
            if (removed) {
                log.debug("Cache deleted: key={}", key);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every entry and reset the hit/miss counters.
     */
    public void clear() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            hits = 0;
            misses = 0;
            log.info("Cache cleared: entriesRemoved={}", size);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            long now = ticker.read();
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Cache cleanup completed: entriesRemoved={}", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public CacheStatistics getStats() {
        lock.lock();
        try {
            long total = hits + misses;
            return CacheStatistics.builder()
                    .hits(hits)
                    .misses(misses)
                    .size(entries.size())
                    .maxSize(maxSize)
                    .hitRate(total > 0 ? (double) hits / total : 0.0)
                    .totalRequests(total)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Build a deterministic key from an endpoint and its parameters.
     *
     * <p>Parameters are sorted by name before hashing, so the same pairs in any order
     * produce the same key. The key is prefixed with the endpoint's last path segment to
     * keep it readable in logs.
     */
    public String generateKey(String endpoint, Map<String, ?> params) {
        StringBuilder keySource = new StringBuilder(endpoint);
        if (params != null && !params.isEmpty()) {
            keySource.append('|').append(serializeParams(params));
        }
        String hash = DigestUtils.sha256Hex(keySource.toString()).substring(0, KEY_HASH_LENGTH);
        String lastSegment = endpoint.substring(endpoint.lastIndexOf('/') + 1);
        return lastSegment + "_" + hash;
    }

    /**
     * Wrap an asynchronous operation so that its results are memoized in this cache.
     *
     * <p>The cache key is {@code generateKey(namespace, keyDerivation.apply(argument))};
     * callers decide which parts of the argument identify a result. Empty results are
     * not cached.
     *
     * @param namespace     key prefix separating this operation from others
     * @param ttl           time to live for memoized results, or {@code null} for the default
     * @param keyDerivation maps an argument to the parameters that identify its result
     * @param operation     the operation to memoize
     */
    public <A, R> Function<A, Mono<R>> cached(String namespace,
                                              Duration ttl,
                                              Function<? super A, ? extends Map<String, ?>> keyDerivation,
                                              Function<? super A, ? extends Mono<R>> operation) {
        return argument -> Mono.defer(() -> {
            String key = generateKey(namespace, keyDerivation.apply(argument));
            CacheResult cached = get(key);
            if (cached.isHit()) {
                log.debug("Cached operation hit: namespace={} key={}", namespace, key);
                return Mono.<R>justOrEmpty(cached.valueAs());
            }
            return operation.apply(argument)
                    .doOnNext(result -> set(key, result, ttl));
        });
    }

    /**
     * Start the periodic expiry sweep, if a positive cleanup interval is configured.
     */
    public synchronized void startCleanup() {
        if (cleanupTask != null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            return;
        }
        cleanupTask = Flux.interval(cleanupInterval, cleanupInterval)
                .subscribe(tick -> {
                    try {
                        cleanupExpired();
                    } catch (RuntimeException e) {
                        log.error("Error in cache cleanup", e);
                    }
                });
        log.debug("Cache cleanup scheduled: interval={}", cleanupInterval);
    }

    public boolean isCleanupRunning() {
        Disposable task = cleanupTask;
        return task != null && !task.isDisposed();
    }

    /**
     * Stop the periodic sweep and run a final one.
     */
    @Override
    public synchronized void close() {
        if (cleanupTask != null) {
            cleanupTask.dispose();
            cleanupTask = null;
        }
        cleanupExpired();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private void evictLeastRecentlyUsed() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String lruKey = it.next();
            it.remove();
            log.debug("Cache evicted LRU: key={}", lruKey);
        }
    }

    private String serializeParams(Map<String, ?> params) {
        List<List<Object>> sortedPairs = new ArrayList<>(params.size());
        new TreeMap<String, Object>(params).forEach((name, value) -> sortedPairs.add(Arrays.asList(name, value)));
        try {
            return keyMapper.writeValueAsString(sortedPairs);
        } catch (JsonProcessingException e) {
            // Values Jackson cannot serialize fall back to their string form.
            List<List<Object>> stringPairs = new ArrayList<>(sortedPairs.size());
            sortedPairs.forEach(pair -> stringPairs.add(Arrays.asList(pair.get(0), String.valueOf(pair.get(1)))));
            try {
                return keyMapper.writeValueAsString(stringPairs);
            } catch (JsonProcessingException fallbackFailure) {
                throw new IllegalStateException("Cannot serialize cache key parameters", fallbackFailure);
            }
        }
    }
}
