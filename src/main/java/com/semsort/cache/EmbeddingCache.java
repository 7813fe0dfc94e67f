package com.semsort.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded memo of text to vector per model.
 *
 * <p>Entries expire {@code ttlMs} after they were written. An expired entry is a miss for every caller and
 * is dropped on the read that finds it, or by the periodic sweep when one is configured. When full, the
 * least recently used entry is evicted; both reads and writes count as use.
 */
public class EmbeddingCache {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    private final int maxSize;
    private final long ttlMs;
    private final Clock clock;
    private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final ScheduledExecutorService sweeper;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;
    private boolean shutdown;

    public EmbeddingCache(int maxSize, long ttlMs) {
        this(maxSize, ttlMs, 0L, Clock.systemUTC());
    }

    public EmbeddingCache(int maxSize, long ttlMs, long cleanupIntervalMs, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be > 0");
        }
        this.maxSize = maxSize;
        this.ttlMs = ttlMs;
        this.clock = clock;
        if (cleanupIntervalMs > 0) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "embedding-cache-sweeper");
                thread.setDaemon(true);
                return thread;
            });
            this.sweeper.scheduleWithFixedDelay(this::evictExpired, cleanupIntervalMs, cleanupIntervalMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public synchronized Optional<CacheEntry> get(String content, String model) {
        CacheKey key = CacheKey.of(content, model);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            log.debug("cache.miss model={}", model);
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key);
            expirations++;
            misses++;
            log.debug("cache.expired model={}", model);
            return Optional.empty();
        }
        hits++;
        return Optional.of(new CacheEntry(entry.vector().clone(), entry.model(), entry.createdAt()));
    }

    public synchronized void set(String content, String model, float[] vector) {
        CacheKey key = CacheKey.of(content, model);
        CacheEntry entry = new CacheEntry(vector.clone(), model, clock.instant());
        if (entries.containsKey(key)) {
            entries.put(key, entry);
            return;
        }
        if (entries.size() >= maxSize) {
            evictExpiredLocked(clock.instant());
        }
        while (entries.size() >= maxSize) {
            Iterator<Map.Entry<CacheKey, CacheEntry>> eldest = entries.entrySet().iterator();
            eldest.next();
            eldest.remove();
            evictions++;
        }
        entries.put(key, entry);
    }

    public synchronized boolean invalidate(String content, String model) {
        return entries.remove(CacheKey.of(content, model)) != null;
    }

    public synchronized int evictExpired() {
        return evictExpiredLocked(clock.instant());
    }

    public synchronized CacheStats getStats() {
        return new CacheStats(hits, misses, entries.size(), maxSize, evictions, expirations, ttlMs);
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Drops all entries and zeroes the counters.
     */
    public synchronized void reset() {
        entries.clear();
        hits = 0;
        misses = 0;
        evictions = 0;
        expirations = 0;
    }

    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            log.debug("cache.shutdown size={}", entries.size());
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private int evictExpiredLocked(Instant now) {
        int removed = 0;
        Iterator<CacheEntry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next(), now)) {
                iterator.remove();
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return now.toEpochMilli() - entry.createdAt().toEpochMilli() >= ttlMs;
    }

    record CacheKey(String contentHash, String model) {
        static CacheKey of(String content, String model) {
            return new CacheKey(EmbeddingCache.contentHash(content), model == null ? "" : model);
        }
    }

    static String contentHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
