package com.promptguard.content.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.promptguard.content.SanitizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Memoizes verdicts keyed by the SHA-256 digest of the exact content. Entries
 * expire after the TTL and are dropped on read when they were produced by a
 * different pattern generation. Capacity is bounded; eviction is Caffeine's
 * size policy.
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<String, CacheEntry> entries;
    private final String generation;
    private final int maxSize;
    private final Clock clock;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public ResultCache(int maxSize, Duration ttl, String generation) {
        this(maxSize, ttl, generation, Ticker.systemTicker(), Clock.systemUTC());
    }

    ResultCache(int maxSize, Duration ttl, String generation, Ticker ticker, Clock clock) {
        this.generation = Objects.requireNonNull(generation, "generation");
        this.maxSize = maxSize;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Optional<SanitizationResult> get(String content) {
        return get(content, generation);
    }

    /**
     * Cached verdict for {@code content}, marked as a cache hit. The stored copy
     * is left untouched.
     */
    public Optional<SanitizationResult> get(String content, String currentGeneration) {
        String key = digest(content);
        CacheEntry entry = entries.getIfPresent(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (!entry.patternGeneration().equals(currentGeneration)) {
            entries.invalidate(key);
            misses.increment();
            log.debug("Dropped cache entry from pattern generation {} (current {})",
                    entry.patternGeneration(), currentGeneration);
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(entry.result().withCacheHit(true));
    }

    public void put(String content, SanitizationResult result) {
        String resultGeneration = result.metadata().patternGeneration();
        entries.put(digest(content), new CacheEntry(result.withCacheHit(false), clock.instant(),
                resultGeneration != null ? resultGeneration : generation));
    }

    /** Drops expired entries and entries from other pattern generations. */
    public long purgeStale() {
        long before = entries.estimatedSize();
        entries.cleanUp();
        entries.asMap().values().removeIf(entry -> !entry.patternGeneration().equals(generation));
        entries.cleanUp();
        return Math.max(0, before - entries.estimatedSize());
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
        hits.reset();
        misses.reset();
    }

    public long size() {
        return entries.estimatedSize();
    }

    public String generation() {
        return generation;
    }

    public CacheStats stats() {
        long h = hits.sum();
        long m = misses.sum();
        double hitRate = h + m > 0 ? h * 100.0 / (h + m) : 0;
        return new CacheStats(size(), maxSize, h, m, hitRate, generation);
    }

    public record CacheStats(long size, int maxSize, long hits, long misses,
                             double hitRatePercent, String patternGeneration) {}

    static String digest(String content) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest((content != null ? content : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
