package com.promptguard.content;

import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide running totals. Sums and counts are kept separately and
 * averages are computed on read, so concurrent writers never race on a mean.
 */
class SanitizationStatistics {

    private final LongAdder allowed = new LongAdder();
    private final LongAdder sanitized = new LongAdder();
    private final LongAdder blocked = new LongAdder();
    private final LongAdder scoreSum = new LongAdder();
    private final DoubleAdder durationSumMs = new DoubleAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();

    void recordOutcome(SanitizationAction action, int score, double durationMs) {
        switch (action) {
            case ALLOW -> allowed.increment();
            case SANITIZE -> sanitized.increment();
            case BLOCK -> blocked.increment();
        }
        scoreSum.add(score);
        durationSumMs.add(durationMs);
    }

    void recordCacheHit() {
        cacheHits.increment();
    }

    void recordCacheMiss() {
        cacheMisses.increment();
    }

    SanitizerStats snapshot(String patternGeneration) {
        long a = allowed.sum();
        long s = sanitized.sum();
        long b = blocked.sum();
        long total = a + s + b;
        long hits = cacheHits.sum();
        long misses = cacheMisses.sum();
        return new SanitizerStats(
                total, a, s, b,
                total > 0 ? (double) scoreSum.sum() / total : 0,
                hits, misses,
                hits + misses > 0 ? hits * 100.0 / (hits + misses) : 0,
                total > 0 ? durationSumMs.sum() / total : 0,
                patternGeneration);
    }

    void reset() {
        allowed.reset();
        sanitized.reset();
        blocked.reset();
        scoreSum.reset();
        durationSumMs.reset();
        cacheHits.reset();
        cacheMisses.reset();
    }
}
