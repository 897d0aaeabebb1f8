package com.promptguard.content;

public record SanitizerStats(
        long totalRequests,
        long allowedRequests,
        long sanitizedRequests,
        long blockedRequests,
        double averageScore,
        long cacheHits,
        long cacheMisses,
        double cacheHitRatePercent,
        double averageProcessingTimeMs,
        String patternGeneration
) {}
