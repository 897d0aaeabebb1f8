package com.promptguard.content.cache;

import com.promptguard.content.SanitizationResult;

import java.time.Instant;

public record CacheEntry(SanitizationResult result, Instant storedAt, String patternGeneration) {}
