package com.promptguard.content;

import java.time.Duration;

/**
 * Immutable engine configuration. Ordering of the thresholds is checked on
 * construction, so a bad configuration fails at startup rather than per call.
 */
public record SanitizationConfig(
        boolean enabled,
        int blockThreshold,
        int sanitizeThreshold,
        int warnThreshold,
        int maxInputLength,
        int maxRepeatedChars,
        boolean cacheEnabled,
        Duration cacheTtl,
        int cacheMaxSize,
        boolean logAllAttempts
) {
    public SanitizationConfig {
        if (warnThreshold < 0) {
            throw new IllegalArgumentException("warnThreshold must be >= 0, was " + warnThreshold);
        }
        if (sanitizeThreshold < warnThreshold || blockThreshold < sanitizeThreshold) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds must satisfy block >= sanitize >= warn (block=%d, sanitize=%d, warn=%d)",
                    blockThreshold, sanitizeThreshold, warnThreshold));
        }
        if (maxInputLength <= 0) {
            throw new IllegalArgumentException("maxInputLength must be positive, was " + maxInputLength);
        }
        if (maxRepeatedChars <= 0) {
            throw new IllegalArgumentException("maxRepeatedChars must be positive, was " + maxRepeatedChars);
        }
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be a positive duration, was " + cacheTtl);
        }
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive, was " + cacheMaxSize);
        }
    }

    public static SanitizationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .blockThreshold(blockThreshold)
                .sanitizeThreshold(sanitizeThreshold)
                .warnThreshold(warnThreshold)
                .maxInputLength(maxInputLength)
                .maxRepeatedChars(maxRepeatedChars)
                .cacheEnabled(cacheEnabled)
                .cacheTtl(cacheTtl)
                .cacheMaxSize(cacheMaxSize)
                .logAllAttempts(logAllAttempts);
    }

    public static class Builder {
        private boolean enabled = true;
        private int blockThreshold = 75;
        private int sanitizeThreshold = 50;
        private int warnThreshold = 25;
        private int maxInputLength = 100_000;
        private int maxRepeatedChars = 50;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofHours(24);
        private int cacheMaxSize = 1000;
        private boolean logAllAttempts = false;

        public Builder enabled(boolean v) { this.enabled = v; return this; }
        public Builder blockThreshold(int v) { this.blockThreshold = v; return this; }
        public Builder sanitizeThreshold(int v) { this.sanitizeThreshold = v; return this; }
        public Builder warnThreshold(int v) { this.warnThreshold = v; return this; }
        public Builder maxInputLength(int v) { this.maxInputLength = v; return this; }
        public Builder maxRepeatedChars(int v) { this.maxRepeatedChars = v; return this; }
        public Builder cacheEnabled(boolean v) { this.cacheEnabled = v; return this; }
        public Builder cacheTtl(Duration v) { this.cacheTtl = v; return this; }
        public Builder cacheMaxSize(int v) { this.cacheMaxSize = v; return this; }
        public Builder logAllAttempts(boolean v) { this.logAllAttempts = v; return this; }

        public SanitizationConfig build() {
            return new SanitizationConfig(enabled, blockThreshold, sanitizeThreshold, warnThreshold,
                    maxInputLength, maxRepeatedChars, cacheEnabled, cacheTtl, cacheMaxSize, logAllAttempts);
        }
    }
}
