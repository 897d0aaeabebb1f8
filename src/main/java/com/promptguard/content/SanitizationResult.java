package com.promptguard.content;

import com.promptguard.content.detect.DetectedThreat;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Verdict for one piece of content. {@code sanitizedContent} is present only
 * when the action is {@link SanitizationAction#SANITIZE}.
 */
public record SanitizationResult(
        SanitizationAction action,
        int score,
        List<DetectedThreat> threats,
        String originalContent,
        Optional<String> sanitizedContent,
        Metadata metadata
) {
    public SanitizationResult {
        threats = threats == null ? List.of() : List.copyOf(threats);
        sanitizedContent = action == SanitizationAction.SANITIZE && sanitizedContent != null
                ? sanitizedContent : Optional.empty();
    }

    public record Metadata(
            Instant processedAt,
            double processingDurationMs,
            int contentLength,
            int threatCount,
            int sectionsRemoved,
            boolean cacheHit,
            String patternGeneration
    ) {
        public Metadata withCacheHit(boolean hit) {
            return new Metadata(processedAt, processingDurationMs, contentLength, threatCount,
                    sectionsRemoved, hit, patternGeneration);
        }
    }

    public SanitizationResult withCacheHit(boolean hit) {
        return new SanitizationResult(action, score, threats, originalContent, sanitizedContent,
                metadata.withCacheHit(hit));
    }

    /** The text the caller should forward downstream, or empty when blocked. */
    public Optional<String> contentToForward() {
        return switch (action) {
            case ALLOW -> Optional.ofNullable(originalContent);
            case SANITIZE -> sanitizedContent;
            case BLOCK -> Optional.empty();
        };
    }

    public Optional<DetectedThreat> topThreat() {
        return threats.stream().max((a, b) -> Integer.compare(a.score(), b.score()));
    }
}
