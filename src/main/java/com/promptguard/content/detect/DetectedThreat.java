package com.promptguard.content.detect;

import com.promptguard.content.pattern.ThreatCategory;
import com.promptguard.content.pattern.ThreatSeverity;

/**
 * One pattern match. {@code position} is an offset into the variant named by
 * {@code origin}, which is the original text unless the match came from a
 * decoded rendition.
 */
public record DetectedThreat(
        String patternName,
        ThreatCategory category,
        ThreatSeverity severity,
        int score,
        String matchedText,
        int position,
        String contextSnippet,
        ContentVariant origin
) {
    public boolean foundInOriginal() {
        return origin == ContentVariant.ORIGINAL;
    }
}
