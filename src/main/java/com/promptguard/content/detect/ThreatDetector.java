package com.promptguard.content.detect;

import com.promptguard.content.pattern.PatternDatabase;
import com.promptguard.content.pattern.ThreatPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Scans content against every pattern of a {@link PatternDatabase}, then
 * repeats the scan over any Base64 or URL-decoded rendition of the input.
 */
public class ThreatDetector {

    static final int CONTEXT_RADIUS = 100;

    private final PatternDatabase patternDatabase;

    public ThreatDetector(PatternDatabase patternDatabase) {
        this.patternDatabase = patternDatabase;
    }

    /**
     * Threats in the original text in pattern order, followed by threats
     * found in decoded renditions.
     */
    public List<DetectedThreat> detect(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        List<DetectedThreat> threats = new ArrayList<>(scan(content, ContentVariant.ORIGINAL));
        for (ContentDecoder.DecodedVariant decoded : ContentDecoder.variants(content)) {
            threats.addAll(scan(decoded.text(), decoded.variant()));
        }
        return threats;
    }

    List<DetectedThreat> scan(String content, ContentVariant origin) {
        List<DetectedThreat> threats = new ArrayList<>();
        for (ThreatPattern pattern : patternDatabase.patterns()) {
            Matcher matcher = pattern.pattern().matcher(content);
            while (matcher.find()) {
                String match = matcher.group();
                threats.add(new DetectedThreat(
                        pattern.name(),
                        pattern.category(),
                        pattern.severity(),
                        pattern.score(),
                        match,
                        matcher.start(),
                        extractContext(content, matcher.start(), match.length()),
                        origin));
            }
        }
        return threats;
    }

    static String extractContext(String content, int position, int matchLength) {
        int start = Math.max(0, position - CONTEXT_RADIUS);
        int end = Math.min(content.length(), position + matchLength + CONTEXT_RADIUS);
        StringBuilder context = new StringBuilder(end - start + 6);
        if (start > 0) context.append("...");
        context.append(content, start, end);
        if (end < content.length()) context.append("...");
        return context.toString();
    }
}
