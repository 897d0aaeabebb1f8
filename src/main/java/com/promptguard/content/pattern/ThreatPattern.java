package com.promptguard.content.pattern;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named, scored detection rule. Immutable once built; an invalid
 * severity/score pairing fails at load time.
 */
public record ThreatPattern(
        String name,
        Pattern pattern,
        int score,
        ThreatSeverity severity,
        ThreatCategory category,
        String description
) {
    public ThreatPattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        if (!severity.accepts(score)) {
            throw new IllegalArgumentException(String.format(
                    "Pattern %s: score %d outside %s band (%d-%d)",
                    name, score, severity, severity.minScore(), severity.maxScore()));
        }
    }

    /** Case-insensitive pattern, the default for phrase rules. */
    public static ThreatPattern of(String name, String regex, int score, ThreatSeverity severity,
                                   ThreatCategory category, String description) {
        return new ThreatPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                score, severity, category, description);
    }

    /** Case-sensitive pattern, for rules where letter case is the signal. */
    public static ThreatPattern caseSensitive(String name, String regex, int score, ThreatSeverity severity,
                                              ThreatCategory category, String description) {
        return new ThreatPattern(name, Pattern.compile(regex), score, severity, category, description);
    }
}
