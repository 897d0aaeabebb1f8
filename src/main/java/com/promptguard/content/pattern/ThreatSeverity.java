package com.promptguard.content.pattern;

/**
 * Severity tier of a threat pattern. Each tier owns a closed score band and a
 * pattern may only carry a score inside the band of its tier.
 */
public enum ThreatSeverity {

    CRITICAL(100, 100),
    HIGH(50, 75),
    MEDIUM(25, 40),
    LOW(10, 20);

    private final int minScore;
    private final int maxScore;

    ThreatSeverity(int minScore, int maxScore) {
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public int minScore() { return minScore; }

    public int maxScore() { return maxScore; }

    public boolean accepts(int score) {
        return score >= minScore && score <= maxScore;
    }
}
