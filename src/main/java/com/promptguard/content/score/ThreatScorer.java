package com.promptguard.content.score;

import com.promptguard.content.SanitizationAction;
import com.promptguard.content.SanitizationConfig;
import com.promptguard.content.detect.DetectedThreat;
import com.promptguard.content.pattern.PatternDatabase;
import com.promptguard.content.pattern.ThreatSeverity;

import java.util.List;

/**
 * Reduces detected threats and raw content properties to one composite score
 * and maps it onto an action.
 */
public class ThreatScorer {

    // Policy constants, tune against production traffic
    static final int LENGTH_PENALTY_STEP_CHARS = 10_000;
    static final int LENGTH_PENALTY_PER_STEP = 5;
    static final int LENGTH_PENALTY_CAP = 25;
    static final int REPETITION_PENALTY_STEP_CHARS = 100;
    static final int REPETITION_PENALTY_PER_STEP = 5;
    static final int REPETITION_PENALTY_CAP = 20;
    static final int WHITELIST_DISCOUNT = 10;
    static final int WHITELIST_DISCOUNT_CEILING = 100;

    static final double ESCALATE_REMOVAL_PERCENT = 50.0;
    static final int ESCALATE_MIN_LENGTH = 100;
    static final int ESCALATE_CRITICAL_COUNT = 2;

    static final double BODY_WEIGHT = 0.7;
    static final double TITLE_WEIGHT = 0.2;
    static final double DESCRIPTION_WEIGHT = 0.1;

    private final PatternDatabase patternDatabase;

    public ThreatScorer(PatternDatabase patternDatabase) {
        this.patternDatabase = patternDatabase;
    }

    public int score(List<DetectedThreat> threats, String content, SanitizationConfig config) {
        String text = content != null ? content : "";
        int score = 0;
        for (DetectedThreat threat : threats) {
            score += threat.score();
        }
        score += lengthPenalty(text.length(), config.maxInputLength());
        score += repetitionPenalty(text, config.maxRepeatedChars());

        if (score < WHITELIST_DISCOUNT_CEILING && patternDatabase.containsWhitelistedPhrase(text)) {
            score -= WHITELIST_DISCOUNT;
        }
        return Math.max(0, score);
    }

    static int lengthPenalty(int length, int maxInputLength) {
        if (length <= maxInputLength) return 0;
        int steps = (length - maxInputLength) / LENGTH_PENALTY_STEP_CHARS;
        return Math.min(LENGTH_PENALTY_CAP, steps * LENGTH_PENALTY_PER_STEP);
    }

    /**
     * Penalises runs of one character longer than {@code maxRepeated}. Line
     * breaks do not count as run characters.
     */
    static int repetitionPenalty(String content, int maxRepeated) {
        long totalRepeated = 0;
        int i = 0;
        int length = content.length();
        while (i < length) {
            char c = content.charAt(i);
            int runEnd = i + 1;
            while (runEnd < length && content.charAt(runEnd) == c) {
                runEnd++;
            }
            int run = runEnd - i;
            if (run > maxRepeated && c != '\n' && c != '\r') {
                totalRepeated += run;
            }
            i = runEnd;
        }
        long steps = totalRepeated / REPETITION_PENALTY_STEP_CHARS;
        return (int) Math.min(REPETITION_PENALTY_CAP, steps * REPETITION_PENALTY_PER_STEP);
    }

    public SanitizationAction action(int score, SanitizationConfig config) {
        if (!config.enabled()) {
            return SanitizationAction.ALLOW;
        }
        if (score >= config.blockThreshold()) {
            return SanitizationAction.BLOCK;
        }
        if (score >= config.sanitizeThreshold()) {
            return SanitizationAction.SANITIZE;
        }
        return SanitizationAction.ALLOW;
    }

    public ScoreBand severityOf(int score) {
        if (score >= 100) return ScoreBand.CRITICAL;
        if (score >= 75) return ScoreBand.HIGH;
        if (score >= 50) return ScoreBand.MEDIUM;
        if (score >= 25) return ScoreBand.LOW;
        return ScoreBand.NONE;
    }

    /** Whether the outcome is worth forwarding to the security event sink. */
    public boolean shouldWarn(int score, SanitizationAction action, SanitizationConfig config) {
        return config.logAllAttempts()
                || action != SanitizationAction.ALLOW
                || score > config.warnThreshold();
    }

    /**
     * Whether a SANITIZE verdict must become BLOCK: too much was cut, too little
     * is left, several critical hits were present, or a threat was only visible
     * after decoding and so could not be cut out of the original text.
     */
    public boolean shouldEscalate(int originalLength, int sanitizedLength, List<DetectedThreat> threats) {
        if (originalLength > 0) {
            double removed = (originalLength - sanitizedLength) * 100.0 / originalLength;
            if (removed >= ESCALATE_REMOVAL_PERCENT) {
                return true;
            }
        }
        if (sanitizedLength < ESCALATE_MIN_LENGTH) {
            return true;
        }
        long critical = threats.stream()
                .filter(t -> t.severity() == ThreatSeverity.CRITICAL)
                .count();
        if (critical >= ESCALATE_CRITICAL_COUNT) {
            return true;
        }
        return threats.stream().anyMatch(t -> !t.foundInOriginal());
    }

    /** Body/title/description combination for hosts that screen all three fields. */
    public double weightedScore(double bodyScore, double titleScore, double descriptionScore) {
        return bodyScore * BODY_WEIGHT + titleScore * TITLE_WEIGHT + descriptionScore * DESCRIPTION_WEIGHT;
    }

    public double averageScore(List<? extends Number> scores) {
        if (scores == null || scores.isEmpty()) return 0;
        return scores.stream().mapToDouble(Number::doubleValue).sum() / scores.size();
    }
}
