package com.promptguard.content.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.promptguard.content.pattern.ThreatCategory.*;
import static com.promptguard.content.pattern.ThreatSeverity.*;

/**
 * Immutable catalogue of threat patterns and benign phrases, stamped with a
 * generation string. Cached results are pinned to the generation that produced
 * them, so bump {@link #DEFAULT_GENERATION} whenever a rule is added or changed.
 */
public final class PatternDatabase {

    public static final String DEFAULT_GENERATION = "1.0.0";

    // Rarely legitimate in market commentary
    private static final List<ThreatPattern> CRITICAL_PATTERNS = List.of(
            ThreatPattern.of("ignore_previous_instructions",
                    "ignore\\s+(all\\s+)?(previous|prior|earlier)\\s+instructions?",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "Direct instruction override attempt"),
            ThreatPattern.of("disregard_instructions",
                    "disregard\\s+(everything|all|previous|prior)",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "Instruction disregard command"),
            ThreatPattern.of("forget_role",
                    "forget\\s+(your|the)\\s+(role|task|instructions?|prompt)",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "Role forgetting attempt"),
            ThreatPattern.of("new_task",
                    "(new\\s+task|new\\s+instructions?)\\s*:",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "Task override injection"),
            ThreatPattern.of("system_prompt",
                    "(^|\\n)\\s*(SYSTEM|ADMIN|ROOT|DEVELOPER)\\s*:",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "System prompt injection"),
            ThreatPattern.of("you_are_now",
                    "you\\s+are\\s+now\\s+(a|an|in|the)\\b",
                    100, CRITICAL, INSTRUCTION_OVERRIDE, "Role reassignment attempt"),
            ThreatPattern.of("print_prompt",
                    "(print|show|display|reveal|output)\\s+(your|the|me\\s+your|me\\s+the)\\s+"
                            + "(prompt|instructions?|system\\s+message)",
                    100, CRITICAL, DATA_EXFILTRATION, "Prompt disclosure attempt"),
            ThreatPattern.of("repeat_instructions",
                    "(repeat|show\\s+all)\\s+(all\\s+)?(your|the)\\s+(instructions?|prompt|rules)",
                    100, CRITICAL, DATA_EXFILTRATION, "Instruction repetition request")
    );

    // Known jailbreak techniques
    private static final List<ThreatPattern> HIGH_PATTERNS = List.of(
            ThreatPattern.of("dan_mode",
                    "\\b(DAN|STAN)\\s+mode",
                    75, HIGH, JAILBREAK, "DAN/STAN jailbreak mode"),
            ThreatPattern.of("developer_mode",
                    "developer\\s+mode\\s+(activated|enabled|on)\\b",
                    75, HIGH, JAILBREAK, "Developer mode activation"),
            ThreatPattern.of("unrestricted_mode",
                    "unrestricted\\s+mode",
                    75, HIGH, JAILBREAK, "Unrestricted mode request"),
            ThreatPattern.of("end_marker",
                    "(---\\s*END\\s*---|###\\s*OVERRIDE\\s*###|===\\s*STOP\\s*===)",
                    60, HIGH, JAILBREAK, "Suspicious boundary marker"),
            ThreatPattern.of("ignore_safety",
                    "(ignore|bypass|disable)\\s+(safety|ethics|guardrails?)",
                    70, HIGH, JAILBREAK, "Safety mechanism bypass"),
            ThreatPattern.of("educational_bypass",
                    "for\\s+(educational|research)\\s+purposes?,?\\s+(ignore|bypass|disable)",
                    65, HIGH, JAILBREAK, "Educational bypass attempt"),
            ThreatPattern.of("pretend_mode",
                    "(pretend|act\\s+as|simulate)\\s+(you\\s+are|being)",
                    50, HIGH, JAILBREAK, "Role-playing scenario"),
            ThreatPattern.of("reveal_data",
                    "(reveal|expose|leak)\\s+(training\\s+data|api\\s+keys?|credentials?|environment)",
                    75, HIGH, DATA_EXFILTRATION, "Data revelation request")
    );

    // Output format and prediction manipulation
    private static final List<ThreatPattern> MEDIUM_PATTERNS = List.of(
            ThreatPattern.of("format_override",
                    "instead\\s+of\\s+JSON,?\\s+(output|return|provide)",
                    35, MEDIUM, OUTPUT_MANIPULATION, "JSON format override"),
            ThreatPattern.of("no_json",
                    "(don't|do\\s+not)\\s+(return|output|use)\\s+JSON",
                    35, MEDIUM, OUTPUT_MANIPULATION, "JSON rejection"),
            ThreatPattern.of("include_in_response",
                    "(include|add|insert)\\s+(in\\s+)?(your|the)\\s+response",
                    30, MEDIUM, OUTPUT_MANIPULATION, "Response content injection"),
            ThreatPattern.of("make_sure_to",
                    "make\\s+sure\\s+to\\s+(print|output|include|add)",
                    30, MEDIUM, OUTPUT_MANIPULATION, "Mandatory output instruction"),
            ThreatPattern.of("reasoning_field_manipulation",
                    "(in\\s+the\\s+reasoning\\s+field|for\\s+reasoning),?\\s+(include|add|put)",
                    40, MEDIUM, OUTPUT_MANIPULATION, "Reasoning field manipulation"),
            ThreatPattern.of("all_bullish",
                    "(all|every|each)\\s+(predictions?|forecasts?|assets?)\\s+(must\\s+be|should\\s+be|are)\\s+bullish",
                    40, MEDIUM, PREDICTION_BIAS, "Blanket bullish bias injection"),
            ThreatPattern.of("all_bearish",
                    "(all|every|each)\\s+(predictions?|forecasts?|assets?)\\s+(must\\s+be|should\\s+be|are)\\s+bearish",
                    40, MEDIUM, PREDICTION_BIAS, "Blanket bearish bias injection"),
            ThreatPattern.of("confidence_override",
                    "(always|every|all)\\s+(use|set|mark|predictions?\\s+set)\\s+(\\d+%|100%|maximum)\\s+confidence",
                    35, MEDIUM, PREDICTION_BIAS, "Confidence level override")
    );

    // Statistical anomalies and encoding indicators
    private static final List<ThreatPattern> LOW_PATTERNS = List.of(
            ThreatPattern.caseSensitive("excessive_caps",
                    "[A-Z\\s]{100,}",
                    15, LOW, RESOURCE_EXHAUSTION, "Excessive capital letters"),
            ThreatPattern.caseSensitive("base64_content",
                    "(?:^|[\\s,])([A-Za-z0-9+/]{50,}={0,2})(?:$|[\\s,])",
                    20, LOW, JAILBREAK, "Potential base64 encoded content"),
            ThreatPattern.of("hex_encoding",
                    "(?:\\\\x[0-9a-f]{2}){10,}",
                    20, LOW, JAILBREAK, "Hex encoded content"),
            ThreatPattern.of("unicode_escapes",
                    "(?:\\\\u[0-9a-f]{4}){10,}",
                    20, LOW, JAILBREAK, "Unicode escape sequences"),
            ThreatPattern.of("repeated_words",
                    "\\b(\\w+)\\s+\\1\\s+\\1\\b",
                    10, LOW, RESOURCE_EXHAUSTION, "Repeated word pattern")
    );

    // Benign phrases that share vocabulary with attacks
    private static final List<String> WHITELISTED_PHRASES = List.of(
            "the economic system",
            "the financial system",
            "the banking system",
            "the monetary system",
            "show the chart",
            "show the data",
            "show you how",
            "let me show",
            "imagine if",
            "think about",
            "root cause",
            "system works",
            "system failure",
            "admin panel",
            "admin access",
            "developer tools",
            "developer experience"
    );

    private static final PatternDatabase DEFAULTS = new PatternDatabase(
            DEFAULT_GENERATION, defaultPatterns(), WHITELISTED_PHRASES);

    private final String generation;
    private final List<ThreatPattern> patterns;
    private final List<String> whitelist;

    public PatternDatabase(String generation, List<ThreatPattern> patterns, List<String> whitelist) {
        if (generation == null || generation.isBlank()) {
            throw new IllegalArgumentException("Pattern generation must not be blank");
        }
        this.generation = generation;
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        this.whitelist = whitelist == null ? List.of() : whitelist.stream()
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .toList();
    }

    /** The built-in catalogue, ordered CRITICAL first. */
    public static PatternDatabase defaults() {
        return DEFAULTS;
    }

    private static List<ThreatPattern> defaultPatterns() {
        List<ThreatPattern> all = new ArrayList<>();
        all.addAll(CRITICAL_PATTERNS);
        all.addAll(HIGH_PATTERNS);
        all.addAll(MEDIUM_PATTERNS);
        all.addAll(LOW_PATTERNS);
        return all;
    }

    public String generation() { return generation; }

    public List<ThreatPattern> patterns() { return patterns; }

    public List<String> whitelist() { return whitelist; }

    public List<ThreatPattern> bySeverity(ThreatSeverity severity) {
        return patterns.stream().filter(p -> p.severity() == severity).toList();
    }

    public List<ThreatPattern> byCategory(ThreatCategory category) {
        return patterns.stream().filter(p -> p.category() == category).toList();
    }

    public boolean containsWhitelistedPhrase(String text) {
        if (text == null || text.isEmpty()) return false;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : whitelist) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
