package com.promptguard.content.sanitize;

import com.promptguard.content.detect.DetectedThreat;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts malicious spans out of content while keeping the surrounding text.
 * Whole sentences are removed around each located threat, fenced blocks and
 * long encoded runs are stripped, then whitespace is tidied.
 */
public class ContentSanitizer {

    static final String ENCODED_PLACEHOLDER = " [encoded content removed] ";
    static final String HEX_PLACEHOLDER = " [hex content removed] ";
    static final String UNICODE_PLACEHOLDER = " [unicode content removed] ";

    static final int MIN_USABLE_LENGTH = 100;
    static final double MAX_USABLE_REMOVAL_PERCENT = 70.0;

    private static final String[] SENTENCE_DELIMITERS = {". ", "! ", "? ", "\n\n"};
    private static final int DELIMITER_LENGTH = 2;

    private static final List<Pattern> BOUNDARY_FENCES = List.of(
            fence("---\\s*END\\s*---.*?---\\s*START\\s*---"),
            fence("###\\s*OVERRIDE\\s*###.*?###\\s*END\\s*###"),
            fence("===\\s*STOP\\s*===.*?===\\s*RESUME\\s*==="),
            fence("\\[SYSTEM\\].*?\\[/SYSTEM\\]")
    );

    private static final Pattern BASE64_RUN =
            Pattern.compile("(?:^|[\\s,])([A-Za-z0-9+/]{50,}={0,2})(?=$|[\\s,])");
    private static final Pattern HEX_RUN =
            Pattern.compile("(?:\\\\x[0-9a-fA-F]{2}){10,}");
    private static final Pattern UNICODE_RUN =
            Pattern.compile("(?:\\\\u[0-9a-fA-F]{4}){10,}");
    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");
    private static final Pattern NEWLINE_RUN = Pattern.compile("\\n{3,}");

    private static Pattern fence(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    public SanitizationOutcome sanitize(String content, List<DetectedThreat> threats) {
        if (content == null || content.isEmpty()) {
            return new SanitizationOutcome("", 0);
        }
        if (threats == null || threats.isEmpty()) {
            return new SanitizationOutcome(content, 0);
        }

        List<int[]> spans = mergedSentenceSpans(content, threats);
        StringBuilder sanitized = new StringBuilder(content);
        // Highest offset first so earlier offsets stay valid
        for (int i = spans.size() - 1; i >= 0; i--) {
            int[] span = spans.get(i);
            sanitized.delete(span[0], span[1]);
        }

        String result = removeBoundaryFences(sanitized.toString());
        result = redactEncodedContent(result);
        result = normalizeWhitespace(result);
        return new SanitizationOutcome(result, spans.size());
    }

    /**
     * Sentence spans around every threat that can be located in {@code content},
     * sorted by start and merged where they touch.
     */
    List<int[]> mergedSentenceSpans(String content, List<DetectedThreat> threats) {
        List<int[]> spans = new ArrayList<>();
        for (DetectedThreat threat : threats) {
            if (isLocatedIn(content, threat)) {
                spans.add(sentenceSpan(content, threat.position(), threat.matchedText().length()));
            }
        }
        spans.sort(Comparator.comparingInt(span -> span[0]));
        List<int[]> merged = new ArrayList<>();
        for (int[] span : spans) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && span[0] <= last[1]) {
                last[1] = Math.max(last[1], span[1]);
            } else {
                merged.add(new int[]{span[0], span[1]});
            }
        }
        return merged;
    }

    // Matches from decoded renditions carry offsets into a different string
    private static boolean isLocatedIn(String content, DetectedThreat threat) {
        String match = threat.matchedText();
        int position = threat.position();
        return threat.foundInOriginal()
                && match != null && !match.isEmpty()
                && position >= 0 && position + match.length() <= content.length()
                && content.startsWith(match, position);
    }

    /**
     * From just after the previous sentence delimiter to just after the next
     * one. The preceding delimiter is kept so the neighbouring sentence stays
     * terminated.
     */
    static int[] sentenceSpan(String content, int position, int matchLength) {
        int start = 0;
        for (String delimiter : SENTENCE_DELIMITERS) {
            int idx = position > 0 ? content.lastIndexOf(delimiter, position - 1) : -1;
            if (idx >= 0 && idx + DELIMITER_LENGTH <= position) {
                start = Math.max(start, idx + DELIMITER_LENGTH);
            }
        }

        int matchEnd = position + matchLength;
        int end = content.length();
        for (String delimiter : SENTENCE_DELIMITERS) {
            int idx = content.indexOf(delimiter, matchEnd);
            if (idx >= 0) {
                end = Math.min(end, idx + DELIMITER_LENGTH);
            }
        }
        return new int[]{start, end};
    }

    static String removeBoundaryFences(String content) {
        String result = content;
        for (Pattern fence : BOUNDARY_FENCES) {
            result = fence.matcher(result).replaceAll(" ");
        }
        return result;
    }

    static String redactEncodedContent(String content) {
        String result = BASE64_RUN.matcher(content).replaceAll(ENCODED_PLACEHOLDER);
        result = HEX_RUN.matcher(result).replaceAll(HEX_PLACEHOLDER);
        return UNICODE_RUN.matcher(result).replaceAll(UNICODE_PLACEHOLDER);
    }

    static String normalizeWhitespace(String content) {
        String result = SPACE_RUN.matcher(content).replaceAll(" ");
        result = NEWLINE_RUN.matcher(result).replaceAll("\n\n");
        return result.trim();
    }

    /**
     * Whether the cleaned text is still worth forwarding: at least 100
     * characters, no more than 70% removed, not blank.
     */
    public boolean isUsable(String sanitized, String original) {
        if (sanitized == null) return false;
        String trimmed = sanitized.trim();
        if (trimmed.isEmpty() || trimmed.length() < MIN_USABLE_LENGTH) {
            return false;
        }
        return removalPercentage(original, sanitized) <= MAX_USABLE_REMOVAL_PERCENT;
    }

    public double removalPercentage(String original, String sanitized) {
        if (original == null || original.isEmpty()) return 0;
        int remaining = sanitized != null ? sanitized.length() : 0;
        return (original.length() - remaining) * 100.0 / original.length();
    }
}
