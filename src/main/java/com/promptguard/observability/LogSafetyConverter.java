package com.promptguard.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Logback converter for messages that may quote untrusted content. Line breaks
 * are escaped so a content preview cannot forge log records, and secrets are
 * redacted. Extra patterns come from promptguard.logging.redact-patterns via
 * LoggingConfig.
 */
public class LogSafetyConverter extends ClassicConverter {

    private static final List<Pattern> DEFAULT_PATTERNS = List.of(
            Pattern.compile("\\bsk-[A-Za-z0-9_-]{16,}\\b"),                        // API key
            Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/-]{16,}=*"),          // Bearer token
            Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}")     // Email
    );

    private static volatile List<Pattern> configuredPatterns = null;

    public static void setConfiguredPatterns(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(DEFAULT_PATTERNS);
        if (patterns != null) {
            for (String p : patterns) {
                compiled.add(Pattern.compile(p));
            }
        }
        configuredPatterns = compiled;
    }

    static void resetPatterns() {
        configuredPatterns = null;
    }

    @Override
    public String convert(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        if (message == null) return "";

        List<Pattern> patterns = configuredPatterns != null ? configuredPatterns : DEFAULT_PATTERNS;
        for (Pattern pattern : patterns) {
            message = pattern.matcher(message).replaceAll("[REDACTED]");
        }
        return message.replace("\r", "\\r").replace("\n", "\\n");
    }
}
