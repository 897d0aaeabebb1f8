package com.promptguard.config;

import com.promptguard.observability.LogSafetyConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Pushes configured redaction patterns into the Logback
 * {@link LogSafetyConverter} via its static holder.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final PromptGuardProperties properties;

    public LoggingConfig(PromptGuardProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void configureRedaction() {
        List<String> patterns = properties.getLogging().getRedactPatterns();
        if (patterns != null && !patterns.isEmpty()) {
            log.info("Configuring {} additional log redaction patterns", patterns.size());
            LogSafetyConverter.setConfiguredPatterns(patterns);
        } else {
            log.info("Using default log redaction patterns (API keys, bearer tokens, email)");
        }
    }
}
