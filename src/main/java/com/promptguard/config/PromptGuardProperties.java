package com.promptguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "promptguard")
public class PromptGuardProperties {

    private SanitizationProperties sanitization = new SanitizationProperties();
    private EventProperties events = new EventProperties();
    private LoggingProperties logging = new LoggingProperties();

    public SanitizationProperties getSanitization() { return sanitization; }
    public void setSanitization(SanitizationProperties sanitization) { this.sanitization = sanitization; }

    public EventProperties getEvents() { return events; }
    public void setEvents(EventProperties events) { this.events = events; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class SanitizationProperties {
        private boolean enabled = true;
        private int blockThreshold = 75;
        private int sanitizeThreshold = 50;
        private int warnThreshold = 25;
        private int maxInputLength = 100_000;
        private int maxRepeatedChars = 50;
        private boolean cacheEnabled = true;
        private Duration cacheTtl = Duration.ofHours(24);
        private int cacheMaxSize = 1000;
        private Duration cacheCleanupInterval = Duration.ofHours(1);
        private boolean logAllAttempts = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getBlockThreshold() { return blockThreshold; }
        public void setBlockThreshold(int blockThreshold) { this.blockThreshold = blockThreshold; }
        public int getSanitizeThreshold() { return sanitizeThreshold; }
        public void setSanitizeThreshold(int sanitizeThreshold) { this.sanitizeThreshold = sanitizeThreshold; }
        public int getWarnThreshold() { return warnThreshold; }
        public void setWarnThreshold(int warnThreshold) { this.warnThreshold = warnThreshold; }
        public int getMaxInputLength() { return maxInputLength; }
        public void setMaxInputLength(int maxInputLength) { this.maxInputLength = maxInputLength; }
        public int getMaxRepeatedChars() { return maxRepeatedChars; }
        public void setMaxRepeatedChars(int maxRepeatedChars) { this.maxRepeatedChars = maxRepeatedChars; }
        public boolean isCacheEnabled() { return cacheEnabled; }
        public void setCacheEnabled(boolean cacheEnabled) { this.cacheEnabled = cacheEnabled; }
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public int getCacheMaxSize() { return cacheMaxSize; }
        public void setCacheMaxSize(int cacheMaxSize) { this.cacheMaxSize = cacheMaxSize; }
        public Duration getCacheCleanupInterval() { return cacheCleanupInterval; }
        public void setCacheCleanupInterval(Duration d) { this.cacheCleanupInterval = d; }
        public boolean isLogAllAttempts() { return logAllAttempts; }
        public void setLogAllAttempts(boolean logAllAttempts) { this.logAllAttempts = logAllAttempts; }
    }

    public static class EventProperties {
        private int executorThreads = 2;
        private int queueCapacity = 500;

        public int getExecutorThreads() { return executorThreads; }
        public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
