package com.promptguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptguard.audit.LoggingSecurityEventSink;
import com.promptguard.audit.SecurityEventPublisher;
import com.promptguard.audit.SecurityEventSink;
import com.promptguard.content.ContentGuard;
import com.promptguard.content.SanitizationConfig;
import com.promptguard.content.UntrustedContentFilter;
import com.promptguard.content.cache.ResultCache;
import com.promptguard.content.pattern.PatternDatabase;
import com.promptguard.observability.PromptGuardMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Wires one long-lived screening engine from {@code promptguard.*} properties.
 */
@Configuration
public class SanitizationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SanitizationConfiguration.class);

    @Bean
    public SanitizationConfig sanitizationConfig(PromptGuardProperties properties) {
        PromptGuardProperties.SanitizationProperties p = properties.getSanitization();
        SanitizationConfig config = SanitizationConfig.builder()
                .enabled(p.isEnabled())
                .blockThreshold(p.getBlockThreshold())
                .sanitizeThreshold(p.getSanitizeThreshold())
                .warnThreshold(p.getWarnThreshold())
                .maxInputLength(p.getMaxInputLength())
                .maxRepeatedChars(p.getMaxRepeatedChars())
                .cacheEnabled(p.isCacheEnabled())
                .cacheTtl(p.getCacheTtl())
                .cacheMaxSize(p.getCacheMaxSize())
                .logAllAttempts(p.isLogAllAttempts())
                .build();
        log.info("Sanitization enabled={} thresholds block={} sanitize={} warn={} cache={} ttl={}",
                config.enabled(), config.blockThreshold(), config.sanitizeThreshold(),
                config.warnThreshold(), config.cacheEnabled(), config.cacheTtl());
        return config;
    }

    @Bean
    public PatternDatabase patternDatabase() {
        PatternDatabase database = PatternDatabase.defaults();
        log.info("Loaded {} threat patterns, generation {}", database.patterns().size(), database.generation());
        return database;
    }

    @Bean
    public PromptGuardMetrics promptGuardMetrics(MeterRegistry registry) {
        return new PromptGuardMetrics(registry);
    }

    @Bean
    public ResultCache resultCache(SanitizationConfig config, PatternDatabase patternDatabase,
                                   PromptGuardMetrics metrics) {
        ResultCache cache = new ResultCache(config.cacheMaxSize(), config.cacheTtl(), patternDatabase.generation());
        metrics.bindCacheSize(cache::size);
        return cache;
    }

    @Bean
    public SecurityEventSink loggingSecurityEventSink(ObjectMapper objectMapper) {
        return new LoggingSecurityEventSink(objectMapper);
    }

    @Bean
    public ThreadPoolTaskExecutor securityEventExecutor(PromptGuardProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEvents().getExecutorThreads());
        executor.setMaxPoolSize(properties.getEvents().getExecutorThreads());
        executor.setQueueCapacity(properties.getEvents().getQueueCapacity());
        executor.setThreadNamePrefix("security-events-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public SecurityEventPublisher securityEventPublisher(
            List<SecurityEventSink> sinks,
            @Qualifier("securityEventExecutor") ThreadPoolTaskExecutor executor,
            PromptGuardMetrics metrics) {
        return new SecurityEventPublisher(sinks, executor, metrics);
    }

    @Bean
    public ContentGuard contentGuard(SanitizationConfig config, PatternDatabase patternDatabase,
                                     ResultCache resultCache, SecurityEventPublisher eventPublisher,
                                     PromptGuardMetrics metrics) {
        return new ContentGuard(config, patternDatabase, resultCache, eventPublisher, metrics);
    }

    @Bean
    public UntrustedContentFilter untrustedContentFilter(ContentGuard contentGuard) {
        return new UntrustedContentFilter(contentGuard);
    }
}
