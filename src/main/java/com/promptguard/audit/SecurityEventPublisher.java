package com.promptguard.audit;

import com.promptguard.observability.PromptGuardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of security events to every registered sink. A full
 * queue or a failing sink costs the event, never the analysis that raised it.
 */
public class SecurityEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventPublisher.class);

    private final List<SecurityEventSink> sinks;
    private final Executor executor;
    private final PromptGuardMetrics metrics;

    public SecurityEventPublisher(List<SecurityEventSink> sinks, Executor executor, PromptGuardMetrics metrics) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
        this.metrics = metrics;
    }

    public void publish(SecurityEvent event) {
        for (SecurityEventSink sink : sinks) {
            try {
                executor.execute(() -> deliver(sink, event));
            } catch (RejectedExecutionException e) {
                metrics.recordEventDropped("rejected");
                log.warn("Security event queue full, dropped {} from principal={}",
                        event.type(), event.requesterIdentity());
            }
        }
    }

    private void deliver(SecurityEventSink sink, SecurityEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            metrics.recordEventDropped("sink_error");
            log.warn("Security event sink {} failed for {}: {}",
                    sink.getClass().getSimpleName(), event.type(), e.getMessage());
        }
    }
}
