package com.jreinhal.legaldoc.reasoning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Creates and retains {@link ReasoningTrace}s. Stages run on pooled threads, so the trace is
 * passed explicitly rather than bound to the calling thread.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    @Value(value = "${legaldoc.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    @Value(value = "${legaldoc.reasoning.max-cached-traces:1000}")
    private long maxCachedTraces = 1000L;
    @Value(value = "${legaldoc.reasoning.trace-ttl:PT1H}")
    private Duration traceTtl = Duration.ofHours(1L);
    private Cache<String, ReasoningTrace> traceCache;

    @PostConstruct
    public void init() {
        this.traceCache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, this.maxCachedTraces))
                .expireAfterWrite(this.traceTtl)
                .build();
        log.info("Reasoning tracer initialized (maxCachedTraces={}, ttl={}, detailed={})",
                this.maxCachedTraces, this.traceTtl, this.detailedTraces);
    }

    public ReasoningTrace startTrace(String query, String conversationId) {
        ReasoningTrace trace = new ReasoningTrace(query, conversationId);
        log.debug("Started reasoning trace: {} for conversation: {}", trace.getTraceId(), conversationId);
        return trace;
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail,
                        long durationMs) {
        this.addStep(trace, type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail,
                        long durationMs, Map<String, Object> data) {
        if (trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] Step: {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    public ReasoningTrace endTrace(ReasoningTrace trace) {
        trace.complete();
        this.traceCache.put(trace.getTraceId(), trace);
        log.debug("Completed reasoning trace: {}", trace.getSummary());
        return trace;
    }

    public Optional<ReasoningTrace> getTrace(String traceId) {
        if (traceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.traceCache.getIfPresent(traceId));
    }

    public void clearCache() {
        this.traceCache.invalidateAll();
    }
}
