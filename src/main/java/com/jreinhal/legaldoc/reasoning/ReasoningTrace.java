package com.jreinhal.legaldoc.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Stage-by-stage record of one {@code answer} call: what each stage did, how long it took and
 * what it degraded to. Written by the thread running the query, read after completion.
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String query;
    private final String conversationId;
    private final List<ReasoningStep> steps = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Object> metrics = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile long totalDurationMs;
    private volatile boolean completed;

    public ReasoningTrace(String query, String conversationId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.query = query;
        this.conversationId = conversationId;
    }

    public void addStep(ReasoningStep step) {
        this.steps.add(step);
        this.totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        this.metrics.put(key, value);
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public String getQuery() {
        return this.query;
    }

    public String getConversationId() {
        return this.conversationId;
    }

    public List<ReasoningStep> getSteps() {
        synchronized (this.steps) {
            return List.copyOf(this.steps);
        }
    }

    public Map<String, Object> getMetrics() {
        synchronized (this.metrics) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(this.metrics));
        }
    }

    /** Sum of the recorded step durations. */
    public long getTotalDurationMs() {
        return this.totalDurationMs;
    }

    public boolean isCompleted() {
        return this.completed;
    }

    /**
     * Convert to a map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("traceId", this.traceId);
        map.put("timestamp", this.timestamp.toString());
        map.put("query", this.query);
        map.put("conversationId", this.conversationId);
        map.put("totalDurationMs", this.totalDurationMs);
        map.put("completed", this.completed);
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : this.getSteps()) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase(Locale.ROOT));
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        map.put("steps", stepMaps);
        Map<String, Object> metricsCopy = this.getMetrics();
        if (!metricsCopy.isEmpty()) {
            map.put("metrics", metricsCopy);
        }
        return map;
    }

    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s",
                this.traceId, this.steps.size(), this.totalDurationMs, this.completed ? "COMPLETED" : "IN_PROGRESS");
    }
}
