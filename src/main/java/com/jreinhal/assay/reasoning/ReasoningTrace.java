package com.jreinhal.assay.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Record of the stages one answer went through, with timings and the metrics each stage
 * reported. The query itself is only kept as a log-safe summary.
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String querySummary;
    private final int projectCount;
    private final List<ReasoningStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private String failedStage;
    private boolean completed;

    public ReasoningTrace(String querySummary, int projectCount) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.querySummary = querySummary;
        this.projectCount = projectCount;
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    public void addStep(ReasoningStep step) {
        steps.add(step);
        totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        metrics.put(key, value);
    }

    public void markFailed(String stage) {
        this.failedStage = stage;
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return traceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getQuerySummary() {
        return querySummary;
    }

    public int getProjectCount() {
        return projectCount;
    }

    public List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * Sum of the recorded step durations, which excludes time spent between stages.
     */
    public long getTotalDurationMs() {
        return totalDurationMs;
    }

    public String getFailedStage() {
        return failedStage;
    }

    public boolean isCompleted() {
        return completed;
    }

    public List<Map<String, Object>> getStepsAsMaps() {
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase());
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        return stepMaps;
    }

    public String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s%s",
                traceId, steps.size(), totalDurationMs, completed ? "COMPLETED" : "IN_PROGRESS",
                failedStage != null ? ", failed at " + failedStage : "");
    }
}
