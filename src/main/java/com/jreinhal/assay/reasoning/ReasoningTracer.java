package com.jreinhal.assay.reasoning;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Thread-bound trace of the answer currently being produced. Steps recorded from a thread
 * without an open trace are dropped.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);
    @Value("${assay.reasoning.enabled:true}")
    private boolean enabled = true;
    @Value("${assay.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    private final ThreadLocal<ReasoningTrace> currentTrace = new ThreadLocal<>();

    public ReasoningTrace startTrace(String querySummary, int projectCount) {
        if (!this.enabled) {
            return null;
        }
        ReasoningTrace trace = new ReasoningTrace(querySummary, projectCount);
        this.currentTrace.set(trace);
        log.debug("Started reasoning trace {} for query {}", trace.getTraceId(), querySummary);
        return trace;
    }

    public ReasoningTrace getCurrentTrace() {
        return this.currentTrace.get();
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] step {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    public void addMetric(String key, Object value) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace != null) {
            trace.addMetric(key, value);
        }
    }

    public void markFailed(String stage, String detail) {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return;
        }
        trace.markFailed(stage);
        trace.addStep(ReasoningStep.of(ReasoningStep.StepType.ERROR, "Failed at " + stage, detail, 0L));
    }

    public ReasoningTrace endTrace() {
        ReasoningTrace trace = this.currentTrace.get();
        if (trace == null) {
            return null;
        }
        trace.complete();
        this.currentTrace.remove();
        log.debug("Completed reasoning trace: {}", trace.getSummary());
        return trace;
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
