package com.jreinhal.assay.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReasoningTraceTest {

    @Nested
    @DisplayName("Trace construction")
    class ConstructionTest {
        @Test
        @DisplayName("Should generate a short traceId")
        void shouldGenerateTraceId() {
            ReasoningTrace trace = new ReasoningTrace("query", 2);

            assertThat(trace.getTraceId()).hasSize(8);
            assertThat(trace.getQuerySummary()).isEqualTo("query");
            assertThat(trace.getProjectCount()).isEqualTo(2);
            assertThat(trace.isCompleted()).isFalse();
        }
    }

    @Nested
    @DisplayName("Step management")
    class StepManagementTest {
        @Test
        @DisplayName("Should add steps and accumulate duration")
        void shouldAddSteps() {
            ReasoningTrace trace = new ReasoningTrace("query", 1);
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.QUERY_ROUTING, "Route", "SIMPLE", 50));
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.HYBRID_RETRIEVAL, "Retrieve", "4 chunks", 100));

            assertThat(trace.getSteps()).hasSize(2);
            assertThat(trace.getTotalDurationMs()).isEqualTo(150);
        }

        @Test
        @DisplayName("Should render steps as maps, with data only when present")
        void shouldRenderStepMaps() {
            ReasoningTrace trace = new ReasoningTrace("query", 1);
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.VERIFICATION, "Numeric verification", "verified", 3,
                    Map.of("checked", 4)));
            trace.addStep(ReasoningStep.of(ReasoningStep.StepType.ANSWER_ASSEMBLY, "Answer assembly", "2 citations", 0));

            List<Map<String, Object>> maps = trace.getStepsAsMaps();

            assertThat(maps.get(0)).containsEntry("type", "verification").containsEntry("data", Map.of("checked", 4));
            assertThat(maps.get(1)).containsEntry("label", "Answer assembly").doesNotContainKey("data");
        }

        @Test
        @DisplayName("Should report the failed stage in the summary")
        void shouldSummarizeFailure() {
            ReasoningTrace trace = new ReasoningTrace("query", 1);
            trace.markFailed("generation");
            trace.complete();

            assertThat(trace.getSummary()).contains("COMPLETED").endsWith("failed at generation");
        }
    }

    @Nested
    @DisplayName("Tracer")
    class TracerTest {
        private final ReasoningTracer tracer = new ReasoningTracer();

        @AfterEach
        void tearDown() {
            tracer.endTrace();
        }

        @Test
        @DisplayName("Should drop steps recorded without an open trace")
        void shouldIgnoreStepsWithoutTrace() {
            tracer.addStep(ReasoningStep.StepType.GENERATION, "Generation", "ok", 10);
            tracer.addMetric("tokens", 12);

            assertThat(tracer.getCurrentTrace()).isNull();
        }

        @Test
        @DisplayName("Should record steps, metrics and failure on the current thread's trace")
        void shouldRecordOnCurrentTrace() {
            ReasoningTrace trace = tracer.startTrace("query", 1);
            tracer.addStep(ReasoningStep.StepType.GENERATION, "Generation", "ok", 10);
            tracer.addMetric("tokens", 12);
            tracer.markFailed("verification", "NUMERIC_GROUNDING_FAILED");

            assertThat(trace.getSteps()).extracting(ReasoningStep::type)
                    .containsExactly(ReasoningStep.StepType.GENERATION, ReasoningStep.StepType.ERROR);
            assertThat(trace.getMetrics()).containsEntry("tokens", 12);
            assertThat(trace.getFailedStage()).isEqualTo("verification");
        }

        @Test
        @DisplayName("Should complete and unbind the trace when it ends")
        void shouldEndTrace() {
            ReasoningTrace trace = tracer.startTrace("query", 1);

            assertThat(tracer.endTrace()).isSameAs(trace);
            assertThat(trace.isCompleted()).isTrue();
            assertThat(tracer.getCurrentTrace()).isNull();
        }
    }
}
