package com.jreinhal.assay.service;

import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.config.GroundingProperties;
import com.jreinhal.assay.exception.AuthorizationException;
import com.jreinhal.assay.exception.ErrorKind;
import com.jreinhal.assay.exception.GenerationServiceException;
import com.jreinhal.assay.exception.InvalidQueryException;
import com.jreinhal.assay.exception.QueryCancelledException;
import com.jreinhal.assay.exception.RagException;
import com.jreinhal.assay.model.AnswerQuery;
import com.jreinhal.assay.model.Chunk;
import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.model.ProjectScope;
import com.jreinhal.assay.rag.answer.AnswerAssembler;
import com.jreinhal.assay.rag.answer.AnswerOutcome;
import com.jreinhal.assay.rag.answer.AnswerResult;
import com.jreinhal.assay.rag.answer.Citation;
import com.jreinhal.assay.rag.answer.CitationPlanner;
import com.jreinhal.assay.rag.answer.GenerationPrompt;
import com.jreinhal.assay.rag.answer.PromptBuilder;
import com.jreinhal.assay.rag.critical.CriticalDocument;
import com.jreinhal.assay.rag.critical.CriticalDocumentSelector;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraphBuilder;
import com.jreinhal.assay.rag.evidence.EvidenceGraphBuilder.EvidenceRequest;
import com.jreinhal.assay.rag.grounding.NumericGroundingVerifier;
import com.jreinhal.assay.rag.grounding.UngroundedValueRedactor;
import com.jreinhal.assay.rag.grounding.VerificationResult;
import com.jreinhal.assay.rag.hybridrag.HybridRetriever;
import com.jreinhal.assay.rag.hybridrag.RetrievalResult;
import com.jreinhal.assay.rag.intent.EvidenceMode;
import com.jreinhal.assay.rag.intent.QueryIntent;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTrace;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import com.jreinhal.assay.service.QueryAnalyzer.QueryAnalysis;
import com.jreinhal.assay.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Answers one question over the caller's projects.
 *
 * <p>Pipeline: validation and scope, query analysis, retrieval (or the caller's chunk selection),
 * evidence graph and critical documents when the intent needs structured evidence, prompt,
 * generation, numeric verification with at most one constrained regeneration, assembly. A FULL
 * query without evidence and a query without any source fail closed before generation. An answer
 * that still fails verification after regeneration is returned only with its ungrounded values
 * withheld.</p>
 *
 * <p>Every failure leaves as a {@link RagException} that names the stage it happened in.</p>
 */
@Service
public class RagAnswerService {
    private static final Logger log = LoggerFactory.getLogger(RagAnswerService.class);
    static final String NO_RESULTS_MESSAGE =
            "No relevant records were found in the projects you can access for this question.";
    static final String INSUFFICIENT_EVIDENCE_MESSAGE =
            "There is not enough verified evidence to answer this question: no experiment measurement backed by "
                    + "a source excerpt was found for it. Try naming the metric or experiment you are interested in.";

    private final QueryAnalyzer queryAnalyzer;
    private final HybridRetriever hybridRetriever;
    private final EvidenceGraphBuilder evidenceGraphBuilder;
    private final CriticalDocumentSelector criticalDocumentSelector;
    private final CitationPlanner citationPlanner;
    private final PromptBuilder promptBuilder;
    private final GenerationService generationService;
    private final NumericGroundingVerifier groundingVerifier;
    private final UngroundedValueRedactor redactor;
    private final AnswerAssembler answerAssembler;
    private final AnswerProperties answerProperties;
    private final GroundingProperties groundingProperties;
    private final ReasoningTracer reasoningTracer;

    public RagAnswerService(QueryAnalyzer queryAnalyzer,
                            HybridRetriever hybridRetriever,
                            EvidenceGraphBuilder evidenceGraphBuilder,
                            CriticalDocumentSelector criticalDocumentSelector,
                            CitationPlanner citationPlanner,
                            PromptBuilder promptBuilder,
                            GenerationService generationService,
                            NumericGroundingVerifier groundingVerifier,
                            UngroundedValueRedactor redactor,
                            AnswerAssembler answerAssembler,
                            AnswerProperties answerProperties,
                            GroundingProperties groundingProperties,
                            ReasoningTracer reasoningTracer) {
        this.queryAnalyzer = queryAnalyzer;
        this.hybridRetriever = hybridRetriever;
        this.evidenceGraphBuilder = evidenceGraphBuilder;
        this.criticalDocumentSelector = criticalDocumentSelector;
        this.citationPlanner = citationPlanner;
        this.promptBuilder = promptBuilder;
        this.generationService = generationService;
        this.groundingVerifier = groundingVerifier;
        this.redactor = redactor;
        this.answerAssembler = answerAssembler;
        this.answerProperties = answerProperties;
        this.groundingProperties = groundingProperties;
        this.reasoningTracer = reasoningTracer;
    }

    public AnswerResult answer(AnswerQuery query) {
        long start = System.currentTimeMillis();
        String text = query.text() == null ? "" : query.text().trim();
        ReasoningTrace trace = this.reasoningTracer.startTrace(LogSanitizer.querySummary(text),
                query.authorizedProjectIds().size());
        String traceId = trace != null ? trace.getTraceId() : null;
        Stages stages = new Stages();
        try {
            AnswerResult result = run(query, text, start, traceId, stages);
            long latency = result.latencyMs();
            log.info("Answered query {}: outcome={}, verified={}, citations={}, {}ms",
                    LogSanitizer.querySummary(text), result.outcome(), result.verified(), result.citations().size(), latency);
            return result;
        } catch (RagException e) {
            e.atStage(stages.current);
            this.reasoningTracer.markFailed(e.getStage(), e.getKind().name());
            log.warn("Query {} failed at stage {}: {}", LogSanitizer.querySummary(text), e.getStage(), e.getKind());
            throw e;
        } catch (RuntimeException e) {
            this.reasoningTracer.markFailed(stages.current, e.getClass().getSimpleName());
            log.error("Query {} failed unexpectedly at stage {}", LogSanitizer.querySummary(text), stages.current, e);
            throw new RagException(ErrorKind.INTERNAL, "The answer could not be produced", stages.current, e);
        } finally {
            this.reasoningTracer.endTrace();
        }
    }

    private AnswerResult run(AnswerQuery query, String text, long start, String traceId, Stages stages) {
        stages.enter("validation");
        ProjectScope scope = validate(query, text);
        List<ConversationTurn> history = recentHistory(query.history());

        stages.enter("query_analysis");
        QueryAnalysis analysis = this.queryAnalyzer.analyze(text, history);
        QueryIntent intent = analysis.intent();
        List<String> diagnostics = new ArrayList<>(analysis.notes());

        stages.enter("retrieval");
        List<Chunk> chunks;
        if (!query.chunkIds().isEmpty()) {
            chunks = this.hybridRetriever.loadSelected(query.chunkIds(), scope);
            diagnostics.add(chunks.size() + " of " + query.chunkIds().size() + " selected chunks loaded");
        } else {
            RetrievalResult retrieval = this.hybridRetriever.retrieve(text, scope,
                    this.answerProperties.chunkBudgetFor(intent.tier()));
            chunks = retrieval.chunks();
            diagnostics.addAll(retrieval.diagnostics());
        }

        stages.enter("evidence_graph");
        EvidenceGraph graph;
        List<String> projectIds = List.copyOf(scope.projectIds());
        if (intent.evidenceMode() == EvidenceMode.FULL) {
            graph = this.evidenceGraphBuilder.build(new EvidenceRequest(text, analysis.targetMetrics(),
                    analysis.metricNames(), scope, chunks));
            diagnostics.addAll(graph.diagnostics());
        } else {
            graph = EvidenceGraph.empty(text, projectIds, "evidence graph not built for a chunk-only query");
        }

        if (intent.evidenceMode() == EvidenceMode.FULL && graph.isEmpty()) {
            AnswerOutcome outcome = chunks.isEmpty() ? AnswerOutcome.NO_RESULTS : AnswerOutcome.INSUFFICIENT_EVIDENCE;
            log.info("Failing closed for query {}: {}", LogSanitizer.querySummary(text), outcome);
            return this.answerAssembler.failClosed(outcome == AnswerOutcome.NO_RESULTS ? NO_RESULTS_MESSAGE
                    : INSUFFICIENT_EVIDENCE_MESSAGE, outcome, intent, diagnostics, elapsed(start), traceId);
        }
        if (chunks.isEmpty() && graph.isEmpty()) {
            return this.answerAssembler.failClosed(NO_RESULTS_MESSAGE, AnswerOutcome.NO_RESULTS, intent, diagnostics,
                    elapsed(start), traceId);
        }

        stages.enter("document_selection");
        List<CriticalDocument> criticalDocuments = intent.evidenceMode() == EvidenceMode.FULL
                ? this.criticalDocumentSelector.select(graph)
                : List.of();
        List<Citation> citations = this.citationPlanner.plan(chunks, criticalDocuments, graph);
        List<String> evidenceTexts = citations.stream().map(Citation::text).toList();

        stages.enter("prompt_assembly");
        long promptStart = System.currentTimeMillis();
        GenerationPrompt prompt = this.promptBuilder.build(text, intent, citations, graph, history);
        this.reasoningTracer.addStep(StepType.PROMPT_ASSEMBLY, "Prompt assembly",
                citations.size() + " sources, maxTokens " + prompt.maxTokens(), System.currentTimeMillis() - promptStart);

        stages.enter("generation");
        String draft = this.generationService.generate(prompt);

        stages.enter("verification");
        VerificationResult verification = this.groundingVerifier.verify(draft, graph, evidenceTexts, intent);
        AnswerOutcome outcome = AnswerOutcome.ANSWERED;
        if (!verification.verified()) {
            String lastDraft = draft;
            VerificationResult lastVerification = verification;
            if (this.groundingProperties.isRegenerationEnabled()) {
                stages.enter("regeneration");
                GenerationPrompt constrained = this.promptBuilder.buildConstrained(text, intent, citations, graph,
                        history, NumericGroundingVerifier.groundedValues(graph), verification.ungroundedValues());
                try {
                    String retry = this.generationService.generate(constrained, StepType.REGENERATION);
                    VerificationResult retryVerification = this.groundingVerifier.verify(retry, graph, evidenceTexts, intent);
                    if (retryVerification.verified()) {
                        draft = retry;
                        verification = retryVerification;
                        diagnostics.add("answer regenerated after a numeric grounding failure");
                    } else {
                        lastDraft = retry;
                        lastVerification = retryVerification;
                    }
                } catch (GenerationServiceException e) {
                    log.warn("Regeneration failed ({}); degrading the first draft", e.getKind());
                    diagnostics.add("regeneration failed: " + e.getKind());
                }
            }
            if (!verification.verified()) {
                draft = this.redactor.redact(lastDraft, lastVerification.ungroundedValues());
                verification = lastVerification;
                outcome = AnswerOutcome.DEGRADED;
                log.warn("Returning degraded answer for query {}: {} values withheld", LogSanitizer.querySummary(text),
                        lastVerification.ungroundedValues().size());
            }
        }

        stages.enter("assembly");
        return this.answerAssembler.assemble(draft, citations, verification, outcome, intent, criticalDocuments,
                diagnostics, elapsed(start), traceId);
    }

    ProjectScope validate(AnswerQuery query, String text) {
        if (text.length() < this.answerProperties.getMinQueryLength()) {
            throw new InvalidQueryException("Query is too short: minimum " + this.answerProperties.getMinQueryLength()
                    + " characters");
        }
        Set<String> authorized = query.authorizedProjectIds();
        if (authorized.isEmpty()) {
            throw new AuthorizationException("No accessible projects");
        }
        if (query.projectScope().isEmpty()) {
            return new ProjectScope(authorized);
        }
        for (String projectId : query.projectScope()) {
            if (!authorized.contains(projectId)) {
                log.warn("Rejected scope outside the authorized projects: {}", LogSanitizer.sanitize(projectId));
                throw new AuthorizationException("Requested project is not accessible");
            }
        }
        return new ProjectScope(query.projectScope());
    }

    List<ConversationTurn> recentHistory(List<ConversationTurn> history) {
        List<ConversationTurn> dialogue = history.stream().filter(ConversationTurn::isDialogue).toList();
        int window = this.answerProperties.getHistoryWindow();
        return dialogue.size() <= window ? dialogue : dialogue.subList(dialogue.size() - window, dialogue.size());
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }

    private static final class Stages {
        private String current = "validation";

        void enter(String stage) {
            if (Thread.currentThread().isInterrupted()) {
                throw new QueryCancelledException(stage);
            }
            this.current = stage;
        }
    }
}
