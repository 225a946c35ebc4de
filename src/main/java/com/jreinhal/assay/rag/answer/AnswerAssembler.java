package com.jreinhal.assay.rag.answer;

import com.jreinhal.assay.exception.GroundingFailedException;
import com.jreinhal.assay.rag.critical.CriticalDocument;
import com.jreinhal.assay.rag.grounding.VerificationResult;
import com.jreinhal.assay.rag.intent.QueryIntent;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a generated answer into the response payload. Citation markers that do not point at a
 * planned source are removed, so every remaining {@code [n]} maps to exactly one citation.
 */
@Component
public class AnswerAssembler {
    private static final Logger log = LoggerFactory.getLogger(AnswerAssembler.class);
    static final int EXCERPT_CHARS = 200;
    private static final Pattern MARKER = Pattern.compile("( ?)\\[(\\d+(?:\\s*,\\s*\\d+)*)\\]");

    private final ReasoningTracer reasoningTracer;

    public AnswerAssembler(ReasoningTracer reasoningTracer) {
        this.reasoningTracer = reasoningTracer;
    }

    /**
     * @throws GroundingFailedException when an answer that failed verification is about to be
     *                                  returned as {@link AnswerOutcome#ANSWERED}
     */
    public AnswerResult assemble(String answer, List<Citation> citations, VerificationResult verification,
                                 AnswerOutcome outcome, QueryIntent intent, List<CriticalDocument> criticalDocuments,
                                 List<String> diagnostics, long latencyMs, String traceId) {
        if (!verification.verified() && outcome == AnswerOutcome.ANSWERED) {
            throw new GroundingFailedException(verification.issues());
        }
        int[] removed = new int[1];
        String text = stripUnknownMarkers(answer, citations.size(), removed);
        if (removed[0] > 0) {
            log.warn("Removed {} citation markers pointing outside the {} planned sources", removed[0], citations.size());
        }
        int chunksUsed = (int) citations.stream().filter(c -> !CitationPlanner.DOCUMENT_TYPE.equals(c.type())).count();
        this.reasoningTracer.addStep(StepType.ANSWER_ASSEMBLY, "Answer assembly",
                citations.size() + " citations, outcome " + outcome, 0L);
        return new AnswerResult(text, cited(citations), chunksUsed, verification.verified(), verification.issues(),
                outcome, intent, criticalDocuments, diagnostics, latencyMs, traceId);
    }

    /**
     * A response that was decided without generation: no citations, nothing to verify.
     */
    public AnswerResult failClosed(String message, AnswerOutcome outcome, QueryIntent intent, List<String> diagnostics,
                                   long latencyMs, String traceId) {
        this.reasoningTracer.addStep(StepType.FAIL_CLOSED, "Fail closed", outcome.name(), 0L);
        return new AnswerResult(message, List.of(), 0, true, List.of(), outcome, intent, List.of(), diagnostics,
                latencyMs, traceId);
    }

    static String stripUnknownMarkers(String text, int citationCount, int[] removed) {
        if (text == null) {
            return "";
        }
        Matcher matcher = MARKER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            if (isYear(matcher.group(2)) && Integer.parseInt(matcher.group(2)) > citationCount) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            List<String> kept = new ArrayList<>();
            for (String n : matcher.group(2).split("\\s*,\\s*")) {
                if (n.length() <= 6 && Integer.parseInt(n) >= 1 && Integer.parseInt(n) <= citationCount) {
                    kept.add(n);
                } else {
                    removed[0]++;
                }
            }
            String replacement = kept.isEmpty() ? "" : matcher.group(1) + "[" + String.join(", ", kept) + "]";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // "[2024]" in a sentence is a year, not a citation
    private static boolean isYear(String marker) {
        if (marker.length() != 4 || !marker.chars().allMatch(Character::isDigit)) {
            return false;
        }
        int year = Integer.parseInt(marker);
        return year >= 1900 && year <= 2100;
    }

    private static List<CitedSource> cited(List<Citation> citations) {
        return citations.stream()
                .map(c -> new CitedSource(c.number(), c.type(), c.id(), c.title(), c.project(), c.excerpt(EXCERPT_CHARS)))
                .toList();
    }
}
