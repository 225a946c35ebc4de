package com.jreinhal.assay.rag.answer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.exception.ErrorKind;
import com.jreinhal.assay.exception.RagException;
import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.intent.EvidenceMode;
import com.jreinhal.assay.rag.intent.QueryIntent;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the system and user prompts for a question: the absolute rules, the numbered sources
 * and, when structured evidence is in play, the evidence graph as JSON.
 */
@Component
public class PromptBuilder {
    static final String NOT_ENOUGH_EVIDENCE = "I could not find enough information about this in the available documents.";

    private static final String RULES = """
            You are a research assistant for a materials R&D laboratory. Answer only from the sources and \
            evidence provided below.

            ABSOLUTE RULES (NON-NEGOTIABLE):
            1. Every technical statement MUST carry a citation in the form [1], [2], etc.
            2. If the sources do not contain enough evidence, say: "%s"
            3. NEVER invent data, values, percentages or facts that are not explicitly present in the sources.
            4. If sources conflict, mention both with their citations.
            5. When experiments disagree, prefer the one with the newer evidence_date and say that you did so.
            6. Keep a technical, objective tone. Be concise but complete.
            7. When you notice relationships between different sources, point them out explicitly.
            """.formatted(NOT_ENOUGH_EVIDENCE);

    private static final String EVIDENCE_RULES = """

            STRUCTURED EVIDENCE:
            The JSON below lists experiments, their variants, conditions and measurements, each measurement \
            with the literal source excerpt it was read from. Numeric values in your answer must come from \
            these measurements or from the numbered sources.
            %s
            """;

    private static final String INTERPRETIVE_RULES = """

            This is an interpretive question. Explain what the experiments demonstrate, why the observed \
            effects are plausible given the conditions, and what the trade-offs are. Ground every claim in \
            the measurements above; say so explicitly when the evidence does not support a conclusion.
            """;

    private final ObjectMapper objectMapper;
    private final AnswerProperties properties;

    public PromptBuilder(ObjectMapper objectMapper, AnswerProperties properties) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.properties = properties;
    }

    public GenerationPrompt build(String question, QueryIntent intent, List<Citation> citations, EvidenceGraph graph,
                                  List<ConversationTurn> history) {
        return new GenerationPrompt(systemPrompt(intent, citations, graph, null), userPrompt(question, citations),
                history, this.properties.maxTokensFor(intent.tier()));
    }

    /**
     * Prompt for the single regeneration after a grounding failure: the generator is told which
     * values are allowed and which ones it must not repeat.
     */
    public GenerationPrompt buildConstrained(String question, QueryIntent intent, List<Citation> citations,
                                             EvidenceGraph graph, List<ConversationTurn> history,
                                             List<String> groundedValues, List<String> rejectedValues) {
        StringBuilder constraint = new StringBuilder("\nNUMERIC CONSTRAINT:\n");
        constraint.append("A previous draft stated numbers that are not in the evidence");
        if (!rejectedValues.isEmpty()) {
            constraint.append(" (").append(String.join(", ", rejectedValues)).append(')');
        }
        constraint.append(". Use ONLY the following values, exactly as written, or none at all:\n");
        if (groundedValues.isEmpty()) {
            constraint.append("- (no numeric values are available; answer without numbers)\n");
        } else {
            groundedValues.forEach(v -> constraint.append("- ").append(v).append('\n'));
        }
        return new GenerationPrompt(systemPrompt(intent, citations, graph, constraint.toString()),
                userPrompt(question, citations), history, this.properties.maxTokensFor(intent.tier()));
    }

    private String systemPrompt(QueryIntent intent, List<Citation> citations, EvidenceGraph graph, String constraint) {
        StringBuilder prompt = new StringBuilder(RULES);
        if (intent.evidenceMode() == EvidenceMode.FULL && graph != null && !graph.isEmpty()) {
            prompt.append(EVIDENCE_RULES.formatted(toJson(graph)));
            if (intent.interpretiveDeepReasoning()) {
                prompt.append(INTERPRETIVE_RULES);
            }
        }
        if (constraint != null) {
            prompt.append(constraint);
        }
        prompt.append("\nAVAILABLE SOURCES:\n");
        prompt.append(citations.stream().map(PromptBuilder::formatSource).collect(Collectors.joining("\n\n---\n\n")));
        return prompt.toString();
    }

    private static String userPrompt(String question, List<Citation> citations) {
        StringBuilder prompt = new StringBuilder("QUESTION:\n").append(question).append("\n\n");
        prompt.append("Answer in the language of the question, using exactly this format:\n\n");
        prompt.append("## Synthesis\n");
        prompt.append("[Consolidated, objective answer with a citation [n] for every technical statement]\n\n");
        prompt.append("## Evidence Used\n");
        for (Citation citation : citations) {
            prompt.append("- ").append(citation.marker()).append(" {short description of the evidence}\n");
        }
        prompt.append("\n## Gaps Identified\n");
        prompt.append("[What is missing or needs further investigation. If everything was answered, write "
                + "\"No gaps identified for this query.\"]");
        return prompt.toString();
    }

    private static String formatSource(Citation citation) {
        StringBuilder source = new StringBuilder(citation.marker()).append(" Source: ").append(citation.type());
        source.append(" - \"").append(citation.title() != null ? citation.title() : citation.id()).append('"');
        if (citation.project() != null) {
            source.append(" | Project: ").append(citation.project());
        }
        return source.append('\n').append(citation.text()).toString();
    }

    private String toJson(EvidenceGraph graph) {
        try {
            return this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new RagException(ErrorKind.INTERNAL, "Evidence could not be prepared for generation",
                    "prompt_assembly", e);
        }
    }
}
