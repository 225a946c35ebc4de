package com.jreinhal.assay.service;

import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.exception.ErrorKind;
import com.jreinhal.assay.exception.GenerationServiceException;
import com.jreinhal.assay.exception.QueryCancelledException;
import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.rag.answer.GenerationPrompt;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;

/**
 * The single call to the text generator. Runs on the RAG pool under a deadline and maps every
 * failure onto one of three caller-visible kinds: rate limited (429), quota exhausted (402) or
 * unavailable (everything else, including timeouts and empty output).
 */
@Service
public class GenerationService {
    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);
    private static final Pattern RATE_LIMIT = Pattern.compile("\\b429\\b|rate.?limit|too many requests");
    private static final Pattern QUOTA = Pattern.compile("\\b402\\b|quota|credits|payment required|insufficient.?funds");

    private final ChatClient chatClient;
    private final ExecutorService ragExecutor;
    private final AnswerProperties properties;
    private final ReasoningTracer reasoningTracer;

    @Value("${assay.generation.temperature:0.3}")
    private double temperature = 0.3;

    public GenerationService(ChatClient.Builder chatClientBuilder,
                             @Qualifier("ragExecutor") ExecutorService ragExecutor,
                             AnswerProperties properties,
                             ReasoningTracer reasoningTracer) {
        this.chatClient = chatClientBuilder.build();
        this.ragExecutor = ragExecutor;
        this.properties = properties;
        this.reasoningTracer = reasoningTracer;
    }

    public String generate(GenerationPrompt request) {
        return generate(request, StepType.GENERATION);
    }

    public String generate(GenerationPrompt request, StepType step) {
        long start = System.currentTimeMillis();
        Prompt prompt = new Prompt(messages(request), ChatOptions.builder()
                .maxTokens(request.maxTokens())
                .temperature(this.temperature)
                .build());
        long timeoutMs = this.properties.getGenerationTimeoutMs();
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt(prompt).call().content(), this.ragExecutor);
        } catch (RejectedExecutionException e) {
            throw new GenerationServiceException(ErrorKind.GENERATION_UNAVAILABLE,
                    "The answer generator is busy, try again shortly", e);
        }
        String content;
        try {
            content = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new QueryCancelledException("generation");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation timed out after {}ms", timeoutMs);
            throw new GenerationServiceException(ErrorKind.GENERATION_UNAVAILABLE,
                    "The answer generator did not respond in time", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            GenerationServiceException classified = classify(cause);
            log.warn("Generation failed ({}): {}", classified.getKind(), cause.getMessage());
            throw classified;
        }
        if (content == null || content.isBlank()) {
            throw new GenerationServiceException(ErrorKind.GENERATION_UNAVAILABLE,
                    "The answer generator returned an empty response", null);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Generation completed: {} chars, maxTokens={}, {}ms", content.length(), request.maxTokens(), elapsed);
        this.reasoningTracer.addStep(step, step == StepType.REGENERATION ? "Constrained regeneration" : "Generation",
                content.length() + " chars", elapsed, Map.of("maxTokens", request.maxTokens()));
        return content.trim();
    }

    static List<Message> messages(GenerationPrompt request) {
        List<Message> messages = new ArrayList<>(request.history().size() + 2);
        messages.add(new SystemMessage(request.systemPrompt()));
        for (ConversationTurn turn : request.history()) {
            if (ConversationTurn.USER.equals(turn.role())) {
                messages.add(new UserMessage(turn.content()));
            } else if (ConversationTurn.ASSISTANT.equals(turn.role())) {
                messages.add(new AssistantMessage(turn.content()));
            }
        }
        messages.add(new UserMessage(request.userPrompt()));
        return messages;
    }

    /**
     * Walks the cause chain for an HTTP status first, then falls back to the error text.
     */
    static GenerationServiceException classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof HttpStatusCodeException http) {
                int status = http.getStatusCode().value();
                if (status == 429) {
                    return rateLimited(error);
                }
                if (status == 402) {
                    return quotaExhausted(error);
                }
            }
        }
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t.getMessage() != null) {
                text.append(t.getMessage()).append(' ');
            }
        }
        String message = text.toString().toLowerCase(Locale.ROOT);
        if (RATE_LIMIT.matcher(message).find()) {
            return rateLimited(error);
        }
        if (QUOTA.matcher(message).find()) {
            return quotaExhausted(error);
        }
        return new GenerationServiceException(ErrorKind.GENERATION_UNAVAILABLE,
                "The answer generator is unavailable, try again later", error);
    }

    private static GenerationServiceException rateLimited(Throwable cause) {
        return new GenerationServiceException(ErrorKind.GENERATION_RATE_LIMITED,
                "Rate limit reached on the answer generator, try again in a moment", cause);
    }

    private static GenerationServiceException quotaExhausted(Throwable cause) {
        return new GenerationServiceException(ErrorKind.GENERATION_QUOTA_EXHAUSTED,
                "Generation credits are exhausted, add credits to continue", cause);
    }
}
