package com.jreinhal.assay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.assay.config.AnswerProperties;
import com.jreinhal.assay.exception.ErrorKind;
import com.jreinhal.assay.exception.GenerationServiceException;
import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.rag.answer.GenerationPrompt;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

class GenerationServiceTest {

    private static final GenerationPrompt PROMPT = new GenerationPrompt("system rules", "QUESTION:\nq",
            List.of(new ConversationTurn(ConversationTurn.USER, "earlier question"),
                    new ConversationTurn(ConversationTurn.ASSISTANT, "earlier answer")), 1200);

    private ChatClient chatClient;
    private AnswerProperties properties;
    private ExecutorService executor;
    private GenerationService service;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, Answers.RETURNS_DEEP_STUBS);
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);
        properties = new AnswerProperties();
        executor = Executors.newSingleThreadExecutor();
        service = new GenerationService(builder, executor, properties, new ReasoningTracer());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        void returnsTrimmedContent() {
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("  ## Synthesis\nok [1]  ");

            assertThat(service.generate(PROMPT)).isEqualTo("## Synthesis\nok [1]");
        }

        @Test
        void sendsTokenBudgetWithThePrompt() {
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("ok");

            service.generate(PROMPT);

            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(chatClient, atLeastOnce()).prompt(captor.capture());
            assertThat(captor.getValue().getOptions().getMaxTokens()).isEqualTo(1200);
            assertThat(captor.getValue().getInstructions()).hasSize(4);
        }

        @Test
        void emptyOutputIsUnavailable() {
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("   ");

            assertThatThrownBy(() -> service.generate(PROMPT))
                    .isInstanceOfSatisfying(GenerationServiceException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.GENERATION_UNAVAILABLE));
        }

        @Test
        void providerRateLimitIsClassified() {
            when(chatClient.prompt(any(Prompt.class)).call().content())
                    .thenThrow(new RuntimeException("429 Too Many Requests"));

            assertThatThrownBy(() -> service.generate(PROMPT))
                    .isInstanceOfSatisfying(GenerationServiceException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.GENERATION_RATE_LIMITED);
                        assertThat(e.getStage()).isEqualTo("generation");
                    });
        }

        @Test
        void slowGeneratorTimesOut() {
            properties.setGenerationTimeoutMs(100);
            when(chatClient.prompt(any(Prompt.class)).call().content()).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return "late";
            });

            assertThatThrownBy(() -> service.generate(PROMPT))
                    .isInstanceOfSatisfying(GenerationServiceException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.GENERATION_UNAVAILABLE);
                        assertThat(e.getMessage()).isEqualTo("The answer generator did not respond in time");
                    });
        }
    }

    @Nested
    @DisplayName("classify")
    class Classify {

        @Test
        void httpStatusInCauseChainWins() {
            RuntimeException wrapped = new RuntimeException("provider call failed",
                    new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));

            assertThat(GenerationService.classify(wrapped).getKind()).isEqualTo(ErrorKind.GENERATION_RATE_LIMITED);
        }

        @Test
        void paymentRequiredIsQuotaExhausted() {
            assertThat(GenerationService.classify(new HttpClientErrorException(HttpStatus.PAYMENT_REQUIRED)).getKind())
                    .isEqualTo(ErrorKind.GENERATION_QUOTA_EXHAUSTED);
        }

        @Test
        void messagesAreMatchedWhenNoStatusIsAvailable() {
            assertThat(GenerationService.classify(new IllegalStateException("Rate limit exceeded")).getKind())
                    .isEqualTo(ErrorKind.GENERATION_RATE_LIMITED);
            assertThat(GenerationService.classify(new IllegalStateException("Insufficient credits on account")).getKind())
                    .isEqualTo(ErrorKind.GENERATION_QUOTA_EXHAUSTED);
            assertThat(GenerationService.classify(new IllegalStateException("Connection refused")).getKind())
                    .isEqualTo(ErrorKind.GENERATION_UNAVAILABLE);
        }

        @Test
        void otherHttpErrorsAreUnavailable() {
            assertThat(GenerationService.classify(new HttpClientErrorException(HttpStatus.BAD_REQUEST)).getKind())
                    .isEqualTo(ErrorKind.GENERATION_UNAVAILABLE);
        }
    }

    @Test
    void historyIsReplayedBetweenSystemAndQuestion() {
        List<Message> messages = GenerationService.messages(new GenerationPrompt("sys", "question",
                List.of(new ConversationTurn(ConversationTurn.USER, "u1"),
                        new ConversationTurn(ConversationTurn.ASSISTANT, "a1"),
                        new ConversationTurn("system", "ignored")), 100));

        assertThat(messages).hasExactlyElementsOfTypes(SystemMessage.class, UserMessage.class, AssistantMessage.class,
                UserMessage.class);
        assertThat(messages.get(3).getText()).isEqualTo("question");
    }
}
