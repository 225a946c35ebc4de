package com.jreinhal.assay.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Nested
    @DisplayName("Status mapping")
    class StatusMapping {

        @Test
        void authorizationFailureIsForbidden() {
            ResponseEntity<Map<String, Object>> response =
                    handler.handleRag(new AuthorizationException("Requested project is not accessible"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(response.getBody())
                    .containsEntry("error", "AUTHORIZATION")
                    .containsEntry("message", "Requested project is not accessible")
                    .containsEntry("stage", "validation")
                    .containsKey("timestamp");
        }

        @Test
        void generationKindsKeepTheirStatus() {
            assertThat(handler.handleRag(new GenerationServiceException(ErrorKind.GENERATION_RATE_LIMITED,
                    "The answer generator is rate limited", null)).getStatusCode())
                    .isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
            assertThat(handler.handleRag(new GenerationServiceException(ErrorKind.GENERATION_QUOTA_EXHAUSTED,
                    "The answer generator quota is exhausted", null)).getStatusCode())
                    .isEqualTo(HttpStatus.PAYMENT_REQUIRED);
        }

        @ParameterizedTest
        @EnumSource(value = ErrorKind.class, names = {"GENERATION_RATE_LIMITED", "GENERATION_QUOTA_EXHAUSTED",
                "GENERATION_UNAVAILABLE"})
        void generationFailuresAreRetryableByTheCaller(ErrorKind kind) {
            ResponseEntity<Map<String, Object>> response =
                    handler.handleRag(new GenerationServiceException(kind, "The answer generator failed", null));

            assertThat(kind.isRetryable()).isTrue();
            assertThat(response.getBody()).containsEntry("retryable", true).containsEntry("stage", "generation");
        }

        @Test
        void authorizationFailureIsNotRetryable() {
            assertThat(handler.handleRag(new AuthorizationException("Requested project is not accessible")).getBody())
                    .containsEntry("retryable", false);
        }

        @Test
        void groundingFailureIsUnprocessable() {
            ResponseEntity<Map<String, Object>> response =
                    handler.handleRag(new GroundingFailedException(List.of("NUMERIC_GROUNDING_FAILED: 3 values")));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
            assertThat(response.getBody()).containsEntry("stage", "assembly");
        }

        @Test
        void retrievalOutageIsUnavailable() {
            ResponseEntity<Map<String, Object>> response =
                    handler.handleRag(new RetrievalUnavailableException("Chunk search is unavailable", null));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
            assertThat(response.getBody()).containsEntry("error", "RETRIEVAL_UNAVAILABLE");
        }

        @Test
        void unexpectedExceptionIsHidden() {
            ResponseEntity<Map<String, Object>> response =
                    handler.handleUnhandled(new IllegalStateException("connection to mongo-0.internal refused"));

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
            assertThat(response.getBody())
                    .containsEntry("message", "Internal server error")
                    .doesNotContainKey("stage");
        }
    }

    @Nested
    @DisplayName("Message sanitization")
    class Sanitization {

        @ParameterizedTest
        @ValueSource(strings = {
                "Failed to read /etc/assay/application.yml",
                "NullPointerException in handler",
                "java.lang.IllegalStateException: boom",
                "at com.jreinhal.assay.service.RagAnswerService"
        })
        void internalDetailsAreReplaced(String message) {
            assertThat(GlobalExceptionHandler.sanitizeExceptionMessage(message)).isEqualTo("Invalid request");
        }

        @Test
        void longAndBlankMessagesAreReplaced() {
            assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201))).isEqualTo("Invalid request");
            assertThat(GlobalExceptionHandler.sanitizeExceptionMessage(" ")).isEqualTo("Invalid request");
            assertThat(GlobalExceptionHandler.sanitizeExceptionMessage(null)).isEqualTo("Invalid request");
        }

        @Test
        void plainMessagesPassThrough() {
            assertThat(GlobalExceptionHandler.sanitizeExceptionMessage("Query is too short: minimum 5 characters"))
                    .isEqualTo("Query is too short: minimum 5 characters");
        }
    }
}
