package com.jreinhal.assay.controller;

import com.jreinhal.assay.dto.AnswerRequest;
import com.jreinhal.assay.dto.AnswerResponse;
import com.jreinhal.assay.rag.answer.AnswerResult;
import com.jreinhal.assay.service.RagAnswerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rag")
@Tag(name = "Answer")
public class AnswerController {
    private static final Logger log = LoggerFactory.getLogger(AnswerController.class);

    private final RagAnswerService ragAnswerService;

    public AnswerController(RagAnswerService ragAnswerService) {
        this.ragAnswerService = ragAnswerService;
    }

    @PostMapping("/answer")
    @Operation(summary = "Answer a question from the caller's projects",
            description = "Retrieves sources, builds structured evidence when the question needs it, generates a cited "
                    + "answer and verifies its numbers against the evidence.")
    @ApiResponse(responseCode = "200", description = "Answered, degraded, or failed closed (see outcome)")
    @ApiResponse(responseCode = "400", description = "Query too short or malformed")
    @ApiResponse(responseCode = "403", description = "Requested scope outside the authorized projects")
    @ApiResponse(responseCode = "402", description = "Generation quota exhausted")
    @ApiResponse(responseCode = "429", description = "Generation rate limited")
    @ApiResponse(responseCode = "503", description = "Retrieval or generation unavailable")
    public ResponseEntity<AnswerResponse> answer(@Valid @RequestBody AnswerRequest request) {
        AnswerResult result = this.ragAnswerService.answer(request.toQuery());
        log.debug("Answer request completed: outcome={}, traceId={}", result.outcome(), result.traceId());
        return ResponseEntity.ok(AnswerResponse.from(result));
    }
}
