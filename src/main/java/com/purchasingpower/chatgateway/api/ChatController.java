package com.purchasingpower.chatgateway.api;

import com.purchasingpower.chatgateway.exception.AllProvidersExhaustedException;
import com.purchasingpower.chatgateway.exception.InvalidChatRequestException;
import com.purchasingpower.chatgateway.exception.RequestCancelledException;
import com.purchasingpower.chatgateway.orchestrator.CompletionOrchestrator;
import com.purchasingpower.chatgateway.orchestrator.Reply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for chat completions.
 *
 * Status codes:
 * - 200 for provider, fallback and moderation replies alike
 * - 400 for malformed requests (nothing is sent to a provider)
 * - 503 when every provider failed and fallback is disabled
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
public class ChatController {

    private final CompletionOrchestrator orchestrator;

    /**
     * POST /api/v1/chat/completions
     */
    @PostMapping("/completions")
    public ResponseEntity<ChatResponse> complete(@RequestBody ChatRequest request) {
        try {
            Reply reply = orchestrator.respond(request.getMessages(), request.toParams());
            return ResponseEntity.ok(ChatResponse.from(reply, request.getMessages()));

        } catch (InvalidChatRequestException e) {
            log.debug("Rejected chat request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .body(ChatResponse.error(e.getMessage()));

        } catch (AllProvidersExhaustedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ChatResponse.error(e.getMessage()));

        } catch (RequestCancelledException e) {
            log.info("Chat request cancelled: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ChatResponse.error("Request cancelled"));

        } catch (Exception e) {
            log.error("Chat completion failed", e);
            return ResponseEntity.internalServerError()
                .body(ChatResponse.error("Internal error: " + e.getMessage()));
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ChatResponse> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable chat request: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ChatResponse.error("Invalid request body"));
    }
}
