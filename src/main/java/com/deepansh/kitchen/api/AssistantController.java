package com.deepansh.kitchen.api;

import com.deepansh.kitchen.agent.AgentRegistry;
import com.deepansh.kitchen.config.OrchestrationProperties;
import com.deepansh.kitchen.core.AssistantService;
import com.deepansh.kitchen.core.CancellationSignal;
import com.deepansh.kitchen.model.Attachment;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.QueryRequest;
import com.deepansh.kitchen.resilience.IdempotencyService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Conversational entry point with idempotency support.
 *
 * POST /api/v1/assistant/query
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, duplicate submissions within 24h return the cached response.
 *
 * The workflow runs off the servlet thread. If the client disconnects or the
 * async request times out, the workflow is cancelled before its next dispatch.
 *
 * GET /api/v1/assistant/health
 */
@RestController
@RequestMapping("/api/v1/assistant")
@Slf4j
public class AssistantController {

    static final Duration ASYNC_GRACE = Duration.ofSeconds(5);

    private final AssistantService assistantService;
    private final IdempotencyService idempotencyService;
    private final AgentRegistry agentRegistry;
    private final ObjectMapper objectMapper;
    private final OrchestrationProperties properties;
    private final Executor queryExecutor;

    public AssistantController(AssistantService assistantService,
                               IdempotencyService idempotencyService,
                               AgentRegistry agentRegistry,
                               ObjectMapper objectMapper,
                               OrchestrationProperties properties,
                               @Qualifier("queryExecutor") Executor queryExecutor) {
        this.assistantService = assistantService;
        this.idempotencyService = idempotencyService;
        this.agentRegistry = agentRegistry;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.queryExecutor = queryExecutor;
    }

    @PostMapping("/query")
    public DeferredResult<ResponseEntity<FinalResponse>> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        log.info("Query request [sessionId={}, idempotencyKey={}]", request.getSessionId(), idempotencyKey);

        CancellationSignal cancellation = new CancellationSignal();
        DeferredResult<ResponseEntity<FinalResponse>> result =
                new DeferredResult<>(properties.getWorkflowDeadline().plus(ASYNC_GRACE).toMillis());
        result.onTimeout(() -> {
            log.warn("Query timed out [sessionId={}], cancelling workflow", request.getSessionId());
            cancellation.cancel();
        });
        result.onError(e -> {
            log.warn("Query aborted [sessionId={}], cancelling workflow: {}", request.getSessionId(), e.toString());
            cancellation.cancel();
        });

        CompletableFuture
                .supplyAsync(() -> handle(request, idempotencyKey, cancellation), queryExecutor)
                .whenComplete((response, error) -> {
                    if (error != null) {
                        result.setErrorResult(error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error);
                    } else {
                        result.setResult(response);
                    }
                });
        return result;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "agents", agentRegistry.agentCount()));
    }

    private ResponseEntity<FinalResponse> handle(QueryRequest request, String idempotencyKey,
                                                 CancellationSignal cancellation) {
        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<FinalResponse> cached = cachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                log.info("Returning cached response for idempotency key={}", idempotencyKey);
                return ResponseEntity.ok(cached.get());
            }
            idempotencyService.claimKey(idempotencyKey);
        }

        FinalResponse response;
        try {
            response = assistantService.submitQuery(request.getText(), request.getSessionId(),
                    toAttachments(request), cancellation);
        } catch (RuntimeException e) {
            // On error, release the key so the client can retry
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            if (cancellation.isCancelled()) {
                // a cut-short answer must not be replayed for the same key
                idempotencyService.releaseKey(idempotencyKey);
            } else {
                storeResponse(idempotencyKey, response);
            }
        }
        return ResponseEntity.ok(response);
    }

    private void storeResponse(String idempotencyKey, FinalResponse response) {
        try {
            idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.warn("Failed to cache idempotency response for key={}", idempotencyKey, e);
            idempotencyService.releaseKey(idempotencyKey);
        }
    }

    private Optional<FinalResponse> cachedResponse(String idempotencyKey) {
        Optional<String> cached = idempotencyService.getCachedResponse(idempotencyKey);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cached.get(), FinalResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cached response for key={}, proceeding fresh", idempotencyKey, e);
            return Optional.empty();
        }
    }

    private List<Attachment> toAttachments(QueryRequest request) {
        if (request.getAttachments() == null) {
            return List.of();
        }
        return request.getAttachments().stream()
                .map(a -> new Attachment(a.getName(), a.getContentType(), a.getUri()))
                .toList();
    }
}
