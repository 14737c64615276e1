package com.deepansh.kitchen.api;

import com.deepansh.kitchen.agent.AgentRegistry;
import com.deepansh.kitchen.config.OrchestrationProperties;
import com.deepansh.kitchen.core.AssistantService;
import com.deepansh.kitchen.core.CancellationSignal;
import com.deepansh.kitchen.model.FinalResponse;
import com.deepansh.kitchen.model.QueryRequest;
import com.deepansh.kitchen.model.WorkflowStatus;
import com.deepansh.kitchen.resilience.IdempotencyService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.request.async.DeferredResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import org.springframework.test.web.servlet.result.MockMvcResultMatchers;

@ExtendWith(MockitoExtension.class)
class AssistantControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock AssistantService assistantService;
    @Mock IdempotencyService idempotencyService;

    AssistantController controller;

    @BeforeEach
    void setUp() {
        controller = controllerOn(Runnable::run);
    }

    @Test
    void query_withoutIdempotencyKey_runsFresh() {
        when(assistantService.submitQuery(eq("Dal recipe"), eq("s1"), anyList(), any())).thenReturn(done());

        ResponseEntity<FinalResponse> response = resultOf(controller.query(request(), null));

        assertThat(response.getBody().getStatus()).isEqualTo(WorkflowStatus.DONE);
        verifyNoInteractions(idempotencyService);
    }

    @Test
    void query_cachedKey_returnsCachedResponseWithoutRunning() throws Exception {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.of(objectMapper.writeValueAsString(done())));

        ResponseEntity<FinalResponse> response = resultOf(controller.query(request(), "k1"));

        assertThat(response.getBody().getRequestId()).isEqualTo("req-1");
        verifyNoInteractions(assistantService);
    }

    @Test
    void query_newKey_claimsRunsAndStores() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(assistantService.submitQuery(anyString(), anyString(), anyList(), any())).thenReturn(done());

        resultOf(controller.query(request(), "k1"));

        verify(idempotencyService).claimKey("k1");
        verify(idempotencyService).storeResponse(eq("k1"), contains("req-1"));
    }

    @Test
    void query_failure_releasesKeyAndReportsError() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(assistantService.submitQuery(anyString(), anyString(), anyList(), any()))
                .thenThrow(new IllegalStateException("boom"));

        DeferredResult<ResponseEntity<FinalResponse>> result = controller.query(request(), "k1");

        assertThat(result.getResult()).isInstanceOf(IllegalStateException.class);
        verify(idempotencyService).releaseKey("k1");
        verify(idempotencyService, never()).storeResponse(anyString(), anyString());
    }

    @Test
    void query_cancelledWhileRunning_releasesKeyInsteadOfCaching() {
        when(idempotencyService.getCachedResponse("k1")).thenReturn(Optional.empty());
        when(assistantService.submitQuery(anyString(), anyString(), anyList(), any())).thenAnswer(inv -> {
            CancellationSignal cancellation = inv.getArgument(3);
            cancellation.cancel();
            return done();
        });

        resultOf(controller.query(request(), "k1"));

        verify(idempotencyService).releaseKey("k1");
        verify(idempotencyService, never()).storeResponse(anyString(), anyString());
    }

    @Test
    void query_clientDisconnects_cancelsTheWorkflow() throws Exception {
        List<Runnable> queued = new ArrayList<>();
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(controllerOn(queued::add)).build();

        MvcResult mvcResult = mockMvc.perform(post("/api/v1/assistant/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Dal recipe\", \"sessionId\": \"s1\"}"))
                .andExpect(MockMvcResultMatchers.request().asyncStarted())
                .andReturn();

        MockAsyncContext asyncContext = (MockAsyncContext) mvcResult.getRequest().getAsyncContext();
        for (AsyncListener listener : new ArrayList<>(asyncContext.getListeners())) {
            listener.onError(new AsyncEvent(asyncContext, new IOException("Broken pipe")));
        }

        when(assistantService.submitQuery(anyString(), anyString(), anyList(), any())).thenReturn(done());
        queued.forEach(Runnable::run);

        ArgumentCaptor<CancellationSignal> cancellation = ArgumentCaptor.forClass(CancellationSignal.class);
        verify(assistantService).submitQuery(eq("Dal recipe"), eq("s1"), anyList(), cancellation.capture());
        assertThat(cancellation.getValue().isCancelled()).isTrue();
    }

    @Test
    void health_reportsRegisteredAgentCount() {
        assertThat(controller.health().getBody()).containsEntry("status", "UP").containsEntry("agents", 0);
    }

    private AssistantController controllerOn(Executor executor) {
        return new AssistantController(assistantService, idempotencyService,
                new AgentRegistry(List.of()), objectMapper, new OrchestrationProperties(), executor);
    }

    @SuppressWarnings("unchecked")
    private static ResponseEntity<FinalResponse> resultOf(DeferredResult<ResponseEntity<FinalResponse>> result) {
        assertThat(result.hasResult()).isTrue();
        return (ResponseEntity<FinalResponse>) result.getResult();
    }

    private static QueryRequest request() {
        QueryRequest request = new QueryRequest();
        request.setText("Dal recipe");
        request.setSessionId("s1");
        return request;
    }

    private static FinalResponse done() {
        return FinalResponse.builder().requestId("req-1").sessionId("s1").status(WorkflowStatus.DONE).build();
    }
}
