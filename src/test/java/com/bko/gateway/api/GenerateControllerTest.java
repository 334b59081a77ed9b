package com.bko.gateway.api;

import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.generation.ForegroundGeneration;
import com.bko.gateway.generation.GenerationOrchestrator;
import com.bko.gateway.generation.GenerationRequest;
import com.bko.gateway.generation.InvalidRequestException;
import com.bko.gateway.generation.SessionBusyException;
import com.bko.gateway.jobs.JobNotFoundException;
import com.bko.gateway.jobs.JobSnapshot;
import com.bko.gateway.jobs.JobStatus;
import com.bko.gateway.jobs.JobSubscription;
import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.GenerationEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GenerateController.class)
@Import(GenerateControllerTest.DirectStreamExecutorConfig.class)
class GenerateControllerTest {

    private static final String SESSION_ID = "5b0c8f7e-2d41-4c3a-9f1e-6a7b8c9d0e1f";
    private static final String TASK_ID = "0f4d3c2b-1a09-4876-b543-210fedcba987";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GenerationOrchestrator orchestrator;

    @MockitoBean(name = "sseKeepaliveScheduler")
    private ScheduledExecutorService keepaliveScheduler;

    private final ScheduledFuture<?> keepaliveFuture = mock(ScheduledFuture.class);
    private final AtomicReference<Runnable> keepaliveTask = new AtomicReference<>();

    @TestConfiguration
    @EnableConfigurationProperties(GatewayProperties.class)
    static class DirectStreamExecutorConfig {

        @Bean("streamExecutor")
        Executor streamExecutor() {
            return Runnable::run;
        }
    }

    @BeforeEach
    void stubKeepalive() {
        when(keepaliveScheduler.scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class)))
                .thenAnswer(invocation -> {
                    keepaliveTask.set(invocation.getArgument(0));
                    return keepaliveFuture;
                });
    }

    @Test
    void testForegroundRequestStreamsEvents() throws Exception {
        ForegroundGeneration generation = mock(ForegroundGeneration.class);
        doAnswer(invocation -> {
            EventSink sink = invocation.getArgument(0);
            sink.emit("{\"type\":\"assistant\",\"content\":\"hi\"}");
            sink.emit(GenerationEvents.DONE);
            return null;
        }).when(generation).run(any());
        when(orchestrator.openForeground(any())).thenReturn(generation);

        MvcResult result = mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("codex", false)))
                .andExpect(status().isOk())
                .andReturn();

        String content = result.getResponse().getContentAsString();
        assertTrue(content.contains("data:{\"type\":\"assistant\",\"content\":\"hi\"}"), content);
        assertTrue(content.contains("data:" + GenerationEvents.DONE), content);

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(orchestrator).openForeground(captor.capture());
        assertEquals(AgentKind.CLI, captor.getValue().agent());
        assertEquals(List.of("/tmp/screenshot.png"), captor.getValue().images());
        assertFalse(captor.getValue().background());
    }

    @Test
    void testSilentForegroundStreamSendsKeepaliveUntilDone() throws Exception {
        ForegroundGeneration generation = mock(ForegroundGeneration.class);
        doAnswer(invocation -> {
            EventSink sink = invocation.getArgument(0);
            keepaliveTask.get().run();
            sink.emit(GenerationEvents.DONE);
            return null;
        }).when(generation).run(any());
        when(orchestrator.openForeground(any())).thenReturn(generation);

        MvcResult result = mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("codex", false)))
                .andExpect(status().isOk())
                .andReturn();

        String content = result.getResponse().getContentAsString();
        assertTrue(content.contains(":keepalive"), content);
        assertTrue(content.indexOf(":keepalive") < content.indexOf("data:" + GenerationEvents.DONE), content);
        verify(keepaliveScheduler).scheduleAtFixedRate(any(Runnable.class), eq(30_000L), eq(30_000L),
                eq(TimeUnit.MILLISECONDS));
        verify(keepaliveFuture).cancel(false);
        verify(generation, never()).cancel();
    }

    @Test
    void testKeepaliveToClosedStreamCancelsGeneration() throws Exception {
        ForegroundGeneration generation = mock(ForegroundGeneration.class);
        when(orchestrator.openForeground(any())).thenReturn(generation);
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("codex", false)))
                .andExpect(status().isOk());

        keepaliveTask.get().run();

        verify(generation).cancel();
    }

    @Test
    void testBackgroundRequestIsAccepted() throws Exception {
        when(orchestrator.startBackground(any())).thenReturn(snapshot(JobStatus.QUEUED, null));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("claude-code", true)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value(TASK_ID))
                .andExpect(jsonPath("$.sessionId").value(SESSION_ID))
                .andExpect(jsonPath("$.status").value("queued"));

        verify(orchestrator, never()).openForeground(any());
    }

    @Test
    void testMissingPromptIsRejected() throws Exception {
        String body = """
                {"session_id": "%s", "cwd": "/tmp", "model": "gpt-5"}
                """.formatted(SESSION_ID);

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.details[0]").value(startsWith("prompt")));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testUnknownAgentIsRejected() throws Exception {
        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("gemini", false)))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void testOrchestratorValidationFailureIsBadRequest() throws Exception {
        when(orchestrator.openForeground(any()))
                .thenThrow(new InvalidRequestException(List.of("session_id must be a UUID")));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("codex", false)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("session_id must be a UUID"));
    }

    @Test
    void testBusySessionIsConflict() throws Exception {
        when(orchestrator.startBackground(any())).thenThrow(new SessionBusyException(SESSION_ID));

        mockMvc.perform(post("/api/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("codex", true)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Session busy"));
    }

    @Test
    void testJobStatus() throws Exception {
        when(orchestrator.getJobStatus(TASK_ID)).thenReturn(snapshot(JobStatus.FAILED, "codex exited with code 1"));

        mockMvc.perform(get("/api/generate/jobs/{taskId}", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("codex exited with code 1"))
                .andExpect(jsonPath("$.eventCount").value(2));
    }

    @Test
    void testUnknownJobIsNotFound() throws Exception {
        when(orchestrator.getJobStatus("missing")).thenThrow(new JobNotFoundException("missing"));
        when(orchestrator.streamJob("missing", 0L)).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/api/generate/jobs/{taskId}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Job not found: missing"));
        mockMvc.perform(get("/api/generate/jobs/{taskId}/stream", "missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testStreamJobReplaysFromOffset() throws Exception {
        JobSubscription subscription = mock(JobSubscription.class);
        doAnswer(invocation -> {
            EventSink sink = invocation.getArgument(0);
            sink.emit("{\"n\":3}");
            sink.emit(GenerationEvents.DONE);
            return null;
        }).when(subscription).drainTo(any());
        when(orchestrator.streamJob(TASK_ID, 2L)).thenReturn(subscription);

        MvcResult result = mockMvc.perform(get("/api/generate/jobs/{taskId}/stream", TASK_ID).param("since", "2"))
                .andExpect(status().isOk())
                .andReturn();

        String content = result.getResponse().getContentAsString();
        assertTrue(content.contains("data:{\"n\":3}"), content);
        assertTrue(content.contains("data:" + GenerationEvents.DONE), content);
        verify(subscription, atLeastOnce()).close();
    }

    @Test
    void testCancelJob() throws Exception {
        when(orchestrator.cancelJob(TASK_ID)).thenReturn(true, false);

        mockMvc.perform(post("/api/generate/jobs/{taskId}/cancel", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
        mockMvc.perform(post("/api/generate/jobs/{taskId}/cancel", TASK_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("finished"));
    }

    @Test
    void testStopGeneration() throws Exception {
        when(orchestrator.stopGeneration(SESSION_ID)).thenReturn(true);

        mockMvc.perform(delete("/api/generate/{sessionId}/stop", SESSION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stopped").value(true))
                .andExpect(jsonPath("$.sessionId").value(SESSION_ID));
        mockMvc.perform(delete("/api/generate/{sessionId}/stop", "idle-session"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.stopped").value(false));
    }

    private String body(String agent, boolean background) {
        return """
                {
                  "prompt": "add a retry to the uploader",
                  "session_id": "%s",
                  "agent": "%s",
                  "cwd": "/tmp",
                  "model": "gpt-5",
                  "images": ["/tmp/screenshot.png"],
                  "background": %s
                }
                """.formatted(SESSION_ID, agent, background);
    }

    private JobSnapshot snapshot(JobStatus status, String error) {
        Instant now = Instant.now();
        return new JobSnapshot(TASK_ID, SESSION_ID, status, now,
                status == JobStatus.QUEUED ? null : now,
                status.isTerminal() ? now : null,
                error, 2);
    }
}
