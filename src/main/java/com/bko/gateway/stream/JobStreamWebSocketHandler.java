package com.bko.gateway.stream;

import com.bko.gateway.generation.GenerationOrchestrator;
import com.bko.gateway.jobs.JobNotFoundException;
import com.bko.gateway.jobs.JobSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Streams a job over a WebSocket: {@code /ws/jobs?taskId=...&since=N}. One text frame per event, replay first.
 */
@Component
public class JobStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(JobStreamWebSocketHandler.class);
    private static final String SUBSCRIPTION_ATTRIBUTE = "jobSubscription";

    private final GenerationOrchestrator orchestrator;
    private final Executor streamExecutor;

    public JobStreamWebSocketHandler(GenerationOrchestrator orchestrator,
                                     @Qualifier("streamExecutor") Executor streamExecutor) {
        this.orchestrator = orchestrator;
        this.streamExecutor = streamExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        Map<String, String> queryParams = parseQueryParams(uri.getQuery());
        String taskId = queryParams.get("taskId");
        if (taskId == null || taskId.isBlank()) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        long since = parseLong(queryParams.get("since"), 0L);
        JobSubscription subscription;
        try {
            subscription = orchestrator.streamJob(taskId, since);
        } catch (JobNotFoundException ex) {
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Job not found"));
            return;
        }
        session.getAttributes().put(SUBSCRIPTION_ATTRIBUTE, subscription);
        streamExecutor.execute(() -> pump(session, subscription));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // server push only
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object subscription = session.getAttributes().remove(SUBSCRIPTION_ATTRIBUTE);
        if (subscription instanceof JobSubscription jobSubscription) {
            jobSubscription.close();
        }
    }

    private void pump(WebSocketSession session, JobSubscription subscription) {
        try (subscription) {
            subscription.drainTo(payload -> send(session, payload));
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (IOException | UncheckedIOException ex) {
            log.debug("Job stream {} ended early: {}", subscription.taskId(), ex.getMessage());
        }
    }

    private void send(WebSocketSession session, String payload) {
        if (!session.isOpen()) {
            return;
        }
        try {
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isBlank()) {
            return params;
        }
        String[] pairs = query.split("&");
        for (String pair : pairs) {
            int idx = pair.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
            String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
            params.put(key, value);
        }
        return params;
    }

    private long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return fallback;
        }
    }
}
