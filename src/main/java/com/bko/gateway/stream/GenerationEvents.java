package com.bko.gateway.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the JSON payloads the gateway itself contributes to a stream. Agent output passes through as-is.
 */
@Component
public class GenerationEvents {

    public static final String DONE = "{\"done\":true}";

    private final ObjectMapper objectMapper;

    public GenerationEvents(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isDone(String payload) {
        return DONE.equals(payload);
    }

    public String done() {
        return DONE;
    }

    public String userMessage(String sessionId, String prompt) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "user");
        message.put("content", prompt);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "user");
        payload.put("session_id", sessionId);
        payload.put("message", message);
        return write(payload);
    }

    public String cliInit(Path sessionFile, String agentSessionId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "init");
        payload.put("session_file_path", sessionFile.toString());
        payload.put("session_id", agentSessionId);
        return write(payload);
    }

    public String sdkInit(String conversationId, String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "system");
        payload.put("subtype", "init");
        payload.put("session_id", conversationId);
        payload.put("model", model);
        return write(payload);
    }

    public String assistantChunk(String conversationId, String chunk) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "assistant");
        payload.put("session_id", conversationId);
        payload.put("content", chunk);
        return write(payload);
    }

    public String result(String conversationId, String content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "result");
        payload.put("session_id", conversationId);
        payload.put("content", content);
        return write(payload);
    }

    public String error(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "error");
        payload.put("error", message == null ? "Unknown error" : message);
        return write(payload);
    }

    private String write(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize stream event", ex);
        }
    }
}
