package com.bko.gateway.api;

import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.generation.GenerationRequest;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record GenerateRequest(
        @NotBlank String prompt,
        @NotBlank @JsonProperty("session_id") String sessionId,
        AgentKind agent,
        @NotBlank String cwd,
        @NotNull String model,
        List<String> images,
        Boolean background
) {

    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(
                sessionId,
                prompt,
                agent != null ? agent : AgentKind.SDK,
                cwd,
                model,
                images,
                Boolean.TRUE.equals(background));
    }
}
