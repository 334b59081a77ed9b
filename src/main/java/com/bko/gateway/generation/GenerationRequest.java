package com.bko.gateway.generation;

import com.bko.gateway.agent.AgentKind;

import java.util.List;

/**
 * One turn as requested by a caller. Checked by {@link GenerationOrchestrator} before anything else happens.
 *
 * @param background run as a job the caller polls or streams instead of streaming directly
 */
public record GenerationRequest(
        String sessionId,
        String prompt,
        AgentKind agent,
        String cwd,
        String model,
        List<String> images,
        boolean background
) {

    public GenerationRequest {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
