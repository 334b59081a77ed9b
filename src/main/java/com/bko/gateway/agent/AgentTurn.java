package com.bko.gateway.agent;

import com.bko.gateway.cancel.CancellationToken;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Everything a backend needs to run one turn.
 *
 * @param resumeToken the agent's own id for the conversation, {@code null} on a first turn
 * @param internalSessionIdListener notified when the agent announces the id to resume with next time
 */
public record AgentTurn(
        String sessionId,
        String prompt,
        Path cwd,
        String model,
        @Nullable String resumeToken,
        List<Path> images,
        CancellationToken cancellation,
        Consumer<String> internalSessionIdListener
) {

    public AgentTurn {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public boolean isResume() {
        return resumeToken != null && !resumeToken.isBlank();
    }
}
