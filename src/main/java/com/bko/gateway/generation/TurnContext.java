package com.bko.gateway.generation;

import com.bko.gateway.agent.AgentTurn;
import com.bko.gateway.cancel.CancellationToken;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A validated turn that holds the session lock. {@link #release()} gives the lock and the cancellation token back
 * and runs at most once.
 */
final class TurnContext {

    private final GenerationRequest request;
    private final boolean firstTurn;
    @Nullable
    private final String resumeToken;
    private final CancellationToken cancellation;
    private final Runnable releaseAction;
    private final AtomicBoolean released = new AtomicBoolean();

    TurnContext(GenerationRequest request, boolean firstTurn, @Nullable String resumeToken,
                CancellationToken cancellation, Runnable releaseAction) {
        this.request = request;
        this.firstTurn = firstTurn;
        this.resumeToken = resumeToken;
        this.cancellation = cancellation;
        this.releaseAction = releaseAction;
    }

    GenerationRequest request() {
        return request;
    }

    String sessionId() {
        return request.sessionId();
    }

    boolean firstTurn() {
        return firstTurn;
    }

    CancellationToken cancellation() {
        return cancellation;
    }

    AgentTurn toAgentTurn(Consumer<String> internalSessionIdListener) {
        return new AgentTurn(
                request.sessionId(),
                request.prompt(),
                Path.of(request.cwd()),
                request.model(),
                resumeToken,
                request.images().stream().map(Path::of).toList(),
                cancellation,
                internalSessionIdListener);
    }

    boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        releaseAction.run();
        return true;
    }
}
