package com.bko.gateway.generation;

import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.GenerationEvents;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;

/**
 * A foreground turn that already holds its session lock. {@link #run(EventSink)} streams the turn and always ends
 * with exactly one completion sentinel; the lock is released when it returns, or by {@link #close()} if the turn
 * never runs.
 */
@Slf4j
public final class ForegroundGeneration implements AutoCloseable {

    private final TurnContext turn;
    private final TurnExecutor executor;
    private final GenerationEvents events;

    ForegroundGeneration(TurnContext turn, TurnExecutor executor, GenerationEvents events) {
        this.turn = turn;
        this.executor = executor;
        this.events = events;
    }

    public String sessionId() {
        return turn.sessionId();
    }

    public void run(EventSink sink) {
        EventSink guarded = payload -> {
            if (!turn.cancellation().isCancelled()) {
                sink.emit(payload);
            }
        };
        try {
            executor.execute(turn, guarded);
        } catch (CancellationException ex) {
            log.debug("Foreground turn for session {} cancelled", turn.sessionId());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (Exception ex) {
            if (!turn.cancellation().isCancelled()) {
                log.error("Foreground turn for session {} failed", turn.sessionId(), ex);
                guarded.emit(events.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
            }
        } finally {
            try {
                sink.emit(events.done());
            } finally {
                close();
            }
        }
    }

    /**
     * Stops the turn, for example because the caller went away.
     */
    public void cancel() {
        turn.cancellation().cancel();
    }

    public boolean isCancelled() {
        return turn.cancellation().isCancelled();
    }

    @Override
    public void close() {
        turn.release();
    }

    @FunctionalInterface
    interface TurnExecutor {
        void execute(TurnContext turn, EventSink sink) throws Exception;
    }
}
