package com.bko.gateway.cancel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cooperative cancellation shared by every stage of one generation turn.
 * <p>
 * Cancellation is irreversible. Listeners registered before cancellation run exactly once, on the
 * thread that calls {@link #cancel()}; listeners registered afterwards run immediately on the
 * registering thread.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicLong registrationIds = new AtomicLong();
    private final Map<Long, Runnable> listeners = new LinkedHashMap<>();
    private volatile boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Triggers cancellation.
     *
     * @return {@code true} if this call performed the transition, {@code false} if the token was
     *         already cancelled.
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners.values());
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            runQuietly(listener);
        }
        return true;
    }

    /**
     * Registers a teardown action. The returned registration removes the action if it has not run yet.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                long id = registrationIds.incrementAndGet();
                listeners.put(id, listener);
                return () -> {
                    synchronized (CancellationToken.this) {
                        listeners.remove(id);
                    }
                };
            }
        }
        runQuietly(listener);
        return () -> { };
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Generation cancelled.");
        }
    }

    /**
     * Creates a token that is cancelled together with this one but can also be cancelled on its own.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration registration = onCancel(child::cancel);
        child.onCancel(registration::remove);
        return child;
    }

    private void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException ex) {
            log.warn("Cancellation listener failed: {}", ex.getMessage(), ex);
        }
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
