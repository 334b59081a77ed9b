package com.bko.gateway.jobs;

import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.stream.StreamEvent;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A background generation turn. All state transitions and the event log are guarded by the job's monitor,
 * which is also what makes replay and live registration atomic with respect to {@link #append(String)}.
 */
public class Job {

    private final String taskId;
    private final String sessionId;
    private final CancellationToken cancellationToken;
    private final Clock clock;
    private final Instant createdAt;
    private final List<StreamEvent> events = new ArrayList<>();
    private final Set<JobSubscription> subscribers = new LinkedHashSet<>();
    private long sequence;
    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;

    Job(String taskId, String sessionId, CancellationToken cancellationToken, Clock clock) {
        this.taskId = taskId;
        this.sessionId = sessionId;
        this.cancellationToken = cancellationToken;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    public String taskId() {
        return taskId;
    }

    public String sessionId() {
        return sessionId;
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public synchronized JobStatus status() {
        return status;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(taskId, sessionId, status, createdAt, startedAt, finishedAt, error, events.size());
    }

    synchronized boolean markRunning() {
        if (status != JobStatus.QUEUED) {
            return false;
        }
        status = JobStatus.RUNNING;
        startedAt = clock.instant();
        return true;
    }

    /**
     * Appends an event and hands it to every live subscriber.
     *
     * @return the buffered event, or {@code null} once the job has finished.
     */
    @Nullable
    synchronized StreamEvent append(String payload) {
        if (status.isTerminal()) {
            return null;
        }
        StreamEvent event = new StreamEvent(++sequence, clock.instant(), payload);
        events.add(event);
        for (JobSubscription subscriber : subscribers) {
            subscriber.deliver(event);
        }
        return event;
    }

    /**
     * Moves the job to a terminal state. The first caller wins; later outcomes are discarded.
     */
    synchronized boolean finish(JobStatus outcome, @Nullable String errorMessage, String terminalPayload) {
        if (status.isTerminal()) {
            return false;
        }
        append(terminalPayload);
        status = outcome;
        error = errorMessage;
        finishedAt = clock.instant();
        if (startedAt == null) {
            startedAt = finishedAt;
        }
        for (JobSubscription subscriber : subscribers) {
            subscriber.complete();
        }
        subscribers.clear();
        return true;
    }

    synchronized JobSubscription subscribe(long sinceId) {
        List<StreamEvent> replay = events.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
        JobSubscription subscription = new JobSubscription(this, replay);
        if (status.isTerminal()) {
            subscription.complete();
        } else {
            subscribers.add(subscription);
        }
        return subscription;
    }

    synchronized void unsubscribe(JobSubscription subscription) {
        subscribers.remove(subscription);
    }

    synchronized boolean isExpired(Instant cutoff) {
        return status.isTerminal() && subscribers.isEmpty() && finishedAt.isBefore(cutoff);
    }
}
