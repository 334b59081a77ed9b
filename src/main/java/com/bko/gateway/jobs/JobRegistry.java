package com.bko.gateway.jobs;

import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.stream.GenerationEvents;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process registry of background generation jobs.
 * <p>
 * Finished jobs stay available for replay until they have been unobserved for the configured retention.
 */
@Component
@Slf4j
public class JobRegistry {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Executor executor;
    private final GenerationEvents events;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public JobRegistry(@Qualifier("jobExecutor") Executor executor,
                       GenerationEvents events,
                       GatewayProperties properties) {
        this(executor, events, properties.getJobs().getRetention(), Clock.systemUTC());
    }

    JobRegistry(Executor executor, GenerationEvents events, Duration retention, Clock clock) {
        this.executor = executor;
        this.events = events;
        this.retention = retention;
        this.clock = clock;
    }

    public Job createJob(String sessionId) {
        return createJob(sessionId, new CancellationToken());
    }

    public Job createJob(String sessionId, CancellationToken cancellationToken) {
        evictExpired();
        String taskId = UUID.randomUUID().toString();
        Job job = new Job(taskId, sessionId, cancellationToken, clock);
        jobs.put(taskId, job);
        log.debug("Created job {} for session {}", taskId, sessionId);
        return job;
    }

    /**
     * Schedules {@code work} without blocking the caller. The job always ends in a terminal state with the
     * completion sentinel as its last event.
     *
     * @throws RejectedExecutionException if the executor refuses the work; the job is marked failed first.
     */
    public void dispatch(Job job, JobWork work) {
        try {
            executor.execute(() -> run(job, work));
        } catch (RejectedExecutionException ex) {
            job.finish(JobStatus.FAILED, "Job could not be scheduled.", events.done());
            throw ex;
        }
    }

    public boolean emit(Job job, String payload) {
        return job.append(payload) != null;
    }

    public JobSubscription subscribe(Job job, long sinceId) {
        return job.subscribe(sinceId);
    }

    public JobSubscription subscribe(String taskId, long sinceId) {
        return subscribe(get(taskId), sinceId);
    }

    public Optional<Job> find(String taskId) {
        return Optional.ofNullable(jobs.get(taskId));
    }

    public Job get(String taskId) {
        Job job = jobs.get(taskId);
        if (job == null) {
            throw new JobNotFoundException(taskId);
        }
        return job;
    }

    public boolean cancel(String taskId) {
        Job job = get(taskId);
        if (job.status().isTerminal()) {
            return false;
        }
        job.cancellationToken().cancel();
        log.info("Cancellation requested for job {}", taskId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        jobs.values().stream()
                .filter(job -> !job.status().isTerminal())
                .forEach(job -> job.cancellationToken().cancel());
    }

    void evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        jobs.values().removeIf(job -> job.isExpired(cutoff));
    }

    int size() {
        return jobs.size();
    }

    private void run(Job job, JobWork work) {
        job.markRunning();
        JobStatus outcome = JobStatus.FAILED;
        String error = null;
        try {
            work.run(payload -> {
                if (!job.cancellationToken().isCancelled()) {
                    emit(job, payload);
                }
            });
            outcome = job.cancellationToken().isCancelled() ? JobStatus.CANCELLED : JobStatus.COMPLETED;
        } catch (CancellationException ex) {
            outcome = JobStatus.CANCELLED;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            outcome = JobStatus.CANCELLED;
        } catch (Exception ex) {
            if (job.cancellationToken().isCancelled()) {
                outcome = JobStatus.CANCELLED;
            } else {
                error = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                log.error("Background job {} for session {} failed", job.taskId(), job.sessionId(), ex);
                emit(job, events.error(error));
            }
        } finally {
            if (job.finish(outcome, error, events.done())) {
                log.info("Job {} finished with status {}", job.taskId(), outcome.value());
            }
        }
    }
}
