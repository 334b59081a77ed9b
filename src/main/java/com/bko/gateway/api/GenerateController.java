package com.bko.gateway.api;

import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.generation.ForegroundGeneration;
import com.bko.gateway.generation.GenerationOrchestrator;
import com.bko.gateway.generation.GenerationRequest;
import com.bko.gateway.generation.InvalidRequestException;
import com.bko.gateway.generation.SessionBusyException;
import com.bko.gateway.jobs.JobNotFoundException;
import com.bko.gateway.jobs.JobSnapshot;
import com.bko.gateway.jobs.JobSubscription;
import com.bko.gateway.stream.EventSink;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/generate")
@Slf4j
public class GenerateController {

    private final GenerationOrchestrator orchestrator;
    private final Executor streamExecutor;
    private final ScheduledExecutorService keepaliveScheduler;
    private final Duration keepaliveInterval;

    public GenerateController(GenerationOrchestrator orchestrator,
                              @Qualifier("streamExecutor") Executor streamExecutor,
                              @Qualifier("sseKeepaliveScheduler") ScheduledExecutorService keepaliveScheduler,
                              GatewayProperties properties) {
        this.orchestrator = orchestrator;
        this.streamExecutor = streamExecutor;
        this.keepaliveScheduler = keepaliveScheduler;
        this.keepaliveInterval = properties.getStream().getKeepaliveInterval();
    }

    /**
     * Starts a turn. Foreground requests are answered with an event stream, background requests with
     * {@code 202 Accepted} and the task id to follow.
     */
    @PostMapping
    public Object generate(@Valid @RequestBody GenerateRequest body) {
        GenerationRequest request = body.toGenerationRequest();
        if (request.background()) {
            JobSnapshot job = orchestrator.startBackground(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenerateAcceptedResponse.from(job));
        }
        ForegroundGeneration generation = orchestrator.openForeground(request);
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean clientGone = new AtomicBoolean();
        Runnable disconnect = () -> {
            if (clientGone.compareAndSet(false, true)) {
                generation.cancel();
            }
        };
        emitter.onTimeout(disconnect);
        emitter.onError(ex -> disconnect.run());
        EventSink sink = payload -> send(emitter, payload, clientGone, disconnect);
        ScheduledFuture<?> keepalive = scheduleKeepalive(emitter, clientGone, disconnect);
        try {
            streamExecutor.execute(() -> {
                try {
                    generation.run(sink);
                } finally {
                    keepalive.cancel(false);
                    emitter.complete();
                }
            });
        } catch (RejectedExecutionException ex) {
            keepalive.cancel(false);
            generation.close();
            throw ex;
        }
        return emitter;
    }

    @GetMapping("/jobs/{taskId}")
    public JobStatusResponse jobStatus(@PathVariable String taskId) {
        return JobStatusResponse.from(orchestrator.getJobStatus(taskId));
    }

    @GetMapping("/jobs/{taskId}/stream")
    public SseEmitter streamJob(@PathVariable String taskId,
                                @RequestParam(value = "since", defaultValue = "0") long since) {
        JobSubscription subscription = orchestrator.streamJob(taskId, since);
        SseEmitter emitter = new SseEmitter(0L);
        AtomicBoolean clientGone = new AtomicBoolean();
        Runnable disconnect = () -> {
            if (clientGone.compareAndSet(false, true)) {
                subscription.close();
            }
        };
        emitter.onTimeout(disconnect);
        emitter.onError(ex -> disconnect.run());
        emitter.onCompletion(subscription::close);
        ScheduledFuture<?> keepalive = scheduleKeepalive(emitter, clientGone, disconnect);
        try {
            streamExecutor.execute(() -> {
                try (subscription) {
                    subscription.drainTo(payload -> send(emitter, payload, clientGone, disconnect));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                } finally {
                    keepalive.cancel(false);
                    emitter.complete();
                }
            });
        } catch (RejectedExecutionException ex) {
            keepalive.cancel(false);
            subscription.close();
            throw ex;
        }
        return emitter;
    }

    @PostMapping("/jobs/{taskId}/cancel")
    public CancelJobResponse cancelJob(@PathVariable String taskId) {
        return orchestrator.cancelJob(taskId) ? CancelJobResponse.success() : CancelJobResponse.alreadyFinished();
    }

    @DeleteMapping("/{sessionId}/stop")
    public ResponseEntity<StopGenerationResponse> stop(@PathVariable String sessionId) {
        boolean stopped = orchestrator.stopGeneration(sessionId);
        StopGenerationResponse response = new StopGenerationResponse(stopped, sessionId, Instant.now());
        return ResponseEntity.status(stopped ? HttpStatus.OK : HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Validation failed", ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Validation failed", "Request body is invalid.", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Validation failed", "Request body could not be read."));
    }

    @ExceptionHandler(SessionBusyException.class)
    public ResponseEntity<ErrorResponse> handleSessionBusy(SessionBusyException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("Session busy", ex.getMessage()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("Not found", ex.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException ex) {
        log.error("Generation request failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Internal server error", ex.getMessage()));
    }

    /**
     * Sends a comment line at a fixed rate so idle streams survive proxies and a vanished client is noticed even
     * while the agent is silent.
     */
    private ScheduledFuture<?> scheduleKeepalive(SseEmitter emitter, AtomicBoolean clientGone, Runnable disconnect) {
        long interval = keepaliveInterval.toMillis();
        return keepaliveScheduler.scheduleAtFixedRate(
                () -> send(emitter, SseEmitter.event().comment("keepalive"), clientGone, disconnect),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    private void send(SseEmitter emitter, String payload, AtomicBoolean clientGone, Runnable disconnect) {
        send(emitter, SseEmitter.event().data(payload), clientGone, disconnect);
    }

    private void send(SseEmitter emitter, SseEmitter.SseEventBuilder event, AtomicBoolean clientGone,
                      Runnable disconnect) {
        if (clientGone.get()) {
            return;
        }
        try {
            emitter.send(event);
        } catch (IOException | IllegalStateException ex) {
            log.debug("Stream client went away: {}", ex.getMessage());
            disconnect.run();
        }
    }
}
