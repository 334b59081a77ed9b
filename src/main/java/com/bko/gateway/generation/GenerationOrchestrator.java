package com.bko.gateway.generation;

import com.bko.gateway.agent.AgentBackend;
import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.cancel.CancellationRegistry;
import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.entity.AgentSession;
import com.bko.gateway.jobs.Job;
import com.bko.gateway.jobs.JobRegistry;
import com.bko.gateway.jobs.JobSnapshot;
import com.bko.gateway.jobs.JobSubscription;
import com.bko.gateway.lock.SessionLock;
import com.bko.gateway.session.SessionService;
import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.GenerationEvents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entry point for generation turns. A turn is validated, takes the session lock and a cancellation token, and
 * then runs either on the caller's thread ({@link #openForeground}) or as a background job
 * ({@link #startBackground}). Whatever happens afterwards, the lock is released and the token deregistered.
 */
@Service
@Slf4j
public class GenerationOrchestrator {

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final SessionService sessionService;
    private final SessionLock sessionLock;
    private final CancellationRegistry cancellations;
    private final JobRegistry jobRegistry;
    private final GenerationEvents events;
    private final Map<AgentKind, AgentBackend> backends = new EnumMap<>(AgentKind.class);

    public GenerationOrchestrator(SessionService sessionService,
                                  SessionLock sessionLock,
                                  CancellationRegistry cancellations,
                                  JobRegistry jobRegistry,
                                  GenerationEvents events,
                                  List<AgentBackend> backends) {
        this.sessionService = sessionService;
        this.sessionLock = sessionLock;
        this.cancellations = cancellations;
        this.jobRegistry = jobRegistry;
        this.events = events;
        for (AgentBackend backend : backends) {
            AgentBackend previous = this.backends.put(backend.kind(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two agent backends registered for " + backend.kind().id());
            }
        }
    }

    /**
     * Claims the session for a foreground turn. Validation and lock failures are thrown from here, before the
     * caller commits to a response; the returned handle must be run or closed.
     *
     * @throws InvalidRequestException if the request is malformed
     * @throws SessionBusyException    if another turn holds the session
     */
    public ForegroundGeneration openForeground(GenerationRequest request) {
        TurnContext turn = prepare(request);
        return new ForegroundGeneration(turn, this::executeTurn, events);
    }

    /**
     * Claims the session and schedules the turn as a job.
     *
     * @return the job as it was before dispatch, i.e. queued
     */
    public JobSnapshot startBackground(GenerationRequest request) {
        TurnContext turn = prepare(request);
        try {
            Job job = jobRegistry.createJob(request.sessionId(), turn.cancellation());
            JobSnapshot queued = job.snapshot();
            jobRegistry.dispatch(job, sink -> {
                try {
                    executeTurn(turn, sink);
                } finally {
                    turn.release();
                }
            });
            log.info("Queued job {} for session {}", job.taskId(), request.sessionId());
            return queued;
        } catch (RuntimeException ex) {
            turn.release();
            throw ex;
        }
    }

    public JobSnapshot getJobStatus(String taskId) {
        return jobRegistry.get(taskId).snapshot();
    }

    public JobSubscription streamJob(String taskId, long sinceId) {
        return jobRegistry.subscribe(taskId, sinceId);
    }

    public boolean cancelJob(String taskId) {
        return jobRegistry.cancel(taskId);
    }

    public boolean stopGeneration(String sessionId) {
        return cancellations.stop(sessionId);
    }

    private TurnContext prepare(GenerationRequest request) {
        validate(request);
        String sessionId = request.sessionId();
        AgentSession session = sessionService.getOrCreate(
                sessionId, request.agent(), request.cwd(), request.model(), request.prompt());
        boolean firstTurn = !sessionService.hasMessages(sessionId);
        String resumeToken = firstTurn ? null : session.getInternalSessionId();

        if (!sessionLock.acquire(sessionId)) {
            throw new SessionBusyException(sessionId);
        }
        CancellationToken token = cancellations.register(sessionId);
        TurnContext turn = new TurnContext(request, firstTurn, resumeToken, token, () -> {
            cancellations.deregister(sessionId, token);
            sessionLock.release(sessionId);
            log.debug("Released session {}", sessionId);
        });
        try {
            sessionService.recordUserMessage(sessionId, request.prompt());
        } catch (RuntimeException ex) {
            turn.release();
            throw ex;
        }
        return turn;
    }

    void executeTurn(TurnContext turn, EventSink sink) throws Exception {
        GenerationRequest request = turn.request();
        AgentBackend backend = backends.get(request.agent());
        if (backend == null) {
            throw new IllegalStateException("No backend available for agent " + request.agent().id());
        }
        sink.emit(events.userMessage(request.sessionId(), request.prompt()));
        log.info("Running {} turn for session {} (first turn: {})",
                request.agent().id(), request.sessionId(), turn.firstTurn());
        backend.run(turn.toAgentTurn(
                internalId -> sessionService.updateInternalSessionId(request.sessionId(), internalId)), sink);
        sessionService.touch(request.sessionId());
    }

    static void validate(GenerationRequest request) {
        List<String> problems = new ArrayList<>();
        if (request == null) {
            throw new InvalidRequestException(List.of("request body is required"));
        }
        if (!StringUtils.hasText(request.sessionId())) {
            problems.add("session_id is required");
        } else if (!UUID_PATTERN.matcher(request.sessionId()).matches()) {
            problems.add("session_id must be a UUID");
        }
        if (!StringUtils.hasText(request.prompt())) {
            problems.add("prompt is required");
        }
        if (request.agent() == null) {
            problems.add("agent is required");
        }
        if (!StringUtils.hasText(request.cwd())) {
            problems.add("cwd is required");
        }
        if (request.model() == null) {
            problems.add("model is required");
        }
        if (request.images().stream().anyMatch(image -> !StringUtils.hasText(image))) {
            problems.add("images must not contain blank paths");
        }
        if (!problems.isEmpty()) {
            throw new InvalidRequestException(problems);
        }
    }
}
