package com.bko.gateway.agent.cli;

import com.bko.gateway.agent.AgentBackend;
import com.bko.gateway.agent.AgentKind;
import com.bko.gateway.agent.AgentTurn;
import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.config.GatewayProperties;
import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.GenerationEvents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a turn through the agent CLI. The CLI's stdout is not machine readable, so events come from the JSONL
 * session log it writes: stderr announces the session id, the log file is located from that id and then tailed
 * for the rest of the turn.
 */
@Component
@Slf4j
public class CliAgentBackend implements AgentBackend {

    private final CliCommandBuilder commandBuilder;
    private final SessionDiscoveryStrategy discovery;
    private final LogTailer tailer;
    private final GenerationEvents events;
    private final Executor ioExecutor;
    private final Duration discoveryTimeout;
    private final Duration killGracePeriod;

    @Autowired
    public CliAgentBackend(CliCommandBuilder commandBuilder,
                           SessionDiscoveryStrategy discovery,
                           LogTailer tailer,
                           GenerationEvents events,
                           @Qualifier("agentIoExecutor") Executor ioExecutor,
                           GatewayProperties properties) {
        this(commandBuilder, discovery, tailer, events, ioExecutor,
                properties.getCli().getDiscoveryTimeout(), properties.getCli().getKillGracePeriod());
    }

    CliAgentBackend(CliCommandBuilder commandBuilder,
                    SessionDiscoveryStrategy discovery,
                    LogTailer tailer,
                    GenerationEvents events,
                    Executor ioExecutor,
                    Duration discoveryTimeout,
                    Duration killGracePeriod) {
        this.commandBuilder = commandBuilder;
        this.discovery = discovery;
        this.tailer = tailer;
        this.events = events;
        this.ioExecutor = ioExecutor;
        this.discoveryTimeout = discoveryTimeout;
        this.killGracePeriod = killGracePeriod;
    }

    @Override
    public AgentKind kind() {
        return AgentKind.CLI;
    }

    @Override
    public void run(AgentTurn turn, EventSink sink) throws Exception {
        if (turn.cancellation().isCancelled()) {
            log.info("Turn for session {} cancelled before the agent was started", turn.sessionId());
            return;
        }
        Optional<SessionLog> knownLog = locateResumedLog(turn);
        List<String> command = commandBuilder.build(turn);
        Process process = start(command, turn.cwd());
        log.info("Started {} (pid {}) for session {}", commandBuilder.executable(), process.pid(), turn.sessionId());

        AtomicBoolean terminating = new AtomicBoolean();
        CancellationToken scope = turn.cancellation().child();
        CancellationToken.Registration killOnCancel =
                turn.cancellation().onCancel(() -> terminate(process, terminating));
        CompletableFuture<String> announcedId = new CompletableFuture<>();
        if (knownLog.isEmpty()) {
            announcedId.orTimeout(discoveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        CompletableFuture<Void> stderrPump = CompletableFuture.runAsync(
                () -> pumpStderr(process, announcedId, knownLog.isEmpty()), ioExecutor);
        CompletableFuture<SessionLog> sessionLog = knownLog
                .map(CompletableFuture::completedFuture)
                .orElseGet(() -> announcedId.thenApplyAsync(id -> awaitLog(id, scope), ioExecutor));
        CancellationToken tailCompletion = new CancellationToken();
        CompletableFuture<Void> tailing = sessionLog.thenAcceptAsync(
                found -> tail(found, turn, sink, scope, tailCompletion), ioExecutor);
        tailing.whenComplete((ignored, ex) -> {
            if (ex != null && sessionLog.isDone() && !sessionLog.isCompletedExceptionally()
                    && !turn.cancellation().isCancelled()) {
                log.warn("Lost the session log of session {}, stopping the agent", turn.sessionId());
                terminate(process, terminating);
            }
        });
        CompletableFuture<Process> exit = process.onExit();
        try {
            CompletableFuture.anyOf(exit, sessionLog.handle((found, ex) -> found)).get();
            if (!exit.isDone()) {
                failIfDiscoveryFailed(sessionLog, turn, process, terminating);
                exit.get();
            }
            int exitCode = process.exitValue();
            log.info("{} for session {} exited with code {}", commandBuilder.executable(), turn.sessionId(), exitCode);
            Throwable tailFailure = null;
            if (sessionLog.isDone() && !sessionLog.isCompletedExceptionally()) {
                tailCompletion.cancel();
                tailFailure = awaitTail(tailing);
            } else {
                log.warn("{} exited before its session log was found", commandBuilder.executable());
                scope.cancel();
            }
            awaitQuietly(stderrPump, "stderr reader");
            if (turn.cancellation().isCancelled()) {
                return;
            }
            if (tailFailure != null) {
                throw asException(tailFailure);
            }
            if (exitCode != 0) {
                throw new ProcessExitException(commandBuilder.executable(), exitCode);
            }
        } finally {
            killOnCancel.remove();
            scope.cancel();
            announcedId.cancel(false);
            if (process.isAlive()) {
                terminate(process, terminating);
            }
        }
    }

    private Optional<SessionLog> locateResumedLog(AgentTurn turn) throws IOException {
        if (!turn.isResume()) {
            return Optional.empty();
        }
        Optional<Path> file = discovery.find(turn.resumeToken());
        if (file.isEmpty()) {
            log.warn("No session log for resume token {}, waiting for the agent to announce one", turn.resumeToken());
        }
        return file.map(path -> new SessionLog(path, turn.resumeToken()));
    }

    private Process start(List<String> command, Path cwd) {
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(cwd.toFile())
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new ProcessSpawnException(commandBuilder.executable(), ex);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            log.debug("Failed to close agent stdin: {}", ex.getMessage());
        }
        return process;
    }

    private void pumpStderr(Process process, CompletableFuture<String> announcedId, boolean scan) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    log.info("[agent stderr] {}", line);
                }
                if (scan && !announcedId.isDone()) {
                    discovery.parseSessionId(line).ifPresent(id -> {
                        log.info("Agent announced session id {}", id);
                        announcedId.complete(id);
                    });
                }
            }
        } catch (IOException ex) {
            log.debug("Agent stderr closed: {}", ex.getMessage());
        }
    }

    private SessionLog awaitLog(String agentSessionId, CancellationToken scope) {
        try {
            return new SessionLog(discovery.await(agentSessionId, discoveryTimeout, scope), agentSessionId);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Session discovery interrupted.");
        }
    }

    private void tail(SessionLog found, AgentTurn turn, EventSink sink,
                      CancellationToken scope, CancellationToken completion) {
        if (scope.isCancelled()) {
            return;
        }
        if (!turn.isResume() || !found.agentSessionId().equals(turn.resumeToken())) {
            turn.internalSessionIdListener().accept(found.agentSessionId());
        }
        sink.emit(events.cliInit(found.file(), found.agentSessionId()));
        try {
            tailer.follow(found.file(), TailOptions.appendedOnly(scope, completion), sink::emit);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private void failIfDiscoveryFailed(CompletableFuture<SessionLog> sessionLog, AgentTurn turn,
                                       Process process, AtomicBoolean terminating) {
        if (!sessionLog.isCompletedExceptionally()) {
            return;
        }
        Throwable failure = unwrap(sessionLog);
        if (turn.cancellation().isCancelled() || failure instanceof CancellationException) {
            return;
        }
        if (failure instanceof TimeoutException) {
            failure = DiscoveryTimeoutException.forAnnouncement(discoveryTimeout);
        }
        log.warn("Session log discovery failed for session {}: {}", turn.sessionId(), failure.getMessage());
        terminate(process, terminating);
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        throw new CompletionException(failure);
    }

    private Throwable unwrap(CompletableFuture<?> future) {
        try {
            future.join();
            return null;
        } catch (CompletionException ex) {
            return ex.getCause() != null ? ex.getCause() : ex;
        } catch (CancellationException ex) {
            return ex;
        }
    }

    /**
     * Waits for the final drain of the session log. The completion request bounds it, so there is no deadline.
     *
     * @return why tailing failed, or {@code null}
     */
    @Nullable
    private Throwable awaitTail(CompletableFuture<Void> tailing) throws InterruptedException {
        try {
            tailing.get();
            return null;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            return cause instanceof UncheckedIOException unchecked ? unchecked.getCause() : cause;
        } catch (CancellationException ex) {
            return null;
        }
    }

    private Exception asException(Throwable failure) {
        if (failure instanceof Exception exception) {
            return exception;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(failure);
    }

    private void awaitQuietly(CompletableFuture<Void> future, String what) throws InterruptedException {
        try {
            future.get(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException ex) {
            log.warn("Agent {} failed: {}", what, ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        } catch (TimeoutException ex) {
            log.warn("Agent {} did not finish within {}ms", what, killGracePeriod.toMillis());
        } catch (CancellationException ex) {
            log.debug("Agent {} was never started", what);
        }
    }

    private void terminate(Process process, AtomicBoolean terminating) {
        if (!process.isAlive() || !terminating.compareAndSet(false, true)) {
            return;
        }
        log.info("Terminating agent process {}", process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        process.onExit()
                .orTimeout(killGracePeriod.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((exited, ex) -> {
                    if (ex != null && process.isAlive()) {
                        log.warn("Agent process {} ignored termination, killing it", process.pid());
                        process.descendants().forEach(ProcessHandle::destroyForcibly);
                        process.destroyForcibly();
                    }
                });
    }

    private record SessionLog(Path file, String agentSessionId) {
    }
}
