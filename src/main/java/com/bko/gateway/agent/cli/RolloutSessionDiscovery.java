package com.bko.gateway.agent.cli;

import com.bko.gateway.cancel.CancellationToken;
import com.bko.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code rollout-<timestamp>-<uuid>.jsonl} files anywhere below the agent's sessions root.
 */
@Slf4j
public class RolloutSessionDiscovery implements SessionDiscoveryStrategy {

    static final Pattern SESSION_ANNOUNCEMENT =
            Pattern.compile("session id:\\s*([0-9a-f-]{36})", Pattern.CASE_INSENSITIVE);
    static final Pattern ROLLOUT_FILE =
            Pattern.compile("^rollout-\\d{4}-\\d{2}-\\d{2}T\\d{2}-\\d{2}-\\d{2}-([0-9a-f-]{36})\\.jsonl$",
                    Pattern.CASE_INSENSITIVE);

    private final Path sessionsRoot;
    private final Duration pollInterval;

    public RolloutSessionDiscovery(GatewayProperties.CliConfig config) {
        this(config.resolveSessionsRoot(), config.getDiscoveryPollInterval());
    }

    public RolloutSessionDiscovery(Path sessionsRoot, Duration pollInterval) {
        this.sessionsRoot = sessionsRoot;
        this.pollInterval = pollInterval;
    }

    @Override
    public Optional<String> parseSessionId(String diagnosticLine) {
        if (diagnosticLine == null) {
            return Optional.empty();
        }
        Matcher matcher = SESSION_ANNOUNCEMENT.matcher(diagnosticLine);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    @Override
    public Optional<Path> find(String agentSessionId) throws IOException {
        if (!Files.isDirectory(sessionsRoot)) {
            return Optional.empty();
        }
        NewestMatch match = new NewestMatch(agentSessionId);
        Files.walkFileTree(sessionsRoot, match);
        return Optional.ofNullable(match.best);
    }

    @Override
    public Path await(String agentSessionId, Duration timeout, CancellationToken cancellation)
            throws IOException, InterruptedException {
        CountDownLatch cancelled = new CountDownLatch(1);
        CancellationToken.Registration registration = cancellation.onCancel(cancelled::countDown);
        try {
            Instant deadline = Instant.now().plus(timeout);
            while (true) {
                cancellation.throwIfCancelled();
                Optional<Path> found = find(agentSessionId);
                if (found.isPresent()) {
                    log.debug("Discovered session log {} for agent session {}", found.get(), agentSessionId);
                    return found.get();
                }
                Duration remaining = Duration.between(Instant.now(), deadline);
                if (remaining.isNegative() || remaining.isZero()) {
                    throw DiscoveryTimeoutException.forSessionFile(agentSessionId, timeout);
                }
                Duration wait = remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
                if (cancelled.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new CancellationException("Session discovery cancelled.");
                }
            }
        } finally {
            registration.remove();
        }
    }

    private static final class NewestMatch extends SimpleFileVisitor<Path> {

        private final String agentSessionId;
        private Path best;
        private FileTime bestModified;

        private NewestMatch(String agentSessionId) {
            this.agentSessionId = agentSessionId;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            Matcher matcher = ROLLOUT_FILE.matcher(file.getFileName().toString());
            if (matcher.matches() && matcher.group(1).equalsIgnoreCase(agentSessionId)) {
                FileTime modified = attrs.lastModifiedTime();
                if (best == null || modified.compareTo(bestModified) > 0) {
                    best = file;
                    bestModified = modified;
                }
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            // entries can vanish while the agent rotates its logs
            return FileVisitResult.CONTINUE;
        }
    }
}
