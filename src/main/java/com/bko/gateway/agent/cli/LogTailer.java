package com.bko.gateway.agent.cli;

import com.bko.gateway.cancel.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Follows a newline-delimited file as it grows.
 * <p>
 * Change notifications come from a {@link WatchService} on the parent directory. Notifications that pile up
 * while a read is in progress are drained together and answered with a single read. A read is also attempted
 * whenever the poll interval passes without a notification, since some platforms deliver them late or not at all.
 * Deletion and replacement are detected by {@link TailSession} on the next read, not from the event kind.
 */
@Slf4j
public class LogTailer {

    private final Duration pollInterval;
    private final int chunkSize;

    public LogTailer(Duration pollInterval, int chunkSize) {
        this.pollInterval = pollInterval;
        this.chunkSize = chunkSize;
    }

    /**
     * Hands every complete, trimmed, non-empty line appended to {@code file} to {@code listener}, on the calling
     * thread, until {@code options.cancellation()} fires or {@code options.completion()} fires and the remaining
     * content has been read.
     *
     * @throws IOException if the parent directory cannot be watched or the file cannot be read
     */
    public void follow(Path file, TailOptions options, Consumer<String> listener)
            throws IOException, InterruptedException {
        Path target = file.toAbsolutePath();
        Path directory = target.getParent();
        Path name = target.getFileName();
        CancellationToken cancellation = options.cancellation();
        if (cancellation.isCancelled()) {
            return;
        }
        try (WatchService watcher = directory.getFileSystem().newWatchService();
             TailSession session = new TailSession(target, options.fromEnd(), chunkSize)) {
            directory.register(watcher,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            CancellationToken.Registration registration = cancellation.onCancel(() -> closeWatcher(watcher));
            try {
                session.open();
                deliver(session.readAppended(), cancellation, listener);
                while (!cancellation.isCancelled()) {
                    if (options.completionRequested()) {
                        deliver(session.readAppended(), cancellation, listener);
                        return;
                    }
                    WatchKey key = watcher.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                    boolean relevant = key == null;
                    while (key != null) {
                        relevant |= inspect(key, name);
                        key = watcher.poll();
                    }
                    if (relevant) {
                        deliver(session.readAppended(), cancellation, listener);
                    }
                }
            } catch (ClosedWatchServiceException ex) {
                if (!cancellation.isCancelled()) {
                    throw new IOException("Watch service for " + directory + " closed unexpectedly", ex);
                }
            } finally {
                registration.remove();
            }
        }
    }

    private boolean inspect(WatchKey key, Path name) {
        boolean relevant = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                relevant = true;
                continue;
            }
            if (name.equals(event.context())) {
                relevant = true;
            }
        }
        key.reset();
        return relevant;
    }

    private void deliver(List<String> lines, CancellationToken cancellation, Consumer<String> listener) {
        for (String line : lines) {
            if (cancellation.isCancelled()) {
                return;
            }
            listener.accept(line);
        }
    }

    private void closeWatcher(WatchService watcher) {
        try {
            watcher.close();
        } catch (IOException ex) {
            log.debug("Failed to close watch service: {}", ex.getMessage());
        }
    }
}
