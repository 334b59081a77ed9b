package com.bko.gateway.jobs;

import com.bko.gateway.stream.EventSink;
import com.bko.gateway.stream.StreamEvent;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One consumer's view of a job: the events buffered when it subscribed, then everything emitted afterwards.
 * Each subscription owns its queue, so a slow consumer never blocks the job or other consumers.
 */
public final class JobSubscription implements AutoCloseable {

    private static final Object END = new Object();

    private final Job job;
    private final List<StreamEvent> replay;
    private final BlockingQueue<Object> live = new LinkedBlockingQueue<>();
    private volatile boolean ended;
    private volatile boolean closed;

    JobSubscription(Job job, List<StreamEvent> replay) {
        this.job = job;
        this.replay = replay;
    }

    public String taskId() {
        return job.taskId();
    }

    public List<StreamEvent> replay() {
        return replay;
    }

    void deliver(StreamEvent event) {
        live.offer(event);
    }

    void complete() {
        live.offer(END);
    }

    /**
     * Blocks until the next live event.
     *
     * @return the event, or {@code null} when the job has finished or this subscription was closed.
     */
    @Nullable
    public StreamEvent next() throws InterruptedException {
        if (ended) {
            return null;
        }
        return unwrap(live.take());
    }

    /**
     * Like {@link #next()} but gives up after {@code timeout}. Returns {@code null} on a timeout as well as at
     * the end.
     */
    @Nullable
    public StreamEvent poll(Duration timeout) throws InterruptedException {
        if (ended) {
            return null;
        }
        Object item = live.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return item == null ? null : unwrap(item);
    }

    /**
     * Sends the replay and then every live event to {@code sink}, returning when the job finishes or the
     * subscription is closed.
     */
    public void drainTo(EventSink sink) throws InterruptedException {
        for (StreamEvent event : replay) {
            if (closed) {
                return;
            }
            sink.emit(event.payload());
        }
        StreamEvent event;
        while ((event = next()) != null) {
            sink.emit(event.payload());
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        job.unsubscribe(this);
        live.offer(END);
    }

    @Nullable
    private StreamEvent unwrap(Object item) {
        if (item == END || closed) {
            ended = true;
            return null;
        }
        return (StreamEvent) item;
    }
}
