package com.agentforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite, non-restartable sequence of {@link OrchestrationEvent}s for one run.
 * <p>
 * The producer runs on an executor and hands events over through a bounded queue, so it
 * blocks whenever the consumer falls {@code bufferSize} events behind. The consumer pulls
 * with {@link #hasNext()}/{@link #next()} and may {@link #close()} at any point, which
 * interrupts the producer and discards anything still buffered.
 * <p>
 * Every stream terminates: a producer that throws is turned into a final {@code ERROR}
 * event, and a cancelled producer simply stops.
 */
public final class EventStream implements Iterator<OrchestrationEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private static final long POLL_INTERVAL_MS = 100;

    /** Marker placed on the queue after the producer's last event. Compared by identity. */
    private static final OrchestrationEvent END_OF_STREAM =
            new OrchestrationEvent(EventKind.FINAL, null, "<end>", Long.MAX_VALUE);

    /**
     * Body of a run. Emits events through the sink and returns when the run is complete.
     */
    @FunctionalInterface
    public interface Producer {
        void produce(EventSink sink) throws Exception;
    }

    private final String runId;
    private final BlockingQueue<OrchestrationEvent> queue;
    private final AtomicLong sequence = new AtomicLong();
    private final EventSink sink = new QueueSink();

    private volatile boolean closed;
    private volatile boolean finished;
    private volatile Future<?> producerTask;
    private volatile OrchestrationEvent next;

    private EventStream(String runId, int bufferSize) {
        this.runId = runId;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, bufferSize) + 1);
    }

    /**
     * Starts {@code producer} on {@code executor} and returns the stream it feeds.
     */
    public static EventStream open(String runId, ExecutorService executor, int bufferSize, Producer producer) {
        EventStream stream = new EventStream(runId, bufferSize);
        stream.producerTask = executor.submit(() -> stream.drive(producer));
        return stream;
    }

    /**
     * A stream holding a single {@code ERROR} event. Nothing runs in the background.
     */
    public static EventStream error(String runId, String payload) {
        EventStream stream = new EventStream(runId, 1);
        stream.queue.add(new OrchestrationEvent(EventKind.ERROR, null, payload,
                stream.sequence.incrementAndGet()));
        stream.queue.add(END_OF_STREAM);
        return stream;
    }

    public String runId() {
        return runId;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            while (!closed) {
                OrchestrationEvent event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (event == END_OF_STREAM) {
                    finished = true;
                    return false;
                }
                next = event;
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        }
        finished = true;
        return false;
    }

    @Override
    public OrchestrationEvent next() {
        OrchestrationEvent event = hasNext() ? next : null;
        if (event == null) {
            throw new NoSuchElementException("Run " + runId + " has no more events");
        }
        next = null;
        return event;
    }

    /**
     * Sequential {@link Stream} view; closing it closes this event stream.
     */
    public Stream<OrchestrationEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(this::close);
    }

    /**
     * Consumes the remaining events into a list, blocking until the run ends.
     */
    public List<OrchestrationEvent> drain() {
        List<OrchestrationEvent> events = new ArrayList<>();
        try {
            forEachRemaining(events::add);
        } finally {
            close();
        }
        return events;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops the run. Idempotent. The producer is interrupted and any buffered events are
     * dropped.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        boolean exhausted = finished;
        finished = true;
        next = null;
        Future<?> task = producerTask;
        if (task != null && !task.isDone()) {
            task.cancel(true);
            if (!exhausted) {
                log.debug("Run {} closed before completion, producer cancelled", runId);
            }
        }
        queue.clear();
    }

    private void drive(Producer producer) {
        try {
            producer.produce(sink);
        } catch (RunCancelledException e) {
            log.debug("Run {} stopped: {}", runId, e.getMessage());
        } catch (Exception | Error e) {
            log.error("Run {} failed unexpectedly", runId, e);
            emitFailure(e);
        } finally {
            markEnd();
        }
    }

    private void emitFailure(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            sink.error("Orchestration failed: " + message);
        } catch (RunCancelledException e) {
            log.debug("Run {} closed before failure could be reported", runId);
        }
    }

    private void markEnd() {
        if (closed) {
            return;
        }
        try {
            queue.put(END_OF_STREAM);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class QueueSink implements EventSink {

        @Override
        public OrchestrationEvent emit(EventKind kind, String sourceAgent, String payload) {
            if (closed) {
                throw new RunCancelledException(runId);
            }
            OrchestrationEvent event = new OrchestrationEvent(kind, sourceAgent, payload,
                    sequence.incrementAndGet());
            try {
                queue.put(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RunCancelledException(runId);
            }
            return event;
        }
    }
}
