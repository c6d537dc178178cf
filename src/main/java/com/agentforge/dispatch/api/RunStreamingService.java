package com.agentforge.dispatch.api;

import com.agentforge.core.events.EventStream;
import com.agentforge.core.events.OrchestrationEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * Pumps an {@link EventStream} into an {@link SseEmitter}, one SSE frame per event.
 * <p>
 * Frames are named after the event kind ({@code progress}, {@code partial}, ...) and carry
 * the event as JSON. When the client disconnects, the emitter times out or errors, the event
 * stream is closed, which cancels the run.
 */
@Service
public class RunStreamingService {

    private static final Logger log = LoggerFactory.getLogger(RunStreamingService.class);

    /** Default emitter timeout: 30 minutes (for long-running agents). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private final ExecutorService executor;
    private final long timeoutMs;

    /** Tracks runs currently being streamed. */
    private final CopyOnWriteArrayList<StreamRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    @Autowired
    public RunStreamingService(ExecutorService orchestrationExecutor) {
        this(orchestrationExecutor, DEFAULT_TIMEOUT_MS);
    }

    RunStreamingService(ExecutorService executor, long timeoutMs) {
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Creates an emitter streaming {@code events} and starts forwarding in the background.
     */
    public SseEmitter stream(EventStream events) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new StreamRegistration(events.runId(), events, emitter);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for run {}", registration.runId());
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for run {}", registration.runId());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for run {}: {}", registration.runId(), ex.getMessage());
            cleanup(registration);
        });

        executor.submit(() -> pump(registration));
        log.info("Streaming run {} over SSE (timeout={}ms)", registration.runId(), timeoutMs);
        return emitter;
    }

    /**
     * Returns the number of runs currently being streamed.
     */
    public int activeStreamCount() {
        return activeRegistrations.size();
    }

    @PreDestroy
    void closeAll() {
        for (StreamRegistration registration : activeRegistrations) {
            cleanup(registration);
        }
    }

    private void pump(StreamRegistration registration) {
        EventStream events = registration.events();
        SseEmitter emitter = registration.emitter();
        try {
            while (events.hasNext()) {
                OrchestrationEvent event = events.next();
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(event.sequenceNumber()))
                        .name(event.kind().name().toLowerCase(Locale.ROOT))
                        .data(event, MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Client for run {} went away: {}", registration.runId(), e.getMessage());
            emitter.completeWithError(e);
        } catch (IllegalStateException e) {
            // Emitter already completed/timed out
            log.debug("Emitter for run {} no longer active", registration.runId());
        } finally {
            cleanup(registration);
        }
    }

    private void cleanup(StreamRegistration registration) {
        registration.events().close();
        if (activeRegistrations.remove(registration)) {
            log.debug("Cleaned up SSE registration for run {}", registration.runId());
        }
    }

    private record StreamRegistration(
            String runId,
            EventStream events,
            SseEmitter emitter
    ) {}
}
