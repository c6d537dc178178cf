package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentHandle;
import com.agentforge.core.directory.AgentInvocationException;
import com.agentforge.core.events.RunCancelledException;
import com.agentforge.core.logging.MdcContext;
import com.agentforge.core.metrics.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs agent invocations on the orchestration executor and turns every way an invocation
 * can go wrong (exception, timeout, cancellation) into a failed {@link Outcome}.
 * <p>
 * Interruption of the waiting thread means the run itself was cancelled: the invocation is
 * cancelled too and {@link RunCancelledException} is thrown.
 */
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    private static final long START_POLL_MS = 50;

    private final ExecutorService executor;
    private final Duration timeout;
    private final OrchestrationMetrics metrics;

    public AgentInvoker(ExecutorService executor, Duration timeout, OrchestrationMetrics metrics) {
        this.executor = executor;
        this.timeout = timeout != null ? timeout : Duration.ZERO;
        this.metrics = metrics;
    }

    /**
     * Result of one invocation; exactly one of {@code output} and {@code failure} is set.
     */
    public record Outcome(String agent, String output, String failure) {

        static Outcome success(String agent, String output) {
            return new Outcome(agent, output, null);
        }

        static Outcome failure(String agent, String failure) {
            return new Outcome(agent, null, failure);
        }

        public boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * An invocation in flight. The timeout clock starts at {@link #startedAtMs()}, when the
     * handle is actually called, not when the invocation was queued.
     */
    public record Pending(String runId, String agent, Future<String> future, StartSignal started) {

        public void cancel() {
            future.cancel(true);
        }

        public long startedAtMs() {
            return started.startedAtMs();
        }
    }

    /**
     * Records when the agent began running. Until then {@link #startedAtMs()} is the
     * submission time.
     */
    public static final class StartSignal {

        private final CountDownLatch latch = new CountDownLatch(1);
        private final long submittedAtMs = System.currentTimeMillis();
        private volatile long startedAtMs = -1L;

        void mark() {
            startedAtMs = System.currentTimeMillis();
            latch.countDown();
        }

        boolean await(long ms) throws InterruptedException {
            return latch.await(ms, TimeUnit.MILLISECONDS);
        }

        public long startedAtMs() {
            long started = startedAtMs;
            return started >= 0 ? started : submittedAtMs;
        }
    }

    /** Invokes and waits. */
    public Outcome invoke(String runId, String agent, AgentHandle handle, String input) {
        return await(submit(runId, agent, handle, input));
    }

    public Pending submit(String runId, String agent, AgentHandle handle, String input) {
        return submit(runId, agent, handle, input, null);
    }

    /**
     * Submits an invocation that first takes a permit from {@code slots} (nullable). Time
     * spent waiting for the permit does not count against the timeout.
     */
    public Pending submit(String runId, String agent, AgentHandle handle, String input, Semaphore slots) {
        log.debug("Invoking agent {}", agent);
        StartSignal started = new StartSignal();
        Future<String> future = executor.submit(() -> {
            if (slots != null) {
                slots.acquire();
            }
            try {
                started.mark();
                MdcContext.setAgent(runId, agent);
                return handle.invoke(input);
            } finally {
                MdcContext.clear();
                if (slots != null) {
                    slots.release();
                }
            }
        });
        return new Pending(runId, agent, future, started);
    }

    public Outcome await(Pending pending) {
        String agent = pending.agent();
        Outcome outcome;
        try {
            String output;
            if (timeout.isZero() || timeout.isNegative()) {
                output = pending.future().get();
            } else {
                awaitStart(pending);
                output = pending.future().get(remainingMs(pending), TimeUnit.MILLISECONDS);
            }
            outcome = output != null
                    ? Outcome.success(agent, output)
                    : Outcome.failure(agent, "Agent " + agent + " returned no output");
        } catch (TimeoutException e) {
            pending.cancel();
            log.warn("Agent {} timed out after {} ms", agent, timeout.toMillis());
            outcome = Outcome.failure(agent, "Agent " + agent + " timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentInvocationException) {
                log.warn("Agent {} failed: {}", agent, cause.getMessage());
            } else {
                log.error("Agent {} raised an unexpected error", agent, cause);
            }
            outcome = Outcome.failure(agent, "Agent " + agent + " failed: " + describe(cause));
        } catch (CancellationException e) {
            outcome = Outcome.failure(agent, "Agent " + agent + " invocation was cancelled");
        } catch (InterruptedException e) {
            pending.cancel();
            Thread.currentThread().interrupt();
            throw new RunCancelledException(pending.runId());
        }
        if (metrics != null) {
            metrics.recordAgentInvocation(agent, System.currentTimeMillis() - pending.startedAtMs(),
                    outcome.succeeded());
        }
        return outcome;
    }

    /** Blocks until the agent has started or its task ended without starting. */
    private static void awaitStart(Pending pending) throws InterruptedException {
        while (!pending.started().await(START_POLL_MS)) {
            if (pending.future().isDone()) {
                return;
            }
        }
    }

    private long remainingMs(Pending pending) {
        long elapsed = System.currentTimeMillis() - pending.startedAtMs();
        return Math.max(timeout.toMillis() - elapsed, 0L);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
