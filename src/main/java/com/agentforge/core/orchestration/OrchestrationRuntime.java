package com.agentforge.core.orchestration;

import com.agentforge.core.metrics.OrchestrationMetrics;

import java.time.Duration;
import java.time.Year;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared, stateless-per-run collaborators handed to every strategy: the executor that runs
 * producers and agent invocations, the invoker, stream sizing and run id generation.
 */
public class OrchestrationRuntime {

    private final ExecutorService executor;
    private final AgentInvoker invoker;
    private final int maxParallel;
    private final int streamBufferSize;
    private final OrchestrationMetrics metrics;
    private final AtomicLong runCounter = new AtomicLong();

    public OrchestrationRuntime(ExecutorService executor, Duration invocationTimeout,
                                int maxParallel, int streamBufferSize, OrchestrationMetrics metrics) {
        this.executor = executor;
        this.invoker = new AgentInvoker(executor, invocationTimeout, metrics);
        this.maxParallel = Math.max(1, maxParallel);
        this.streamBufferSize = Math.max(1, streamBufferSize);
        this.metrics = metrics;
    }

    /** Runtime without timeout or metrics. */
    public OrchestrationRuntime(ExecutorService executor) {
        this(executor, Duration.ZERO, 4, 16, null);
    }

    /**
     * Generates ids like {@code RUN-2026-0001}. Unique per process only.
     */
    public String nextRunId() {
        return String.format("RUN-%d-%04d", Year.now().getValue(), runCounter.incrementAndGet());
    }

    public ExecutorService executor() { return executor; }
    public AgentInvoker invoker() { return invoker; }
    public int maxParallel() { return maxParallel; }
    public int streamBufferSize() { return streamBufferSize; }

    /** Nullable. */
    public OrchestrationMetrics metrics() { return metrics; }
}
