package com.agentforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param pattern pattern tag the run executed under
     * @param outcome "completed", "failed" or "cancelled"
     */
    public void recordRun(String pattern, String outcome) {
        Counter.builder("agentforge.runs.total")
                .description("Orchestration runs by pattern and outcome")
                .tag("pattern", pattern)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAgentInvocation(String agent, long ms, boolean success) {
        Timer.builder("agentforge.agent.invocation.duration")
                .tag("agent", agent)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordUnsupportedPattern(String pattern) {
        Counter.builder("agentforge.patterns.unsupported")
                .description("Runs rejected because their pattern has no strategy")
                .tag("pattern", pattern)
                .register(registry)
                .increment();
    }
}
