package com.agentforge.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMetricsTest {

    private SimpleMeterRegistry registry;
    private OrchestrationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OrchestrationMetrics(registry);
    }

    @Test
    void recordRunCountsByPatternAndOutcome() {
        metrics.recordRun("sequential", "completed");
        metrics.recordRun("sequential", "completed");
        metrics.recordRun("parallel", "cancelled");

        assertEquals(2.0, registry.counter("agentforge.runs.total",
                "pattern", "sequential", "outcome", "completed").count());
        assertEquals(1.0, registry.counter("agentforge.runs.total",
                "pattern", "parallel", "outcome", "cancelled").count());
    }

    @Test
    void recordAgentInvocationTimesByResult() {
        metrics.recordAgentInvocation("writer", 120, true);
        metrics.recordAgentInvocation("writer", 80, false);

        var success = registry.find("agentforge.agent.invocation.duration")
                .tags("agent", "writer", "result", "success").timer();
        assertNotNull(success);
        assertEquals(1, success.count());
        assertEquals(120.0, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void recordUnsupportedPattern() {
        metrics.recordUnsupportedPattern("debate");

        assertEquals(1.0, registry.counter("agentforge.patterns.unsupported", "pattern", "debate").count());
    }
}
