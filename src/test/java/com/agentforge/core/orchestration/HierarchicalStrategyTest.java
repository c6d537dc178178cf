package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentInvocationException;
import com.agentforge.core.events.EventKind;
import com.agentforge.core.events.OrchestrationEvent;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.agentforge.core.orchestration.TestAgents.*;
import static org.junit.jupiter.api.Assertions.*;

class HierarchicalStrategyTest {

    private ExecutorService executor;
    private OrchestrationRuntime runtime;
    private RecordingDirectory directory;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        runtime = new OrchestrationRuntime(executor);
        directory = new RecordingDirectory();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<OrchestrationEvent> run(List<String> agents, String input) {
        var workflow = WorkflowDescriptor.of("team", PatternKind.HIERARCHICAL, agents);
        return new HierarchicalStrategy(workflow, directory, runtime).process("user-1", input).drain();
    }

    @Test
    @DisplayName("zero agents yields exactly one error event")
    void noAgents() {
        var events = run(List.of(), "task");

        assertEquals(1, events.size());
        assertEquals(EventKind.ERROR, events.get(0).kind());
        assertEquals("No agents in workflow", events.get(0).payload());
        assertEquals(0, directory.lookupCount());
    }

    @Test
    @DisplayName("final output names the coordinator and every worker")
    void finalMentionsCoordinatorAndWorkers() {
        directory.withWrappers("coord", "w1", "w2");

        var events = run(List.of("coord", "w1", "w2"), "task");

        OrchestrationEvent result = last(events);
        assertEquals(EventKind.FINAL, result.kind());
        assertTrue(result.payload().contains("coord"));
        assertTrue(result.payload().contains("w1"));
        assertTrue(result.payload().contains("w2"));
        assertEquals("Coordinator coord final output:\n[w1]: w1(task)\n[w2]: w2(task)", result.payload());
    }

    @Test
    @DisplayName("emits analyze, plan, per-worker execute/complete, synthesize, final")
    void eventOrder() {
        directory.withWrappers("coord", "w1", "w2");

        var events = run(List.of("coord", "w1", "w2"), "task");

        assertEquals(List.of(EventKind.PROGRESS, EventKind.PROGRESS,
                        EventKind.PROGRESS, EventKind.PARTIAL,
                        EventKind.PROGRESS, EventKind.PARTIAL,
                        EventKind.PROGRESS, EventKind.FINAL),
                kinds(events));
        assertEquals("Coordinator coord analyzing task...", events.get(0).payload());
        assertEquals("Plan: Will delegate to 2 worker agents", events.get(1).payload());
        assertEquals("Worker w1 executing...", events.get(2).payload());
        assertEquals("Coordinator coord synthesizing results...", events.get(6).payload());
    }

    @Test
    @DisplayName("workers receive the original input, not each other's output")
    void workersGetOriginalInput() {
        directory.withWrappers("w1", "w2");

        var partials = run(List.of("coord", "w1", "w2"), "task").stream()
                .filter(e -> e.kind() == EventKind.PARTIAL)
                .map(OrchestrationEvent::payload)
                .toList();

        assertEquals(List.of("[w1]: w1(task)", "[w2]: w2(task)"), partials);
    }

    @Test
    @DisplayName("missing worker is warned about and skipped")
    void missingWorker() {
        directory.withWrappers("coord", "w2");

        var events = run(List.of("coord", "ghost", "w2"), "task");

        var warnings = events.stream().filter(e -> e.kind() == EventKind.WARNING).toList();
        assertEquals(1, warnings.size());
        assertEquals("Agent ghost not found", warnings.get(0).payload());
        assertFalse(last(events).payload().contains("ghost"));
        assertTrue(last(events).payload().contains("[w2]"));
    }

    @Test
    @DisplayName("failing worker is warned about and skipped")
    void failingWorker() {
        directory.withWrappers("w2").with("w1", input -> {
            throw new AgentInvocationException("no quota");
        });

        var events = run(List.of("coord", "w1", "w2"), "task");

        assertEquals(1, count(events, EventKind.WARNING));
        assertEquals("Coordinator coord final output:\n[w2]: w2(task)", last(events).payload());
    }

    @Test
    @DisplayName("coordinator alone delegates to zero workers")
    void coordinatorOnly() {
        var events = run(List.of("coord"), "task");

        assertEquals("Plan: Will delegate to 0 worker agents", events.get(1).payload());
        assertEquals("Coordinator coord final output:\n", last(events).payload());
    }
}
