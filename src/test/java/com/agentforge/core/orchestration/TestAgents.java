package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.directory.AgentHandle;
import com.agentforge.core.events.EventKind;
import com.agentforge.core.events.OrchestrationEvent;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test fixtures: an agent directory that records lookups, and a few canned handles.
 */
final class TestAgents {

    private TestAgents() {}

    /** Directory backed by a map; counts every lookup. */
    static final class RecordingDirectory implements AgentDirectory {

        private final Map<String, AgentHandle> handles = new ConcurrentHashMap<>();
        private final AtomicInteger lookups = new AtomicInteger();
        private final List<String> lookedUp = new CopyOnWriteArrayList<>();

        RecordingDirectory with(String name, AgentHandle handle) {
            handles.put(name, handle);
            return this;
        }

        RecordingDirectory withWrappers(String... names) {
            for (String name : names) {
                handles.put(name, wrapping(name));
            }
            return this;
        }

        @Override
        public Optional<AgentHandle> lookup(String name) {
            lookups.incrementAndGet();
            lookedUp.add(name);
            return Optional.ofNullable(handles.get(name));
        }

        int lookupCount() {
            return lookups.get();
        }

        List<String> lookedUp() {
            return lookedUp;
        }
    }

    /** Returns {@code name(input)} so chaining is visible in the output. */
    static AgentHandle wrapping(String name) {
        return input -> name + "(" + input + ")";
    }

    /** Returns {@code [name]: input} after sleeping {@code delayMs}. */
    static AgentHandle delayed(String name, long delayMs) {
        return input -> {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "[" + name + "]: " + input;
        };
    }

    static List<EventKind> kinds(List<OrchestrationEvent> events) {
        return events.stream().map(OrchestrationEvent::kind).toList();
    }

    static long count(List<OrchestrationEvent> events, EventKind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }

    static OrchestrationEvent last(List<OrchestrationEvent> events) {
        return events.get(events.size() - 1);
    }
}
