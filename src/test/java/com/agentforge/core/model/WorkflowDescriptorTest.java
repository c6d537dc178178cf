package com.agentforge.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowDescriptorTest {

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void rejectsBlankName() {
            assertThrows(IllegalArgumentException.class,
                    () -> WorkflowDescriptor.of(" ", PatternKind.SEQUENTIAL, List.of("a")));
        }

        @Test
        void rejectsMissingPattern() {
            var ex = assertThrows(IllegalArgumentException.class,
                    () -> WorkflowDescriptor.of("wf", null, List.of("a")));
            assertTrue(ex.getMessage().contains("wf"));
        }

        @Test
        void rejectsMissingAgentList() {
            assertThrows(IllegalArgumentException.class,
                    () -> WorkflowDescriptor.of("wf", PatternKind.PARALLEL, null));
        }

        @Test
        void rejectsNonPositiveIterations() {
            assertThrows(IllegalArgumentException.class,
                    () -> new WorkflowDescriptor("wf", "", PatternKind.DEBATE, List.of("a"),
                            0, Optional.empty(), Map.of()));
        }

        @Test
        @DisplayName("empty agent list is valid; emptiness is handled at run time")
        void allowsEmptyAgents() {
            assertTrue(WorkflowDescriptor.of("wf", PatternKind.HIERARCHICAL, List.of()).agentNames().isEmpty());
        }
    }

    @Test
    @DisplayName("copies mutable inputs")
    void immutable() {
        List<String> agents = new ArrayList<>(List.of("a", "b"));
        var workflow = WorkflowDescriptor.of("wf", PatternKind.SEQUENTIAL, agents);

        agents.add("c");

        assertEquals(List.of("a", "b"), workflow.agentNames());
        assertThrows(UnsupportedOperationException.class, () -> workflow.agentNames().add("d"));
    }

    @Test
    @DisplayName("withPattern keeps everything but the pattern")
    void withPattern() {
        var workflow = new WorkflowDescriptor("wf", "desc", PatternKind.DYNAMIC, List.of("a"),
                3, Optional.of("consensus"), Map.of("dynamic-pattern", "parallel"));

        var copy = workflow.withPattern(PatternKind.PARALLEL);

        assertEquals(PatternKind.PARALLEL, copy.pattern());
        assertEquals(workflow.name(), copy.name());
        assertEquals(3, copy.maxIterations());
        assertEquals(Optional.of("consensus"), copy.terminationCondition());
        assertEquals(workflow.metadata(), copy.metadata());
    }
}
