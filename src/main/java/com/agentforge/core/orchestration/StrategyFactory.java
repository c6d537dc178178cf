package com.agentforge.core.orchestration;

import com.agentforge.core.directory.AgentDirectory;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Registration table from {@link PatternKind} to strategy constructor. A pattern without an
 * entry is unsupported.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    @FunctionalInterface
    interface StrategyConstructor {
        OrchestrationStrategy create(WorkflowDescriptor workflow, AgentDirectory directory, OrchestrationRuntime runtime);
    }

    private final OrchestrationRuntime runtime;
    private final Map<PatternKind, StrategyConstructor> registrations = new EnumMap<>(PatternKind.class);

    public StrategyFactory(OrchestrationRuntime runtime, PatternSelector selector) {
        this.runtime = runtime;
        registrations.put(PatternKind.SEQUENTIAL, SequentialStrategy::new);
        registrations.put(PatternKind.PARALLEL, ParallelStrategy::new);
        registrations.put(PatternKind.HIERARCHICAL, HierarchicalStrategy::new);
        registrations.put(PatternKind.DYNAMIC,
                (workflow, directory, rt) -> new DynamicStrategy(workflow, directory, this, selector));
        log.info("Registered orchestration patterns: {}", registrations.keySet());
    }

    public boolean isSupported(PatternKind pattern) {
        return pattern != null && registrations.containsKey(pattern);
    }

    public Set<PatternKind> supportedPatterns() {
        return Collections.unmodifiableSet(registrations.keySet());
    }

    /**
     * @throws UnsupportedPatternException if {@code pattern} has no registered strategy
     */
    public OrchestrationStrategy createStrategy(PatternKind pattern, AgentDirectory directory,
                                                WorkflowDescriptor workflow) {
        StrategyConstructor constructor = pattern != null ? registrations.get(pattern) : null;
        if (constructor == null) {
            throw new UnsupportedPatternException(pattern);
        }
        return constructor.create(workflow, directory, runtime);
    }

    OrchestrationRuntime runtime() {
        return runtime;
    }
}
