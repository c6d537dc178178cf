package com.agentforge.core.orchestration;

import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;

/**
 * Chooses the concrete pattern a {@link DynamicStrategy} runs for one invocation.
 */
@FunctionalInterface
public interface PatternSelector {

    PatternKind select(WorkflowDescriptor workflow, String input);
}
