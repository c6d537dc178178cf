package com.agentforge.core.orchestration;

import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;

/**
 * Reads the pattern from the workflow's {@code dynamic-pattern} metadata entry, defaulting
 * to {@link PatternKind#SEQUENTIAL}.
 */
public class MetadataPatternSelector implements PatternSelector {

    public static final String METADATA_KEY = "dynamic-pattern";

    private final PatternKind fallback;

    public MetadataPatternSelector() {
        this(PatternKind.SEQUENTIAL);
    }

    public MetadataPatternSelector(PatternKind fallback) {
        this.fallback = fallback;
    }

    @Override
    public PatternKind select(WorkflowDescriptor workflow, String input) {
        String configured = workflow.metadata().get(METADATA_KEY);
        if (configured == null || configured.isBlank()) {
            return fallback;
        }
        return PatternKind.fromTag(configured)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown pattern '" + configured + "' in " + METADATA_KEY + " of workflow " + workflow.name()));
    }
}
