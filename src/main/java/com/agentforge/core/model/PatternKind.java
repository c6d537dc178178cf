package com.agentforge.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Coordination patterns a workflow can name.
 * <p>
 * SEQUENTIAL, PARALLEL and HIERARCHICAL have concrete strategies. DYNAMIC re-selects one of
 * those per run. DEBATE, PLANNER_EXECUTOR and REASONER may appear in configuration but have
 * no strategy, so running them yields an unsupported-pattern error event.
 */
public enum PatternKind {
    SEQUENTIAL("sequential"),
    PARALLEL("parallel"),
    HIERARCHICAL("hierarchical"),
    DYNAMIC("dynamic"),
    DEBATE("debate"),
    PLANNER_EXECUTOR("planner_executor"),
    REASONER("reasoner");

    private final String tag;

    PatternKind(String tag) {
        this.tag = tag;
    }

    /** Lower-case tag used in configuration, event payloads and the REST API. */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a pattern from its tag or enum name, ignoring case.
     */
    public static Optional<PatternKind> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return tag;
    }
}
