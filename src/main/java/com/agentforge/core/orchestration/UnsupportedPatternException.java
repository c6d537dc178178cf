package com.agentforge.core.orchestration;

import com.agentforge.core.model.PatternKind;

/**
 * Raised by {@link StrategyFactory} when no strategy is registered for a pattern.
 */
public class UnsupportedPatternException extends RuntimeException {

    private final transient PatternKind pattern;

    public UnsupportedPatternException(PatternKind pattern) {
        super(describe(pattern));
        this.pattern = pattern;
    }

    public PatternKind pattern() {
        return pattern;
    }

    /** Payload of the error event reported for an unsupported pattern. */
    public static String describe(PatternKind pattern) {
        return "Orchestration pattern '" + pattern + "' not supported";
    }
}
