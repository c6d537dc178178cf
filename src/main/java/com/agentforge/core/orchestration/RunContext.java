package com.agentforge.core.orchestration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Transient state of one run, owned by the strategy executing it. Not thread-safe; only the
 * run's producer thread touches it.
 */
public final class RunContext {

    private final String runId;
    private final String userId;
    private final String originalInput;
    private final List<String> workerResults = new ArrayList<>();
    private String currentContent;

    public RunContext(String runId, String userId, String input) {
        this.runId = runId;
        this.userId = userId;
        this.originalInput = input;
        this.currentContent = input;
    }

    public String runId() { return runId; }
    public String userId() { return userId; }
    public String originalInput() { return originalInput; }

    public String currentContent() { return currentContent; }
    public void setCurrentContent(String content) { this.currentContent = content; }

    public void addWorkerResult(String result) { workerResults.add(result); }
    public List<String> workerResults() { return Collections.unmodifiableList(workerResults); }
}
