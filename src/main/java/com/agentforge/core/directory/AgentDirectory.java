package com.agentforge.core.directory;

import java.util.Optional;

/**
 * Read-only lookup from agent name to handle. Implementations must tolerate concurrent
 * lookups from independent runs.
 */
@FunctionalInterface
public interface AgentDirectory {

    Optional<AgentHandle> lookup(String name);
}
