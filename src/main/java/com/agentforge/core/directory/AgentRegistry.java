package com.agentforge.core.directory;

import com.agentforge.core.config.AgentforgeProperties;
import com.agentforge.core.model.AgentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link AgentDirectory} of named agents.
 * <p>
 * Configured agents that pass {@link WorkflowValidator#validateAgent} are registered at
 * startup with a {@link SimulatedAgentHandle}; other handles can be registered or replaced at
 * any time. Lookups are safe from concurrent runs.
 */
@Service
public class AgentRegistry implements AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentHashMap<String, Entry> agents = new ConcurrentHashMap<>();

    @Autowired
    public AgentRegistry(AgentforgeProperties properties) {
        for (AgentforgeProperties.Agent agent : properties.getAgents()) {
            AgentDefinition definition;
            try {
                definition = agent.toDefinition();
            } catch (IllegalArgumentException e) {
                log.error("Skipping invalid agent definition {}: {}", agent.getName(), e.getMessage());
                continue;
            }
            List<String> errors = WorkflowValidator.validateAgent(definition);
            if (!errors.isEmpty()) {
                log.error("Skipping invalid agent definition {}: {}", definition.name(), errors);
                continue;
            }
            register(definition);
        }
        log.info("Agent registry loaded {} agents", agents.size());
    }

    public AgentRegistry() {
    }

    /**
     * Registers a configured agent backed by a {@link SimulatedAgentHandle}.
     */
    public void register(AgentDefinition definition) {
        register(definition, new SimulatedAgentHandle(definition));
    }

    public void register(AgentDefinition definition, AgentHandle handle) {
        Entry previous = agents.put(definition.name(), new Entry(definition, handle));
        if (previous != null) {
            log.info("Replaced agent {}", definition.name());
        } else {
            log.debug("Registered agent {} ({})", definition.name(), definition.role());
        }
    }

    /**
     * Registers a bare handle under {@code name} with a default definition.
     */
    public void register(String name, AgentHandle handle) {
        register(new AgentDefinition(name, null, null, null, null, 0.7, null, null), handle);
    }

    public boolean remove(String name) {
        return agents.remove(name) != null;
    }

    @Override
    public Optional<AgentHandle> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(name)).map(Entry::handle);
    }

    public Optional<AgentDefinition> definition(String name) {
        return Optional.ofNullable(agents.get(name)).map(Entry::definition);
    }

    /** Definitions sorted by name. */
    public List<AgentDefinition> definitions() {
        List<AgentDefinition> result = new ArrayList<>();
        agents.values().forEach(entry -> result.add(entry.definition()));
        result.sort(Comparator.comparing(AgentDefinition::name));
        return result;
    }

    public int size() {
        return agents.size();
    }

    private record Entry(AgentDefinition definition, AgentHandle handle) {}
}
