package com.agentforge.core.directory;

import com.agentforge.core.config.AgentforgeProperties;
import com.agentforge.core.model.WorkflowDescriptor;
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
 * Named workflows available to runs. Configured workflows failing
 * {@link WorkflowValidator#validateStructure} are logged and skipped; unregistered agent names
 * only produce a warning.
 */
@Service
public class WorkflowRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRegistry.class);

    private final ConcurrentHashMap<String, WorkflowDescriptor> workflows = new ConcurrentHashMap<>();

    @Autowired
    public WorkflowRegistry(AgentforgeProperties properties, AgentDirectory agents) {
        for (AgentforgeProperties.Workflow workflow : properties.getWorkflows()) {
            WorkflowDescriptor descriptor;
            try {
                descriptor = workflow.toDescriptor();
            } catch (IllegalArgumentException e) {
                log.error("Skipping invalid workflow {}: {}", workflow.getName(), e.getMessage());
                continue;
            }
            List<String> errors = WorkflowValidator.validateStructure(descriptor);
            if (!errors.isEmpty()) {
                log.error("Skipping invalid workflow {}: {}", descriptor.name(), errors);
                continue;
            }
            List<String> missing = WorkflowValidator.missingAgents(descriptor, name -> agents.lookup(name).isPresent());
            if (!missing.isEmpty()) {
                log.warn("Workflow {} references unregistered agents: {}", descriptor.name(), missing);
            }
            register(descriptor);
        }
        log.info("Workflow registry loaded {} workflows", workflows.size());
    }

    public WorkflowRegistry() {
    }

    public void register(WorkflowDescriptor workflow) {
        workflows.put(workflow.name(), workflow);
        log.debug("Registered workflow {} [{}] with agents {}",
                workflow.name(), workflow.pattern(), workflow.agentNames());
    }

    public Optional<WorkflowDescriptor> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(workflows.get(name));
    }

    /** Workflows sorted by name. */
    public List<WorkflowDescriptor> list() {
        List<WorkflowDescriptor> result = new ArrayList<>(workflows.values());
        result.sort(Comparator.comparing(WorkflowDescriptor::name));
        return result;
    }
}
