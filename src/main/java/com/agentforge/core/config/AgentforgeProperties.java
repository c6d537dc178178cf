package com.agentforge.core.config;

import com.agentforge.core.directory.AgentTemplates;
import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.AgentRole;
import com.agentforge.core.model.PatternKind;
import com.agentforge.core.model.WorkflowDescriptor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "agentforge")
public class AgentforgeProperties {

    private Orchestration orchestration = new Orchestration();
    private List<Agent> agents = new ArrayList<>();
    private List<Workflow> workflows = new ArrayList<>();

    // -- Orchestration accessors (delegate to nested) --
    public Duration getInvocationTimeout() { return orchestration.invocationTimeout; }
    public int getMaxParallel() { return orchestration.maxParallel; }
    public int getStreamBufferSize() { return orchestration.streamBufferSize; }

    public Orchestration getOrchestration() { return orchestration; }
    public void setOrchestration(Orchestration orchestration) { this.orchestration = orchestration; }
    public List<Agent> getAgents() { return agents; }
    public void setAgents(List<Agent> agents) { this.agents = agents; }
    public List<Workflow> getWorkflows() { return workflows; }
    public void setWorkflows(List<Workflow> workflows) { this.workflows = workflows; }

    public static class Orchestration {
        /** Per agent invocation; zero disables the timeout. */
        private Duration invocationTimeout = Duration.ZERO;
        private int maxParallel = 4;
        private int streamBufferSize = 16;

        public Duration getInvocationTimeout() { return invocationTimeout; }
        public void setInvocationTimeout(Duration invocationTimeout) { this.invocationTimeout = invocationTimeout; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getStreamBufferSize() { return streamBufferSize; }
        public void setStreamBufferSize(int streamBufferSize) { this.streamBufferSize = streamBufferSize; }
    }

    public static class Agent {
        private String name;
        private String template;
        private String role;
        private String description;
        private String instructions;
        private String modelId;
        private Double temperature;
        private Integer maxTokens;
        private List<String> tools = new ArrayList<>();

        /**
         * Builds the definition, starting from {@link #template} when one is named. Unset
         * fields fall back to the template, then to the defaults.
         *
         * @throws IllegalArgumentException for an unknown template or role, or a missing name
         */
        public AgentDefinition toDefinition() {
            AgentDefinition base = null;
            if (template != null && !template.isBlank()) {
                base = AgentTemplates.find(template.trim())
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown agent template '" + template + "' for agent " + name));
            }
            AgentRole agentRole = isSet(role)
                    ? AgentRole.valueOf(role.trim().toUpperCase(Locale.ROOT))
                    : base != null ? base.role() : AgentRole.CUSTOM;
            return new AgentDefinition(
                    isSet(name) ? name : base != null ? base.name() : null,
                    agentRole,
                    isSet(description) ? description : base != null ? base.description() : "",
                    isSet(instructions) ? instructions : base != null ? base.instructions() : "",
                    modelId,
                    temperature != null ? temperature : base != null ? base.temperature() : 0.7,
                    maxTokens,
                    tools);
        }

        private static boolean isSet(String value) {
            return value != null && !value.isBlank();
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getTemplate() { return template; }
        public void setTemplate(String template) { this.template = template; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getInstructions() { return instructions; }
        public void setInstructions(String instructions) { this.instructions = instructions; }
        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }
        public Double getTemperature() { return temperature; }
        public void setTemperature(Double temperature) { this.temperature = temperature; }
        public Integer getMaxTokens() { return maxTokens; }
        public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
    }

    public static class Workflow {
        private String name;
        private String description = "";
        private String pattern;
        private List<String> agents = new ArrayList<>();
        private int maxIterations = WorkflowDescriptor.DEFAULT_MAX_ITERATIONS;
        private String terminationCondition;
        private Map<String, String> metadata = new LinkedHashMap<>();

        /**
         * @throws IllegalArgumentException for an unknown pattern tag or an invalid workflow
         */
        public WorkflowDescriptor toDescriptor() {
            PatternKind kind = PatternKind.fromTag(pattern)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown orchestration pattern '" + pattern + "' in workflow " + name));
            return new WorkflowDescriptor(name, description, kind, agents, maxIterations,
                    Optional.ofNullable(terminationCondition).filter(s -> !s.isBlank()), metadata);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public List<String> getAgents() { return agents; }
        public void setAgents(List<String> agents) { this.agents = agents; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public String getTerminationCondition() { return terminationCondition; }
        public void setTerminationCondition(String terminationCondition) { this.terminationCondition = terminationCondition; }
        public Map<String, String> getMetadata() { return metadata; }
        public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
    }
}
