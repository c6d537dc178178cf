package com.agentforge.core.directory;

import com.agentforge.core.model.AgentDefinition;
import com.agentforge.core.model.AgentRole;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in agent definitions that configured agents can start from with
 * {@code template: <name>}. Fields set on the agent entry override the template's.
 */
public final class AgentTemplates {

    private static final Map<String, AgentDefinition> TEMPLATES = new LinkedHashMap<>();

    static {
        add("critic", AgentRole.CRITIC,
                "Analyzes content and gives constructive feedback",
                "Review the content objectively. Name its strengths and weaknesses, suggest concrete "
                        + "improvements and rate it from 1 to 10.");
        add("writer", AgentRole.WRITER,
                "Produces clear, well-structured written content",
                "Work out the topic and the audience, then write clear and engaging content. "
                        + "Incorporate any feedback you are given.");
        add("researcher", AgentRole.RESEARCHER,
                "Gathers and synthesizes information",
                "Collect the relevant facts and data on the topic and summarize the findings, "
                        + "citing sources where possible.");
        add("planner", AgentRole.PLANNER,
                "Breaks goals down into plans and tasks",
                "Restate the objective, split it into ordered, actionable steps and note the "
                        + "dependencies between them.");
        add("executor", AgentRole.EXECUTOR,
                "Carries out plans and reports results",
                "Follow the plan step by step and report the result of each step, including any "
                        + "step that failed.");
    }

    private AgentTemplates() {}

    private static void add(String name, AgentRole role, String description, String instructions) {
        TEMPLATES.put(name, new AgentDefinition(name, role, description, instructions, null, 0.7, null, null));
    }

    public static Optional<AgentDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(TEMPLATES.get(name));
    }

    /** Templates in catalogue order. */
    public static List<AgentDefinition> all() {
        return new ArrayList<>(TEMPLATES.values());
    }
}
