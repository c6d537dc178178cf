package com.agentforge.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One unit of a run's output stream.
 *
 * @param kind           what this event reports
 * @param sourceAgent    agent the event relates to (nullable for run-level events)
 * @param payload        human-readable text or agent output
 * @param sequenceNumber position within the run, starting at 1 and strictly increasing
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrchestrationEvent(
    EventKind kind,
    @JsonProperty("source_agent") String sourceAgent,
    String payload,
    @JsonProperty("sequence_number") long sequenceNumber
) implements Serializable {}
