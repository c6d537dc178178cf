package com.agentforge.dispatch.api;

import com.agentforge.core.model.ChatMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/workflows/{name}/runs.
 *
 * @param userId   issuing user; nullable, defaults to "anonymous"
 * @param input    text fed to the agents; ignored when {@code messages} is non-empty
 * @param messages conversation whose last message is fed to the agents; nullable
 * @param pattern  pattern tag overriding the workflow's own pattern for this run; nullable
 */
public record RunRequest(
    @JsonProperty("user_id") String userId,
    String input,
    List<ChatMessage> messages,
    String pattern
) {}
