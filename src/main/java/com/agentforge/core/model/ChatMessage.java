package com.agentforge.core.model;

/**
 * One message of a conversation handed to a run. Only the content of the last message is
 * fed to the agents.
 *
 * @param role    author role, e.g. "user" or "assistant"
 * @param content message text
 */
public record ChatMessage(String role, String content) {}
