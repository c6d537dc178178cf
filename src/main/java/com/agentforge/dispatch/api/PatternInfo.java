package com.agentforge.dispatch.api;

/**
 * JSON entry of GET /api/v1/patterns.
 *
 * @param pattern   pattern tag
 * @param supported whether a strategy is registered for it
 */
public record PatternInfo(String pattern, boolean supported) {}
