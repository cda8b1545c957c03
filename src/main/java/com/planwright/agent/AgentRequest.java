package com.planwright.agent;

import java.util.Set;

/**
 * Everything an agent needs to work on one task.
 *
 * @param planId         plan the task belongs to
 * @param taskId         task id, e.g. "3.1"
 * @param description    what the agent should do
 * @param fileReferences files the task is expected to touch
 * @param attempt        1 for the first attempt, 2+ for retries
 */
public record AgentRequest(
    String planId,
    String taskId,
    String description,
    Set<String> fileReferences,
    int attempt
) {}
