package com.planwright.agent;

/**
 * Executes a single task. Implementations may block for as long as the task takes;
 * the orchestration loop calls them from worker threads, never from its coordinator.
 * Failures are reported in the result, not thrown.
 */
public interface AgentRunner {

    AgentResult run(AgentRequest request);
}
