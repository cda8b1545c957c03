package com.planwright.agent;

import java.util.List;

/**
 * @param success   true when the agent reports the task done
 * @param artifacts files or other outputs the agent reported
 * @param error     failure description when not successful
 * @param output    tail of the agent's console output, may be empty
 */
public record AgentResult(boolean success, List<String> artifacts, String error, String output) {

    public AgentResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        output = output == null ? "" : output;
    }

    public static AgentResult success(List<String> artifacts) {
        return new AgentResult(true, artifacts, null, "");
    }

    public static AgentResult failure(String error) {
        return new AgentResult(false, List.of(), error, "");
    }
}
