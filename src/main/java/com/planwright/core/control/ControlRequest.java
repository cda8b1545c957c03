package com.planwright.core.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One control message from an external controller.
 *
 * @param protocolVersion sender's protocol version, assumed current when absent
 * @param id              request id used for de-duplication; assigned by the server when absent
 * @param planId          target plan; may be omitted while exactly one run is active
 * @param command         command name, e.g. {@code pause} or {@code retryTask}
 * @param payload         command arguments such as {@code taskId} or {@code batchSize}
 * @param timestamp       when the controller sent the request
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlRequest(
    Integer protocolVersion,
    String id,
    String planId,
    String command,
    Map<String, Object> payload,
    Instant timestamp
) {

    public ControlRequest {
        payload = payload == null ? Map.of() : payload;
    }

    public static ControlRequest of(String planId, String command, Map<String, Object> payload) {
        return new ControlRequest(ControlDispatcher.PROTOCOL_VERSION, null, planId, command, payload, Instant.now());
    }

    public ControlRequest withId(String newId) {
        return new ControlRequest(protocolVersion, newId, planId, command, payload, timestamp);
    }
}
