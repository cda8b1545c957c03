package com.planwright.core.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.planwright.core.model.ErrorKind;

import java.util.Map;

/**
 * Reply to a {@link ControlRequest}. Exactly one of {@code data} and {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlResponse(
    int protocolVersion,
    String id,
    boolean success,
    Map<String, Object> data,
    ErrorBody error
) {

    public record ErrorBody(String code, String message) {}

    public static ControlResponse ok(String id, Map<String, Object> data) {
        return new ControlResponse(ControlDispatcher.PROTOCOL_VERSION, id, true, data, null);
    }

    public static ControlResponse failure(String id, ErrorKind kind, String message) {
        return new ControlResponse(ControlDispatcher.PROTOCOL_VERSION, id, false, null,
                new ErrorBody(kind.name(), message));
    }

    public boolean hasError(ErrorKind kind) {
        return error != null && kind.name().equals(error.code());
    }
}
