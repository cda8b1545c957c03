package com.planwright.core.events;

import com.planwright.core.model.Task;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds payloads for task events. Every event that changes a task carries the
 * task's resulting status, retry count and last error so the log alone can rebuild
 * the snapshot.
 */
public final class TaskPayloads {

    private TaskPayloads() {}

    public static Map<String, Object> of(Task task) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", task.status().wireName());
        payload.put("retryCount", task.retryCount());
        if (task.lastError() != null) {
            payload.put("lastError", task.lastError());
        }
        return payload;
    }

    public static Map<String, Object> of(Task task, String key, Object value) {
        var payload = of(task);
        payload.put(key, value);
        return payload;
    }
}
