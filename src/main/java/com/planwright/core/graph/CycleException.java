package com.planwright.core.graph;

import java.util.List;

/**
 * Thrown when the dependency relation contains a cycle. The path lists the cycle
 * in traversal order with the first id repeated at the end.
 */
public class CycleException extends RuntimeException {

    private final List<String> path;

    public CycleException(List<String> path) {
        super("Dependency cycle: " + String.join(" -> ", path));
        this.path = List.copyOf(path);
    }

    public List<String> path() {
        return path;
    }
}
