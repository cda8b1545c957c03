package com.planwright.core.model;

import java.util.List;

/**
 * A restriction on which ready tasks may run together.
 *
 * @param kind    constraint kind
 * @param groupId sequential group id, or the id of the task holding the contested file
 * @param members affected task ids, in declared order for sequential groups
 * @param reason  human-readable explanation
 */
public record ExecutionConstraint(
    Kind kind,
    String groupId,
    List<String> members,
    String reason
) {

    public enum Kind { SEQUENTIAL, FILE_CONFLICT }

    public ExecutionConstraint {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static ExecutionConstraint sequential(String groupId, List<String> members, String reason) {
        return new ExecutionConstraint(Kind.SEQUENTIAL, groupId, members, reason);
    }

    public static ExecutionConstraint fileConflict(String holderId, List<String> members, String file) {
        return new ExecutionConstraint(Kind.FILE_CONFLICT, holderId, members,
                "shared file " + file);
    }
}
