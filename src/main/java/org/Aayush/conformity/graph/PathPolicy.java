package org.Aayush.conformity.graph;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Time-respecting path classification used to pick one distance per node pair.
 */
public enum PathPolicy {
    SHORTEST("shortest"),
    FASTEST("fastest"),
    FOREMOST("foremost"),
    FASTEST_SHORTEST("fastest_shortest"),
    SHORTEST_FASTEST("shortest_fastest");

    private final String id;

    PathPolicy(String id) {
        this.id = id;
    }

    /**
     * Returns stable lower-case policy id (for example {@code fastest_shortest}).
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a policy from its stable id.
     *
     * @throws IllegalArgumentException when the id is unknown.
     */
    public static PathPolicy fromId(String id) {
        if (id != null) {
            String normalized = id.trim();
            for (PathPolicy policy : values()) {
                if (policy.id.equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("unknown path policy '" + id + "', expected one of "
                + Arrays.stream(values()).map(PathPolicy::id).collect(Collectors.joining(", ")));
    }
}
