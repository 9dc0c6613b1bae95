package org.Aayush.conformity.shell;

import java.util.Arrays;

/**
 * Nodes at one time-respecting distance from a source.
 *
 * <p>Equality compares distance and node contents.</p>
 *
 * @param distance positive integer distance.
 * @param nodes node indices of the shell, non-empty and ascending.
 */
public record DistanceShell(int distance, int[] nodes) {
    public DistanceShell {
        if (distance <= 0) {
            throw new IllegalArgumentException("shell distance must be > 0, got " + distance);
        }
        if (nodes == null || nodes.length == 0) {
            throw new IllegalArgumentException("shell at distance " + distance + " must be non-empty");
        }
        nodes = nodes.clone();
    }

    /**
     * Returns a defensive copy of the shell nodes.
     */
    @Override
    public int[] nodes() {
        return nodes.clone();
    }

    public int size() {
        return nodes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DistanceShell)) {
            return false;
        }
        DistanceShell other = (DistanceShell) o;
        return distance == other.distance && Arrays.equals(nodes, other.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(distance) + Arrays.hashCode(nodes);
    }

    @Override
    public String toString() {
        return "DistanceShell(distance=" + distance + ", nodes=" + Arrays.toString(nodes) + ")";
    }
}
