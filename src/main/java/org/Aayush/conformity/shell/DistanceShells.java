package org.Aayush.conformity.shell;

import java.util.List;

/**
 * Reachability shells of one source, ascending by distance.
 *
 * <p>{@link #maxDistance()} is the source's reachability depth used for normalization;
 * it is {@code 0} when nothing is reachable.</p>
 */
public final class DistanceShells {
    private static final DistanceShells EMPTY = new DistanceShells(List.of());

    private final List<DistanceShell> shells;
    private final int maxDistance;
    private final int reachableCount;

    private DistanceShells(List<DistanceShell> shells) {
        this.shells = List.copyOf(shells);
        int max = 0;
        int reachable = 0;
        for (DistanceShell shell : this.shells) {
            max = Math.max(max, shell.distance());
            reachable += shell.size();
        }
        this.maxDistance = max;
        this.reachableCount = reachable;
    }

    static DistanceShells of(List<DistanceShell> shells) {
        return shells.isEmpty() ? EMPTY : new DistanceShells(shells);
    }

    public static DistanceShells empty() {
        return EMPTY;
    }

    public List<DistanceShell> shells() {
        return shells;
    }

    public int maxDistance() {
        return maxDistance;
    }

    /**
     * Returns number of nodes reachable from the source.
     */
    public int reachableCount() {
        return reachableCount;
    }

    public boolean isEmpty() {
        return shells.isEmpty();
    }
}
