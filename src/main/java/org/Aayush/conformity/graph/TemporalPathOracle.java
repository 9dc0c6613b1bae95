package org.Aayush.conformity.graph;

/**
 * Time-respecting path oracle.
 *
 * <p>Implementations enumerate the valid temporal paths of a snapshot and classify them
 * by {@link PathPolicy}. The conformity core only reads the resulting distances.</p>
 */
@FunctionalInterface
public interface TemporalPathOracle {

    /**
     * Computes policy distances for every ordered reachable pair of the snapshot.
     *
     * @param snapshot snapshot materialized for {@code [from, to]}.
     * @param from first temporal id of the window.
     * @param to last temporal id of the window.
     * @return pair distances keyed by policy.
     */
    PathDistances distances(GraphSnapshot snapshot, long from, long to);
}
