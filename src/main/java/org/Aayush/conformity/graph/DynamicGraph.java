package org.Aayush.conformity.graph;

import java.util.Collection;

/**
 * Time-evolving graph contract consumed by the conformity core.
 *
 * <p>The core never mutates a graph. It only asks for the temporal index, to derive
 * sliding-window starts, and for static snapshots of a temporal range.</p>
 */
public interface DynamicGraph {

    /**
     * Returns every node known to the graph across its whole temporal span.
     */
    Collection<String> nodes();

    /**
     * Returns the known temporal snapshot ids in strictly increasing order.
     */
    long[] temporalSnapshotIds();

    /**
     * Materializes a static view of the interactions active in {@code [from, to]}.
     *
     * @param from first temporal id of the range (inclusive).
     * @param to last temporal id of the range (inclusive).
     * @return snapshot view; never {@code null} for a well-behaved provider.
     */
    GraphSnapshot timeSlice(long from, long to);
}
