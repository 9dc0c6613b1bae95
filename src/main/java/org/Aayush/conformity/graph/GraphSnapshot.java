package org.Aayush.conformity.graph;

import java.util.Collection;

/**
 * Static view of a dynamic graph over one temporal range.
 */
public interface GraphSnapshot {

    /**
     * Returns the nodes present in the snapshot.
     */
    Collection<String> nodes();

    /**
     * Returns the categorical value of one label for a node, or {@code null} when absent.
     */
    String attribute(String node, String label);

    /**
     * Returns the direct neighbors of a node inside the snapshot.
     */
    Collection<String> neighbors(String node);
}
