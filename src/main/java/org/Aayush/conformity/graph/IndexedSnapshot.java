package org.Aayush.conformity.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;
import org.Aayush.conformity.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Dense, immutable copy of one {@link GraphSnapshot}.
 *
 * <p>Node ids are mapped to {@code 0..nodeCount-1}, neighbors are stored as
 * deduplicated adjacency arrays and the requested label values are copied into one
 * array per label. Building the index validates the provider's data once, so the
 * scoring code never has to re-check it and may read the index from many threads.</p>
 */
public final class IndexedSnapshot {
    private static final int UNKNOWN_LABEL = -1;

    @Getter
    @Accessors(fluent = true)
    private final IDMapper nodeIds;
    private final int[][] neighbors;
    // [labelIndex][node]
    private final String[][] values;
    private final List<String> labels;
    private final Object2IntOpenHashMap<String> labelIndex;

    private IndexedSnapshot(IDMapper nodeIds, int[][] neighbors, String[][] values, List<String> labels) {
        this.nodeIds = nodeIds;
        this.neighbors = neighbors;
        this.values = values;
        this.labels = List.copyOf(labels);
        this.labelIndex = new Object2IntOpenHashMap<>(labels.size());
        this.labelIndex.defaultReturnValue(UNKNOWN_LABEL);
        for (int i = 0; i < labels.size(); i++) {
            labelIndex.put(labels.get(i), i);
        }
    }

    /**
     * Indexes a provider snapshot for the given labels.
     *
     * @param snapshot provider snapshot.
     * @param labels labels whose values must be present on every node.
     * @return immutable index.
     * @throws ConformityException with an upstream-data reason code on inconsistent snapshots
     * or when the snapshot view itself fails.
     */
    public static IndexedSnapshot index(GraphSnapshot snapshot, List<String> labels) {
        if (snapshot == null) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_SNAPSHOT_UNAVAILABLE,
                    "snapshot provider returned no snapshot"
            );
        }
        Objects.requireNonNull(labels, "labels");
        try {
            return read(snapshot, labels);
        } catch (ConformityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_SNAPSHOT_UNAVAILABLE,
                    "snapshot provider failed while indexing: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static IndexedSnapshot read(GraphSnapshot snapshot, List<String> labels) {
        Collection<String> nodes = snapshot.nodes();
        if (nodes == null) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_SNAPSHOT_UNAVAILABLE,
                    "snapshot provider returned no node set"
            );
        }
        final IDMapper nodeIds;
        try {
            nodeIds = IDMapper.denseOf(nodes);
        } catch (IllegalArgumentException ex) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_DUPLICATE_SNAPSHOT_NODE,
                    "snapshot node set is not a set of distinct non-null ids: " + ex.getMessage(),
                    ex
            );
        }

        int nodeCount = nodeIds.size();
        int[][] neighbors = new int[nodeCount][];
        String[][] values = new String[labels.size()][nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            String nodeId = nodeIds.toExternal(node);
            neighbors[node] = indexNeighbors(snapshot, nodeIds, nodeId);
            for (int label = 0; label < labels.size(); label++) {
                String value = snapshot.attribute(nodeId, labels.get(label));
                if (value == null) {
                    throw ConformityException.upstream(
                            ConformityCore.REASON_LABEL_VALUE_MISSING,
                            "node " + nodeId + " has no value for label " + labels.get(label)
                    );
                }
                values[label][node] = value;
            }
        }
        return new IndexedSnapshot(nodeIds, neighbors, values, labels);
    }

    private static int[] indexNeighbors(GraphSnapshot snapshot, IDMapper nodeIds, String nodeId) {
        Collection<String> raw = snapshot.neighbors(nodeId);
        if (raw == null || raw.isEmpty()) {
            return new int[0];
        }
        IntArrayList ordered = new IntArrayList(raw.size());
        IntOpenHashSet seen = new IntOpenHashSet(raw.size());
        for (String neighbor : raw) {
            if (neighbor == null || !nodeIds.containsExternal(neighbor)) {
                throw ConformityException.upstream(
                        ConformityCore.REASON_UNKNOWN_NEIGHBOR,
                        "neighbor " + neighbor + " of node " + nodeId + " is not part of the snapshot"
                );
            }
            int neighborId = nodeIds.toInternal(neighbor);
            if (seen.add(neighborId)) {
                ordered.add(neighborId);
            }
        }
        return ordered.toIntArray();
    }

    public int nodeCount() {
        return neighbors.length;
    }

    /**
     * Returns the indexed labels in request order.
     */
    public List<String> labels() {
        return labels;
    }

    /**
     * Returns the position of a label in {@link #labels()}.
     *
     * @throws IllegalArgumentException when the label was not indexed.
     */
    public int labelIndex(String label) {
        int index = labelIndex.getInt(label);
        if (index == UNKNOWN_LABEL) {
            throw new IllegalArgumentException("label not indexed: " + label);
        }
        return index;
    }

    /**
     * Returns the value of an indexed label for a node.
     */
    public String value(int labelIndex, int node) {
        return values[labelIndex][node];
    }

    /**
     * Returns neighbor count of a node.
     */
    public int degree(int node) {
        return neighbors[node].length;
    }

    /**
     * Returns the i-th neighbor of a node.
     */
    public int neighbor(int node, int i) {
        return neighbors[node][i];
    }

    /**
     * Returns the snapshot node ids in index order.
     */
    public List<String> nodeIdList() {
        List<String> ids = new ArrayList<>(nodeCount());
        for (int node = 0; node < nodeCount(); node++) {
            ids.add(nodeIds.toExternal(node));
        }
        return ids;
    }
}
