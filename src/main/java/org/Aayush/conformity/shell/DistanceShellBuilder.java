package org.Aayush.conformity.shell;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;
import org.Aayush.conformity.core.id.IDMapper;
import org.Aayush.conformity.graph.IndexedSnapshot;
import org.Aayush.conformity.graph.PathDistances;
import org.Aayush.conformity.graph.PathPolicy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups the nodes reachable from a source into shells keyed by distance.
 */
public final class DistanceShellBuilder {

    /**
     * Builds the shells of one source.
     *
     * <p>Entries with distance {@code <= 0} never form a shell. Unreachable nodes are simply
     * absent from the input.</p>
     *
     * @param distancesFromSource target node -> distance.
     * @return shells ascending by distance.
     */
    public DistanceShells build(Int2IntMap distancesFromSource) {
        Objects.requireNonNull(distancesFromSource, "distancesFromSource");
        Int2ObjectRBTreeMap<IntArrayList> byDistance = new Int2ObjectRBTreeMap<>();
        for (Int2IntMap.Entry entry : distancesFromSource.int2IntEntrySet()) {
            int distance = entry.getIntValue();
            if (distance <= 0) {
                continue;
            }
            IntArrayList nodes = byDistance.get(distance);
            if (nodes == null) {
                nodes = new IntArrayList();
                byDistance.put(distance, nodes);
            }
            nodes.add(entry.getIntKey());
        }
        if (byDistance.isEmpty()) {
            return DistanceShells.empty();
        }
        List<DistanceShell> shells = new ArrayList<>(byDistance.size());
        for (Int2ObjectMap.Entry<IntArrayList> entry : byDistance.int2ObjectEntrySet()) {
            int[] nodes = entry.getValue().toIntArray();
            Arrays.sort(nodes);
            shells.add(new DistanceShell(entry.getIntKey(), nodes));
        }
        return DistanceShells.of(shells);
    }

    /**
     * Extracts the selected policy's distances and builds the shells of every snapshot node.
     *
     * @param snapshot indexed window snapshot.
     * @param distances oracle answer for the same window.
     * @param policy path policy whose distance is used.
     * @return shells indexed by source node.
     * @throws ConformityException with an upstream-data reason code when the oracle answer
     * does not match the snapshot.
     */
    public DistanceShells[] buildAll(IndexedSnapshot snapshot, PathDistances distances, PathPolicy policy) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(distances, "distances");
        Objects.requireNonNull(policy, "policy");

        IDMapper nodeIds = snapshot.nodeIds();
        Int2IntOpenHashMap[] bySource = new Int2IntOpenHashMap[snapshot.nodeCount()];
        for (PathDistances.NodePair pair : distances.pairs()) {
            int source = resolve(nodeIds, pair.source(), pair);
            int target = resolve(nodeIds, pair.target(), pair);
            Map<PathPolicy, Integer> policies = distances.policies(pair.source(), pair.target());
            Integer distance = policies.get(policy);
            if (distance == null) {
                throw ConformityException.upstream(
                        ConformityCore.REASON_POLICY_DISTANCE_MISSING,
                        "no " + policy.id() + " distance for pair " + pair.source() + " -> " + pair.target()
                );
            }
            if (distance < 0) {
                throw ConformityException.upstream(
                        ConformityCore.REASON_NEGATIVE_DISTANCE,
                        "negative " + policy.id() + " distance " + distance
                                + " for pair " + pair.source() + " -> " + pair.target()
                );
            }
            if (source == target || distance == 0) {
                continue;
            }
            if (bySource[source] == null) {
                bySource[source] = new Int2IntOpenHashMap();
            }
            bySource[source].put(target, distance.intValue());
        }

        DistanceShells[] shells = new DistanceShells[snapshot.nodeCount()];
        for (int node = 0; node < shells.length; node++) {
            shells[node] = bySource[node] == null ? DistanceShells.empty() : build(bySource[node]);
        }
        return shells;
    }

    private static int resolve(IDMapper nodeIds, String nodeId, PathDistances.NodePair pair) {
        if (!nodeIds.containsExternal(nodeId)) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_UNKNOWN_PAIR_NODE,
                    "distance reported for pair " + pair.source() + " -> " + pair.target()
                            + " but " + nodeId + " is not part of the snapshot"
            );
        }
        return nodeIds.toInternal(nodeId);
    }
}
