package org.Aayush.conformity.shell;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;
import org.Aayush.conformity.graph.IndexedSnapshot;
import org.Aayush.conformity.graph.PathDistances;
import org.Aayush.conformity.graph.PathPolicy;
import org.Aayush.conformity.testutil.InMemoryDynamicGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distance shells")
class DistanceShellBuilderTest {

    private final DistanceShellBuilder builder = new DistanceShellBuilder();
    private IndexedSnapshot snapshot;

    @BeforeEach
    void setUp() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph()
                .node("A", "l", "x")
                .node("B", "l", "x")
                .node("C", "l", "y")
                .node("D", "l", "y")
                .interaction("A", "B", 0, 5)
                .interaction("B", "C", 0, 5);
        snapshot = IndexedSnapshot.index(graph.timeSlice(0, 5), List.of("l"));
    }

    @Test
    @DisplayName("Targets group by distance with ascending shells and sorted members")
    void testGroupsByDistance() {
        Int2IntOpenHashMap distances = new Int2IntOpenHashMap();
        distances.put(7, 3);
        distances.put(2, 1);
        distances.put(5, 3);
        distances.put(4, 1);
        distances.put(9, 0);
        distances.put(8, -2);

        DistanceShells shells = builder.build(distances);

        assertEquals(2, shells.shells().size());
        assertEquals(1, shells.shells().get(0).distance());
        assertArrayEquals(new int[]{2, 4}, shells.shells().get(0).nodes());
        assertEquals(3, shells.shells().get(1).distance());
        assertArrayEquals(new int[]{5, 7}, shells.shells().get(1).nodes());
        assertEquals(3, shells.maxDistance());
        assertEquals(4, shells.reachableCount());
    }

    @Test
    @DisplayName("Source with nothing reachable has empty shells and depth 0")
    void testEmptyShells() {
        DistanceShells shells = builder.build(new Int2IntOpenHashMap());

        assertTrue(shells.isEmpty());
        assertEquals(0, shells.maxDistance());
        assertEquals(0, shells.reachableCount());
    }

    @Test
    @DisplayName("Selected policy distance drives the shells; self pairs are skipped")
    void testBuildAllUsesPolicy() {
        PathDistances distances = PathDistances.builder()
                .distance("A", "B", PathPolicy.SHORTEST, 1)
                .distance("A", "B", PathPolicy.FOREMOST, 4)
                .distance("A", "C", PathPolicy.SHORTEST, 2)
                .distance("A", "C", PathPolicy.FOREMOST, 4)
                .distance("A", "A", PathPolicy.SHORTEST, 0)
                .distance("A", "A", PathPolicy.FOREMOST, 0)
                .build();

        DistanceShells[] byShortest = builder.buildAll(snapshot, distances, PathPolicy.SHORTEST);
        DistanceShells[] byForemost = builder.buildAll(snapshot, distances, PathPolicy.FOREMOST);

        int a = snapshot.nodeIds().toInternal("A");
        assertEquals(4, byShortest.length);
        assertEquals(2, byShortest[a].shells().size());
        assertEquals(2, byShortest[a].maxDistance());
        assertEquals(1, byForemost[a].shells().size());
        assertEquals(4, byForemost[a].maxDistance());
        assertEquals(2, byForemost[a].reachableCount());
        assertTrue(byShortest[snapshot.nodeIds().toInternal("D")].isEmpty());
    }

    @Test
    @DisplayName("Pair naming a node outside the snapshot is an upstream error")
    void testUnknownPairNode() {
        PathDistances distances = PathDistances.builder()
                .distanceForAllPolicies("A", "ghost", 1)
                .build();

        ConformityException ex = assertThrows(
                ConformityException.class,
                () -> builder.buildAll(snapshot, distances, PathPolicy.SHORTEST)
        );
        assertEquals(ConformityCore.REASON_UNKNOWN_PAIR_NODE, ex.reasonCode());
        assertEquals(ConformityException.ErrorKind.UPSTREAM_DATA_ERROR, ex.errorKind());
    }

    @Test
    @DisplayName("Pair without the selected policy distance is an upstream error")
    void testPolicyDistanceMissing() {
        PathDistances distances = PathDistances.builder()
                .distance("A", "B", PathPolicy.SHORTEST, 1)
                .build();

        ConformityException ex = assertThrows(
                ConformityException.class,
                () -> builder.buildAll(snapshot, distances, PathPolicy.FASTEST)
        );
        assertEquals(ConformityCore.REASON_POLICY_DISTANCE_MISSING, ex.reasonCode());
    }

    @Test
    @DisplayName("Negative distance is an upstream error")
    void testNegativeDistance() {
        PathDistances distances = PathDistances.builder()
                .distance("A", "B", PathPolicy.SHORTEST, -1)
                .build();

        ConformityException ex = assertThrows(
                ConformityException.class,
                () -> builder.buildAll(snapshot, distances, PathPolicy.SHORTEST)
        );
        assertEquals(ConformityCore.REASON_NEGATIVE_DISTANCE, ex.reasonCode());
    }

    @Test
    @DisplayName("Shell records reject non-positive distance and empty members")
    void testShellContract() {
        assertThrows(IllegalArgumentException.class, () -> new DistanceShell(0, new int[]{1}));
        assertThrows(IllegalArgumentException.class, () -> new DistanceShell(1, new int[0]));

        int[] members = {3, 1};
        DistanceShell shell = new DistanceShell(2, members);
        members[0] = 99;
        assertEquals(3, shell.nodes()[0]);
    }

    @Test
    @DisplayName("Shells with the same distance and members are equal")
    void testShellEquality() {
        DistanceShell shell = new DistanceShell(2, new int[]{1, 4});

        assertEquals(new DistanceShell(2, new int[]{1, 4}), shell);
        assertEquals(new DistanceShell(2, new int[]{1, 4}).hashCode(), shell.hashCode());
        assertNotEquals(new DistanceShell(3, new int[]{1, 4}), shell);
        assertNotEquals(new DistanceShell(2, new int[]{1, 5}), shell);
        assertEquals("DistanceShell(distance=2, nodes=[1, 4])", shell.toString());
    }
}
