package org.Aayush.conformity.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Path policies and distance tables")
class PathPolicyTest {

    @ParameterizedTest
    @CsvSource({
            "shortest, SHORTEST",
            "fastest, FASTEST",
            "foremost, FOREMOST",
            "fastest_shortest, FASTEST_SHORTEST",
            "shortest_fastest, SHORTEST_FASTEST"
    })
    @DisplayName("Stable ids resolve to their policy")
    void testFromId(String id, PathPolicy expected) {
        assertEquals(expected, PathPolicy.fromId(id));
        assertEquals(id, expected.id());
    }

    @Test
    @DisplayName("Unknown or null id is rejected with the accepted ids listed")
    void testUnknownId() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> PathPolicy.fromId("slowest"));
        assertTrue(ex.getMessage().contains("fastest_shortest"));
        assertThrows(IllegalArgumentException.class, () -> PathPolicy.fromId(null));
    }

    @Test
    @DisplayName("Distance table keeps one distance per policy and pair")
    void testPathDistancesTable() {
        PathDistances distances = PathDistances.builder()
                .distance("A", "B", PathPolicy.SHORTEST, 2)
                .distance("A", "B", PathPolicy.FASTEST, 5)
                .distanceForAllPolicies("B", "C", 1)
                .build();

        assertEquals(2, distances.pairCount());
        Map<PathPolicy, Integer> ab = distances.policies("A", "B");
        assertEquals(2, ab.get(PathPolicy.SHORTEST));
        assertEquals(5, ab.get(PathPolicy.FASTEST));
        assertNull(ab.get(PathPolicy.FOREMOST));
        assertEquals(PathPolicy.values().length, distances.policies("B", "C").size());
        assertTrue(distances.policies("C", "B").isEmpty());
        assertEquals(0, PathDistances.empty().pairCount());
    }
}
