package org.Aayush.conformity.label;

import org.Aayush.conformity.graph.IndexedSnapshot;
import org.Aayush.conformity.testutil.InMemoryDynamicGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Label similarity scoring")
class LabelSimilarityScorerTest {

    private static IndexedSnapshot indexed(InMemoryDynamicGraph graph, String... labels) {
        return IndexedSnapshot.index(graph.timeSlice(0, 10), List.of(labels));
    }

    private static int id(IndexedSnapshot snapshot, String node) {
        return snapshot.nodeIds().toInternal(node);
    }

    @Test
    @DisplayName("Homogeneity is the like-valued neighbor fraction with neutral smoothing")
    void testHomogeneityWeights() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph()
                .node("S", "l", "x")
                .node("P", "l", "x")
                .node("R", "l", "y")
                .node("Z", "l", "z")
                .interaction("S", "P", 0, 10)
                .interaction("P", "R", 0, 10);
        IndexedSnapshot snapshot = indexed(graph, "l");

        HomogeneityIndex homogeneity = HomogeneityIndex.build(snapshot);

        assertEquals(0.5d, homogeneity.weight(0, id(snapshot, "P")), 1e-12);
        assertEquals(1.0d, homogeneity.weight(0, id(snapshot, "S")), 1e-12);
        // R has no like-valued neighbor, Z has no neighbor at all.
        assertEquals(HomogeneityIndex.NEUTRAL_WEIGHT, homogeneity.weight(0, id(snapshot, "R")), 1e-12);
        assertEquals(HomogeneityIndex.NEUTRAL_WEIGHT, homogeneity.weight(0, id(snapshot, "Z")), 1e-12);
    }

    @Test
    @DisplayName("Exact-match shell scores the mean homogeneity of its members")
    void testExactMatchShell() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph()
                .node("S", "l", "x")
                .node("P", "l", "x")
                .node("Q", "l", "x")
                .node("R", "l", "y")
                .interaction("S", "P", 0, 10)
                .interaction("S", "Q", 0, 10)
                .interaction("P", "R", 0, 10);
        IndexedSnapshot snapshot = indexed(graph, "l");
        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                snapshot, HomogeneityIndex.build(snapshot), LabelHierarchies.none());

        double score = scorer.score(
                id(snapshot, "S"),
                new int[]{id(snapshot, "P"), id(snapshot, "Q")},
                Profile.of("l")
        );

        assertEquals(0.75d, score, 1e-12);
    }

    @Test
    @DisplayName("Ranked label grades mismatches instead of applying the flat penalty")
    void testHierarchyGrading() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph()
                .node("S", "income", "low")
                .node("X", "income", "high")
                .node("Y", "income", "mid")
                .interaction("S", "X", 0, 10)
                .interaction("S", "Y", 0, 10);
        IndexedSnapshot snapshot = indexed(graph, "income");
        HomogeneityIndex homogeneity = HomogeneityIndex.build(snapshot);
        int[] shell = {id(snapshot, "X"), id(snapshot, "Y")};

        LabelSimilarityScorer graded = new LabelSimilarityScorer(
                snapshot,
                homogeneity,
                LabelHierarchies.of(LabelHierarchy.ordered("income", List.of("low", "mid", "high")))
        );
        LabelSimilarityScorer flat = new LabelSimilarityScorer(snapshot, homogeneity, null);

        assertEquals(-0.75d, graded.score(id(snapshot, "S"), shell, Profile.of("income")), 1e-12);
        assertEquals(-1.0d, flat.score(id(snapshot, "S"), shell, Profile.of("income")), 1e-12);
    }

    @Test
    @DisplayName("Multi-label profile multiplies per-label means")
    void testProfileProduct() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph()
                .node("S", Map.of("color", "x", "size", "s"))
                .node("P", Map.of("color", "x", "size", "m"))
                .interaction("S", "P", 0, 10);
        IndexedSnapshot snapshot = indexed(graph, "color", "size");
        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                snapshot, HomogeneityIndex.build(snapshot), LabelHierarchies.none());
        int[] shell = {id(snapshot, "P")};
        int source = id(snapshot, "S");

        assertEquals(1.0d, scorer.score(source, shell, Profile.of("color")), 1e-12);
        assertEquals(-1.0d, scorer.score(source, shell, Profile.of("size")), 1e-12);
        assertEquals(-1.0d, scorer.score(source, shell, Profile.of("color", "size")), 1e-12);
    }

    @Test
    @DisplayName("Empty shell is rejected")
    void testEmptyShell() {
        InMemoryDynamicGraph graph = new InMemoryDynamicGraph().node("S", "l", "x");
        IndexedSnapshot snapshot = indexed(graph, "l");
        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                snapshot, HomogeneityIndex.build(snapshot), LabelHierarchies.none());

        assertThrows(IllegalArgumentException.class, () -> scorer.score(0, new int[0], Profile.of("l")));
    }
}
