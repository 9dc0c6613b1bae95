package org.Aayush.conformity.aggregate;

import org.Aayush.conformity.graph.IndexedSnapshot;
import org.Aayush.conformity.label.HomogeneityIndex;
import org.Aayush.conformity.label.LabelHierarchies;
import org.Aayush.conformity.label.LabelSimilarityScorer;
import org.Aayush.conformity.label.Profile;
import org.Aayush.conformity.shell.DistanceShell;
import org.Aayush.conformity.testutil.ConformityFixtureFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Damped shell aggregation")
class ConformityAggregatorTest {

    private IndexedSnapshot snapshot;
    private ConformityAggregator aggregator;

    @BeforeEach
    void setUp() {
        snapshot = IndexedSnapshot.index(
                ConformityFixtureFactory.fourNodeExample().graph().timeSlice(1, 6),
                List.of(ConformityFixtureFactory.LABEL)
        );
        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                snapshot, HomogeneityIndex.build(snapshot), LabelHierarchies.none());
        aggregator = new ConformityAggregator(
                scorer,
                List.of(Profile.of(ConformityFixtureFactory.LABEL)),
                List.of(DampingFactor.of(1.0d), DampingFactor.of(2.0d))
        );
    }

    private int id(String node) {
        return snapshot.nodeIds().toInternal(node);
    }

    @Test
    @DisplayName("Shell similarities are damped by distance and summed per alpha")
    void testDampedSum() {
        List<DistanceShell> shells = List.of(
                new DistanceShell(1, new int[]{id("B"), id("C")}),
                new DistanceShell(2, new int[]{id("D")})
        );

        NodeAccumulator accumulator = aggregator.accumulate(id("A"), shells);

        // shell 1 scores 1/12, shell 2 scores -1
        assertEquals(1.0d / 12.0d - 0.5d, accumulator.value(0, 0), 1e-12);
        assertEquals(1.0d / 12.0d - 0.25d, accumulator.value(1, 0), 1e-12);
        assertEquals(id("A"), accumulator.source());
    }

    @Test
    @DisplayName("Shell order does not change the accumulated scores")
    void testShellOrderInvariance() {
        DistanceShell near = new DistanceShell(1, new int[]{id("B"), id("C")});
        DistanceShell far = new DistanceShell(2, new int[]{id("D")});

        NodeAccumulator forward = aggregator.accumulate(id("A"), List.of(near, far));
        NodeAccumulator reversed = aggregator.accumulate(id("A"), List.of(far, near));

        for (int a = 0; a < 2; a++) {
            assertEquals(forward.value(a, 0), reversed.value(a, 0), 1e-15);
        }
    }

    @Test
    @DisplayName("No shells leave every slot at zero")
    void testNoShells() {
        NodeAccumulator accumulator = aggregator.accumulate(id("B"), List.of());

        assertEquals(0.0d, accumulator.value(0, 0));
        assertEquals(0.0d, accumulator.value(1, 0));
    }

    @Test
    @DisplayName("Aggregator needs at least one profile and one alpha")
    void testRequiresProfilesAndAlphas() {
        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                snapshot, HomogeneityIndex.build(snapshot), LabelHierarchies.none());

        assertThrows(IllegalArgumentException.class,
                () -> new ConformityAggregator(scorer, List.of(), List.of(DampingFactor.of(1.0d))));
        assertThrows(IllegalArgumentException.class,
                () -> new ConformityAggregator(scorer, List.of(Profile.of("labels")), List.of()));
    }
}
