package org.Aayush.conformity.label;

import org.Aayush.conformity.graph.IndexedSnapshot;

import java.util.List;
import java.util.Objects;

/**
 * Similarity between a source node and one reachability shell.
 *
 * <p>For each label of the profile the scorer averages, over the shell, the agreement
 * indicator between source and candidate weighted by the candidate's local homogeneity.
 * The profile score is the product of these per-label averages.</p>
 *
 * <p>Instances only read immutable window state and can be shared across threads.</p>
 */
public final class LabelSimilarityScorer {
    private final IndexedSnapshot snapshot;
    private final HomogeneityIndex homogeneity;
    private final LabelHierarchies hierarchies;

    /**
     * @param snapshot indexed window snapshot.
     * @param homogeneity homogeneity weights computed from the same snapshot.
     * @param hierarchies optional label hierarchies.
     */
    public LabelSimilarityScorer(IndexedSnapshot snapshot, HomogeneityIndex homogeneity, LabelHierarchies hierarchies) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.homogeneity = Objects.requireNonNull(homogeneity, "homogeneity");
        this.hierarchies = hierarchies == null ? LabelHierarchies.none() : hierarchies;
    }

    /**
     * Scores one shell against the source for a profile.
     *
     * @param source source node index.
     * @param candidates nodes at one temporal distance from the source (non-empty).
     * @param profile labels evaluated jointly.
     * @return product over labels of the mean weighted agreement.
     * @throws IllegalArgumentException when the shell is empty.
     */
    public double score(int source, int[] candidates, Profile profile) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(profile, "profile");
        if (candidates.length == 0) {
            throw new IllegalArgumentException("candidate shell must be non-empty");
        }
        double product = 1.0d;
        List<String> labels = profile.labels();
        for (String label : labels) {
            product *= labelScore(source, candidates, label);
        }
        return product;
    }

    private double labelScore(int source, int[] candidates, String label) {
        int labelIndex = snapshot.labelIndex(label);
        String sourceValue = snapshot.value(labelIndex, source);
        double sum = 0.0d;
        for (int candidate : candidates) {
            double agreement = hierarchies.agreement(label, sourceValue, snapshot.value(labelIndex, candidate));
            sum += agreement * homogeneity.weight(labelIndex, candidate);
        }
        return sum / candidates.length;
    }
}
