package org.Aayush.conformity.label;

import org.Aayush.conformity.graph.IndexedSnapshot;

import java.util.Objects;

/**
 * Per-window local homogeneity weights, one array per indexed label.
 *
 * <p>The weight of node {@code v} for a label is the fraction of its neighbors sharing
 * {@code v}'s own value. Two smoothing rules apply:</p>
 * <ul>
 * <li>a fraction of {@code 0} is replaced by {@link #NEUTRAL_WEIGHT}, so a matching node
 * with no like-valued neighbor is not punished;</li>
 * <li>a zero-degree node also gets {@link #NEUTRAL_WEIGHT} instead of failing.</li>
 * </ul>
 * <p>Both are policy, not numerical accidents.</p>
 */
public final class HomogeneityIndex {
    public static final double NEUTRAL_WEIGHT = 1.0d;

    private final double[][] weights;

    private HomogeneityIndex(double[][] weights) {
        this.weights = weights;
    }

    /**
     * Computes weights for every indexed label of the snapshot.
     */
    public static HomogeneityIndex build(IndexedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        int labelCount = snapshot.labels().size();
        double[][] weights = new double[labelCount][snapshot.nodeCount()];
        for (int label = 0; label < labelCount; label++) {
            for (int node = 0; node < snapshot.nodeCount(); node++) {
                weights[label][node] = weightOf(snapshot, label, node);
            }
        }
        return new HomogeneityIndex(weights);
    }

    private static double weightOf(IndexedSnapshot snapshot, int label, int node) {
        int degree = snapshot.degree(node);
        if (degree == 0) {
            return NEUTRAL_WEIGHT;
        }
        String own = snapshot.value(label, node);
        int same = 0;
        for (int i = 0; i < degree; i++) {
            if (own.equals(snapshot.value(label, snapshot.neighbor(node, i)))) {
                same++;
            }
        }
        return same == 0 ? NEUTRAL_WEIGHT : (double) same / degree;
    }

    /**
     * Returns the smoothed homogeneity of a node for an indexed label.
     */
    public double weight(int labelIndex, int node) {
        return weights[labelIndex][node];
    }
}
