package org.Aayush.conformity.aggregate;

import org.Aayush.conformity.label.LabelSimilarityScorer;
import org.Aayush.conformity.label.Profile;
import org.Aayush.conformity.shell.DistanceShell;

import java.util.List;
import java.util.Objects;

/**
 * Accumulates damped shell similarities into one {@link NodeAccumulator} per source.
 *
 * <p>For every shell at distance {@code d}, every profile and every alpha the slot
 * {@code (alpha, profile)} receives {@code sim / d^alpha}. Shells are independent
 * summands, so their order does not matter.</p>
 */
public final class ConformityAggregator {
    private final LabelSimilarityScorer scorer;
    private final List<Profile> profiles;
    private final List<DampingFactor> alphas;

    public ConformityAggregator(LabelSimilarityScorer scorer, List<Profile> profiles, List<DampingFactor> alphas) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.profiles = List.copyOf(profiles);
        this.alphas = List.copyOf(alphas);
        if (this.profiles.isEmpty() || this.alphas.isEmpty()) {
            throw new IllegalArgumentException("at least one profile and one alpha are required");
        }
    }

    /**
     * Computes the unnormalized accumulator of one source.
     *
     * @param source source node index.
     * @param shells reachability shells of the source, in any order.
     * @return fresh accumulator owned by the caller.
     */
    public NodeAccumulator accumulate(int source, List<DistanceShell> shells) {
        Objects.requireNonNull(shells, "shells");
        NodeAccumulator accumulator = new NodeAccumulator(source, alphas.size(), profiles.size());
        double[] damping = new double[alphas.size()];
        for (DistanceShell shell : shells) {
            for (int a = 0; a < alphas.size(); a++) {
                damping[a] = alphas.get(a).damping(shell.distance());
            }
            int[] nodes = shell.nodes();
            for (int p = 0; p < profiles.size(); p++) {
                double similarity = scorer.score(source, nodes, profiles.get(p));
                for (int a = 0; a < damping.length; a++) {
                    accumulator.add(a, p, similarity * damping[a]);
                }
            }
        }
        return accumulator;
    }

    public List<Profile> profiles() {
        return profiles;
    }

    public List<DampingFactor> alphas() {
        return alphas;
    }
}
