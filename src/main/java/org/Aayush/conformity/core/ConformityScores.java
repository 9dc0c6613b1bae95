package org.Aayush.conformity.core;

import org.Aayush.conformity.aggregate.DampingFactor;
import org.Aayush.conformity.aggregate.NodeAccumulator;
import org.Aayush.conformity.label.Profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable delta-conformity result of one window: alpha key -> profile name -> node -> score.
 *
 * <p>Every snapshot node is present under every (alpha, profile) key; nodes with no reachable
 * node in the window score exactly {@code 0}.</p>
 */
public final class ConformityScores {
    private final Map<String, Map<String, Map<String, Double>>> scores;
    private final List<String> nodes;
    private final WindowTelemetry telemetry;

    private ConformityScores(
            Map<String, Map<String, Map<String, Double>>> scores,
            List<String> nodes,
            WindowTelemetry telemetry
    ) {
        this.scores = scores;
        this.nodes = nodes;
        this.telemetry = telemetry;
    }

    /**
     * Merges per-node accumulators into the nested result.
     *
     * @param nodeIds snapshot node ids by node index.
     * @param alphas damping factors by alpha slot.
     * @param profiles profiles by profile slot.
     * @param accumulators normalized accumulators by node index.
     * @param telemetry window counters.
     */
    static ConformityScores merge(
            List<String> nodeIds,
            List<DampingFactor> alphas,
            List<Profile> profiles,
            NodeAccumulator[] accumulators,
            WindowTelemetry telemetry
    ) {
        if (accumulators.length != nodeIds.size()) {
            throw new IllegalArgumentException(
                    "accumulator count " + accumulators.length + " does not match node count " + nodeIds.size()
            );
        }
        LinkedHashMap<String, Map<String, Map<String, Double>>> byAlpha = new LinkedHashMap<>();
        for (int a = 0; a < alphas.size(); a++) {
            LinkedHashMap<String, Map<String, Double>> byProfile = new LinkedHashMap<>();
            for (int p = 0; p < profiles.size(); p++) {
                LinkedHashMap<String, Double> byNode = new LinkedHashMap<>();
                for (int node = 0; node < nodeIds.size(); node++) {
                    byNode.put(nodeIds.get(node), accumulators[node].value(a, p));
                }
                byProfile.put(profiles.get(p).name(), Collections.unmodifiableMap(byNode));
            }
            byAlpha.put(alphas.get(a).key(), Collections.unmodifiableMap(byProfile));
        }
        return new ConformityScores(
                Collections.unmodifiableMap(byAlpha),
                List.copyOf(nodeIds),
                Objects.requireNonNull(telemetry, "telemetry")
        );
    }

    /**
     * Returns the full nested view: alpha key -> profile name -> node -> score.
     */
    public Map<String, Map<String, Map<String, Double>>> asMap() {
        return scores;
    }

    /**
     * Returns one score.
     *
     * @throws NoSuchElementException when any key is unknown.
     */
    public double score(String alphaKey, String profileName, String node) {
        Map<String, Map<String, Double>> byProfile = scores.get(alphaKey);
        if (byProfile == null) {
            throw new NoSuchElementException("unknown alpha key: " + alphaKey);
        }
        Map<String, Double> byNode = byProfile.get(profileName);
        if (byNode == null) {
            throw new NoSuchElementException("unknown profile: " + profileName);
        }
        Double value = byNode.get(node);
        if (value == null) {
            throw new NoSuchElementException("node not in window snapshot: " + node);
        }
        return value;
    }

    /**
     * Returns one score, keying the alpha by its numeric value.
     */
    public double score(double alpha, String profileName, String node) {
        return score(DampingFactor.keyOf(alpha), profileName, node);
    }

    /**
     * Returns the snapshot nodes in result order.
     */
    public List<String> nodes() {
        return nodes;
    }

    public WindowTelemetry telemetry() {
        return telemetry;
    }
}
