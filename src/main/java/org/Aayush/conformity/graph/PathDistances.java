package org.Aayush.conformity.graph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable answer of a {@link TemporalPathOracle}: ordered node pair to
 * {@code policy -> distance}.
 *
 * <p>Values are stored as delivered. Consistency against the snapshot is checked by
 * the consumer.</p>
 */
public final class PathDistances {
    private static final PathDistances EMPTY = new PathDistances(Map.of());

    private final Map<NodePair, Map<PathPolicy, Integer>> distancesByPair;

    private PathDistances(Map<NodePair, Map<PathPolicy, Integer>> distancesByPair) {
        this.distancesByPair = distancesByPair;
    }

    /**
     * Returns an answer without any reachable pair.
     */
    public static PathDistances empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns all ordered pairs with at least one policy distance.
     */
    public Set<NodePair> pairs() {
        return distancesByPair.keySet();
    }

    /**
     * Returns the policy distances for one pair, empty when the pair is unreachable.
     */
    public Map<PathPolicy, Integer> policies(String source, String target) {
        Map<PathPolicy, Integer> policies = distancesByPair.get(new NodePair(source, target));
        return policies == null ? Map.of() : policies;
    }

    /**
     * Returns the number of ordered pairs.
     */
    public int pairCount() {
        return distancesByPair.size();
    }

    /**
     * Ordered node pair.
     */
    public record NodePair(String source, String target) {
        public NodePair {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
        }
    }

    /**
     * Mutable builder; not thread-safe.
     */
    public static final class Builder {
        private final LinkedHashMap<NodePair, EnumMap<PathPolicy, Integer>> distances = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Records one policy distance, replacing any previous value for the same pair and policy.
         */
        public Builder distance(String source, String target, PathPolicy policy, int distance) {
            Objects.requireNonNull(policy, "policy");
            distances.computeIfAbsent(new NodePair(source, target), ignored -> new EnumMap<>(PathPolicy.class))
                    .put(policy, distance);
            return this;
        }

        /**
         * Records the same distance under every policy.
         */
        public Builder distanceForAllPolicies(String source, String target, int distance) {
            for (PathPolicy policy : PathPolicy.values()) {
                distance(source, target, policy, distance);
            }
            return this;
        }

        public PathDistances build() {
            LinkedHashMap<NodePair, Map<PathPolicy, Integer>> copy = new LinkedHashMap<>();
            for (Map.Entry<NodePair, EnumMap<PathPolicy, Integer>> entry : distances.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
            }
            return new PathDistances(Collections.unmodifiableMap(copy));
        }
    }
}
