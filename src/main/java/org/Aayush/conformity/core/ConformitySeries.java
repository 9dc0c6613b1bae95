package org.Aayush.conformity.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sliding delta-conformity result: alpha key -> profile name -> node -> time-ordered scores.
 */
public final class ConformitySeries {
    private final Map<String, Map<String, Map<String, List<TimedScore>>>> series;
    private final int windowCount;

    private ConformitySeries(Map<String, Map<String, Map<String, List<TimedScore>>>> series, int windowCount) {
        this.series = series;
        this.windowCount = windowCount;
    }

    /**
     * Returns the full nested view.
     */
    public Map<String, Map<String, Map<String, List<TimedScore>>>> asMap() {
        return series;
    }

    /**
     * Returns the series of one (alpha, profile, node) key, empty when the key is unknown.
     */
    public List<TimedScore> series(String alphaKey, String profileName, String node) {
        return series.getOrDefault(alphaKey, Map.of())
                .getOrDefault(profileName, Map.of())
                .getOrDefault(node, List.of());
    }

    /**
     * Returns number of windows evaluated.
     */
    public int windowCount() {
        return windowCount;
    }

    /**
     * Append-only builder used by the sliding runner; not thread-safe.
     */
    static final class Builder {
        private final LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, List<TimedScore>>>> series =
                new LinkedHashMap<>();
        private int windowCount;

        /**
         * Pre-registers every key so that keys without windows still map to empty series.
         */
        Builder seed(Collection<String> alphaKeys, Collection<String> profileNames, Collection<String> nodes) {
            for (String alphaKey : alphaKeys) {
                for (String profileName : profileNames) {
                    LinkedHashMap<String, List<TimedScore>> byNode = byNode(alphaKey, profileName);
                    for (String node : nodes) {
                        byNode.computeIfAbsent(node, ignored -> new ArrayList<>());
                    }
                }
            }
            return this;
        }

        /**
         * Appends one window result stamped with the window end.
         */
        Builder append(long timestamp, ConformityScores scores) {
            for (Map.Entry<String, Map<String, Map<String, Double>>> alpha : scores.asMap().entrySet()) {
                for (Map.Entry<String, Map<String, Double>> profile : alpha.getValue().entrySet()) {
                    LinkedHashMap<String, List<TimedScore>> byNode = byNode(alpha.getKey(), profile.getKey());
                    for (Map.Entry<String, Double> node : profile.getValue().entrySet()) {
                        byNode.computeIfAbsent(node.getKey(), ignored -> new ArrayList<>())
                                .add(new TimedScore(timestamp, node.getValue()));
                    }
                }
            }
            windowCount++;
            return this;
        }

        ConformitySeries build() {
            LinkedHashMap<String, Map<String, Map<String, List<TimedScore>>>> byAlpha = new LinkedHashMap<>();
            for (Map.Entry<String, LinkedHashMap<String, LinkedHashMap<String, List<TimedScore>>>> alpha : series.entrySet()) {
                LinkedHashMap<String, Map<String, List<TimedScore>>> byProfile = new LinkedHashMap<>();
                for (Map.Entry<String, LinkedHashMap<String, List<TimedScore>>> profile : alpha.getValue().entrySet()) {
                    LinkedHashMap<String, List<TimedScore>> byNode = new LinkedHashMap<>();
                    for (Map.Entry<String, List<TimedScore>> node : profile.getValue().entrySet()) {
                        byNode.put(node.getKey(), List.copyOf(node.getValue()));
                    }
                    byProfile.put(profile.getKey(), Collections.unmodifiableMap(byNode));
                }
                byAlpha.put(alpha.getKey(), Collections.unmodifiableMap(byProfile));
            }
            return new ConformitySeries(Collections.unmodifiableMap(byAlpha), windowCount);
        }

        private LinkedHashMap<String, List<TimedScore>> byNode(String alphaKey, String profileName) {
            return series.computeIfAbsent(alphaKey, ignored -> new LinkedHashMap<>())
                    .computeIfAbsent(profileName, ignored -> new LinkedHashMap<>());
        }
    }
}
