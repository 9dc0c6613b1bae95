package org.Aayush.conformity.label;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordinal ranking of the values of one categorical label.
 *
 * <p>Two different values are graded by rank gap:
 * {@code -|rank(a) - rank(b)| / (size - 1)}, which lies in {@code [-1, 0)}.</p>
 */
public final class LabelHierarchy {
    @Getter
    @Accessors(fluent = true)
    private final String label;
    private final Object2IntOpenHashMap<String> ranks;

    private LabelHierarchy(String label, Map<String, Integer> ranks) {
        String normalized = Objects.requireNonNull(label, "label").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("label must be non-blank");
        }
        Objects.requireNonNull(ranks, "ranks");
        if (ranks.size() < 2) {
            throw new IllegalArgumentException("hierarchy for " + normalized + " needs at least two values");
        }
        this.label = normalized;
        this.ranks = new Object2IntOpenHashMap<>(ranks.size());
        for (Map.Entry<String, Integer> entry : ranks.entrySet()) {
            String value = Objects.requireNonNull(entry.getKey(), "hierarchy value");
            Integer rank = Objects.requireNonNull(entry.getValue(), "rank of " + value);
            this.ranks.put(value, rank.intValue());
        }
        this.ranks.trim();
    }

    /**
     * Creates a hierarchy with explicit ranks.
     */
    public static LabelHierarchy of(String label, Map<String, Integer> ranks) {
        return new LabelHierarchy(label, ranks);
    }

    /**
     * Creates a hierarchy ranking values by list position ({@code 0..n-1}).
     */
    public static LabelHierarchy ordered(String label, List<String> values) {
        Objects.requireNonNull(values, "values");
        Object2IntOpenHashMap<String> ranks = new Object2IntOpenHashMap<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            String value = Objects.requireNonNull(values.get(i), "hierarchy value");
            if (ranks.containsKey(value)) {
                throw new IllegalArgumentException("duplicate hierarchy value: " + value);
            }
            ranks.put(value, i);
        }
        return new LabelHierarchy(label, ranks);
    }

    /**
     * Returns number of ranked values.
     */
    public int size() {
        return ranks.size();
    }

    public boolean contains(String value) {
        return ranks.containsKey(value);
    }

    /**
     * Graded dissimilarity of two values, {@code 0} when ranks coincide.
     *
     * @throws ConformityException when either value is not ranked.
     */
    public double dissimilarity(String a, String b) {
        int rankA = rankOf(a);
        int rankB = rankOf(b);
        return -Math.abs((double) rankA - rankB) / (size() - 1);
    }

    private int rankOf(String value) {
        if (!ranks.containsKey(value)) {
            throw ConformityException.invalidArgument(
                    ConformityCore.REASON_HIERARCHY_VALUE_UNKNOWN,
                    "value '" + value + "' is not ranked in the hierarchy of label " + label
            );
        }
        return ranks.getInt(value);
    }
}
