package org.Aayush.conformity.label;

import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;
import org.Aayush.conformity.graph.IndexedSnapshot;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable label -> hierarchy registry.
 *
 * <p>Labels without a hierarchy compare flat: equal values agree with {@code 1}, any
 * other pair gets {@link #OUT_OF_HIERARCHY_PENALTY}.</p>
 */
public final class LabelHierarchies {
    public static final double OUT_OF_HIERARCHY_PENALTY = -1.0d;

    private static final LabelHierarchies NONE = new LabelHierarchies(Map.of());

    private final Map<String, LabelHierarchy> byLabel;

    private LabelHierarchies(Map<String, LabelHierarchy> byLabel) {
        this.byLabel = byLabel;
    }

    /**
     * Returns the registry without hierarchies.
     */
    public static LabelHierarchies none() {
        return NONE;
    }

    /**
     * Creates a registry; later entries replace earlier ones for the same label.
     */
    public static LabelHierarchies of(Collection<LabelHierarchy> hierarchies) {
        Objects.requireNonNull(hierarchies, "hierarchies");
        LinkedHashMap<String, LabelHierarchy> map = new LinkedHashMap<>();
        for (LabelHierarchy hierarchy : hierarchies) {
            LabelHierarchy nonNull = Objects.requireNonNull(hierarchy, "hierarchy");
            map.put(nonNull.label(), nonNull);
        }
        return new LabelHierarchies(Map.copyOf(map));
    }

    public static LabelHierarchies of(LabelHierarchy... hierarchies) {
        return of(java.util.List.of(hierarchies));
    }

    /**
     * Returns the hierarchy of a label, or {@code null} when the label compares flat.
     */
    public LabelHierarchy hierarchy(String label) {
        if (label == null) {
            return null;
        }
        return byLabel.get(label);
    }

    public Set<String> labels() {
        return byLabel.keySet();
    }

    /**
     * Checks that every node value of an indexed, ranked label is listed in its hierarchy.
     *
     * <p>Runs once per window before any pair is scored, so the outcome does not depend on
     * which values happen to meet.</p>
     *
     * @throws ConformityException with {@code DC_HIERARCHY_VALUE_UNKNOWN} (upstream data) on the
     * first unranked value.
     */
    public void validate(IndexedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        for (int label = 0; label < snapshot.labels().size(); label++) {
            LabelHierarchy hierarchy = hierarchy(snapshot.labels().get(label));
            if (hierarchy == null) {
                continue;
            }
            for (int node = 0; node < snapshot.nodeCount(); node++) {
                String value = snapshot.value(label, node);
                if (!hierarchy.contains(value)) {
                    throw ConformityException.upstream(
                            ConformityCore.REASON_HIERARCHY_VALUE_UNKNOWN,
                            "node " + snapshot.nodeIds().toExternal(node) + " has value '" + value
                                    + "' which the hierarchy of label " + hierarchy.label() + " does not rank"
                    );
                }
            }
        }
    }

    /**
     * Agreement indicator of two values of one label.
     *
     * @return {@code 1} on equal values, the hierarchy grade when the label is ranked,
     * {@link #OUT_OF_HIERARCHY_PENALTY} otherwise.
     */
    public double agreement(String label, String sourceValue, String candidateValue) {
        if (Objects.equals(sourceValue, candidateValue)) {
            return 1.0d;
        }
        LabelHierarchy hierarchy = hierarchy(label);
        if (hierarchy == null) {
            return OUT_OF_HIERARCHY_PENALTY;
        }
        return hierarchy.dissimilarity(sourceValue, candidateValue);
    }
}
