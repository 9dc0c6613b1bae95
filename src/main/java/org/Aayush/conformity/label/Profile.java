package org.Aayush.conformity.label;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combination of one or more labels evaluated jointly.
 *
 * <p>Identity is the label set, so {@code [a, b]} equals {@code [b, a]}. The {@link #name()}
 * keeps the request order and is what result maps are keyed by.</p>
 */
public final class Profile {
    public static final String NAME_SEPARATOR = "_";

    private final List<String> labels;
    private final Set<String> labelSet;
    private final String name;

    private Profile(List<String> labels) {
        this.labels = List.copyOf(labels);
        this.labelSet = Set.copyOf(labels);
        if (this.labels.isEmpty()) {
            throw new IllegalArgumentException("profile must contain at least one label");
        }
        if (this.labelSet.size() != this.labels.size()) {
            throw new IllegalArgumentException("profile labels must be distinct: " + labels);
        }
        this.name = String.join(NAME_SEPARATOR, this.labels);
    }

    /**
     * Creates a profile from labels in the given order.
     */
    public static Profile of(String... labels) {
        return new Profile(List.of(labels));
    }

    /**
     * Creates a profile from labels in the given order.
     */
    public static Profile of(List<String> labels) {
        return new Profile(Objects.requireNonNull(labels, "labels"));
    }

    /**
     * Generates all label combinations of sizes {@code 1..maxSize}.
     *
     * <p>Smaller profiles come first; inside one size, combinations follow label positions
     * lexicographically ({@code a, b, c} with size 2 gives {@code a_b, a_c, b_c}).</p>
     *
     * @param labels distinct labels in request order.
     * @param maxSize largest profile size, {@code 1 <= maxSize <= labels.size()}.
     */
    public static List<Profile> combinations(List<String> labels, int maxSize) {
        Objects.requireNonNull(labels, "labels");
        if (maxSize < 1 || maxSize > labels.size()) {
            throw new IllegalArgumentException(
                    "maxSize must be in [1, " + labels.size() + "], got " + maxSize
            );
        }
        List<Profile> profiles = new ArrayList<>();
        for (int size = 1; size <= maxSize; size++) {
            collect(labels, size, 0, new ArrayList<>(size), profiles);
        }
        return List.copyOf(profiles);
    }

    private static void collect(List<String> labels, int size, int from, List<String> current, List<Profile> out) {
        if (current.size() == size) {
            out.add(new Profile(current));
            return;
        }
        int remaining = size - current.size();
        for (int i = from; i <= labels.size() - remaining; i++) {
            current.add(labels.get(i));
            collect(labels, size, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * Returns canonical result-map key: labels joined with {@value #NAME_SEPARATOR}.
     */
    public String name() {
        return name;
    }

    public int size() {
        return labels.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Profile)) {
            return false;
        }
        return labelSet.equals(((Profile) o).labelSet);
    }

    @Override
    public int hashCode() {
        return labelSet.hashCode();
    }

    @Override
    public String toString() {
        return "Profile(" + name + ")";
    }
}
