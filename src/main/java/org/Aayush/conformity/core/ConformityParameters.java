package org.Aayush.conformity.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.conformity.graph.PathPolicy;
import org.Aayush.conformity.label.LabelHierarchies;

import java.util.List;

/**
 * Client-facing delta-conformity parameters shared by single-window and sliding runs.
 */
@Value
@Builder
public class ConformityParameters {
    /** Maximum duration of time-respecting paths; a window spans {@code [start, start + delta]}. */
    long delta;
    /** Damping factors; each must be finite and positive. */
    @Singular("alpha")
    List<Double> alphas;
    /** Categorical labels, in the order used to name profiles. */
    @Singular("label")
    List<String> labels;
    /** Largest profile size, between 1 and the number of labels. */
    @Builder.Default
    int profileSize = 1;
    /** Optional label hierarchies; {@code null} compares every label flat. */
    LabelHierarchies hierarchies;
    /** Path policy whose distance is used. */
    @Builder.Default
    PathPolicy pathPolicy = PathPolicy.SHORTEST;
}
