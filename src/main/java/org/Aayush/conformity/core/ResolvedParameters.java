package org.Aayush.conformity.core;

import org.Aayush.conformity.aggregate.DampingFactor;
import org.Aayush.conformity.graph.PathPolicy;
import org.Aayush.conformity.label.LabelHierarchies;
import org.Aayush.conformity.label.Profile;

import java.util.List;

/**
 * Internal validated parameters.
 *
 * <p>Instances are created by {@link ConformityCore} after every request contract holds.</p>
 *
 * @param delta window duration.
 * @param alphas distinct damping factors in request order.
 * @param labels distinct labels in request order.
 * @param profiles generated label combinations.
 * @param hierarchies label hierarchies, never {@code null}.
 * @param pathPolicy selected path policy.
 */
record ResolvedParameters(
        long delta,
        List<DampingFactor> alphas,
        List<String> labels,
        List<Profile> profiles,
        LabelHierarchies hierarchies,
        PathPolicy pathPolicy
) {
    ResolvedParameters {
        alphas = List.copyOf(alphas);
        labels = List.copyOf(labels);
        profiles = List.copyOf(profiles);
    }

    List<String> alphaKeys() {
        return alphas.stream().map(DampingFactor::key).toList();
    }

    List<String> profileNames() {
        return profiles.stream().map(Profile::name).toList();
    }
}
