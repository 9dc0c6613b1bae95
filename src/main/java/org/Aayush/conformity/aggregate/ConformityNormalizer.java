package org.Aayush.conformity.aggregate;

import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;

import java.util.List;
import java.util.Objects;

/**
 * Per-node normalization by the damping mass of the node's own reachability depth.
 */
public final class ConformityNormalizer {

    /**
     * Returns {@code sum_{k=1..maxDistance} k^-alpha}.
     *
     * @throws IllegalArgumentException when {@code maxDistance < 1}.
     */
    public static double divisor(DampingFactor alpha, int maxDistance) {
        Objects.requireNonNull(alpha, "alpha");
        if (maxDistance < 1) {
            throw new IllegalArgumentException("maxDistance must be >= 1, got " + maxDistance);
        }
        double norm = 0.0d;
        for (int k = 1; k <= maxDistance; k++) {
            norm += alpha.damping(k);
        }
        return norm;
    }

    /**
     * Divides every slot of the accumulator by its alpha's divisor.
     *
     * <p>A node without reachable nodes ({@code maxDistance <= 0}) is left untouched at its
     * zero default.</p>
     *
     * @throws ConformityException when a normalized score is not finite.
     */
    public void normalize(NodeAccumulator accumulator, int maxDistance, List<DampingFactor> alphas) {
        Objects.requireNonNull(accumulator, "accumulator");
        Objects.requireNonNull(alphas, "alphas");
        if (maxDistance <= 0) {
            return;
        }
        for (int a = 0; a < alphas.size(); a++) {
            accumulator.divideAlpha(a, divisor(alphas.get(a), maxDistance));
        }
        ensureFinite(accumulator);
    }

    private static void ensureFinite(NodeAccumulator accumulator) {
        for (int a = 0; a < accumulator.alphaCount(); a++) {
            for (int p = 0; p < accumulator.profileCount(); p++) {
                double value = accumulator.value(a, p);
                if (!Double.isFinite(value)) {
                    throw ConformityException.execution(
                            ConformityCore.REASON_NUMERIC_SAFETY_BREACH,
                            "normalized score must be finite, got " + value
                                    + " at alpha slot " + a + ", profile slot " + p
                                    + " for node index " + accumulator.source()
                    );
                }
            }
        }
    }
}
