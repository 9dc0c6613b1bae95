package org.Aayush.conformity.aggregate;

import java.math.BigDecimal;

/**
 * Distance damping exponent (alpha).
 *
 * <p>A shell at distance {@code d} contributes with weight {@code d^-alpha}; larger values
 * suppress distant shells faster. The {@link #key()} is the plain decimal rendering used
 * in result maps ({@code 1.0 -> "1"}, {@code 1.5 -> "1.5"}).</p>
 *
 * @param value positive finite exponent.
 */
public record DampingFactor(double value) {
    public DampingFactor {
        if (!isValid(value)) {
            throw new IllegalArgumentException("damping factor must be finite and > 0, got " + value);
        }
    }

    public static DampingFactor of(double value) {
        return new DampingFactor(value);
    }

    /**
     * Returns whether a value can be used as damping factor.
     */
    public static boolean isValid(double value) {
        return Double.isFinite(value) && value > 0.0d;
    }

    /**
     * Returns the result-map key of a damping value.
     */
    public static String keyOf(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        return decimal.scale() < 0 ? decimal.setScale(0).toPlainString() : decimal.toPlainString();
    }

    public String key() {
        return keyOf(value);
    }

    /**
     * Returns {@code distance^-alpha}.
     */
    public double damping(int distance) {
        return 1.0d / Math.pow(distance, value);
    }
}
