package org.Aayush.conformity.aggregate;

/**
 * Conformity accumulator of one source node, one slot per (alpha, profile).
 *
 * <p>Each worker owns its accumulators exclusively; results are merged only after all
 * nodes of a window are done, so no slot is ever shared between threads.</p>
 */
public final class NodeAccumulator {
    private final int source;
    private final int profileCount;
    private final double[] values;

    public NodeAccumulator(int source, int alphaCount, int profileCount) {
        if (alphaCount <= 0 || profileCount <= 0) {
            throw new IllegalArgumentException("alphaCount and profileCount must be > 0");
        }
        this.source = source;
        this.profileCount = profileCount;
        this.values = new double[alphaCount * profileCount];
    }

    public int source() {
        return source;
    }

    public int alphaCount() {
        return values.length / profileCount;
    }

    public int profileCount() {
        return profileCount;
    }

    void add(int alphaIndex, int profileIndex, double delta) {
        values[slot(alphaIndex, profileIndex)] += delta;
    }

    void divideAlpha(int alphaIndex, double divisor) {
        int from = alphaIndex * profileCount;
        for (int i = from; i < from + profileCount; i++) {
            values[i] /= divisor;
        }
    }

    public double value(int alphaIndex, int profileIndex) {
        return values[slot(alphaIndex, profileIndex)];
    }

    /**
     * Returns number of slots whose magnitude exceeds {@code 1 + tolerance}.
     */
    public int outOfRangeCount(double tolerance) {
        int count = 0;
        for (double value : values) {
            if (Math.abs(value) > 1.0d + tolerance) {
                count++;
            }
        }
        return count;
    }

    private int slot(int alphaIndex, int profileIndex) {
        if (profileIndex < 0 || profileIndex >= profileCount) {
            throw new IndexOutOfBoundsException("profile index out of bounds: " + profileIndex);
        }
        return alphaIndex * profileCount + profileIndex;
    }
}
