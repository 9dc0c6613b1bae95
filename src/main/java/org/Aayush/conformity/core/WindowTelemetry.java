package org.Aayush.conformity.core;

/**
 * Deterministic counters of one window evaluation.
 *
 * @param windowStart first temporal id of the window.
 * @param windowEnd last temporal id of the window.
 * @param nodeCount snapshot node count.
 * @param reachablePairs ordered pairs contributing to some shell.
 * @param shellCount total shells across all sources.
 * @param maxDepth largest reachability depth of any source.
 * @param outOfRangeScores normalized scores with magnitude above 1.
 * @param elapsedNanos wall time of the evaluation.
 */
public record WindowTelemetry(
        long windowStart,
        long windowEnd,
        int nodeCount,
        int reachablePairs,
        int shellCount,
        int maxDepth,
        int outOfRangeScores,
        long elapsedNanos
) {
}
