package org.Aayush.conformity.core;

import lombok.extern.log4j.Log4j2;
import org.Aayush.conformity.graph.DynamicGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Slides the single-window pipeline over a dynamic graph's temporal index.
 *
 * <p>A window starts at every temporal id {@code t} with {@code t + delta} strictly below the
 * last id. Windows are independent; the only state kept across them is the growing
 * {@link ConformitySeries}, appended in increasing {@code t}.</p>
 */
@Log4j2
final class SlidingWindowRunner {

    /**
     * Single-window evaluation seam.
     */
    @FunctionalInterface
    interface WindowEvaluator {
        ConformityScores evaluate(long windowStart, int nodeParallelism);
    }

    private final ConformityRuntimeConfig runtimeConfig;

    SlidingWindowRunner(ConformityRuntimeConfig runtimeConfig) {
        this.runtimeConfig = Objects.requireNonNull(runtimeConfig, "runtimeConfig");
    }

    /**
     * Evaluates every admissible window and collects the per-key series.
     *
     * @param graph dynamic graph supplying the temporal index and node set.
     * @param parameters validated parameters.
     * @param evaluator single-window evaluation.
     */
    ConformitySeries run(DynamicGraph graph, ResolvedParameters parameters, WindowEvaluator evaluator) {
        long startedAt = System.nanoTime();
        long[] temporalIds = temporalIds(graph);
        long[] windowStarts = windowStarts(temporalIds, parameters.delta());
        enforceWindowBudget(windowStarts.length);

        ConformitySeries.Builder series = new ConformitySeries.Builder()
                .seed(parameters.alphaKeys(), parameters.profileNames(), graphNodes(graph));
        if (windowStarts.length == 0) {
            log.info("No window admits delta={} over {} temporal ids; returning empty series",
                    parameters.delta(), temporalIds.length);
            return series.build();
        }

        boolean parallelWindows = runtimeConfig.getWindowParallelism() > 1 && windowStarts.length > 1;
        int nodeParallelism = parallelWindows ? 1 : runtimeConfig.getNodeParallelism();
        List<Callable<ConformityScores>> tasks = new ArrayList<>(windowStarts.length);
        for (long windowStart : windowStarts) {
            tasks.add(() -> {
                ParallelExecution.checkInterrupted("sliding window " + windowStart);
                return evaluator.evaluate(windowStart, nodeParallelism);
            });
        }
        List<ConformityScores> results = ParallelExecution.invokeAll(
                tasks,
                parallelWindows ? runtimeConfig.getWindowParallelism() : 1,
                "conformity-window"
        );

        for (int i = 0; i < windowStarts.length; i++) {
            series.append(windowStarts[i] + parameters.delta(), results.get(i));
        }
        log.info("Sliding delta-conformity: {} windows, delta={}, {} alphas x {} profiles in {} ms",
                windowStarts.length, parameters.delta(), parameters.alphas().size(),
                parameters.profiles().size(), (System.nanoTime() - startedAt) / 1_000_000L);
        return series.build();
    }

    /**
     * Returns every {@code t} of the index with {@code t + delta < last}, ascending.
     */
    static long[] windowStarts(long[] temporalIds, long delta) {
        if (temporalIds.length == 0) {
            return new long[0];
        }
        long last = temporalIds[temporalIds.length - 1];
        long[] starts = new long[temporalIds.length];
        int count = 0;
        for (long t : temporalIds) {
            final long end;
            try {
                end = Math.addExact(t, delta);
            } catch (ArithmeticException ex) {
                continue;
            }
            if (end < last) {
                starts[count++] = t;
            }
        }
        long[] trimmed = new long[count];
        System.arraycopy(starts, 0, trimmed, 0, count);
        return trimmed;
    }

    private void enforceWindowBudget(int windowCount) {
        if (runtimeConfig.windowBudgetBounded() && windowCount > runtimeConfig.getMaxWindows()) {
            throw ConformityException.execution(
                    ConformityCore.REASON_WINDOW_BUDGET_EXCEEDED,
                    "sliding run needs " + windowCount + " windows > budget " + runtimeConfig.getMaxWindows()
            );
        }
    }

    private static long[] temporalIds(DynamicGraph graph) {
        final long[] ids;
        try {
            ids = graph.temporalSnapshotIds();
        } catch (RuntimeException ex) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_TEMPORAL_INDEX_INVALID,
                    "temporal index provider failed",
                    ex
            );
        }
        if (ids == null) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_TEMPORAL_INDEX_INVALID,
                    "temporal index provider returned no ids"
            );
        }
        for (int i = 1; i < ids.length; i++) {
            if (ids[i] <= ids[i - 1]) {
                throw ConformityException.upstream(
                        ConformityCore.REASON_TEMPORAL_INDEX_INVALID,
                        "temporal ids must be strictly increasing, got " + ids[i - 1] + " then " + ids[i]
                );
            }
        }
        return ids.clone();
    }

    private static Collection<String> graphNodes(DynamicGraph graph) {
        Collection<String> nodes = graph.nodes();
        return nodes == null ? List.of() : nodes;
    }
}
