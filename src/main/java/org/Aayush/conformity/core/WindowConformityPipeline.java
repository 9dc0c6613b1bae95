package org.Aayush.conformity.core;

import lombok.extern.log4j.Log4j2;
import org.Aayush.conformity.aggregate.ConformityAggregator;
import org.Aayush.conformity.aggregate.ConformityNormalizer;
import org.Aayush.conformity.aggregate.NodeAccumulator;
import org.Aayush.conformity.graph.DynamicGraph;
import org.Aayush.conformity.graph.GraphSnapshot;
import org.Aayush.conformity.graph.IndexedSnapshot;
import org.Aayush.conformity.graph.PathDistances;
import org.Aayush.conformity.graph.TemporalPathOracle;
import org.Aayush.conformity.label.HomogeneityIndex;
import org.Aayush.conformity.label.LabelSimilarityScorer;
import org.Aayush.conformity.shell.DistanceShellBuilder;
import org.Aayush.conformity.shell.DistanceShells;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Single-window delta-conformity pipeline.
 *
 * <p>Execution flow for a window {@code [start, start + delta]}:</p>
 * <ul>
 * <li>Materialize and index the snapshot, then check node values against the hierarchies.</li>
 * <li>Ask the path oracle for pair distances and build every node's shells.</li>
 * <li>Aggregate and normalize one accumulator per node, optionally on a worker pool.</li>
 * <li>Merge accumulators into {@link ConformityScores}.</li>
 * </ul>
 */
@Log4j2
final class WindowConformityPipeline {
    static final double SCORE_BOUND_TOLERANCE = 1e-9d;

    private final TemporalPathOracle pathOracle;
    private final DistanceShellBuilder shellBuilder;
    private final ConformityNormalizer normalizer;

    WindowConformityPipeline(TemporalPathOracle pathOracle) {
        this(pathOracle, new DistanceShellBuilder(), new ConformityNormalizer());
    }

    WindowConformityPipeline(
            TemporalPathOracle pathOracle,
            DistanceShellBuilder shellBuilder,
            ConformityNormalizer normalizer
    ) {
        this.pathOracle = Objects.requireNonNull(pathOracle, "pathOracle");
        this.shellBuilder = Objects.requireNonNull(shellBuilder, "shellBuilder");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    /**
     * Evaluates one window.
     *
     * @param graph dynamic graph.
     * @param windowStart first temporal id of the window.
     * @param parameters validated parameters.
     * @param nodeParallelism worker count for the per-node loop.
     */
    ConformityScores evaluate(DynamicGraph graph, long windowStart, ResolvedParameters parameters, int nodeParallelism) {
        long startedAt = System.nanoTime();
        long windowEnd = windowEnd(windowStart, parameters.delta());

        GraphSnapshot snapshot = slice(graph, windowStart, windowEnd);
        IndexedSnapshot indexed = IndexedSnapshot.index(snapshot, parameters.labels());
        parameters.hierarchies().validate(indexed);
        PathDistances distances = queryOracle(snapshot, windowStart, windowEnd);
        DistanceShells[] shells = shellBuilder.buildAll(indexed, distances, parameters.pathPolicy());

        LabelSimilarityScorer scorer = new LabelSimilarityScorer(
                indexed,
                HomogeneityIndex.build(indexed),
                parameters.hierarchies()
        );
        ConformityAggregator aggregator = new ConformityAggregator(scorer, parameters.profiles(), parameters.alphas());
        NodeAccumulator[] accumulators = computeNodes(aggregator, shells, parameters, nodeParallelism);

        WindowTelemetry telemetry = telemetry(windowStart, windowEnd, shells, accumulators, startedAt);
        if (telemetry.outOfRangeScores() > 0) {
            log.warn("Window [{}, {}]: {} normalized scores fall outside [-1, 1]",
                    windowStart, windowEnd, telemetry.outOfRangeScores());
        }
        log.debug("Window [{}, {}]: nodes={} reachablePairs={} shells={} maxDepth={} elapsedMicros={}",
                windowStart, windowEnd, telemetry.nodeCount(), telemetry.reachablePairs(),
                telemetry.shellCount(), telemetry.maxDepth(), telemetry.elapsedNanos() / 1_000L);

        return ConformityScores.merge(
                indexed.nodeIdList(),
                parameters.alphas(),
                parameters.profiles(),
                accumulators,
                telemetry
        );
    }

    /**
     * Runs aggregation and normalization for every node.
     *
     * <p>Nodes are split into contiguous chunks; each chunk owns its accumulators.</p>
     */
    private NodeAccumulator[] computeNodes(
            ConformityAggregator aggregator,
            DistanceShells[] shells,
            ResolvedParameters parameters,
            int nodeParallelism
    ) {
        int nodeCount = shells.length;
        NodeAccumulator[] accumulators = new NodeAccumulator[nodeCount];
        if (nodeCount == 0) {
            return accumulators;
        }
        int chunks = Math.max(1, Math.min(nodeParallelism, nodeCount));
        int chunkSize = (nodeCount + chunks - 1) / chunks;
        List<Callable<NodeAccumulator[]>> tasks = new ArrayList<>(chunks);
        for (int from = 0; from < nodeCount; from += chunkSize) {
            int chunkFrom = from;
            int chunkTo = Math.min(nodeCount, from + chunkSize);
            tasks.add(() -> computeChunk(aggregator, shells, parameters, chunkFrom, chunkTo));
        }
        List<NodeAccumulator[]> chunkResults = ParallelExecution.invokeAll(tasks, nodeParallelism, "conformity-node");
        int offset = 0;
        for (NodeAccumulator[] chunk : chunkResults) {
            System.arraycopy(chunk, 0, accumulators, offset, chunk.length);
            offset += chunk.length;
        }
        return accumulators;
    }

    private NodeAccumulator[] computeChunk(
            ConformityAggregator aggregator,
            DistanceShells[] shells,
            ResolvedParameters parameters,
            int from,
            int to
    ) {
        NodeAccumulator[] chunk = new NodeAccumulator[to - from];
        for (int node = from; node < to; node++) {
            ParallelExecution.checkInterrupted("node aggregation");
            NodeAccumulator accumulator = aggregator.accumulate(node, shells[node].shells());
            normalizer.normalize(accumulator, shells[node].maxDistance(), parameters.alphas());
            chunk[node - from] = accumulator;
        }
        return chunk;
    }

    private GraphSnapshot slice(DynamicGraph graph, long windowStart, long windowEnd) {
        try {
            return graph.timeSlice(windowStart, windowEnd);
        } catch (ConformityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_SNAPSHOT_UNAVAILABLE,
                    "snapshot provider failed for window [" + windowStart + ", " + windowEnd + "]",
                    ex
            );
        }
    }

    private PathDistances queryOracle(GraphSnapshot snapshot, long windowStart, long windowEnd) {
        final PathDistances distances;
        try {
            distances = pathOracle.distances(snapshot, windowStart, windowEnd);
        } catch (ConformityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_PATH_ORACLE_FAILED,
                    "path oracle failed for window [" + windowStart + ", " + windowEnd + "]",
                    ex
            );
        }
        if (distances == null) {
            throw ConformityException.upstream(
                    ConformityCore.REASON_PATH_ORACLE_FAILED,
                    "path oracle returned no distances for window [" + windowStart + ", " + windowEnd + "]"
            );
        }
        return distances;
    }

    private static WindowTelemetry telemetry(
            long windowStart,
            long windowEnd,
            DistanceShells[] shells,
            NodeAccumulator[] accumulators,
            long startedAt
    ) {
        int reachablePairs = 0;
        int shellCount = 0;
        int maxDepth = 0;
        for (DistanceShells nodeShells : shells) {
            reachablePairs += nodeShells.reachableCount();
            shellCount += nodeShells.shells().size();
            maxDepth = Math.max(maxDepth, nodeShells.maxDistance());
        }
        int outOfRange = 0;
        for (NodeAccumulator accumulator : accumulators) {
            outOfRange += accumulator.outOfRangeCount(SCORE_BOUND_TOLERANCE);
        }
        return new WindowTelemetry(
                windowStart,
                windowEnd,
                shells.length,
                reachablePairs,
                shellCount,
                maxDepth,
                outOfRange,
                System.nanoTime() - startedAt
        );
    }

    /**
     * Returns {@code windowStart + delta}.
     *
     * @throws ConformityException when the window end does not fit a {@code long}.
     */
    static long windowEnd(long windowStart, long delta) {
        try {
            return Math.addExact(windowStart, delta);
        } catch (ArithmeticException ex) {
            throw ConformityException.invalidArgument(
                    ConformityCore.REASON_WINDOW_OUT_OF_RANGE,
                    "window end overflows: " + windowStart + " + " + delta
            );
        }
    }
}
