package org.Aayush.conformity.core;

import lombok.Builder;
import lombok.extern.log4j.Log4j2;
import org.Aayush.conformity.aggregate.DampingFactor;
import org.Aayush.conformity.graph.DynamicGraph;
import org.Aayush.conformity.graph.TemporalPathOracle;
import org.Aayush.conformity.label.LabelHierarchies;
import org.Aayush.conformity.label.Profile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Main delta-conformity entry point.
 *
 * <p>The facade validates every request before the graph is touched, then:</p>
 * <ul>
 * <li>resolves alphas, labels and the generated profiles into an internal parameter set;</li>
 * <li>delegates single windows to the window pipeline;</li>
 * <li>delegates sliding runs to the sliding runner, which re-enters the window pipeline
 * once per admissible window start.</li>
 * </ul>
 */
@Log4j2
public final class ConformityCore implements ConformityService {
    public static final String REASON_GRAPH_REQUIRED = "DC_GRAPH_REQUIRED";
    public static final String REASON_PARAMETERS_REQUIRED = "DC_PARAMETERS_REQUIRED";
    public static final String REASON_ALPHAS_REQUIRED = "DC_ALPHAS_REQUIRED";
    public static final String REASON_LABELS_REQUIRED = "DC_LABELS_REQUIRED";
    public static final String REASON_PROFILE_SIZE_OUT_OF_RANGE = "DC_PROFILE_SIZE_OUT_OF_RANGE";
    public static final String REASON_ALPHA_INVALID = "DC_ALPHA_INVALID";
    public static final String REASON_DUPLICATE_ALPHA = "DC_DUPLICATE_ALPHA";
    public static final String REASON_LABEL_INVALID = "DC_LABEL_INVALID";
    public static final String REASON_DUPLICATE_LABEL = "DC_DUPLICATE_LABEL";
    public static final String REASON_PATH_POLICY_REQUIRED = "DC_PATH_POLICY_REQUIRED";
    public static final String REASON_DELTA_NEGATIVE = "DC_DELTA_NEGATIVE";
    public static final String REASON_WINDOW_OUT_OF_RANGE = "DC_WINDOW_OUT_OF_RANGE";
    public static final String REASON_HIERARCHY_VALUE_UNKNOWN = "DC_HIERARCHY_VALUE_UNKNOWN";
    public static final String REASON_SNAPSHOT_UNAVAILABLE = "DC_SNAPSHOT_UNAVAILABLE";
    public static final String REASON_DUPLICATE_SNAPSHOT_NODE = "DC_DUPLICATE_SNAPSHOT_NODE";
    public static final String REASON_UNKNOWN_NEIGHBOR = "DC_UNKNOWN_NEIGHBOR";
    public static final String REASON_LABEL_VALUE_MISSING = "DC_LABEL_VALUE_MISSING";
    public static final String REASON_PATH_ORACLE_FAILED = "DC_PATH_ORACLE_FAILED";
    public static final String REASON_UNKNOWN_PAIR_NODE = "DC_UNKNOWN_PAIR_NODE";
    public static final String REASON_POLICY_DISTANCE_MISSING = "DC_POLICY_DISTANCE_MISSING";
    public static final String REASON_NEGATIVE_DISTANCE = "DC_NEGATIVE_DISTANCE";
    public static final String REASON_TEMPORAL_INDEX_INVALID = "DC_TEMPORAL_INDEX_INVALID";
    public static final String REASON_NUMERIC_SAFETY_BREACH = "DC_NUMERIC_SAFETY_BREACH";
    public static final String REASON_WINDOW_BUDGET_EXCEEDED = "DC_WINDOW_BUDGET_EXCEEDED";
    public static final String REASON_INTERRUPTED = "DC_INTERRUPTED";
    public static final String REASON_EXECUTION_FAILED = "DC_EXECUTION_FAILED";

    private final ConformityRuntimeConfig runtimeConfig;
    private final WindowConformityPipeline windowPipeline;
    private final SlidingWindowRunner slidingRunner;

    /**
     * Creates the conformity facade.
     *
     * @param pathOracle time-respecting path oracle.
     * @param runtimeConfig optional runtime configuration; system-property defaults when omitted.
     */
    @Builder
    public ConformityCore(TemporalPathOracle pathOracle, ConformityRuntimeConfig runtimeConfig) {
        this.runtimeConfig = runtimeConfig == null ? ConformityRuntimeConfig.defaults() : runtimeConfig;
        this.windowPipeline = new WindowConformityPipeline(Objects.requireNonNull(pathOracle, "pathOracle"));
        this.slidingRunner = new SlidingWindowRunner(this.runtimeConfig);
    }

    /**
     * Computes delta-conformity over one window.
     *
     * @throws ConformityException when request contracts fail or upstream data is inconsistent.
     */
    @Override
    public ConformityScores deltaConformity(DynamicGraph graph, long windowStart, ConformityParameters parameters) {
        ResolvedParameters resolved = resolve(graph, parameters);
        WindowConformityPipeline.windowEnd(windowStart, resolved.delta());
        return windowPipeline.evaluate(graph, windowStart, resolved, runtimeConfig.getNodeParallelism());
    }

    /**
     * Computes delta-conformity over every admissible sliding window.
     *
     * @throws ConformityException when request contracts fail or upstream data is inconsistent.
     */
    @Override
    public ConformitySeries slidingDeltaConformity(DynamicGraph graph, ConformityParameters parameters) {
        ResolvedParameters resolved = resolve(graph, parameters);
        return slidingRunner.run(
                graph,
                resolved,
                (windowStart, nodeParallelism) -> windowPipeline.evaluate(graph, windowStart, resolved, nodeParallelism)
        );
    }

    public ConformityRuntimeConfig runtimeConfig() {
        return runtimeConfig;
    }

    /**
     * Validates a request and resolves it into internal form.
     *
     * <p>No graph method is called here, so every invalid request fails before any
     * computation.</p>
     */
    private ResolvedParameters resolve(DynamicGraph graph, ConformityParameters parameters) {
        if (graph == null) {
            throw ConformityException.invalidArgument(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (parameters == null) {
            throw ConformityException.invalidArgument(REASON_PARAMETERS_REQUIRED, "parameters must be provided");
        }
        List<DampingFactor> alphas = resolveAlphas(parameters.getAlphas());
        List<String> labels = resolveLabels(parameters.getLabels());

        int profileSize = parameters.getProfileSize();
        if (profileSize < 1 || profileSize > labels.size()) {
            throw ConformityException.invalidArgument(
                    REASON_PROFILE_SIZE_OUT_OF_RANGE,
                    "profileSize must be in [1, " + labels.size() + "], got " + profileSize
            );
        }
        if (parameters.getPathPolicy() == null) {
            throw ConformityException.invalidArgument(REASON_PATH_POLICY_REQUIRED, "pathPolicy must be specified");
        }
        if (parameters.getDelta() < 0L) {
            throw ConformityException.invalidArgument(
                    REASON_DELTA_NEGATIVE,
                    "delta must be >= 0, got " + parameters.getDelta()
            );
        }

        List<Profile> profiles = Profile.combinations(labels, profileSize);
        LabelHierarchies hierarchies = parameters.getHierarchies() == null
                ? LabelHierarchies.none()
                : parameters.getHierarchies();
        log.debug("Resolved conformity request: alphas={} profiles={} policy={} delta={}",
                alphas.size(), profiles.size(), parameters.getPathPolicy().id(), parameters.getDelta());
        return new ResolvedParameters(
                parameters.getDelta(),
                alphas,
                labels,
                profiles,
                hierarchies,
                parameters.getPathPolicy()
        );
    }

    private static List<DampingFactor> resolveAlphas(List<Double> rawAlphas) {
        if (rawAlphas == null || rawAlphas.isEmpty()) {
            throw ConformityException.invalidArgument(REASON_ALPHAS_REQUIRED, "at least one alpha must be specified");
        }
        List<DampingFactor> alphas = new ArrayList<>(rawAlphas.size());
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < rawAlphas.size(); i++) {
            Double alpha = rawAlphas.get(i);
            if (alpha == null || !DampingFactor.isValid(alpha)) {
                throw ConformityException.invalidArgument(
                        REASON_ALPHA_INVALID,
                        "alphas[" + i + "] must be finite and > 0, got " + alpha
                );
            }
            DampingFactor factor = DampingFactor.of(alpha);
            if (!keys.add(factor.key())) {
                throw ConformityException.invalidArgument(
                        REASON_DUPLICATE_ALPHA,
                        "alpha " + factor.key() + " is requested more than once"
                );
            }
            alphas.add(factor);
        }
        return alphas;
    }

    private static List<String> resolveLabels(List<String> rawLabels) {
        if (rawLabels == null || rawLabels.isEmpty()) {
            throw ConformityException.invalidArgument(REASON_LABELS_REQUIRED, "at least one label must be specified");
        }
        List<String> labels = new ArrayList<>(rawLabels.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawLabels.size(); i++) {
            String label = rawLabels.get(i);
            if (label == null || label.isBlank()) {
                throw ConformityException.invalidArgument(REASON_LABEL_INVALID, "labels[" + i + "] must be non-blank");
            }
            if (!seen.add(label)) {
                throw ConformityException.invalidArgument(
                        REASON_DUPLICATE_LABEL,
                        "label " + label + " is requested more than once"
                );
            }
            labels.add(label);
        }
        return labels;
    }
}
