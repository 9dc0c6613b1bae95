package org.Aayush.conformity.core;

import org.Aayush.conformity.graph.DynamicGraph;

/**
 * Public delta-conformity service contract.
 *
 * <p>Implementations validate every request before touching the graph and throw
 * {@link ConformityException} with stable reason codes on contract failures.</p>
 */
public interface ConformityService {
    /**
     * Computes delta-conformity over one window {@code [windowStart, windowStart + delta]}.
     *
     * @param graph dynamic graph.
     * @param windowStart first temporal id of the window.
     * @param parameters conformity parameters.
     * @return alpha key -> profile name -> node -> score, every snapshot node present.
     */
    ConformityScores deltaConformity(DynamicGraph graph, long windowStart, ConformityParameters parameters);

    /**
     * Computes delta-conformity on every admissible sliding window of the graph.
     *
     * @param graph dynamic graph.
     * @param parameters conformity parameters.
     * @return alpha key -> profile name -> node -> time-ordered {@code (start + delta, score)} series.
     */
    ConformitySeries slidingDeltaConformity(DynamicGraph graph, ConformityParameters parameters);
}
