package org.Aayush.conformity.core;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration bound once per {@link ConformityCore}.
 */
@Value
@Builder
public class ConformityRuntimeConfig {
    static final int UNBOUNDED = 0;

    private static final String PROP_NODE_PARALLELISM = "conformity.core.nodeParallelism";
    private static final String PROP_WINDOW_PARALLELISM = "conformity.core.windowParallelism";
    private static final String PROP_MAX_WINDOWS = "conformity.core.maxWindows";

    /**
     * Worker threads for the per-node loop of one window; {@code <= 1} runs sequentially.
     */
    @Builder.Default
    int nodeParallelism = 1;

    /**
     * Worker threads for the per-window loop of a sliding run; {@code <= 1} runs sequentially.
     *
     * <p>When windows run in parallel, nodes inside each window run sequentially.</p>
     */
    @Builder.Default
    int windowParallelism = 1;

    /**
     * Maximum windows a sliding run may evaluate; {@code <= 0} means unbounded.
     */
    @Builder.Default
    int maxWindows = UNBOUNDED;

    /**
     * Returns a fully sequential, unbounded configuration.
     */
    public static ConformityRuntimeConfig sequential() {
        return ConformityRuntimeConfig.builder().build();
    }

    /**
     * Loads configuration from system properties, falling back to sequential defaults on
     * missing or malformed values.
     */
    public static ConformityRuntimeConfig defaults() {
        return ConformityRuntimeConfig.builder()
                .nodeParallelism(readInt(PROP_NODE_PARALLELISM, 1))
                .windowParallelism(readInt(PROP_WINDOW_PARALLELISM, 1))
                .maxWindows(readInt(PROP_MAX_WINDOWS, UNBOUNDED))
                .build();
    }

    boolean windowBudgetBounded() {
        return maxWindows > 0;
    }

    private static int readInt(String property, int defaultValue) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }
}
