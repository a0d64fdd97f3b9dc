package org.graphx.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time configuration for {@link AdjacencyStore}.
 */
@Value
@Builder
public class GraphConfig {
    /**
     * Upper bound on distinct node keys the store will ever resolve. Must be positive.
     */
    int nodeCapacity;

    /**
     * {@code true} stores each edge once; {@code false} mirrors every inserted edge.
     */
    @Builder.Default
    boolean directed = true;

    /**
     * Sizing hint for the identifier index. 0 means no hint. Never a bound.
     */
    @Builder.Default
    int expectedNodes = 0;
}
