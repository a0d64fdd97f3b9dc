package org.graphx.search;

/**
 * Lifecycle of a {@link BfsTraversal}.
 */
public enum TraversalState {
    /**
     * All nodes unvisited, all distances -1. Initial state and state after {@code clear()}.
     */
    IDLE,
    /**
     * A run finished; results are queryable until the next {@code clear()}.
     */
    COMPLETED
}
