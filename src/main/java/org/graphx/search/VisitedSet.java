package org.graphx.search;

import java.util.BitSet;

/**
 * Reached-or-not flag per dense node id, one bit each.
 * Owned by a single {@link BfsTraversal}; no synchronization.
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param nodeCapacity node ids the traversal can produce; sizes the bit set up front.
     */
    public VisitedSet(int nodeCapacity) {
        this.visited = new BitSet(nodeCapacity);
    }

    /**
     * Sets the flag for {@code nodeId}.
     *
     * @return {@code true} only on the first call for this id since the last {@link #clear()}.
     */
    public boolean markVisited(int nodeId) {
        if (visited.get(nodeId)) {
            return false;
        }
        visited.set(nodeId);
        return true;
    }

    public boolean isVisited(int nodeId) {
        return visited.get(nodeId);
    }

    /**
     * Returns how many ids carry the flag.
     */
    public int cardinality() {
        return visited.cardinality();
    }

    public void clear() {
        visited.clear();
    }
}
