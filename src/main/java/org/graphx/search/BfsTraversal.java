package org.graphx.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.graphx.core.GraphContractException;
import org.graphx.core.id.NodeKey;
import org.graphx.graph.AdjacencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Single-source breadth-first search over an {@link AdjacencyStore}, measuring hop counts.
 * <p>
 * Edge weights are ignored: every traversed edge costs one hop. Neighbors of a node are
 * expanded in adjacency insertion order, so two runs from the same source over an
 * unmodified store dequeue nodes in the same order.
 * </p>
 * <p>
 * Query keys are resolved through the store's identifier index, so a key never seen
 * before gets an id minted for it and reports distance -1.
 * </p>
 * <p><strong>Usage:</strong> one run per {@link #clear()}. Calling {@link #run(NodeKey)} on a
 * completed traversal fails with {@link #REASON_STALE_TRAVERSAL_STATE}; use
 * {@link #runFresh(NodeKey)} to reset and run in one call.</p>
 * <p>NOT thread-safe. Several traversals may share one store as long as nobody inserts edges.</p>
 */
public class BfsTraversal {

    private static final Logger log = LoggerFactory.getLogger(BfsTraversal.class);

    public static final String REASON_STALE_TRAVERSAL_STATE = "G3_STALE_TRAVERSAL_STATE";

    static final int UNREACHED = -1;

    private final AdjacencyStore store;
    private final VisitedSet visited;
    private final int[] distance;
    private final NodeQueue queue;

    // Dequeue order of the last run; doubles as the touched list for clear()
    private final IntArrayList visitOrder;

    @Getter
    @Accessors(fluent = true)
    private TraversalState state = TraversalState.IDLE;

    /**
     * Binds a traversal to a store. The store is only read.
     *
     * @param store graph to traverse.
     */
    public BfsTraversal(AdjacencyStore store) {
        this.store = Objects.requireNonNull(store, "store");
        int capacity = store.nodeCapacity();
        this.visited = new VisitedSet(capacity);
        this.distance = new int[capacity];
        Arrays.fill(distance, UNREACHED);
        this.queue = new NodeQueue(capacity);
        assert queue.capacity() == capacity;
        this.visitOrder = new IntArrayList();
    }

    /**
     * Resets every node to unvisited with distance -1. Safe to call at any time.
     */
    public void clear() {
        for (int i = 0; i < visitOrder.size(); i++) {
            distance[visitOrder.getInt(i)] = UNREACHED;
        }
        visitOrder.clear();
        visited.clear();
        queue.clear();
        state = TraversalState.IDLE;
    }

    /**
     * Explores everything reachable from {@code source} in level order.
     *
     * @param source start node; may be a key never inserted as an edge endpoint.
     * @throws GraphContractException with {@link #REASON_STALE_TRAVERSAL_STATE} if a previous
     * run has not been cleared, or with {@link AdjacencyStore#REASON_CAPACITY_EXCEEDED} if
     * the source does not fit the store.
     */
    public void run(NodeKey source) {
        Objects.requireNonNull(source, "source");
        if (state != TraversalState.IDLE) {
            throw new GraphContractException(
                    REASON_STALE_TRAVERSAL_STATE,
                    "traversal holds results of a previous run; call clear() before run(" + source + ")"
            );
        }
        int sourceId = store.resolve(source);
        assert !visited.isVisited(sourceId) && distance[sourceId] == UNREACHED;

        visited.markVisited(sourceId);
        distance[sourceId] = 0;
        queue.enqueue(sourceId);

        while (!queue.isEmpty()) {
            int current = queue.dequeue();
            visitOrder.add(current);
            int nextDistance = distance[current] + 1;
            int degree = store.degree(current);
            for (int slot = 0; slot < degree; slot++) {
                int neighbor = store.neighborAt(current, slot);
                if (visited.markVisited(neighbor)) {
                    distance[neighbor] = nextDistance;
                    queue.enqueue(neighbor);
                }
            }
        }

        state = TraversalState.COMPLETED;
        log.debug("BFS from {} (id {}) visited {} nodes", source, sourceId, visitOrder.size());
    }

    /**
     * Clears any previous results, then runs from {@code source}.
     */
    public void runFresh(NodeKey source) {
        clear();
        run(source);
    }

    /**
     * Returns hop distance from the last run's source, or -1 if {@code target} was not reached.
     *
     * @param target node key; resolved (and possibly minted) through the store's index.
     * @return hop count, or -1.
     */
    public int minDist(NodeKey target) {
        return distance[store.resolve(Objects.requireNonNull(target, "target"))];
    }

    /**
     * Returns whether {@code target} was reached by the last run.
     *
     * @param target node key; resolved (and possibly minted) through the store's index.
     */
    public boolean isVisited(NodeKey target) {
        return visited.isVisited(store.resolve(Objects.requireNonNull(target, "target")));
    }

    /**
     * Returns number of nodes reached by the last run (0 when idle).
     */
    public int visitedCount() {
        return visited.cardinality();
    }

    /**
     * Returns dense ids in the order the last run dequeued them.
     *
     * @return defensive copy; empty when idle.
     */
    public int[] visitOrder() {
        return visitOrder.toIntArray();
    }
}
