package org.graphx.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.graphx.core.GraphContractException;
import org.graphx.core.id.IdentifierIndex;
import org.graphx.core.id.NodeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Weighted adjacency-list graph keyed by {@link NodeKey}.
 * <p>
 * Keys are translated to dense ids through one owned {@link IdentifierIndex}; every id
 * must stay below {@link #nodeCapacity()}. Each id maps to two parallel lists
 * (neighbor ids, weights) kept in insertion order, so traversal order among
 * same-distance neighbors is reproducible.
 * </p>
 * <ul>
 * <li>Parallel edges and self loops are stored as inserted.</li>
 * <li>Weights are stored verbatim and never interpreted here.</li>
 * </ul>
 * <p><strong>Thread Safety:</strong> NOT thread-safe. Concurrent readers are fine only while
 * no edge insertion is in flight.</p>
 */
public class AdjacencyStore {

    private static final Logger log = LoggerFactory.getLogger(AdjacencyStore.class);

    public static final String REASON_CAPACITY_EXCEEDED = "G2_CAPACITY_EXCEEDED";

    @Getter
    @Accessors(fluent = true)
    private final int nodeCapacity;

    @Getter
    @Accessors(fluent = true)
    private final boolean directed;

    private final IdentifierIndex index;

    // SoA adjacency: neighbors[id] and weights[id] grow in lockstep. Lazily allocated.
    private final IntArrayList[] neighbors;
    private final IntArrayList[] weights;

    @Getter
    @Accessors(fluent = true)
    private int edgeCount;

    /**
     * Creates an empty store.
     *
     * @param nodeCapacity maximum number of distinct node keys; must be positive.
     * @param directed whether inserted edges are one-way.
     */
    public AdjacencyStore(int nodeCapacity, boolean directed) {
        this(nodeCapacity, directed, IdentifierIndex.create());
    }

    private AdjacencyStore(int nodeCapacity, boolean directed, IdentifierIndex index) {
        if (nodeCapacity <= 0) {
            throw new IllegalArgumentException("nodeCapacity must be positive");
        }
        this.nodeCapacity = nodeCapacity;
        this.directed = directed;
        this.index = index;
        this.neighbors = new IntArrayList[nodeCapacity];
        this.weights = new IntArrayList[nodeCapacity];
        log.debug("Created {} adjacency store with capacity {}", directed ? "directed" : "undirected", nodeCapacity);
    }

    /**
     * Creates an empty store from a configuration object.
     *
     * @param config store configuration.
     * @return new store.
     */
    public static AdjacencyStore from(GraphConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.getExpectedNodes() < 0) {
            throw new IllegalArgumentException("expectedNodes must be non-negative");
        }
        int hint = Math.min(config.getExpectedNodes(), Math.max(config.getNodeCapacity(), 0));
        return new AdjacencyStore(config.getNodeCapacity(), config.isDirected(), IdentifierIndex.create(hint));
    }

    /**
     * Inserts an edge with weight 0.
     *
     * @see #addEdge(NodeKey, NodeKey, int)
     */
    public void addEdge(NodeKey u, NodeKey v) {
        addEdge(u, v, 0);
    }

    /**
     * Inserts an edge {@code u -> v}, mirrored as {@code v -> u} when the store is undirected.
     * <p>
     * Both endpoints are resolved before any append, so a capacity failure leaves the
     * adjacency lists untouched.
     * </p>
     *
     * @param u source key.
     * @param v destination key.
     * @param weight stored edge weight.
     * @throws GraphContractException with {@link #REASON_CAPACITY_EXCEEDED} if an endpoint
     * would need an id {@code >= nodeCapacity}.
     */
    public void addEdge(NodeKey u, NodeKey v, int weight) {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        int idU = resolve(u);
        int idV = resolve(v);

        append(idU, idV, weight);
        if (!directed) {
            append(idV, idU, weight);
        }
    }

    /**
     * Resolves a key through the shared index and enforces the capacity bound.
     *
     * @param key node key.
     * @return dense id, strictly below {@link #nodeCapacity()}.
     * @throws GraphContractException with {@link #REASON_CAPACITY_EXCEEDED} if the key is new
     * and every id below the capacity is taken. The index is left unchanged in that case.
     */
    public int resolve(NodeKey key) {
        int id = index.resolveWithin(key, nodeCapacity);
        if (id == IdentifierIndex.NO_ID) {
            String shape = key.shape().name().toLowerCase(Locale.ROOT);
            log.warn("Rejected {} key {}: all {} ids are in use", shape, key, nodeCapacity);
            throw new GraphContractException(
                    REASON_CAPACITY_EXCEEDED,
                    shape + " key " + key + " needs a new id but all " + nodeCapacity + " ids are in use"
            );
        }
        return id;
    }

    /**
     * Returns number of ids minted so far by the shared index.
     */
    public int nodeCount() {
        return index.size();
    }

    /**
     * Returns number of adjacency entries stored under one id.
     */
    public int degree(int nodeId) {
        validateNode(nodeId);
        IntArrayList list = neighbors[nodeId];
        return list == null ? 0 : list.size();
    }

    /**
     * Returns neighbor id at one adjacency slot.
     */
    public int neighborAt(int nodeId, int slot) {
        validateSlot(nodeId, slot);
        return neighbors[nodeId].getInt(slot);
    }

    /**
     * Returns stored weight at one adjacency slot.
     */
    public int weightAt(int nodeId, int slot) {
        validateSlot(nodeId, slot);
        return weights[nodeId].getInt(slot);
    }

    private void append(int from, int to, int weight) {
        IntArrayList targets = neighbors[from];
        if (targets == null) {
            targets = new IntArrayList(4);
            neighbors[from] = targets;
            weights[from] = new IntArrayList(4);
        }
        targets.add(to);
        weights[from].add(weight);
        assert targets.size() == weights[from].size();
        edgeCount++;
    }

    private void validateSlot(int nodeId, int slot) {
        int degree = degree(nodeId);
        if (slot < 0 || slot >= degree) {
            throw new IndexOutOfBoundsException("slot " + slot + " out of bounds for node " + nodeId + " (degree " + degree + ")");
        }
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCapacity) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }
}
