package org.graphx.graph;

import org.graphx.core.GraphContractException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.graphx.core.id.NodeKey.pair;
import static org.graphx.core.id.NodeKey.scalar;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdjacencyStore.
 * Covers construction, directed/undirected insertion, insertion order, and capacity limits.
 */
class AdjacencyStoreTest {

    @Test
    @DisplayName("Construction exposes capacity and direction")
    void testConstruction() {
        AdjacencyStore directed = new AdjacencyStore(5, true);
        assertTrue(directed.directed());
        assertEquals(5, directed.nodeCapacity());
        assertEquals(0, directed.nodeCount());
        assertEquals(0, directed.edgeCount());

        AdjacencyStore undirected = new AdjacencyStore(5, false);
        assertFalse(undirected.directed());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Non-positive capacity is rejected")
    void testInvalidCapacity(int capacity) {
        assertThrows(IllegalArgumentException.class, () -> new AdjacencyStore(capacity, true));
        assertThrows(IllegalArgumentException.class,
                () -> AdjacencyStore.from(GraphConfig.builder().nodeCapacity(capacity).build()));
    }

    @Test
    @DisplayName("Config builder defaults to a directed store")
    void testFromConfig() {
        AdjacencyStore store = AdjacencyStore.from(GraphConfig.builder().nodeCapacity(8).build());
        assertTrue(store.directed());
        assertEquals(8, store.nodeCapacity());

        AdjacencyStore undirected = AdjacencyStore.from(GraphConfig.builder()
                .nodeCapacity(8)
                .directed(false)
                .expectedNodes(1_000)
                .build());
        assertFalse(undirected.directed());

        assertThrows(IllegalArgumentException.class, () -> AdjacencyStore.from(GraphConfig.builder()
                .nodeCapacity(8)
                .expectedNodes(-1)
                .build()));
    }

    @Test
    @DisplayName("Directed edge produces exactly one entry")
    void testAddEdgeDirected() {
        AdjacencyStore store = new AdjacencyStore(5, true);
        store.addEdge(scalar(0), scalar(1), 5);

        int u = store.resolve(scalar(0));
        int v = store.resolve(scalar(1));

        assertEquals(1, store.degree(u));
        assertEquals(v, store.neighborAt(u, 0));
        assertEquals(5, store.weightAt(u, 0));
        assertEquals(0, store.degree(v));
        assertEquals(1, store.edgeCount());
    }

    @Test
    @DisplayName("Undirected edge is mirrored")
    void testAddEdgeUndirected() {
        AdjacencyStore store = new AdjacencyStore(5, false);
        store.addEdge(scalar(0), scalar(1), 3);

        int u = store.resolve(scalar(0));
        int v = store.resolve(scalar(1));

        assertEquals(1, store.degree(u));
        assertEquals(1, store.degree(v));
        assertEquals(v, store.neighborAt(u, 0));
        assertEquals(3, store.weightAt(u, 0));
        assertEquals(u, store.neighborAt(v, 0));
        assertEquals(3, store.weightAt(v, 0));
        assertEquals(2, store.edgeCount());
    }

    @Test
    @DisplayName("Composite keys are resolved through the shared index")
    void testAddEdgeTuple() {
        AdjacencyStore store = new AdjacencyStore(10, true);
        store.addEdge(pair(0, 0), pair(1, 1), 7);

        int u = store.resolve(pair(0, 0));
        int v = store.resolve(pair(1, 1));

        assertEquals(0, u);
        assertEquals(1, v);
        assertEquals(1, store.degree(u));
        assertEquals(v, store.neighborAt(u, 0));
        assertEquals(7, store.weightAt(u, 0));
        assertEquals(2, store.nodeCount());
    }

    @Test
    @DisplayName("Default weight is zero; parallel edges and self loops are kept")
    void testParallelEdgesAndSelfLoops() {
        AdjacencyStore store = new AdjacencyStore(4, false);
        store.addEdge(scalar(0), scalar(1));
        store.addEdge(scalar(0), scalar(1), 9);
        store.addEdge(scalar(2), scalar(2), 4);

        int a = store.resolve(scalar(0));
        int b = store.resolve(scalar(1));
        int c = store.resolve(scalar(2));

        assertEquals(2, store.degree(a));
        assertEquals(0, store.weightAt(a, 0));
        assertEquals(9, store.weightAt(a, 1));
        assertEquals(2, store.degree(b));
        // undirected self loop is appended twice
        assertEquals(2, store.degree(c));
        assertEquals(c, store.neighborAt(c, 0));
        assertEquals(c, store.neighborAt(c, 1));
        assertEquals(6, store.edgeCount());
    }

    @Test
    @DisplayName("Adjacency preserves insertion order")
    void testInsertionOrder() {
        AdjacencyStore store = new AdjacencyStore(6, true);
        store.addEdge(scalar(0), scalar(3));
        store.addEdge(scalar(0), scalar(1));
        store.addEdge(scalar(0), scalar(2));

        int source = store.resolve(scalar(0));
        assertEquals(store.resolve(scalar(3)), store.neighborAt(source, 0));
        assertEquals(store.resolve(scalar(1)), store.neighborAt(source, 1));
        assertEquals(store.resolve(scalar(2)), store.neighborAt(source, 2));
    }

    @Test
    @DisplayName("Capacity overflow fails before any append")
    void testCapacityExceeded() {
        AdjacencyStore store = new AdjacencyStore(2, false);
        store.addEdge(scalar(0), scalar(1));
        assertEquals(2, store.edgeCount());

        GraphContractException ex = assertThrows(GraphContractException.class,
                () -> store.addEdge(scalar(0), scalar(2)));
        assertEquals(AdjacencyStore.REASON_CAPACITY_EXCEEDED, ex.reasonCode());
        assertEquals(2, store.edgeCount());
        assertEquals(1, store.degree(store.resolve(scalar(0))));

        GraphContractException direct = assertThrows(GraphContractException.class,
                () -> store.resolve(pair(9, 9)));
        assertEquals(AdjacencyStore.REASON_CAPACITY_EXCEEDED, direct.reasonCode());
    }

    @Test
    @DisplayName("Full store never mints an id at or above capacity")
    void testFullStoreMintsNoIds() {
        AdjacencyStore store = new AdjacencyStore(2, true);
        assertEquals(0, store.resolve(scalar(0)));
        assertEquals(1, store.resolve(scalar(1)));

        for (int attempt = 0; attempt < 3; attempt++) {
            GraphContractException ex = assertThrows(GraphContractException.class,
                    () -> store.resolve(scalar(2)));
            assertEquals(AdjacencyStore.REASON_CAPACITY_EXCEEDED, ex.reasonCode());
            assertTrue(ex.getMessage().contains("scalar key 2"));
            assertEquals(2, store.nodeCount(), "Rejected key must not consume an id");
        }
        assertThrows(GraphContractException.class, () -> store.addEdge(pair(0, 0), pair(5, 5)));
        assertEquals(2, store.nodeCount());
        assertEquals(0, store.edgeCount());

        // known keys, in any equivalent shape, still resolve once full
        assertEquals(0, store.resolve(pair(0, 0)));
        store.addEdge(scalar(1), scalar(0), 4);
        assertEquals(1, store.edgeCount());
    }

    @Test
    @DisplayName("Inspection accessors validate bounds")
    void testAccessorBounds() {
        AdjacencyStore store = new AdjacencyStore(3, true);
        store.addEdge(scalar(0), scalar(1));

        assertEquals(0, store.degree(2));
        assertThrows(IndexOutOfBoundsException.class, () -> store.degree(3));
        assertThrows(IndexOutOfBoundsException.class, () -> store.degree(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> store.neighborAt(0, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> store.weightAt(1, 0));
    }

    @Test
    @DisplayName("Null endpoints are rejected")
    void testNullEndpoints() {
        AdjacencyStore store = new AdjacencyStore(3, true);
        assertThrows(NullPointerException.class, () -> store.addEdge(null, scalar(1)));
        assertThrows(NullPointerException.class, () -> store.addEdge(scalar(1), null, 2));
        assertEquals(0, store.nodeCount());
    }
}
