package org.graphx.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Fixed-capacity FIFO of dense node ids for level-order traversal.
 * <p>
 * A BFS run enqueues every node at most once, so a capacity equal to the node capacity
 * of the graph never overflows. Slots are plain ints; no allocation after construction.
 * </p>
 * <p><strong>Usage Warning:</strong> NOT thread-safe.</p>
 */
public class NodeQueue {

    // ring buffer
    private final int[] slots;
    private int head = 0;
    private int tail = 0;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    /**
     * @param capacity maximum number of ids held at once; must be positive.
     */
    public NodeQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.slots = new int[capacity];
    }

    /**
     * Appends a node id at the tail.
     *
     * @throws IllegalStateException if the queue is full.
     */
    public void enqueue(int nodeId) {
        if (size == slots.length) {
            throw new IllegalStateException("Queue full. Capacity: " + capacity());
        }
        slots[tail] = nodeId;
        tail = (tail + 1) % slots.length;
        size++;
    }

    /**
     * Removes and returns the node id at the head.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int dequeue() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int nodeId = slots[head];
        head = (head + 1) % slots.length;
        size--;
        return nodeId;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int capacity() {
        return slots.length;
    }

    public void clear() {
        head = 0;
        tail = 0;
        size = 0;
    }
}
