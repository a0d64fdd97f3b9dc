package org.graphx.search;

/**
 * Signals a dequeue on a {@link NodeQueue} that holds no node ids.
 * A BFS loop guarded by {@code isEmpty()} never triggers it.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String message) {
        super(message);
    }
}
