package org.graphx.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Objects;

/**
 * {@link IdentifierIndex} backed by a fastutil open-addressing map.
 * <p>
 * Not thread-safe. Mutation must stay with a single owner (the graph that holds it).
 * </p>
 */
public class FastUtilIdentifierIndex implements IdentifierIndex {

    private static final int MISSING = NO_ID;

    // getInt/put avoid boxing on the hot resolve path
    private final Object2IntOpenHashMap<NodeKey> forward;

    FastUtilIdentifierIndex(int expectedKeys) {
        if (expectedKeys < 0) {
            throw new IllegalArgumentException("expectedKeys must be non-negative");
        }
        this.forward = expectedKeys == 0
                ? new Object2IntOpenHashMap<>()
                : new Object2IntOpenHashMap<>(expectedKeys);
        this.forward.defaultReturnValue(MISSING);
    }

    @Override
    public int resolve(NodeKey key) {
        Objects.requireNonNull(key, "key");
        int id = forward.getInt(key);
        if (id != MISSING) {
            return id;
        }
        id = forward.size();
        forward.put(key, id);
        return id;
    }

    @Override
    public int resolveWithin(NodeKey key, int limit) {
        Objects.requireNonNull(key, "key");
        int id = forward.getInt(key);
        if (id != MISSING || forward.size() >= limit) {
            return id;
        }
        id = forward.size();
        forward.put(key, id);
        return id;
    }

    @Override
    public int size() {
        return forward.size();
    }
}
