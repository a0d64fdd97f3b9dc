package org.graphx.core.id;

import org.graphx.core.GraphContractException;

/**
 * Caller-facing node identifier: a scalar, a coordinate pair or a coordinate triple.
 * <p>
 * Every variant reduces to a normalized triple ({@code Scalar(x) -> (x,0,0)},
 * {@code Pair(x,y) -> (x,y,0)}). Equality and hashing look only at that triple, so
 * {@code Scalar(5)}, {@code Pair(5,0)} and {@code Triple(5,0,0)} are the same node.
 * </p>
 * Instances are immutable.
 */
public abstract class NodeKey {

    public static final String REASON_INVALID_KEY_SHAPE = "G1_INVALID_KEY_SHAPE";

    /**
     * Arity of the caller-facing form.
     */
    public enum KeyShape {
        SCALAR,
        PAIR,
        TRIPLE
    }

    private final int x;
    private final int y;
    private final int z;

    private NodeKey(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Scalar scalar(int x) {
        return new Scalar(x);
    }

    public static Pair pair(int x, int y) {
        return new Pair(x, y);
    }

    public static Triple triple(int x, int y, int z) {
        return new Triple(x, y, z);
    }

    /**
     * Builds a key from raw components, picking the variant from the component count.
     *
     * @param components one, two or three integers.
     * @return the matching variant.
     * @throws GraphContractException with {@link #REASON_INVALID_KEY_SHAPE} when the
     * component array is null, empty or longer than three.
     */
    public static NodeKey of(int... components) {
        if (components == null) {
            throw new GraphContractException(REASON_INVALID_KEY_SHAPE, "key components must be provided");
        }
        switch (components.length) {
            case 1:
                return new Scalar(components[0]);
            case 2:
                return new Pair(components[0], components[1]);
            case 3:
                return new Triple(components[0], components[1], components[2]);
            default:
                throw new GraphContractException(
                        REASON_INVALID_KEY_SHAPE,
                        "key must have 1, 2 or 3 components, got " + components.length
                );
        }
    }

    public int x() { return x; }
    public int y() { return y; }
    public int z() { return z; }

    public abstract KeyShape shape();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeKey)) return false;
        NodeKey other = (NodeKey) o;
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public final int hashCode() {
        int h = x;
        h = 31 * h + y;
        h = 31 * h + z;
        return h;
    }

    public static final class Scalar extends NodeKey {
        private Scalar(int x) {
            super(x, 0, 0);
        }

        @Override
        public KeyShape shape() {
            return KeyShape.SCALAR;
        }

        @Override
        public String toString() {
            return Integer.toString(x());
        }
    }

    public static final class Pair extends NodeKey {
        private Pair(int x, int y) {
            super(x, y, 0);
        }

        @Override
        public KeyShape shape() {
            return KeyShape.PAIR;
        }

        @Override
        public String toString() {
            return "(" + x() + ", " + y() + ")";
        }
    }

    public static final class Triple extends NodeKey {
        private Triple(int x, int y, int z) {
            super(x, y, z);
        }

        @Override
        public KeyShape shape() {
            return KeyShape.TRIPLE;
        }

        @Override
        public String toString() {
            return "(" + x() + ", " + y() + ", " + z() + ")";
        }
    }
}
