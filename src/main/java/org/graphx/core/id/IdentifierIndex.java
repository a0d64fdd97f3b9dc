package org.graphx.core.id;

/**
 * Append-only translation from {@link NodeKey} values to dense integer ids.
 * <p>
 * Ids are 0-based and handed out contiguously in first-seen order. An id is never
 * reassigned or reused for the lifetime of the index.
 * </p>
 */
public interface IdentifierIndex {

    /**
     * Returned by {@link #resolveWithin(NodeKey, int)} when a new key would exceed the limit.
     */
    int NO_ID = -1;

    /**
     * Returns the id of a key, minting the next sequential id when the key is new.
     *
     * @param key node key; keys with the same normalized triple share one id.
     * @return dense id in {@code [0, size())}.
     * @throws NullPointerException if key is null.
     */
    int resolve(NodeKey key);

    /**
     * Like {@link #resolve(NodeKey)}, but only mints while fewer than {@code limit} ids exist.
     *
     * @param key node key.
     * @param limit exclusive upper bound for a newly minted id.
     * @return existing id, newly minted id below {@code limit}, or {@link #NO_ID} when the key
     * is new and the index already holds {@code limit} ids. Nothing is stored in that case.
     * @throws NullPointerException if key is null.
     */
    int resolveWithin(NodeKey key, int limit);

    /**
     * Returns number of ids handed out, which is also the next id to be minted.
     *
     * @return current mapping size.
     */
    int size();

    /**
     * Factory method for the default fastutil-backed index.
     *
     * @return a fresh empty index.
     */
    static IdentifierIndex create() {
        return new FastUtilIdentifierIndex(0);
    }

    /**
     * Factory method for the default index, pre-sized for an expected key count.
     *
     * @param expectedKeys sizing hint; 0 means no hint.
     * @return a fresh empty index.
     */
    static IdentifierIndex create(int expectedKeys) {
        return new FastUtilIdentifierIndex(expectedKeys);
    }
}
