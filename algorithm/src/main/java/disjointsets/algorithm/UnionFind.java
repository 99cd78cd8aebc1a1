package disjointsets.algorithm;

/**
 * Partition of a universe of items into disjoint sets, supporting merges and same-set queries.
 * Sets only ever grow and merge; there is no way to remove an item or split a set.
 *
 * Every operation taking an item throws {@link ItemNotFoundException} if that item was never passed to
 * {@link #makeSet}. Failed operations leave the structure unchanged.
 *
 * @param <T> item type; items are compared with equals/hashCode and must not be null
 */
public interface UnionFind<T> {

    boolean contains(T item);

    /**
     * Establishes a new singleton set containing only `item`.
     * @throws ItemExistsException if `item` is already present
     */
    void makeSet(T item);

    /**
     * Finds the representative of the set containing `item`.
     * Performs path compression.
     */
    T findSet(T item);

    boolean sameSet(T x, T y);

    /**
     * Unifies the sets containing x and y.
     * @return true if the sets were different and are now merged, false if they were already the same.
     */
    boolean union(T x, T y);

    /** number of items in the set containing `item` */
    int setSize(T item);

    int numSets();

    int numItems();

    class ItemNotFoundException extends RuntimeException {
        private final Object item;

        public ItemNotFoundException(Object item) {
            super("item not found: " + item);
            this.item = item;
        }

        public Object getItem() {
            return item;
        }
    }

    class ItemExistsException extends RuntimeException {
        private final Object item;

        public ItemExistsException(Object item) {
            super("item already exists: " + item);
            this.item = item;
        }

        public Object getItem() {
            return item;
        }
    }
}
