package disjointsets;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;

public class Config {
    private static final int defaultInitialCapacity = 100;
    private static final float defaultLoadFactor = 0.5f; // same as trove's own default
    private int initialCapacity = defaultInitialCapacity;
    private float loadFactor = defaultLoadFactor;

    public static Config withDefaults() {
        return new Config();
    }

    /**
     * Expected number of items. The backing maps are presized for this many entries,
     * so registering up to that many items never rehashes.
     * defaults to 100
     */
    public Config withInitialCapacity(int initialCapacity) {
        checkArgument(initialCapacity >= 0, "initial capacity must not be negative, but was: %s", initialCapacity);
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Load factor of the backing open-addressing maps, strictly between 0 and 1.
     * defaults to 0.5
     */
    public Config withLoadFactor(float loadFactor) {
        checkArgument(loadFactor > 0f && loadFactor < 1f, "load factor must be in (0, 1), but was: %s", loadFactor);
        this.loadFactor = loadFactor;
        return this;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public float getLoadFactor() {
        return loadFactor;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("initialCapacity", initialCapacity)
                .add("loadFactor", loadFactor)
                .toString();
    }
}
