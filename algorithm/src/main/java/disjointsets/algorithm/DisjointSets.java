package disjointsets.algorithm;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import disjointsets.Config;
import disjointsets.storage.ItemIndex;
import disjointsets.storage.Node;
import disjointsets.storage.NodeRegistry;
import gnu.trove.list.array.TLongArrayList;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Union-Find (Disjoint Set Union) over arbitrary items, with full path compression and union by rank.
 *
 * Items are mapped to sequential ids, and all parent/rank bookkeeping happens on those ids in a {@link NodeRegistry},
 * so items are stored exactly once.
 *
 * The rank of a representative is the size of its set: a merge sums both ranks rather than taking max+1.
 * This keeps {@link #setSize} O(1) once the representative is found.
 *
 * Not thread safe, see {@link SynchronizedDisjointSets}.
 */
public class DisjointSets<T> implements UnionFind<T> {
    private static final Logger logger = Logger.getLogger(DisjointSets.class.getName());

    private final ItemIndex<T> index;
    private final NodeRegistry registry;
    // reused between finds to avoid allocating on every lookup
    private final TLongArrayList compressionPath = new TLongArrayList();

    public DisjointSets() {
        this(Config.withDefaults());
    }

    public DisjointSets(Config config) {
        this.index = new ItemIndex<>(config);
        this.registry = new NodeRegistry(config);
    }

    /** independent deep copy of `other`, including its current (possibly uncompressed) parent links */
    public DisjointSets(DisjointSets<T> other) {
        this.index = new ItemIndex<>(other.index);
        this.registry = new NodeRegistry(other.registry);
    }

    @Override
    public boolean contains(T item) {
        return index.contains(item);
    }

    @Override
    public void makeSet(T item) {
        if (index.contains(item)) {
            throw new ItemExistsException(item);
        }
        long id = index.register(item);
        registry.create(id);
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest(String.format("created set for %s (id=%d)", item, id));
        }
    }

    @Override
    public T findSet(T item) {
        long root = findRepresentativeId(requireId(item));
        return index.itemOf(root);
    }

    @Override
    public boolean sameSet(T x, T y) {
        long xId = requireId(x);
        long yId = requireId(y);
        return findRepresentativeId(xId) == findRepresentativeId(yId);
    }

    /**
     * The root with the strictly smaller rank is attached below the other one, and the surviving root's rank
     * becomes the sum of both. On equal ranks the representative of `x` survives.
     */
    @Override
    public boolean union(T x, T y) {
        long xId = requireId(x);
        long yId = requireId(y);
        long rootX = findRepresentativeId(xId);
        long rootY = findRepresentativeId(yId);

        if (rootX == rootY) {
            return false;
        }

        Node xNode = registry.get(rootX);
        Node yNode = registry.get(rootY);
        int rankSum = xNode.rank() + yNode.rank();

        if (xNode.rank() < yNode.rank()) {
            registry.setParent(xNode, rootY);
            registry.setRank(yNode, rankSum);
        } else {
            registry.setParent(yNode, rootX);
            registry.setRank(xNode, rankSum);
        }

        if (logger.isLoggable(Level.FINEST)) {
            logger.finest(String.format("merged sets of %s and %s, new size %d", x, y, rankSum));
        }
        return true;
    }

    @Override
    public int setSize(T item) {
        long root = findRepresentativeId(requireId(item));
        return registry.get(root).rank();
    }

    @Override
    public int numSets() {
        return registry.countRepresentatives();
    }

    @Override
    public int numItems() {
        return index.size();
    }

    /** the item the parent link of `item` currently points to, without compressing anything */
    @VisibleForTesting
    T parentOf(T item) {
        Node node = registry.get(requireId(item));
        return index.itemOf(node.parent());
    }

    private long requireId(T item) {
        long id = index.idOf(item);
        if (id == ItemIndex.NO_ID) {
            throw new ItemNotFoundException(item);
        }
        return id;
    }

    /**
     * Walks up to the root, then points every node visited on the way directly at it.
     * Iterative, so that long chains cannot overflow the stack before they were compressed.
     */
    private long findRepresentativeId(long id) {
        Node node = registry.get(id);
        compressionPath.resetQuick();
        while (!registry.isRepresentative(node)) {
            compressionPath.add(node.id());
            node = registry.get(node.parent());
        }

        long root = node.id();
        for (int i = 0; i < compressionPath.size(); i++) {
            registry.setParent(registry.get(compressionPath.get(i)), root);
        }
        return root;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("numItems", numItems())
                .add("numSets", numSets())
                .toString();
    }
}
