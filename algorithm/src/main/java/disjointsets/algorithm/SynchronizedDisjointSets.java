package disjointsets.algorithm;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thread safe view of a {@link UnionFind}: every operation holds one lock for its whole duration,
 * since finds and unions read and then write several nodes.
 *
 * All access must go through this view; using the wrapped instance directly bypasses the lock.
 */
public final class SynchronizedDisjointSets<T> implements UnionFind<T> {
    private final UnionFind<T> delegate;
    private final Object lock = new Object();

    private SynchronizedDisjointSets(UnionFind<T> delegate) {
        this.delegate = checkNotNull(delegate);
    }

    public static <T> UnionFind<T> wrap(UnionFind<T> delegate) {
        if (delegate instanceof SynchronizedDisjointSets) {
            return delegate;
        }
        return new SynchronizedDisjointSets<>(delegate);
    }

    @Override
    public boolean contains(T item) {
        synchronized (lock) {
            return delegate.contains(item);
        }
    }

    @Override
    public void makeSet(T item) {
        synchronized (lock) {
            delegate.makeSet(item);
        }
    }

    @Override
    public T findSet(T item) {
        synchronized (lock) {
            return delegate.findSet(item);
        }
    }

    @Override
    public boolean sameSet(T x, T y) {
        synchronized (lock) {
            return delegate.sameSet(x, y);
        }
    }

    @Override
    public boolean union(T x, T y) {
        synchronized (lock) {
            return delegate.union(x, y);
        }
    }

    @Override
    public int setSize(T item) {
        synchronized (lock) {
            return delegate.setSize(item);
        }
    }

    @Override
    public int numSets() {
        synchronized (lock) {
            return delegate.numSets();
        }
    }

    @Override
    public int numItems() {
        synchronized (lock) {
            return delegate.numItems();
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "Synchronized" + delegate;
        }
    }
}
