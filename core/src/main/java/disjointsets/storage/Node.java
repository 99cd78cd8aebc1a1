package disjointsets.storage;

/**
 * Bookkeeping record for one registered item: its id, the id of its parent and its rank.
 * A node whose parent is its own id is the representative of its set.
 *
 * Fields are only mutated through {@link NodeRegistry}.
 */
public final class Node {
  private final long id;
  private long parent;
  private int rank;

  Node(long id) {
    this(id, id, 1);
  }

  Node(long id, long parent, int rank) {
    this.id = id;
    this.parent = parent;
    this.rank = rank;
  }

  Node copy() {
    return new Node(id, parent, rank);
  }

  public long id() {
    return id;
  }

  public long parent() {
    return parent;
  }

  /** only meaningful while this node is a representative: the number of items in its set */
  public int rank() {
    return rank;
  }

  void setParent(long parent) {
    this.parent = parent;
  }

  void setRank(int rank) {
    this.rank = rank;
  }

  @Override
  public String toString() {
    return String.format("Node(id=%d, parent=%d, rank=%d)", id, parent, rank);
  }
}
