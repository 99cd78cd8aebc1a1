package disjointsets.storage;

import disjointsets.Config;
import gnu.trove.map.hash.TLongObjectHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Arena holding exactly one {@link Node} per registered id. Nodes are never removed.
 *
 * Callers keep ids rather than nodes; parent and rank are changed one field at a time
 * via {@link #setParent} and {@link #setRank}. Not thread safe.
 */
public class NodeRegistry {
  private final TLongObjectHashMap<Node> nodes;

  public NodeRegistry() {
    this(Config.withDefaults());
  }

  public NodeRegistry(Config config) {
    this.nodes = new TLongObjectHashMap<>(config.getInitialCapacity(), config.getLoadFactor());
  }

  /** deep copy: nodes of the new registry are independent of the ones in `other` */
  public NodeRegistry(NodeRegistry other) {
    this.nodes = new TLongObjectHashMap<>(Math.max(other.nodes.size(), 10));
    other.nodes.forEachEntry((id, node) -> {
      nodes.put(id, node.copy());
      return true;
    });
  }

  /**
   * Allocates a singleton node with parent = itself and rank = 1.
   * @throws IllegalStateException if `id` is already registered - checking for that is up to the caller
   */
  public Node create(long id) {
    checkState(!nodes.containsKey(id), "node %s already exists", id);
    Node node = new Node(id);
    nodes.put(id, node);
    return node;
  }

  /** @return the node for `id`, or null if it was never created */
  public Node get(long id) {
    return nodes.get(id);
  }

  public void setParent(Node node, long parent) {
    checkNotNull(node);
    node.setParent(parent);
  }

  public void setRank(Node node, int rank) {
    checkNotNull(node);
    checkArgument(rank > 0, "rank must be positive, but was: %s", rank);
    node.setRank(rank);
  }

  public boolean isRepresentative(Node node) {
    return node.parent() == node.id();
  }

  public int size() {
    return nodes.size();
  }

  public int countRepresentatives() {
    int[] count = {0};
    nodes.forEachValue(node -> {
      if (isRepresentative(node)) count[0]++;
      return true;
    });
    return count[0];
  }
}
