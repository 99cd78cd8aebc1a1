package disjointsets.storage;

import disjointsets.Config;
import gnu.trove.map.hash.TObjectLongHashMap;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Maps caller supplied items to synthetic ids and back.
 * Ids are handed out sequentially starting at 0 and are never reused, so they double as list offsets.
 */
public class ItemIndex<T> {
  public static final long NO_ID = -1;

  private final TObjectLongHashMap<T> idByItem;
  private final List<T> itemById;

  public ItemIndex() {
    this(Config.withDefaults());
  }

  public ItemIndex(Config config) {
    this.idByItem = new TObjectLongHashMap<>(config.getInitialCapacity(), config.getLoadFactor(), NO_ID);
    this.itemById = new ArrayList<>(config.getInitialCapacity());
  }

  public ItemIndex(ItemIndex<T> other) {
    this.idByItem = new TObjectLongHashMap<>(Math.max(other.size(), 10), 0.5f, NO_ID);
    this.idByItem.putAll(other.idByItem);
    this.itemById = new ArrayList<>(other.itemById);
  }

  /**
   * @return the id assigned to the newly registered item
   * @throws IllegalStateException if the item is already registered
   */
  public long register(T item) {
    checkNotNull(item, "item must not be null");
    checkState(!idByItem.containsKey(item), "item already registered: %s", item);
    long id = itemById.size();
    itemById.add(item);
    idByItem.put(item, id);
    return id;
  }

  /** @return the id of `item`, or {@link #NO_ID} if it was never registered */
  public long idOf(T item) {
    checkNotNull(item, "item must not be null");
    return idByItem.get(item);
  }

  public boolean contains(T item) {
    return idOf(item) != NO_ID;
  }

  public T itemOf(long id) {
    checkElementIndex((int) id, itemById.size(), "id");
    return itemById.get((int) id);
  }

  public int size() {
    return itemById.size();
  }
}
