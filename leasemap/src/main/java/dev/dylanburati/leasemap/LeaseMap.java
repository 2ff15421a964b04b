package dev.dylanburati.leasemap;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Map from generated keys to Objects, for entries that come and go quickly.
 *
 * Think of a hotel: {@link #insert} checks a guest in and hands back a room key,
 * {@link #remove} checks them out and frees the room. The room vacated most recently
 * is the next one assigned, and rooms are only added when none are free. Values live
 * in one dense array indexed by room number.
 *
 * Every key carries the generation of its room, so a key kept after checkout never
 * reaches the room's next guest. Lookups with a stale, foreign or {@code null} key
 * return {@code null} rather than throwing. Values may not be {@code null}.
 *
 * Not thread-safe.
 */
public class LeaseMap<V> extends AbstractLeaseTable implements Iterable<Map.Entry<LeaseKey, V>>, Cloneable {
  // INVARIANT 3: values[i] != null IFF slot i is occupied
  private Object[] values;

  public LeaseMap() {
    this(0);
  }

  public LeaseMap(int initialCapacity) {
    this(initialCapacity, SystemLeaseClock.instance());
  }

  public LeaseMap(int initialCapacity, final LeaseClock clock) {
    super(initialCapacity, clock);
    this.values = new Object[initialCapacity];
  }

  private LeaseMap(final LeaseMap<V> src) {
    super(src);
    this.values = Arrays.copyOf(src.values, src.values.length);
  }

  @SuppressWarnings("unchecked")
  private static <V> V castUnsafe(Object v) {
    return (V) v;
  }

  /**
   * Stores {@code value} in the most recently vacated slot, or a new one if none are
   * vacant.
   *
   * @return the key for the new entry
   * @throws CapacityExceededException if every slot index is already in use
   */
  public LeaseKey insert(V value) {
    Objects.requireNonNull(value);
    int idx = this.claimSlot();
    // INVARIANT 3 upheld
    this.values[idx] = value;
    return this.keyOf(idx);
  }

  /** Returns the value for {@code key}, or {@code null} if the key is not live. */
  public V get(LeaseKey key) {
    return this.getOrDefault(key, null);
  }

  public V getOrDefault(LeaseKey key, V defaultValue) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return defaultValue;
    }
    return castUnsafe(this.values[idx]);
  }

  public boolean containsValue(Object value) {
    for (int src = 0; src < this.length; src++) {
      if (isOccupied(this.meta[src]) && this.values[src].equals(value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes the entry for {@code key} and frees its slot for the next insert.
   *
   * @return the removed value, or {@code null} if the key was not live
   */
  public V remove(LeaseKey key) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    V result = castUnsafe(this.values[idx]);
    this.vacateSlot(idx);
    return result;
  }

  public boolean remove(LeaseKey key, Object value) {
    int idx = this.slotOf(key);
    if (idx >= 0 && this.values[idx].equals(value)) {
      this.vacateSlot(idx);
      return true;
    }
    return false;
  }

  /**
   * Overwrites the value of a live entry. The key stays the same.
   *
   * @return the previous value, or {@code null} if nothing was written
   */
  public V replace(LeaseKey key, V value) {
    Objects.requireNonNull(value);
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    V prev = castUnsafe(this.values[idx]);
    this.values[idx] = value;
    return prev;
  }

  public boolean replace(LeaseKey key, V oldValue, V newValue) {
    Objects.requireNonNull(newValue);
    int idx = this.slotOf(key);
    if (idx >= 0 && this.values[idx].equals(oldValue)) {
      this.values[idx] = newValue;
      return true;
    }
    return false;
  }

  /**
   * Updates a live entry in place. A {@code null} result removes the entry.
   *
   * @return the new value, or {@code null} if the key was not live or the entry was removed
   * @throws ConcurrentModificationException if the function inserted or removed entries
   */
  public V computeIfPresent(LeaseKey key, BiFunction<? super LeaseKey, ? super V, ? extends V> remappingFunction) {
    Objects.requireNonNull(remappingFunction);
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    int mc = this.modCount;
    V result = remappingFunction.apply(key, castUnsafe(this.values[idx]));
    if (this.modCount != mc) {
      throw new ConcurrentModificationException();
    }
    if (result != null) {
      this.values[idx] = result;
    } else {
      this.vacateSlot(idx);
    }
    return result;
  }

  public void replaceAll(BiFunction<? super LeaseKey, ? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    int mc = this.modCount;
    for (int i = 0; i < this.length; i++) {
      if (isOccupied(this.meta[i])) {
        V result = function.apply(this.keyOf(i), castUnsafe(this.values[i]));
        if (this.modCount != mc) {
          throw new ConcurrentModificationException();
        }
        this.values[i] = Objects.requireNonNull(result);
      }
    }
  }

  public void forEach(BiConsumer<? super LeaseKey, ? super V> action) {
    Objects.requireNonNull(action);
    int mc = this.modCount;
    for (int src = 0; src < this.length; src++) {
      if (isOccupied(this.meta[src])) {
        action.accept(this.keyOf(src), castUnsafe(this.values[src]));
      }
    }
    if (this.modCount != mc) {
      throw new ConcurrentModificationException();
    }
  }

  /**
   * Iterates live entries in ascending index order. {@link Map.Entry#setValue} writes
   * through, and {@link Iterator#remove} frees the slot of the last entry returned.
   */
  @Override
  public Iterator<Map.Entry<LeaseKey, V>> iterator() {
    return new EntryIterator<>(this);
  }

  /**
   * Iterates live entries in ascending index order, removing each one as it is
   * returned. Entries not yet reached when iteration stops stay in the map.
   */
  public Iterator<Map.Entry<LeaseKey, V>> drain() {
    return new DrainIterator<>(this);
  }

  @Override
  public Spliterator<Map.Entry<LeaseKey, V>> spliterator() {
    return Spliterators.spliterator(this.iterator(), this.size,
        Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL);
  }

  public Stream<Map.Entry<LeaseKey, V>> stream() {
    return StreamSupport.stream(this.spliterator(), false);
  }

  public Set<LeaseKey> keySet() {
    return new KeySet(this);
  }

  public Collection<V> values() {
    return new Values<>(this);
  }

  @Override
  protected void resizeValues(int newLength) {
    this.values = Arrays.copyOf(this.values, newLength);
  }

  @Override
  protected void clearValue(int index) {
    this.values[index] = null;
  }

  /**
   * Creates a shallow clone of this map. Keys issued before the clone are live in both
   * maps, and the two free lists evolve independently afterwards.
   */
  @Override
  public LeaseMap<V> clone() {
    return new LeaseMap<>(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int src = this.nextOccupied(0); src != NIL; src = this.nextOccupied(src + 1)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      Object v = this.values[src];
      sb.append(this.keyOf(src)).append('=').append(v == this ? "(this Map)" : v);
    }
    return sb.append('}').toString();
  }

  protected static class KeySet extends AbstractSet<LeaseKey> {
    private final LeaseMap<?> owner;
    protected KeySet(final LeaseMap<?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<LeaseKey> iterator() {
      return new KeyIterator(owner);
    }
    public final boolean contains(Object o) {
      return o instanceof LeaseKey && owner.containsKey((LeaseKey) o);
    }
    public final boolean remove(Object key) {
      return key instanceof LeaseKey && owner.remove((LeaseKey) key) != null;
    }

    public final void forEach(Consumer<? super LeaseKey> action) {
      Objects.requireNonNull(action);
      owner.forEach((k, _v) -> action.accept(k));
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final LeaseMap<V> owner;
    protected Values(final LeaseMap<V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }

    public final void forEach(Consumer<? super V> action) {
      Objects.requireNonNull(action);
      owner.forEach((_k, v) -> action.accept(v));
    }
  }

  /** Live view of one entry, valid until the entry is removed. */
  protected static class Node<V> implements Map.Entry<LeaseKey, V> {
    protected final LeaseMap<V> owner;
    protected final LeaseKey key;

    protected Node(final LeaseMap<V> owner, int index) {
      this.owner = owner;
      this.key = owner.keyOf(index);
    }

    private int getIndex() {
      int idx = owner.slotOf(this.key);
      if (idx < 0) {
        throw new IllegalStateException("Entry no longer in map");
      }
      return idx;
    }

    @Override
    public LeaseKey getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return castUnsafe(owner.values[this.getIndex()]);
    }

    @Override
    public V setValue(V value) {
      Objects.requireNonNull(value);
      int idx = this.getIndex();
      V prev = castUnsafe(owner.values[idx]);
      owner.values[idx] = value;
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.getKey(), e.getKey()) && Objects.equals(this.getValue(), e.getValue());
    }

    @Override
    public int hashCode() {
      return this.key.hashCode() ^ this.getValue().hashCode();
    }

    @Override
    public String toString() {
      return this.key + "=" + this.getValue();
    }
  }

  protected static class KeyIterator extends SlotCursor implements Iterator<LeaseKey> {
    protected KeyIterator(final LeaseMap<?> owner) {
      super(owner);
    }
    public final LeaseKey next() {
      return owner.keyOf(this.advance());
    }
    public final void remove() {
      this.vacateCurrent();
    }
  }

  protected static class ValueIterator<V> extends SlotCursor implements Iterator<V> {
    private final LeaseMap<V> map;

    protected ValueIterator(final LeaseMap<V> owner) {
      super(owner);
      this.map = owner;
    }
    public final V next() {
      return castUnsafe(map.values[this.advance()]);
    }
    public final void remove() {
      this.vacateCurrent();
    }
  }

  protected static class EntryIterator<V> extends SlotCursor implements Iterator<Map.Entry<LeaseKey, V>> {
    private final LeaseMap<V> map;

    protected EntryIterator(final LeaseMap<V> owner) {
      super(owner);
      this.map = owner;
    }
    public final Map.Entry<LeaseKey, V> next() {
      return new Node<>(map, this.advance());
    }
    public final void remove() {
      this.vacateCurrent();
    }
  }

  protected static class DrainIterator<V> extends SlotCursor implements Iterator<Map.Entry<LeaseKey, V>> {
    private final LeaseMap<V> map;

    protected DrainIterator(final LeaseMap<V> owner) {
      super(owner);
      this.map = owner;
    }
    public final Map.Entry<LeaseKey, V> next() {
      int idx = this.advance();
      V value = castUnsafe(map.values[idx]);
      Map.Entry<LeaseKey, V> taken = new AbstractMap.SimpleImmutableEntry<>(map.keyOf(idx), value);
      this.vacateCurrent();
      return taken;
    }
    public final void remove() {
      throw new IllegalStateException("Entry already removed by drain");
    }
  }
}
