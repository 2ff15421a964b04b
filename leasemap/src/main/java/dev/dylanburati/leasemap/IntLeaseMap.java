package dev.dylanburati.leasemap;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntUnaryOperator;
import java.util.function.ObjIntConsumer;

/**
 * Lease map holding {@code int} values in a primitive array. Slot allocation, key
 * validation and eviction behave exactly as in {@link LeaseMap}.
 *
 * Methods returning {@link Integer} use {@code null} for "no live entry"; the
 * {@code OrDefault} variants avoid boxing.
 */
public class IntLeaseMap extends AbstractLeaseTable implements Iterable<Map.Entry<LeaseKey, Integer>>, Cloneable {
  private int[] values;

  public IntLeaseMap() {
    this(0);
  }

  public IntLeaseMap(int initialCapacity) {
    this(initialCapacity, SystemLeaseClock.instance());
  }

  public IntLeaseMap(int initialCapacity, final LeaseClock clock) {
    super(initialCapacity, clock);
    this.values = new int[initialCapacity];
  }

  private IntLeaseMap(final IntLeaseMap src) {
    super(src);
    this.values = Arrays.copyOf(src.values, src.values.length);
  }

  public LeaseKey insert(int value) {
    int idx = this.claimSlot();
    this.values[idx] = value;
    return this.keyOf(idx);
  }

  public Integer get(LeaseKey key) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    return this.values[idx];
  }

  public int getOrDefault(LeaseKey key, int defaultValue) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return defaultValue;
    }
    return this.values[idx];
  }

  public boolean containsValue(int value) {
    for (int src = 0; src < this.length; src++) {
      if (isOccupied(this.meta[src]) && this.values[src] == value) {
        return true;
      }
    }
    return false;
  }

  public Integer remove(LeaseKey key) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    int result = this.values[idx];
    this.vacateSlot(idx);
    return result;
  }

  public int removeOrDefault(LeaseKey key, int defaultValue) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return defaultValue;
    }
    int result = this.values[idx];
    this.vacateSlot(idx);
    return result;
  }

  public Integer replace(LeaseKey key, int value) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    int prev = this.values[idx];
    this.values[idx] = value;
    return prev;
  }

  /**
   * Adds {@code increment} to the value of a live entry.
   *
   * @return the previous value, or 0 if the key was not live and nothing changed
   */
  public int addTo(LeaseKey key, int increment) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return 0;
    }
    int prev = this.values[idx];
    this.values[idx] = prev + increment;
    return prev;
  }

  public void replaceAll(IntUnaryOperator function) {
    Objects.requireNonNull(function);
    int mc = this.modCount;
    for (int i = 0; i < this.length; i++) {
      if (isOccupied(this.meta[i])) {
        int result = function.applyAsInt(this.values[i]);
        if (this.modCount != mc) {
          throw new ConcurrentModificationException();
        }
        this.values[i] = result;
      }
    }
  }

  public void forEach(ObjIntConsumer<? super LeaseKey> action) {
    Objects.requireNonNull(action);
    int mc = this.modCount;
    for (int src = 0; src < this.length; src++) {
      if (isOccupied(this.meta[src])) {
        action.accept(this.keyOf(src), this.values[src]);
      }
    }
    if (this.modCount != mc) {
      throw new ConcurrentModificationException();
    }
  }

  /** Iterates live entries in ascending index order. Entries are snapshots. */
  @Override
  public Iterator<Map.Entry<LeaseKey, Integer>> iterator() {
    return new EntryIterator(this, false);
  }

  /** Like {@link #iterator()}, but removes each entry as it is returned. */
  public Iterator<Map.Entry<LeaseKey, Integer>> drain() {
    return new EntryIterator(this, true);
  }

  @Override
  protected void resizeValues(int newLength) {
    this.values = Arrays.copyOf(this.values, newLength);
  }

  @Override
  protected void clearValue(int index) {
    this.values[index] = 0;
  }

  @Override
  public IntLeaseMap clone() {
    return new IntLeaseMap(this);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int src = this.nextOccupied(0); src != NIL; src = this.nextOccupied(src + 1)) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(this.keyOf(src)).append('=').append(this.values[src]);
    }
    return sb.append('}').toString();
  }

  protected static class EntryIterator extends SlotCursor implements Iterator<Map.Entry<LeaseKey, Integer>> {
    private final IntLeaseMap map;
    private final boolean draining;

    protected EntryIterator(final IntLeaseMap owner, boolean draining) {
      super(owner);
      this.map = owner;
      this.draining = draining;
    }

    public final Map.Entry<LeaseKey, Integer> next() {
      int idx = this.advance();
      Map.Entry<LeaseKey, Integer> entry = new AbstractMap.SimpleImmutableEntry<>(map.keyOf(idx), map.values[idx]);
      if (this.draining) {
        this.vacateCurrent();
      }
      return entry;
    }

    public final void remove() {
      if (this.draining) {
        throw new IllegalStateException("Entry already removed by drain");
      }
      this.vacateCurrent();
    }
  }
}
