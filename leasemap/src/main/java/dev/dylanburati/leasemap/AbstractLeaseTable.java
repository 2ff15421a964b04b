package dev.dylanburati.leasemap;

import java.time.Duration;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slot table shared by the lease maps. Subclasses own the value arrays; this class
 * owns slot state, the free list and the check-in timestamps.
 *
 * Each slot has one metadata word:
 * <pre>
 * bits[63:32] = generation
 *     [31]    = occupied flag
 *     [30:0]  = next free index + 1 while vacant, 0 at the end of the free list
 * </pre>
 * The free list is threaded through the vacant slots and popped from {@code freeHead},
 * so the most recently vacated slot is always handed out first.
 */
/* package-private */ abstract class AbstractLeaseTable {
  private static final Logger LOG = LoggerFactory.getLogger(AbstractLeaseTable.class);

  static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
  static final int MIN_ALLOCATION = 8;
  static final int NIL = -1;

  static final int GENERATION_SHIFT = 32;
  static final long OCCUPIED_FLAG = 1L << 31;
  static final long LINK_MASK = OCCUPIED_FLAG - 1;

  private static final Duration MAX_AGE = Duration.ofNanos(Long.MAX_VALUE);

  protected final LeaseClock clock;
  // INVARIANT 0: meta.length == leasedAt.length >= length, and the subclass value array
  //   has the same length as meta
  // INVARIANT 1: size == count [i < length | (meta[i] & OCCUPIED_FLAG) != 0]
  // INVARIANT 2: following links from freeHead visits every vacant i < length exactly
  //   once and then reaches NIL
  long[] meta;
  long[] leasedAt;
  int length;
  int size;
  int freeHead;
  int modCount;
  // lowered by tests to reach the limit without allocating it
  int maxCapacity = MAX_CAPACITY;

  AbstractLeaseTable(int initialCapacity, final LeaseClock clock) {
    if (initialCapacity < 0) {
      throw new IllegalArgumentException("expected non-negative initialCapacity");
    }
    if (initialCapacity > MAX_CAPACITY) {
      throw new CapacityExceededException(initialCapacity, MAX_CAPACITY);
    }
    this.clock = Objects.requireNonNull(clock);
    this.meta = new long[initialCapacity];
    this.leasedAt = new long[initialCapacity];
    this.length = initialCapacity;
    this.size = 0;
    this.freeHead = NIL;
    // INVARIANT 2 upheld: pushed in descending order so the rooms are handed out 0, 1, 2, ...
    for (int i = initialCapacity - 1; i >= 0; i--) {
      this.meta[i] = vacant(0, this.freeHead);
      this.freeHead = i;
    }
  }

  AbstractLeaseTable(final AbstractLeaseTable src) {
    // clone constructor, the subclass copies its values
    this.clock = src.clock;
    this.meta = Arrays.copyOf(src.meta, src.meta.length);
    this.leasedAt = Arrays.copyOf(src.leasedAt, src.leasedAt.length);
    this.length = src.length;
    this.size = src.size;
    this.freeHead = src.freeHead;
    this.modCount = 0;
    this.maxCapacity = src.maxCapacity;
  }

  static int generationOf(long slotMeta) {
    return (int) (slotMeta >>> GENERATION_SHIFT);
  }

  static boolean isOccupied(long slotMeta) {
    return (slotMeta & OCCUPIED_FLAG) != 0;
  }

  static int linkOf(long slotMeta) {
    return (int) (slotMeta & LINK_MASK) - 1;
  }

  static long vacant(int generation, int next) {
    return ((long) generation << GENERATION_SHIFT) | (next + 1L);
  }

  static long occupied(int generation) {
    return ((long) generation << GENERATION_SHIFT) | OCCUPIED_FLAG;
  }

  /** Resizes the subclass value storage to {@code newLength}, keeping existing entries. */
  protected abstract void resizeValues(int newLength);

  /** Drops the value held at {@code index}; called after the slot is vacated. */
  protected abstract void clearValue(int index);

  /** Number of live entries. */
  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.size == 0;
  }

  /** Number of slots in the table, occupied or vacant. Never decreases. */
  public int capacity() {
    return this.length;
  }

  /** Number of vacant slots, all of which are reachable from the free list. */
  public int vacantCount() {
    return this.length - this.size;
  }

  public boolean containsKey(LeaseKey key) {
    return this.slotOf(key) >= 0;
  }

  /**
   * Returns the current key of the slot at {@code index}, or {@code null} if the index
   * is out of range or the slot is vacant.
   */
  public LeaseKey keyAt(int index) {
    if (index < 0 || index >= this.length || !isOccupied(this.meta[index])) {
      return null;
    }
    return this.keyOf(index);
  }

  /**
   * Time since the entry for {@code key} was checked in, or {@code null} if the key is
   * not live.
   */
  public Duration leaseAge(LeaseKey key) {
    int idx = this.slotOf(key);
    if (idx < 0) {
      return null;
    }
    return Duration.ofNanos(this.clock.nanoTime() - this.leasedAt[idx]);
  }

  /**
   * Removes every entry that has been checked in for longer than {@code maxAge}.
   * Evicted slots are vacated exactly as by {@code remove}, in ascending index order.
   *
   * @return the number of entries evicted
   */
  public int evictOlderThan(Duration maxAge) {
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("expected non-negative maxAge");
    }
    if (maxAge.compareTo(MAX_AGE) >= 0) {
      return 0;
    }
    long maxAgeNanos = maxAge.toNanos();
    long now = this.clock.nanoTime();
    int evicted = 0;
    for (int i = 0; i < this.length; i++) {
      if (isOccupied(this.meta[i]) && now - this.leasedAt[i] > maxAgeNanos) {
        this.vacateSlot(i);
        evicted++;
      }
    }
    if (evicted > 0) {
      LOG.debug("Evicted {} leases older than {}, {} remain", evicted, maxAge, this.size);
    }
    return evicted;
  }

  /** Vacates every occupied slot. Capacity is unchanged. */
  public void clear() {
    for (int i = 0; i < this.length; i++) {
      if (isOccupied(this.meta[i])) {
        this.vacateSlot(i);
      }
    }
  }

  /** Index of the slot addressed by {@code key}, or {@link #NIL} if the key is not live. */
  final int slotOf(LeaseKey key) {
    if (key == null) {
      return NIL;
    }
    int idx = key.index();
    if (idx >= this.length) {
      return NIL;
    }
    long slotMeta = this.meta[idx];
    if (!isOccupied(slotMeta) || generationOf(slotMeta) != key.generation()) {
      return NIL;
    }
    return idx;
  }

  final LeaseKey keyOf(int index) {
    return new LeaseKey(index, generationOf(this.meta[index]));
  }

  /**
   * Marks a slot occupied for a new tenant and returns its index. The caller stores the
   * value afterwards.
   */
  final int claimSlot() {
    int idx = this.popFree();
    if (idx == NIL) {
      idx = this.appendSlot();
    }
    this.meta[idx] = occupied(generationOf(this.meta[idx]));
    this.leasedAt[idx] = this.clock.nanoTime();
    this.size++;
    this.modCount++;
    return idx;
  }

  /** INVARIANTS 1 and 2 upheld WHEN meta[index] has OCCUPIED_FLAG prior to calling */
  final void vacateSlot(int index) {
    // the generation bump invalidates every key issued for this tenancy
    this.meta[index] = vacant(generationOf(this.meta[index]) + 1, NIL);
    this.pushFree(index);
    this.clearValue(index);
    this.size--;
    this.modCount++;
  }

  /** First occupied index at or after {@code start}, or {@link #NIL}. */
  final int nextOccupied(int start) {
    for (int src = start; src < this.length; src++) {
      if (isOccupied(this.meta[src])) {
        return src;
      }
    }
    return NIL;
  }

  /** INVARIANT 2 upheld WHEN meta[index] is vacant and not already on the free list */
  private void pushFree(int index) {
    long slotMeta = this.meta[index];
    this.meta[index] = vacant(generationOf(slotMeta), this.freeHead);
    this.freeHead = index;
  }

  private int popFree() {
    int idx = this.freeHead;
    if (idx == NIL) {
      return NIL;
    }
    this.freeHead = linkOf(this.meta[idx]);
    return idx;
  }

  private int appendSlot() {
    if (this.length >= this.maxCapacity) {
      throw new CapacityExceededException(this.length + 1L, this.maxCapacity);
    }
    if (this.length == this.meta.length) {
      this.grow();
    }
    int idx = this.length++;
    // new slots start vacant at generation 0, the caller claims it immediately
    this.meta[idx] = vacant(0, NIL);
    return idx;
  }

  private void grow() {
    int cap = this.meta.length;
    long nextCap = Math.max(MIN_ALLOCATION, (long) cap << 1);
    int newCap = (int) Math.min(nextCap, this.maxCapacity);
    LOG.debug("Growing slot table from {} to {} slots", cap, newCap);
    // INVARIANT 0 upheld
    this.meta = Arrays.copyOf(this.meta, newCap);
    this.leasedAt = Arrays.copyOf(this.leasedAt, newCap);
    this.resizeValues(newCap);
  }

  // used by tests to check INVARIANT 2
  final int[] freeListIndices() {
    int[] chain = new int[this.length - this.size];
    int count = 0;
    for (int idx = this.freeHead; idx != NIL; idx = linkOf(this.meta[idx])) {
      if (count == chain.length || isOccupied(this.meta[idx])) {
        throw new IllegalStateException("Free list is corrupt at index " + idx);
      }
      chain[count++] = idx;
    }
    if (count != chain.length) {
      throw new IllegalStateException("Free list reaches " + count + " of " + chain.length + " vacant slots");
    }
    return chain;
  }

  final boolean isVacantSlot(int index) {
    return !isOccupied(this.meta[index]);
  }

  /**
   * Walks occupied slots in ascending index order. Any structural change not made
   * through the cursor itself fails the next step.
   */
  protected abstract static class SlotCursor {
    protected final AbstractLeaseTable owner;
    private int expectedModCount;
    protected int index;
    private int nextIndex;

    protected SlotCursor(final AbstractLeaseTable owner) {
      this.owner = owner;
      this.expectedModCount = owner.modCount;
      this.index = NIL;
      this.nextIndex = owner.nextOccupied(0);
    }

    public final boolean hasNext() {
      return this.nextIndex != NIL;
    }

    protected final int advance() {
      if (this.expectedModCount != owner.modCount) {
        throw new ConcurrentModificationException();
      }
      if (this.nextIndex == NIL) {
        throw new NoSuchElementException();
      }
      this.index = this.nextIndex;
      this.nextIndex = owner.nextOccupied(this.index + 1);
      return this.index;
    }

    /** Vacates the slot last returned by {@link #advance()}. */
    protected final void vacateCurrent() {
      if (this.index == NIL) {
        throw new IllegalStateException();
      }
      if (this.expectedModCount != owner.modCount) {
        throw new ConcurrentModificationException();
      }
      owner.vacateSlot(this.index);
      this.index = NIL;
      this.expectedModCount = owner.modCount;
    }
  }
}
