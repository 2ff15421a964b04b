package dev.dylanburati.leasemap;

/**
 * Handle for one tenancy of a slot in a {@link LeaseMap} or {@link IntLeaseMap}.
 *
 * A key is the pair (slot index, generation). The generation of a slot is bumped
 * every time its tenant leaves, so a key kept after its entry was removed never
 * addresses the slot's next tenant, even though the index is reused.
 *
 * Keys are immutable and compare structurally.
 */
public final class LeaseKey implements Comparable<LeaseKey> {
  private final int index;
  private final int generation;

  /**
   * Reconstructs a key from its parts. Keys built this way are only live if a map
   * issued an identical one and the entry has not been removed since.
   */
  public LeaseKey(int index, int generation) {
    if (index < 0) {
      throw new IllegalArgumentException("expected non-negative index");
    }
    this.index = index;
    this.generation = generation;
  }

  /** Unpacks a key produced by {@link #toLong()}. */
  public static LeaseKey fromLong(long packed) {
    return new LeaseKey((int) packed, (int) (packed >>> 32));
  }

  public int index() {
    return this.index;
  }

  public int generation() {
    return this.generation;
  }

  // bits[63:32] = generation
  //     [31:0]  = index
  public long toLong() {
    return ((long) this.generation << 32) | (this.index & 0xFFFF_FFFFL);
  }

  @Override
  public int compareTo(LeaseKey other) {
    int c = Integer.compare(this.index, other.index);
    if (c != 0) {
      return c;
    }
    return Integer.compareUnsigned(this.generation, other.generation);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LeaseKey)) {
      return false;
    }
    LeaseKey other = (LeaseKey) o;
    return this.index == other.index && this.generation == other.generation;
  }

  @Override
  public int hashCode() {
    return 31 * this.index + this.generation;
  }

  @Override
  public String toString() {
    return this.index + "@" + Integer.toUnsignedString(this.generation);
  }
}
