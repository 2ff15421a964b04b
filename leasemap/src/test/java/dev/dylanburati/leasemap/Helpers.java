package dev.dylanburati.leasemap;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

public class Helpers {
  public static class ManualClock implements LeaseClock {
    private long now;

    public void advance(Duration d) {
      this.now += d.toNanos();
    }

    @Override
    public long nanoTime() {
      return this.now;
    }
  }

  // every vacant slot is on the free list exactly once, and nothing else is
  static void assertFreeListMatchesVacancies(AbstractLeaseTable table) {
    Set<Integer> chained = new HashSet<>();
    for (int idx : table.freeListIndices()) {
      assertTrue(chained.add(idx), String.format("index %d appears twice in the free list", idx));
    }
    Set<Integer> vacant = new HashSet<>();
    for (int i = 0; i < table.capacity(); i++) {
      if (table.isVacantSlot(i)) {
        vacant.add(i);
      }
    }
    assertEquals(vacant, chained);
    assertEquals(table.capacity(), table.size() + table.vacantCount());
  }
}
