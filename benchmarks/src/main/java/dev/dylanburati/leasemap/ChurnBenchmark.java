package dev.dylanburati.leasemap;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

@State(Scope.Benchmark)
public class ChurnBenchmark {
  private static final int OPERATIONS = 10_000_000;

  // number of entries kept alive at once
  @Param({"16", "4096"})
  public int residents;

  private boolean[] departs;
  private int[] picks;

  @Setup
  public void setup() {
    Random r = new Random(0L);
    this.departs = new boolean[OPERATIONS];
    this.picks = new int[OPERATIONS];
    for (int i = 0; i < OPERATIONS; i++) {
      this.departs[i] = r.nextBoolean();
      this.picks[i] = r.nextInt(this.residents);
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnLeaseMap(Blackhole bh) {
    LeaseMap<String> m = new LeaseMap<>();
    LeaseKey[] slots = new LeaseKey[this.residents];
    for (int i = 0; i < this.residents; i++) {
      slots[i] = m.insert("resident");
    }
    for (int i = 0; i < OPERATIONS; i++) {
      int pick = this.picks[i];
      if (this.departs[i]) {
        bh.consume(m.remove(slots[pick]));
        slots[pick] = m.insert("guest");
      } else {
        bh.consume(m.get(slots[pick]));
      }
    }
    bh.consume(m.capacity());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnIntLeaseMap(Blackhole bh) {
    IntLeaseMap m = new IntLeaseMap();
    long[] slots = new long[this.residents];
    for (int i = 0; i < this.residents; i++) {
      slots[i] = m.insert(i).toLong();
    }
    for (int i = 0; i < OPERATIONS; i++) {
      int pick = this.picks[i];
      LeaseKey k = LeaseKey.fromLong(slots[pick]);
      if (this.departs[i]) {
        bh.consume(m.removeOrDefault(k, -1));
        slots[pick] = m.insert(i).toLong();
      } else {
        bh.consume(m.getOrDefault(k, -1));
      }
    }
    bh.consume(m.capacity());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnHashMap(Blackhole bh) {
    bh.consume(this.churnCounterKeyed(new HashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnInt2ObjectMap(Blackhole bh) {
    bh.consume(this.churnCounterKeyed(new Int2ObjectOpenHashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void churnInt2IntMap(Blackhole bh) {
    Int2IntOpenHashMap m = new Int2IntOpenHashMap();
    int[] slots = new int[this.residents];
    int nextKey = 0;
    for (int i = 0; i < this.residents; i++) {
      slots[i] = nextKey;
      m.put(nextKey++, i);
    }
    for (int i = 0; i < OPERATIONS; i++) {
      int pick = this.picks[i];
      if (this.departs[i]) {
        bh.consume(m.remove(slots[pick]));
        slots[pick] = nextKey;
        m.put(nextKey++, i);
      } else {
        bh.consume(m.get(slots[pick]));
      }
    }
    bh.consume(m.size());
  }

  private int churnCounterKeyed(Map<Integer, String> m) {
    int[] slots = new int[this.residents];
    int nextKey = 0;
    for (int i = 0; i < this.residents; i++) {
      slots[i] = nextKey;
      m.put(nextKey++, "resident");
    }
    int found = 0;
    for (int i = 0; i < OPERATIONS; i++) {
      int pick = this.picks[i];
      if (this.departs[i]) {
        m.remove(slots[pick]);
        slots[pick] = nextKey;
        m.put(nextKey++, "guest");
      } else if (m.get(slots[pick]) != null) {
        found++;
      }
    }
    return found;
  }
}
