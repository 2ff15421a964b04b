package dev.dylanburati;

import dev.dylanburati.leasemap.LeaseKey;
import dev.dylanburati.leasemap.LeaseMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
  private static final Logger LOG = LoggerFactory.getLogger(App.class);

  /** Front desk that hands out a numeric handle per guest. */
  interface Hotel {
    long checkIn(String guest);
    String checkOut(long handle);
    int occupancy();
    long rooms();
  }

  static class LeaseMapHotel implements Hotel {
    private final LeaseMap<String> rooms = new LeaseMap<>();

    @Override
    public long checkIn(String guest) {
      return rooms.insert(guest).toLong();
    }

    @Override
    public String checkOut(long handle) {
      return rooms.remove(LeaseKey.fromLong(handle));
    }

    @Override
    public int occupancy() {
      return rooms.size();
    }

    @Override
    public long rooms() {
      return rooms.capacity();
    }

    int evict(Duration maxAge) {
      return rooms.evictOlderThan(maxAge);
    }
  }

  // counter keys, never reused
  static class MapHotel implements Hotel {
    private final Map<Long, String> rooms;
    private long nextHandle = 0;

    MapHotel(Map<Long, String> rooms) {
      this.rooms = rooms;
    }

    @Override
    public long checkIn(String guest) {
      long handle = nextHandle++;
      rooms.put(handle, guest);
      return handle;
    }

    @Override
    public String checkOut(long handle) {
      return rooms.remove(handle);
    }

    @Override
    public int occupancy() {
      return rooms.size();
    }

    @Override
    public long rooms() {
      return nextHandle;
    }
  }

  public static int frontDesk(Hotel hotel) {
    LongArrayList staying = new LongArrayList();
    Random r = new Random(0L);
    int peak = 0;
    for (int i = 0; i < 10_000_000; i++) {
      // bursts of arrivals, with departures slightly more likely overall
      if (staying.isEmpty() || r.nextInt(1000) < 495) {
        staying.add(hotel.checkIn("guest-" + i));
        peak = Math.max(peak, hotel.occupancy());
      } else {
        int which = r.nextInt(staying.size());
        long handle = staying.getLong(which);
        staying.set(which, staying.getLong(staying.size() - 1));
        staying.removeLong(staying.size() - 1);
        if (hotel.checkOut(handle) == null) {
          throw new IllegalStateException("Guest with handle " + handle + " was not checked in");
        }
      }
    }
    LOG.info("Occupancy: {}, peak: {}, rooms used: {}", hotel.occupancy(), peak, hotel.rooms());
    return hotel.occupancy();
  }

  public static void main(String[] args) {
    Hotel hotel;
    switch (args.length > 0 ? args[0] : "") {
      case "java.util":
        hotel = new MapHotel(new HashMap<>());
        break;
      case "fastutil":
        hotel = new MapHotel(new Long2ObjectOpenHashMap<>());
        break;
      default:
        hotel = new LeaseMapHotel();
        break;
    };
    long start = System.nanoTime();
    frontDesk(hotel);
    LOG.info("Finished in {}", Duration.ofNanos(System.nanoTime() - start));
    if (hotel instanceof LeaseMapHotel) {
      int evicted = ((LeaseMapHotel) hotel).evict(Duration.ofMillis(500));
      LOG.info("Evicted {} guests staying over 500ms, {} rooms stay allocated", evicted, hotel.rooms());
    }
  }
}
