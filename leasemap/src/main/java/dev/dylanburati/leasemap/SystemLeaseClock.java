package dev.dylanburati.leasemap;

/* package-private */ class SystemLeaseClock implements LeaseClock {
  private static SystemLeaseClock instance = null;

  private SystemLeaseClock() {}

  static SystemLeaseClock instance() {
    if (instance == null) {
      instance = new SystemLeaseClock();
    }
    return instance;
  }

  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
