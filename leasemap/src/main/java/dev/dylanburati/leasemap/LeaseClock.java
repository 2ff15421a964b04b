package dev.dylanburati.leasemap;

/**
 * Time source used to stamp check-ins. Only differences between readings are
 * meaningful, as with {@link System#nanoTime()}.
 */
public interface LeaseClock {
  long nanoTime();
}
