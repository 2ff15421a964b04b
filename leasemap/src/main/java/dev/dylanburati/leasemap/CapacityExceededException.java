package dev.dylanburati.leasemap;

/**
 * Thrown when a slot table would need more slots than it can index.
 */
public class CapacityExceededException extends RuntimeException {

  public CapacityExceededException(final long requested, final int limit) {
    super("Slot table cannot hold " + requested + " slots, the limit is " + limit);
  }
}
