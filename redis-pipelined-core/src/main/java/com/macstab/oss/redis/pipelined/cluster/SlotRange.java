/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

/**
 * Contiguous, inclusive range of hash slots.
 *
 * @param start first slot (inclusive)
 * @param end last slot (inclusive)
 */
public record SlotRange(int start, int end) {

  /** Size of the Redis Cluster keyspace. */
  public static final int SLOT_COUNT = 16384;

  public SlotRange {
    if (start < 0 || end >= SLOT_COUNT || start > end) {
      throw new IllegalArgumentException(
          "Invalid slot range [" + start + ", " + end + "], expected 0 <= start <= end < "
              + SLOT_COUNT);
    }
  }

  public boolean contains(final int slot) {
    return slot >= start && slot <= end;
  }

  public int size() {
    return end - start + 1;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + "]";
  }
}
