/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.strategy;

/**
 * Picks the lane with the fewest batches/operations in flight; ties go to the lowest index.
 *
 * <p>Routes around lanes that hold a long reservation (a {@code WATCH ... EXEC} chain blocks its
 * lane for everybody else) or sit behind a slow command. The scan reads counters without locking,
 * so concurrent callers may see slightly stale values and pick the same lane. That is acceptable:
 * the next selection sees the increment.
 */
public final class LeastUsedStrategy extends AbstractLaneSelectionStrategy {

  @Override
  public int selectLane(final int numLanes) {
    if (lanes == null) {
      throw new IllegalStateException(
          "Strategy not initialized. Client must call initialize(lanes) before selectLane()");
    }
    var minLane = 0;
    var minCount = lanes[0].getInFlightCount().get();
    for (var i = 1; i < numLanes; i++) {
      final var count = lanes[i].getInFlightCount().get();
      if (count < minCount) {
        minCount = count;
        minLane = i;
      }
    }
    return minLane;
  }

  @Override
  public String getName() {
    return "least-used";
  }
}
