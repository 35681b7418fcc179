/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.strategy;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.atomic.AtomicInteger;

import lombok.experimental.FieldDefaults;

/**
 * Cycles through the lanes: 0, 1, ..., n-1, 0, ...
 *
 * <p>One {@code getAndIncrement} per selection. Masking the sign bit keeps the index non-negative
 * after the counter wraps past {@link Integer#MAX_VALUE}:
 *
 * <pre>
 * counter = Integer.MAX_VALUE  ->  lane (MAX_VALUE % n)
 * counter = Integer.MIN_VALUE  ->  (MIN_VALUE &amp; MAX_VALUE) = 0  ->  lane 0
 * </pre>
 *
 * <p>Blind to load: a lane stuck behind a slow command keeps receiving its share. See {@link
 * LeastUsedStrategy} for that case.
 */
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RoundRobinStrategy implements LaneSelectionStrategy {

  AtomicInteger counter = new AtomicInteger(0);

  @Override
  public int selectLane(final int numLanes) {
    return (counter.getAndIncrement() & Integer.MAX_VALUE) % numLanes;
  }

  @Override
  public String getName() {
    return "round-robin";
  }

  /** Number of selections so far (wraps). */
  public int getTotalSelections() {
    return counter.get();
  }
}
