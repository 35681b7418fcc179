/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.strategy;

import com.macstab.oss.redis.pipelined.connection.ConnectionLane;

/**
 * Picks the lane of a pooled node client that receives the next batch or operation.
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <ol>
 *   <li>{@link #initialize(ConnectionLane[])} once, from the node client constructor
 *   <li>{@link #selectLane(int)} per batch/operation
 *   <li>{@link #onLaneAcquired(int)} right after selection
 *   <li>{@link #onLaneReleased(int)} when the batch/operation completed (success or failure)
 * </ol>
 *
 * <p>Implementations are called concurrently from any caller thread and must be lock-free. The
 * node client creates one instance per client (see {@code NodeConfig#getLaneSelectionStrategy()}),
 * so per-pool state such as counters is never shared between clients.
 */
public interface LaneSelectionStrategy {

  default void initialize(final ConnectionLane[] lanes) {
    // Stateless strategies don't need the lanes
  }

  /**
   * @param numLanes pool size, at least 1
   * @return lane index in {@code [0, numLanes)}
   */
  int selectLane(int numLanes);

  /** Short name, used as metrics tag. */
  String getName();

  default void onLaneAcquired(final int laneIndex) {
    // Not tracked by default
  }

  default void onLaneReleased(final int laneIndex) {
    // Not tracked by default
  }
}
