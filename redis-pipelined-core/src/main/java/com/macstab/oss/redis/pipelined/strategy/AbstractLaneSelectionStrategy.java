/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.strategy;

import com.macstab.oss.redis.pipelined.connection.ConnectionLane;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;

/**
 * Base for strategies that look at lane state.
 *
 * <p>Keeps the lane array so subclasses can read each lane's in-flight counter (maintained by the
 * node client around every batch and operation). Stateless strategies implement {@link
 * LaneSelectionStrategy} directly.
 *
 * <p>{@code lanes} is assigned in {@link #initialize(ConnectionLane[])}, called from the node
 * client constructor before the client is published, so no further synchronization is needed.
 */
@FieldDefaults(level = AccessLevel.PROTECTED)
public abstract class AbstractLaneSelectionStrategy implements LaneSelectionStrategy {

  ConnectionLane[] lanes; // Set once in initialize()

  @Override
  public void initialize(@NonNull final ConnectionLane[] lanes) {
    if (lanes.length == 0) {
      throw new IllegalArgumentException("Lanes array cannot be empty");
    }
    this.lanes = lanes;
  }

  public int getInFlightCount(final int laneIndex) {
    return lanes[laneIndex].getInFlightCount().get();
  }
}
