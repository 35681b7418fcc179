/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

import java.util.List;

import com.macstab.oss.redis.pipelined.NodeAddress;

/**
 * One {@code CLUSTER SLOTS} entry: a slot range, the master serving it and its replicas.
 *
 * @param range slot range
 * @param master master address
 * @param replicas replica addresses, possibly empty
 */
public record SlotRangeMapping(SlotRange range, NodeAddress master, List<NodeAddress> replicas) {

  public SlotRangeMapping {
    replicas = List.copyOf(replicas);
  }

  @Override
  public String toString() {
    return range + " -> " + master + (replicas.isEmpty() ? "" : " (replicas: " + replicas + ")");
  }
}
