/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys.
 *
 * <p>Dot-separated, lowercase; Micrometer converts per registry (Prometheus: {@code
 * redis_pipelined_lane_selections_total}).
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "redis.pipelined";

  /** Counter: lane picked by a pooled node client. */
  public static final String LANE_SELECTIONS = PREFIX + ".lane.selections";

  /** Gauge: batches/operations currently assigned to a lane. */
  public static final String LANE_IN_FLIGHT = PREFIX + ".lane.in_flight";

  /** Counter: reconnects scheduled after a lost connection. */
  public static final String LANE_RECONNECTS = PREFIX + ".lane.reconnects";

  /** Counter: CLUSTER SLOTS queries, tagged by outcome. */
  public static final String TOPOLOGY_REFRESHES = PREFIX + ".cluster.topology.refreshes";

  /** Counter: published slot mapping replaced. */
  public static final String SLOT_MAPPING_CHANGES = PREFIX + ".cluster.mapping.changes";

  /** Gauge: ranges in the published slot mapping. */
  public static final String SLOT_RANGES = PREFIX + ".cluster.mapping.ranges";

  /** Counter: MOVED/ASK redirections followed. */
  public static final String REDIRECTIONS = PREFIX + ".cluster.redirections";

  /** Counter: bytes written to / read from sockets. */
  public static final String BYTES_SENT = PREFIX + ".traffic.bytes.sent";

  public static final String BYTES_RECEIVED = PREFIX + ".traffic.bytes.received";

  /** Counter: socket writes / reads (buffers, not commands). */
  public static final String WRITES = PREFIX + ".traffic.writes";

  public static final String READS = PREFIX + ".traffic.reads";

  public static final String TAG_CLIENT_NAME = "client.name";
  public static final String TAG_LANE_INDEX = "lane.index";
  public static final String TAG_STRATEGY_NAME = "strategy.name";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_KIND = "kind";
  public static final String TAG_NODE = "node";
}
