/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.metrics;

/**
 * Metrics SPI of the client runtime (Micrometer implementation lives in {@code
 * redis-pipelined-metrics}).
 *
 * <p>All methods default to no-op, so the core carries no metrics dependency and {@link #NOOP}
 * costs one virtual call. Every method takes the client name as first argument: several clients
 * (a cluster client owns one node client per master) report into one registry.
 */
public interface RedisClientMetrics {

  /** No-op singleton. */
  RedisClientMetrics NOOP = new RedisClientMetrics() {};

  /** Lane chosen for a batch or operation by a pooled node client. */
  default void recordLaneSelection(
      final String clientName, final int laneIndex, final String strategyName) {
    // No-op by default
  }

  /** Current number of batches/operations in flight on a lane. */
  default void setInFlightOperations(
      final String clientName, final int laneIndex, final int count) {
    // No-op by default
  }

  /** A lane lost its connection and scheduled a reconnect. */
  default void recordReconnect(final String clientName, final int laneIndex) {
    // No-op by default
  }

  /** Outcome of one {@code CLUSTER SLOTS} query. */
  default void recordTopologyRefresh(final String clientName, final boolean success) {
    // No-op by default
  }

  /** A refresh produced a slot mapping different from the published one. */
  default void recordSlotMappingChange(final String clientName, final int rangeCount) {
    // No-op by default
  }

  /** MOVED or ASK redirection followed by the cluster client. */
  default void recordRedirection(final String clientName, final String kind) {
    // No-op by default
  }

  /** Releases per-client meters (gauges hold strong references). */
  default void close(final String clientName) {
    // No-op by default
  }
}
