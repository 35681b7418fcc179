/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.metrics.micrometer;

import static com.macstab.oss.redis.pipelined.metrics.micrometer.MetricsConfiguration.*;

import java.util.Objects;

import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link RedisClientMetrics}.
 *
 * <p>One instance can serve any number of clients: every meter is tagged with {@code client.name}.
 * A cluster client passes its instance on to the node clients it creates, which report as {@code
 * <cluster>@<host:port>}.
 *
 * <pre>{@code
 * var metrics = new MicrometerRedisClientMetrics(meterRegistry);
 * var config = NodeConfig.builder().clientName("sessions").metrics(metrics).build();
 * }</pre>
 *
 * <p>Exported meters:
 *
 * <ul>
 *   <li>{@code redis.pipelined.lane.selections} (counter; client.name, lane.index, strategy.name)
 *   <li>{@code redis.pipelined.lane.in_flight} (gauge; client.name, lane.index)
 *   <li>{@code redis.pipelined.lane.reconnects} (counter; client.name, lane.index)
 *   <li>{@code redis.pipelined.cluster.topology.refreshes} (counter; client.name, outcome)
 *   <li>{@code redis.pipelined.cluster.mapping.changes} (counter) and {@code
 *       redis.pipelined.cluster.mapping.ranges} (gauge)
 *   <li>{@code redis.pipelined.cluster.redirections} (counter; client.name, kind)
 * </ul>
 */
@Slf4j
public final class MicrometerRedisClientMetrics implements RedisClientMetrics {

  private final MetricCache cache;

  public MicrometerRedisClientMetrics(final MeterRegistry registry, final int maxCacheSize) {
    this.cache =
        new MetricCache(
            Objects.requireNonNull(registry, "MeterRegistry must not be null"), maxCacheSize);
    log.debug("Created MicrometerRedisClientMetrics (maxCacheSize: {})", maxCacheSize);
  }

  public MicrometerRedisClientMetrics(final MeterRegistry registry) {
    this(registry, 1000);
  }

  @Override
  public void recordLaneSelection(
      final String clientName, final int laneIndex, final String strategyName) {
    if (laneIndex < 0) {
      log.warn("Invalid lane index: {} (negative), skipping metric", laneIndex);
      return;
    }
    cache
        .getOrCreateCounter(
            LANE_SELECTIONS,
            "Lane selection frequency",
            TAG_CLIENT_NAME,
            clientName,
            TAG_LANE_INDEX,
            String.valueOf(laneIndex),
            TAG_STRATEGY_NAME,
            strategyName)
        .increment();
  }

  @Override
  public void setInFlightOperations(final String clientName, final int laneIndex, final int count) {
    if (laneIndex < 0) {
      log.warn("Invalid lane index: {} (negative), skipping metric", laneIndex);
      return;
    }
    cache
        .getOrCreateGaugeValue(
            LANE_IN_FLIGHT,
            "Batches and operations currently assigned to the lane",
            TAG_CLIENT_NAME,
            clientName,
            TAG_LANE_INDEX,
            String.valueOf(laneIndex))
        .set(count);
  }

  @Override
  public void recordReconnect(final String clientName, final int laneIndex) {
    cache
        .getOrCreateCounter(
            LANE_RECONNECTS,
            "Reconnects scheduled after a lost connection",
            TAG_CLIENT_NAME,
            clientName,
            TAG_LANE_INDEX,
            String.valueOf(laneIndex))
        .increment();
  }

  @Override
  public void recordTopologyRefresh(final String clientName, final boolean success) {
    cache
        .getOrCreateCounter(
            TOPOLOGY_REFRESHES,
            "CLUSTER SLOTS queries",
            TAG_CLIENT_NAME,
            clientName,
            TAG_OUTCOME,
            success ? "success" : "failure")
        .increment();
  }

  @Override
  public void recordSlotMappingChange(final String clientName, final int rangeCount) {
    cache
        .getOrCreateCounter(
            SLOT_MAPPING_CHANGES, "Slot mapping replacements", TAG_CLIENT_NAME, clientName)
        .increment();
    cache
        .getOrCreateGaugeValue(
            SLOT_RANGES, "Ranges in the published slot mapping", TAG_CLIENT_NAME, clientName)
        .set(rangeCount);
  }

  @Override
  public void recordRedirection(final String clientName, final String kind) {
    cache
        .getOrCreateCounter(
            REDIRECTIONS,
            "MOVED/ASK redirections followed",
            TAG_CLIENT_NAME,
            clientName,
            TAG_KIND,
            kind)
        .increment();
  }

  /** Removes the client's gauges; counters stay (they are cumulative). */
  @Override
  public void close(final String clientName) {
    cache.removeGaugesForClient(clientName);
    log.debug("Released gauges of client '{}'", clientName);
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
