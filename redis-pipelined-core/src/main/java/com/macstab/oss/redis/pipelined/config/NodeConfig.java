/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.util.function.IntFunction;
import java.util.function.Supplier;

import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;
import com.macstab.oss.redis.pipelined.strategy.LaneSelectionStrategy;
import com.macstab.oss.redis.pipelined.strategy.RoundRobinStrategy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Settings of a pooled node client. */
@Value
@Builder(toBuilder = true)
public class NodeConfig {

  /** Number of lanes (connections) to the node. */
  @Builder.Default int poolSize = 4;

  /** Per-lane connection settings, by lane index. */
  @NonNull @Builder.Default
  IntFunction<ConnectionConfig> connectionConfigs = index -> ConnectionConfig.defaults();

  /** Fresh strategy per client: strategies hold per-pool state. */
  @NonNull @Builder.Default
  Supplier<LaneSelectionStrategy> laneSelectionStrategy = RoundRobinStrategy::new;

  @NonNull @Builder.Default RedisClientMetrics metrics = RedisClientMetrics.NOOP;

  /** Metrics dimension distinguishing clients sharing one registry. */
  @NonNull @Builder.Default String clientName = "default";

  public static NodeConfig defaults() {
    return builder().build();
  }
}
