/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.IntUnaryOperator;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Settings of a cluster client and its topology monitor. */
@Value
@Builder(toBuilder = true)
public class ClusterConfig {

  /** Node client settings for each master that serves slots. */
  @NonNull @Builder.Default
  Function<NodeAddress, NodeConfig> nodeConfigs = address -> NodeConfig.defaults();

  /** Settings of the dedicated lanes used for {@code CLUSTER SLOTS} queries. */
  @NonNull @Builder.Default
  Function<NodeAddress, ConnectionConfig> monitoringConnectionConfigs =
      address -> ConnectionConfig.builder().connectionName("cluster-monitor").build();

  /** Period of unconditional topology refreshes. */
  @NonNull @Builder.Default Duration autoRefreshInterval = Duration.ofSeconds(5);

  /** Refresh requests arriving sooner than this after the last honored one are dropped. */
  @NonNull @Builder.Default Duration minRefreshInterval = Duration.ofSeconds(1);

  /** Known master count to number of masters queried per refresh. */
  @NonNull @Builder.Default IntUnaryOperator nodesToQueryForState = count -> Math.min(count, 5);

  /** Grace period before closing the node client of a master that no longer serves slots. */
  @NonNull @Builder.Default Duration nodeClientCloseDelay = Duration.ofSeconds(1);

  /** MOVED/ASK hops followed per command pack before giving up. */
  @Builder.Default int maxRedirections = 3;

  @NonNull @Builder.Default RedisClientMetrics metrics = RedisClientMetrics.NOOP;

  @NonNull @Builder.Default String clientName = "cluster";

  public static ClusterConfig defaults() {
    return builder().build();
  }
}
