/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.connection.DebugListener;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings of a single connection lane.
 *
 * <pre>{@code
 * ConnectionConfig config =
 *     ConnectionConfig.builder()
 *         .connectionName("orders")
 *         .initCommands(RedisCommands.clientSetname("orders-service"))
 *         .reconnectionStrategy(ExponentialBackoff.unbounded(ofMillis(50), ofSeconds(5)))
 *         .build();
 * }</pre>
 */
@Value
@Builder(toBuilder = true)
public class ConnectionConfig {

  /** Logical name, used in logs and as metrics dimension. */
  @NonNull @Builder.Default String connectionName = "default";

  @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(10);

  /**
   * Executed on every (re)connect before any queued batch. A failing init batch counts as a failed
   * connection attempt.
   */
  @NonNull @Builder.Default RedisBatch<?> initCommands = RedisBatch.success(null);

  /** Consecutive failed connection attempts; empty delay stops the lane for good. */
  @NonNull @Builder.Default
  RetryStrategy reconnectionStrategy =
      ExponentialBackoff.unbounded(Duration.ofMillis(100), Duration.ofSeconds(10));

  /** Resubmission of written-but-unanswered batches after a disconnect. */
  @NonNull @Builder.Default RetryStrategy retryStrategy = new ImmediateRetry(1);

  @NonNull @Builder.Default DebugListener debugListener = DebugListener.NOOP;

  public static ConnectionConfig defaults() {
    return builder().build();
  }
}
