/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Never retries.
 *
 * <p>Used by {@code RedisConnectionClient}: a silent reconnect would lose connection state
 * ({@code WATCH}, {@code CLIENT SETNAME}, {@code SELECT}) behind the caller's back, and a silent
 * resubmit could duplicate non-idempotent commands.
 */
public enum NoRetryStrategy implements RetryStrategy {
  INSTANCE;

  @Override
  public Optional<Duration> retryDelay(final int attempt) {
    return Optional.empty();
  }
}
