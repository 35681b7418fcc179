/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;
import java.util.Optional;

import lombok.Value;

/** Retries up to {@code maxRetries} times without delay. */
@Value
public class ImmediateRetry implements RetryStrategy {

  int maxRetries;

  public ImmediateRetry(final int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    this.maxRetries = maxRetries;
  }

  @Override
  public Optional<Duration> retryDelay(final int attempt) {
    return attempt < maxRetries ? Optional.of(Duration.ZERO) : Optional.empty();
  }
}
