/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code minDelay * 2^attempt}, capped at {@code maxDelay}, for at most {@code maxRetries}
 * attempts.
 *
 * <pre>
 * minDelay=100ms, maxDelay=10s:  100ms, 200ms, 400ms, ... 6.4s, 10s, 10s, ...
 * </pre>
 */
@Value
public class ExponentialBackoff implements RetryStrategy {

  Duration minDelay;
  Duration maxDelay;
  int maxRetries;

  public ExponentialBackoff(
      @NonNull final Duration minDelay, @NonNull final Duration maxDelay, final int maxRetries) {
    if (minDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
      throw new IllegalArgumentException(
          "Expected 0 <= minDelay <= maxDelay, got: " + minDelay + ", " + maxDelay);
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    this.minDelay = minDelay;
    this.maxDelay = maxDelay;
    this.maxRetries = maxRetries;
  }

  /** Unbounded number of attempts. */
  public static ExponentialBackoff unbounded(final Duration minDelay, final Duration maxDelay) {
    return new ExponentialBackoff(minDelay, maxDelay, Integer.MAX_VALUE);
  }

  @Override
  public Optional<Duration> retryDelay(final int attempt) {
    if (attempt >= maxRetries) {
      return Optional.empty();
    }
    // 2^30 * minDelay overflows long nanos for any sane minDelay; cap the shift first
    final int shift = Math.min(attempt, 30);
    final long nanos = minDelay.toNanos();
    if (nanos == 0) {
      return Optional.of(Duration.ZERO);
    }
    final long scaled = nanos > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : nanos << shift;
    return Optional.of(Duration.ofNanos(Math.min(scaled, maxDelay.toNanos())));
  }
}
