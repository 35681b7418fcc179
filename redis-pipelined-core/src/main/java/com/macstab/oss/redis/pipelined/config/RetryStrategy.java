/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether (and after which delay) attempt number {@code attempt} should happen.
 *
 * <p>Used twice per connection: as reconnection strategy ({@code attempt} = consecutive failed
 * connection attempts) and as retry strategy for batches that were written but not answered when
 * the connection dropped ({@code attempt} = how often that batch was already resubmitted; only
 * presence of a delay matters, the batch is resubmitted once the connection is back).
 */
@FunctionalInterface
public interface RetryStrategy {

  /**
   * @param attempt zero-based attempt index
   * @return delay before the attempt, or empty to give up
   */
  Optional<Duration> retryDelay(int attempt);
}
