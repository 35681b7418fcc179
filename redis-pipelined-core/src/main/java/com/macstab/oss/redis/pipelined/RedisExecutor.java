/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.redis.pipelined.command.RedisBatch;

/**
 * Executes pipelined batches.
 *
 * <p>Every returned future completes exactly once: with the decoded result, or exceptionally with
 * a {@link com.macstab.oss.redis.pipelined.exception.RedisException} subclass. Work submitted
 * before {@link #initialized()} completes is queued, not rejected.
 */
public interface RedisExecutor extends AutoCloseable {

  <A> CompletableFuture<A> executeBatch(RedisBatch<A> batch, Duration timeout);

  /** Completes once the underlying connection(s) or cluster topology are first ready. */
  CompletableFuture<? extends RedisExecutor> initialized();

  /** Stops accepting work; pending work fails with {@code ClientStoppedException}. Idempotent. */
  @Override
  void close();
}
