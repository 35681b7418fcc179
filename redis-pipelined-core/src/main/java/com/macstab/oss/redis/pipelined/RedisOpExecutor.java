/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import com.macstab.oss.redis.pipelined.command.OpResult;
import com.macstab.oss.redis.pipelined.command.RedisOp;

/** Executes dependent chains of batches on one reserved connection. */
public interface RedisOpExecutor extends RedisExecutor {

  <A> CompletableFuture<A> executeOp(RedisOp<A> op, Duration timeout);

  /** Like {@link #executeOp}, but the future always succeeds and carries the outcome. */
  default <A> CompletableFuture<OpResult<A>> executeOpForResult(
      final RedisOp<A> op, final Duration timeout) {
    return executeOp(op, timeout)
        .handle(
            (value, error) ->
                error == null ? OpResult.success(value) : OpResult.failure(Futures.unwrap(error)));
  }
}
