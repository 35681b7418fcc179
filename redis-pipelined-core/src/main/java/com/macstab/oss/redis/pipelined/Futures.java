/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.experimental.UtilityClass;

/** Future plumbing shared by the client facades. */
@UtilityClass
class Futures {

  Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }

  /** Decodes {@code replies} with {@code batch}; decoding failures fail the returned future. */
  <A> CompletableFuture<A> decode(
      final CompletableFuture<List<RedisReply>> replies, final RedisBatch<A> batch) {
    final var result = new CompletableFuture<A>();
    replies.whenComplete(
        (list, error) -> {
          if (error != null) {
            result.completeExceptionally(unwrap(error));
            return;
          }
          try {
            result.complete(batch.decodeReplies(list));
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  /** Batches without commands never touch a connection. */
  <A> CompletableFuture<A> decodeLocally(final RedisBatch<A> batch) {
    try {
      return CompletableFuture.completedFuture(batch.decodeReplies(List.of()));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
