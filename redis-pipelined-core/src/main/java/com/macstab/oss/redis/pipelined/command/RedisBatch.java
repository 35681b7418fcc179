/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

/**
 * Commands pipelined together plus one decoder for their ordered replies.
 *
 * <p>Batches compose: {@link #sequence(List)} of N batches is one pipelined batch whose decoder
 * hands each sub-decoder its own slice of the reply list, in order.
 *
 * <pre>{@code
 * RedisBatch<List<Object>> batch = RedisBatch.sequence(List.of(set("k", "v"), get("k")));
 * // one write: SET k v, GET k  ->  [true, "v"]
 * }</pre>
 *
 * @param <A> decoded result type
 */
public interface RedisBatch<A> {

  RawCommandPacks rawCommandPacks();

  /**
   * Decodes the replies to {@link #rawCommandPacks()}, one reply per command, in command order.
   *
   * @throws RuntimeException usually a {@link
   *     com.macstab.oss.redis.pipelined.exception.RedisException}
   *     when a reply is an error or has an unexpected shape
   */
  A decodeReplies(List<RedisReply> replies);

  static <A> RedisBatch<A> command(
      final RawCommand command, final Function<RedisReply, ? extends A> decoder) {
    return new CommandBatch<>(command, decoder);
  }

  /** Batch with no commands, decoding to {@code value} without touching the connection. */
  static <A> RedisBatch<A> success(final A value) {
    return new ValueBatch<>(value);
  }

  static <A> RedisBatch<List<A>> sequence(final List<? extends RedisBatch<? extends A>> batches) {
    return new SequencedBatch<>(batches);
  }

  static <A, B, C> RedisBatch<C> zip(
      final RedisBatch<A> first,
      final RedisBatch<B> second,
      final BiFunction<? super A, ? super B, ? extends C> combiner) {
    return new ZippedBatch<>(first, second, combiner);
  }

  default <B> RedisBatch<B> map(final Function<? super A, ? extends B> mapper) {
    return new MappedBatch<>(this, mapper);
  }

  /** Wraps all commands into one {@code MULTI ... EXEC} pack. */
  default RedisBatch<A> transaction() {
    return new TransactionBatch<>(this);
  }

  /** Like {@link #transaction()}, but single-command batches are left alone (already atomic). */
  default RedisBatch<A> atomic() {
    return rawCommandPacks().getCommandCount() > 1 ? transaction() : this;
  }

  default RedisOp<A> operation() {
    return new RedisOp.Leaf<>(this);
  }

  default <B> RedisOp<B> flatMap(final Function<? super A, ? extends RedisOp<B>> next) {
    return new RedisOp.FlatMapped<>(this, next);
  }
}
