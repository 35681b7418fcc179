/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.function.Function;

/**
 * Dependent chain of batches: later batches are computed from earlier replies.
 *
 * <p>Needed when a command cannot be pipelined with its predecessors, the classic case being
 * optimistic locking:
 *
 * <pre>{@code
 * RedisOp<Long> increment =
 *     watch("counter").operation()
 *         .then(get("counter"))
 *         .flatMap(value -> set("counter", next(value)).transaction().operation());
 * }</pre>
 *
 * <p>An operation is either a terminal {@link Leaf} or a {@link FlatMapped} step whose
 * continuation yields the rest of the chain. Evaluating it yields exactly one terminal result. The
 * whole chain runs on one connection held under reservation, see {@code OperationInterpreter}.
 *
 * @param <A> result type of the whole chain
 */
public sealed interface RedisOp<A> permits RedisOp.Leaf, RedisOp.FlatMapped {

  /** First batch of the chain (routing decisions are made from its keys). */
  RedisBatch<?> batch();

  <B> RedisOp<B> flatMap(Function<? super A, ? extends RedisOp<B>> next);

  default <B> RedisOp<B> map(final Function<? super A, ? extends B> mapper) {
    return flatMap(a -> new Leaf<B>(RedisBatch.<B>success(mapper.apply(a))));
  }

  /** Runs {@code next} after this operation, discarding this operation's result. */
  default <B> RedisOp<B> then(final RedisBatch<B> next) {
    return flatMap(ignored -> next.operation());
  }

  static <A> RedisOp<A> success(final A value) {
    return new Leaf<>(RedisBatch.success(value));
  }

  /** Terminal step. */
  record Leaf<A>(RedisBatch<A> batch) implements RedisOp<A> {

    @Override
    public <B> RedisOp<B> flatMap(final Function<? super A, ? extends RedisOp<B>> next) {
      return new FlatMapped<A, B>(batch, next);
    }
  }

  /**
   * Step followed by a continuation.
   *
   * @param <X> result type of {@code batch}
   * @param <A> result type of the chain
   */
  record FlatMapped<X, A>(RedisBatch<X> batch, Function<? super X, ? extends RedisOp<A>> next)
      implements RedisOp<A> {

    @Override
    public <B> RedisOp<B> flatMap(final Function<? super A, ? extends RedisOp<B>> after) {
      return new FlatMapped<X, B>(batch, x -> next.apply(x).flatMap(after));
    }
  }
}
