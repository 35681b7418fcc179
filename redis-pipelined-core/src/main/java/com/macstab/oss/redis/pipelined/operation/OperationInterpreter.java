/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.operation;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisOp;
import com.macstab.oss.redis.pipelined.connection.ConnectionLane;
import com.macstab.oss.redis.pipelined.connection.Reservation;
import com.macstab.oss.redis.pipelined.exception.AbortedOperationException;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one {@link RedisOp} step by step against one lane, under a reservation held for the
 * whole chain.
 *
 * <p>The first step that actually has commands is sent with {@link ConnectionLane#reserving}, so no
 * other caller's batch can reach the wire between, for example, {@code WATCH} and {@code EXEC}.
 * Later steps use {@link ConnectionLane#execute(RawCommandPacks, Reservation)}. Steps without
 * commands ({@code RedisBatch.success}, {@code map}) are evaluated locally in a loop, so long
 * chains do not grow the stack.
 *
 * <p>The reservation is released from a completion callback of the result future. Whatever
 * completes the result (last step, failed step, throwing continuation, caller timeout, {@link
 * #abort(String)}) therefore releases the lane exactly once. The lane clears a {@code WATCH} or
 * {@code MULTI} the chain left open before it serves anybody else.
 *
 * <p>Single use: one instance per operation.
 *
 * @param <A> result type of the operation
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class OperationInterpreter<A> {

  ConnectionLane lane;
  Reservation reservation = new Reservation();
  CompletableFuture<A> result = new CompletableFuture<>();
  AtomicBoolean started = new AtomicBoolean();
  AtomicBoolean reservedOnce = new AtomicBoolean();
  AtomicBoolean released = new AtomicBoolean();

  public OperationInterpreter(@NonNull final ConnectionLane lane) {
    this.lane = lane;
  }

  /**
   * Starts the operation.
   *
   * @return the operation's result; a second call returns a future failed with {@link
   *     IllegalStateException}
   */
  public CompletableFuture<A> execute(@NonNull final RedisOp<A> op) {
    if (!started.compareAndSet(false, true)) {
      return CompletableFuture.failedFuture(
          new IllegalStateException("Interpreter already executed an operation"));
    }
    result.whenComplete((value, error) -> releaseOnce());
    if (lane.isTerminated()) {
      result.completeExceptionally(
          new AbortedOperationException("Lane " + lane + " is terminated"));
      return result;
    }
    run(op);
    return result;
  }

  /**
   * Fails the operation with {@link AbortedOperationException} unless it already completed.
   *
   * @return whether this call completed the operation
   */
  public boolean abort(final String reason) {
    return result.completeExceptionally(new AbortedOperationException(reason));
  }

  public boolean isDone() {
    return result.isDone();
  }

  @SuppressWarnings("unchecked")
  private void run(final RedisOp<?> op) {
    var current = op;
    while (!result.isDone()) {
      final var batch = (RedisBatch<Object>) current.batch();
      final RawCommandPacks packs;
      try {
        packs = batch.rawCommandPacks();
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
        return;
      }

      if (packs.isEmpty()) {
        final Object value;
        try {
          value = batch.decodeReplies(List.of());
        } catch (RuntimeException e) {
          result.completeExceptionally(e);
          return;
        }
        current = continueWith(current, value);
        if (current == null) {
          return;
        }
        continue;
      }

      final var step = current;
      sendStep(packs).whenComplete((list, error) -> onReplies(step, batch, list, error));
      return;
    }
  }

  private CompletableFuture<List<RedisReply>> sendStep(final RawCommandPacks packs) {
    final var first = !reservedOnce.getAndSet(true);
    final var future =
        first ? lane.reserving(packs, reservation) : lane.execute(packs, reservation);
    if (first && result.isDone()) {
      // Completed (timeout, abort) while the reserving batch was being submitted: the release
      // issued by the completion callback may have reached the lane first
      lane.release(reservation);
    }
    return future;
  }

  private void onReplies(
      final RedisOp<?> step,
      final RedisBatch<Object> batch,
      final List<RedisReply> replies,
      final Throwable error) {
    if (error != null) {
      final var cause = unwrap(error);
      final var terminated = lane.isTerminated();
      result.completeExceptionally(
          terminated
              ? new AbortedOperationException("Lane " + lane + " terminated during step", cause)
              : cause);
      return;
    }
    if (result.isDone()) {
      log.debug("Discarding step result of {}, operation already completed", reservation);
      return;
    }
    final Object value;
    try {
      value = batch.decodeReplies(replies);
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
      return;
    }
    final var next = continueWith(step, value);
    if (next != null) {
      run(next);
    }
  }

  /** Next step, or null when the result has been completed. */
  @SuppressWarnings("unchecked")
  private RedisOp<?> continueWith(final RedisOp<?> step, final Object value) {
    if (step instanceof RedisOp.Leaf) {
      if (!result.complete((A) value)) {
        log.debug("Operation of {} already completed, dropping result", reservation);
      }
      return null;
    }
    final var flatMapped = (RedisOp.FlatMapped<Object, ?>) step;
    try {
      final RedisOp<?> next = flatMapped.next().apply(value);
      if (next == null) {
        throw new IllegalStateException("Operation continuation returned null");
      }
      return next;
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
      return null;
    }
  }

  private void releaseOnce() {
    if (reservedOnce.get() && released.compareAndSet(false, true)) {
      lane.release(reservation);
    }
  }

  private static Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
  }
}
