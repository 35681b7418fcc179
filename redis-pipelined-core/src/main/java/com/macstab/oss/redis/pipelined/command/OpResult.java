/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import com.macstab.oss.redis.pipelined.exception.RedisException;

/**
 * Terminal outcome of an operation.
 *
 * @param <A> result type
 */
public sealed interface OpResult<A> permits OpResult.Success, OpResult.Failure {

  /**
   * Returns the value, or throws the failure cause (wrapped in {@link RedisException} if checked).
   */
  A get();

  boolean isSuccess();

  static <A> OpResult<A> success(final A value) {
    return new Success<>(value);
  }

  static <A> OpResult<A> failure(final Throwable cause) {
    return new Failure<>(cause);
  }

  record Success<A>(A value) implements OpResult<A> {

    @Override
    public A get() {
      return value;
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  record Failure<A>(Throwable cause) implements OpResult<A> {

    @Override
    public A get() {
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new RedisException("Operation failed", cause);
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
