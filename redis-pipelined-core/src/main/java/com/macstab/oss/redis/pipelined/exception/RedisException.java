/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/**
 * Root of all failures surfaced by the pipelined client runtime.
 *
 * <p>Every public {@code execute*} future completes exceptionally with a subclass of this type (or
 * with an exception thrown by a user-supplied continuation). Unchecked: callers consume failures
 * through {@link java.util.concurrent.CompletableFuture} completion, never through {@code throws}
 * clauses.
 */
public class RedisException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RedisException(final String message) {
    super(message);
  }

  public RedisException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
