/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** {@code EXEC} returned a nil array: a key observed by {@code WATCH} was modified. */
public class OptimisticLockException extends RedisException {

  private static final long serialVersionUID = 1L;

  public OptimisticLockException() {
    super("Transaction aborted: a watched key was modified");
  }
}
