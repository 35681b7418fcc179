/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

import java.time.Duration;

/**
 * Caller-side deadline exceeded.
 *
 * <p>The command is not retracted from the wire (RESP has no cancel primitive). Its reply is read
 * and discarded by the lane once it arrives.
 */
public class RedisTimeoutException extends RedisException {

  private static final long serialVersionUID = 1L;

  public RedisTimeoutException(final Duration timeout) {
    super("Redis command timed out after " + timeout.toMillis() + "ms");
  }
}
