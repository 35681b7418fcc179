/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** Operation interpreter was torn down before it produced a result. */
public class AbortedOperationException extends RedisException {

  private static final long serialVersionUID = 1L;

  public AbortedOperationException(final String message) {
    super(message);
  }

  public AbortedOperationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
