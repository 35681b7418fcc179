/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** Malformed reply, or a reply that arrived while no command was pending. */
public class ProtocolErrorException extends RedisException {

  private static final long serialVersionUID = 1L;

  public ProtocolErrorException(final String message) {
    super(message);
  }

  public ProtocolErrorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
