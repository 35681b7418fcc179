/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

import com.macstab.oss.redis.pipelined.NodeAddress;

import lombok.Getter;

/** Socket or transport failure on the connection to {@link #getAddress()}. */
@Getter
public class ConnectionFaultException extends RedisException {

  private static final long serialVersionUID = 1L;

  private final transient NodeAddress address;

  public ConnectionFaultException(final NodeAddress address, final String message) {
    super("Connection to " + address + " failed: " + message);
    this.address = address;
  }

  public ConnectionFaultException(
      final NodeAddress address, final String message, final Throwable cause) {
    super("Connection to " + address + " failed: " + message, cause);
    this.address = address;
  }
}
