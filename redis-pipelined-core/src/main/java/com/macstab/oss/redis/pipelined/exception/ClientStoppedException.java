/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

import com.macstab.oss.redis.pipelined.NodeAddress;

/** Work submitted after {@code close()}, or pending work failed by {@code close()}. */
public class ClientStoppedException extends RedisException {

  private static final long serialVersionUID = 1L;

  public ClientStoppedException() {
    super("Redis client has been stopped");
  }

  public ClientStoppedException(final NodeAddress address) {
    super("Redis client for " + address + " has been stopped");
  }
}
