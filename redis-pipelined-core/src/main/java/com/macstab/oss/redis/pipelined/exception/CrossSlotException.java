/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** Keys of a single command pack hash to different cluster slots. */
public class CrossSlotException extends RedisException {

  private static final long serialVersionUID = 1L;

  public CrossSlotException(final String commandName) {
    super("Keys of " + commandName + " hash to different cluster slots");
  }
}
