/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

/** No entry of the current cluster slot mapping covers the slot. */
public class UnmappedSlotException extends RedisException {

  private static final long serialVersionUID = 1L;

  public UnmappedSlotException(final int slot) {
    super("No cluster node currently serves slot " + slot);
  }
}
