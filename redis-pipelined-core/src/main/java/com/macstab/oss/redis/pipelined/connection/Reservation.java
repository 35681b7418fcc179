/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a caller that holds, or asks for, exclusive use of a lane.
 *
 * <p>Compared by identity. One instance per operation.
 */
public final class Reservation {

  private static final AtomicLong IDS = new AtomicLong();

  private final long id = IDS.incrementAndGet();

  @Override
  public String toString() {
    return "Reservation#" + id;
  }
}
