/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import com.macstab.oss.redis.pipelined.NodeAddress;

/**
 * Observes raw traffic of a lane: one call per buffer written to, or read from, the socket.
 *
 * <p>Called on the lane's event loop thread. Implementations must be fast and must not throw; the
 * lane's correctness does not depend on them.
 */
public interface DebugListener {

  DebugListener NOOP = new DebugListener() {};

  default void onSend(final NodeAddress address, final int bytes) {
    // No-op by default
  }

  default void onReceive(final NodeAddress address, final int bytes) {
    // No-op by default
  }
}
