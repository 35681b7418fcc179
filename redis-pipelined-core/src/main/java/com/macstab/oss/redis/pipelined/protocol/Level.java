/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

/**
 * Widest client surface a command may be executed by.
 *
 * <p>Ordered from most to least restrictive. A client surface {@code S} accepts a command of level
 * {@code L} iff {@code L >= S}:
 *
 * <pre>
 * command level   connection client   node client   cluster client
 * CONNECTION      yes                 no            no
 * NODE            yes                 yes           no
 * CLUSTER         yes                 yes           yes
 * </pre>
 *
 * <p>{@code CONNECTION}: mutates connection state ({@code WATCH}, {@code CLIENT SETNAME}, {@code
 * SELECT}); only meaningful when every following command is guaranteed to use the same
 * connection. {@code NODE}: node-wide but keyless ({@code FLUSHALL}, {@code CLUSTER SLOTS}).
 * {@code CLUSTER}: keyed data commands routable by slot.
 */
public enum Level {
  CONNECTION,
  NODE,
  CLUSTER;

  /** Whether a client of this level may execute a command declaring {@code commandLevel}. */
  public boolean accepts(final Level commandLevel) {
    return commandLevel.compareTo(this) >= 0;
  }
}
