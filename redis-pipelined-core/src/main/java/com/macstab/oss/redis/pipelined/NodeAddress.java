/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import java.util.Objects;

/**
 * Address of a single Redis endpoint.
 *
 * <p>Immutable value, used as map key by the cluster topology monitor (per-master lanes and node
 * clients) and carried by connection faults.
 *
 * @param host host name or IP literal (as reported by {@code CLUSTER SLOTS})
 * @param port TCP port (1-65535)
 */
public record NodeAddress(String host, int port) {

  public static final NodeAddress DEFAULT = new NodeAddress("localhost", 6379);

  public NodeAddress {
    Objects.requireNonNull(host, "host must not be null");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be in [1, 65535], got: " + port);
    }
  }

  /**
   * Parses {@code host:port}. IPv6 literals use the last colon as separator, which is also how
   * Redis formats them in {@code MOVED}/{@code ASK} errors.
   */
  public static NodeAddress parse(final String hostAndPort) {
    final int separator = hostAndPort.lastIndexOf(':');
    if (separator <= 0 || separator == hostAndPort.length() - 1) {
      throw new IllegalArgumentException("Expected host:port, got: " + hostAndPort);
    }
    try {
      return new NodeAddress(
          hostAndPort.substring(0, separator),
          Integer.parseInt(hostAndPort.substring(separator + 1)));
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in: " + hostAndPort, e);
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
