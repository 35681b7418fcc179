/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.metrics.micrometer;

import static com.macstab.oss.redis.pipelined.metrics.micrometer.MetricsConfiguration.*;

import java.util.Objects;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.connection.DebugListener;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counts socket traffic per node: bytes and buffers written and read.
 *
 * <p>Plug into {@code ConnectionConfig.debugListener}. Called on event loop threads; each call is a
 * map lookup plus a counter increment.
 */
public final class MicrometerDebugListener implements DebugListener {

  private final MetricCache cache;
  private final String clientName;

  public MicrometerDebugListener(final MeterRegistry registry, final String clientName) {
    this.cache =
        new MetricCache(Objects.requireNonNull(registry, "MeterRegistry must not be null"), 1000);
    this.clientName = Objects.requireNonNull(clientName, "clientName must not be null");
  }

  @Override
  public void onSend(final NodeAddress address, final int bytes) {
    final var node = address.toString();
    cache
        .getOrCreateCounter(WRITES, "Socket writes", TAG_CLIENT_NAME, clientName, TAG_NODE, node)
        .increment();
    cache
        .getOrCreateCounter(
            BYTES_SENT, "Bytes written", TAG_CLIENT_NAME, clientName, TAG_NODE, node)
        .increment(bytes);
  }

  @Override
  public void onReceive(final NodeAddress address, final int bytes) {
    final var node = address.toString();
    cache
        .getOrCreateCounter(READS, "Socket reads", TAG_CLIENT_NAME, clientName, TAG_NODE, node)
        .increment();
    cache
        .getOrCreateCounter(
            BYTES_RECEIVED, "Bytes read", TAG_CLIENT_NAME, clientName, TAG_NODE, node)
        .increment(bytes);
  }
}
