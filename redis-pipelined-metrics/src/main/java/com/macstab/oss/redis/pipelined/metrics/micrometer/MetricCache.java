/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.metrics.micrometer;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded cache of counters and gauge values keyed by name plus tags.
 *
 * <p>Hot paths (lane selection, traffic) hit a {@link ConcurrentHashMap#get} instead of the
 * registry's meter lookup. Once {@code maxCacheSize} entries exist, further meters are registered
 * directly and not cached: high-cardinality tags (for example a node address per cluster member)
 * degrade to slower lookups instead of unbounded memory.
 *
 * <p>Gauges hold their {@link AtomicInteger} strongly, so they must be removed explicitly when a
 * client closes: see {@link #removeGaugesForClient(String)}.
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;
  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(128);
  private final ConcurrentHashMap<String, GaugeEntry> gauges = new ConcurrentHashMap<>(128);
  private final AtomicInteger cacheSize = new AtomicInteger(0);

  /** Registered gauge plus its mutable value. */
  private record GaugeEntry(Gauge gauge, AtomicInteger value) {}

  MetricCache(final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }
    this.maxCacheSize = maxCacheSize;
  }

  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);
    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }
    if (cacheSize.get() >= maxCacheSize) {
      log.warn(
          "Metric cache full at {} entries. Direct registry used for counter: {}",
          maxCacheSize,
          key);
      return createCounter(name, description, tagPairs);
    }
    return counters.computeIfAbsent(
        key,
        k -> {
          cacheSize.incrementAndGet();
          return createCounter(name, description, tagPairs);
        });
  }

  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);
    final var key = buildKey(name, tagPairs);
    final var cached = gauges.get(key);
    if (cached != null) {
      return cached.value();
    }
    if (cacheSize.get() >= maxCacheSize) {
      log.warn(
          "Metric cache full at {} entries. Direct registry used for gauge: {}", maxCacheSize, key);
      return createGauge(name, description, tagPairs).value();
    }
    return gauges
        .computeIfAbsent(
            key,
            k -> {
              cacheSize.incrementAndGet();
              return createGauge(name, description, tagPairs);
            })
        .value();
  }

  /** Unregisters every cached gauge tagged with {@code client.name=clientName}. */
  void removeGaugesForClient(final String clientName) {
    final var tag = ":" + MetricsConfiguration.TAG_CLIENT_NAME + "=" + clientName + ":";
    gauges
        .entrySet()
        .removeIf(
            entry -> {
              if (!(entry.getKey() + ":").contains(tag)) {
                return false;
              }
              registry.remove(entry.getValue().gauge().getId());
              cacheSize.decrementAndGet();
              log.debug("Removed gauge of client {}: {}", clientName, entry.getKey());
              return true;
            });
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  private GaugeEntry createGauge(
      final String name, final String description, final String... tagPairs) {
    final var value = new AtomicInteger(0);
    final var gauge =
        Gauge.builder(name, value, AtomicInteger::get)
            .description(description)
            .tags(tagPairs)
            .register(registry);
    return new GaugeEntry(gauge, value);
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  /** {@code name:k1=v1:k2=v2} */
  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }
}
