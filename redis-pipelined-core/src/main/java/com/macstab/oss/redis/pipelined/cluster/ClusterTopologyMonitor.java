/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.RedisClientResources;
import com.macstab.oss.redis.pipelined.RedisNodeClient;
import com.macstab.oss.redis.pipelined.command.RedisCommands;
import com.macstab.oss.redis.pipelined.config.ClusterConfig;
import com.macstab.oss.redis.pipelined.config.NodeConfig;
import com.macstab.oss.redis.pipelined.connection.ConnectionLane;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;

import io.netty.channel.EventLoop;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the slot routing table of a cluster and keeps it fresh.
 *
 * <p>All state lives on one event loop, like a connection lane. The published {@link
 * ClusterSlotMapping} is the only field read from other threads; it is replaced as a whole, never
 * mutated.
 *
 * <p><strong>Refresh cycle:</strong>
 *
 * <ol>
 *   <li>{@link #start()} queries every seed, then schedules a refresh every {@code
 *       autoRefreshInterval}.
 *   <li>A refresh arriving before {@code minRefreshInterval} has passed since the last honored one
 *       is dropped.
 *   <li>An honored refresh queries {@code nodesToQueryForState(n)} of the {@code n} known masters,
 *       drawn uniformly without replacement.
 *   <li>Each {@code CLUSTER SLOTS} reply becomes a mapping sorted by range start. Node clients are
 *       reused for known masters and created for new ones. The listener fires only if ranges or
 *       owners differ from the published mapping.
 *   <li>After every non-empty reply, changed or not, nodes that are not masters in it lose their
 *       monitoring lane at once (seeds that turned out to be replicas included). Their node client
 *       is closed after {@code nodeClientCloseDelay} so traffic already routed to it can finish.
 * </ol>
 *
 * <p>A failed query is logged and counted; the published mapping stays as it is.
 */
@Slf4j
@FieldDefaults(level = PRIVATE)
public final class ClusterTopologyMonitor implements AutoCloseable {

  /** Notified on the monitor's event loop whenever the published mapping changes. */
  @FunctionalInterface
  public interface Listener {

    Listener NOOP = mapping -> {};

    void onMappingChanged(ClusterSlotMapping mapping);
  }

  final List<NodeAddress> seeds;
  final ClusterConfig config;
  final RedisClientResources resources;
  final Listener listener;
  final EventLoop eventLoop;
  final CompletableFuture<ClusterSlotMapping> firstMapping = new CompletableFuture<>();

  // Event-loop confined state
  final Map<NodeAddress, ConnectionLane> monitoringLanes = new HashMap<>();
  final Map<NodeAddress, RedisNodeClient> clients = new HashMap<>();
  List<NodeAddress> knownMasters;
  long suspendUntilNanos;
  boolean suspended;
  boolean started;
  boolean closed;
  ScheduledFuture<?> autoRefreshTask;

  volatile ClusterSlotMapping mapping = ClusterSlotMapping.EMPTY;

  public ClusterTopologyMonitor(
      @NonNull final Collection<NodeAddress> seeds,
      @NonNull final ClusterConfig config,
      @NonNull final RedisClientResources resources,
      @NonNull final Listener listener) {
    if (seeds.isEmpty()) {
      throw new IllegalArgumentException("At least one seed address is required");
    }
    this.seeds = List.copyOf(seeds);
    this.config = config;
    this.resources = resources;
    this.listener = listener;
    this.eventLoop = resources.nextEventLoop();
    this.knownMasters = this.seeds;
  }

  /** Queries all seeds and starts periodic refreshing. Idempotent. */
  public void start() {
    onLoop(
        null,
        () -> {
          if (started || closed) {
            return;
          }
          started = true;
          log.info("Starting cluster topology monitor with seeds {}", seeds);
          markRefreshed();
          for (final var seed : seeds) {
            query(seed);
          }
          final var interval = config.getAutoRefreshInterval().toNanos();
          autoRefreshTask =
              eventLoop.scheduleAtFixedRate(
                  () -> doRefresh(null), interval, interval, TimeUnit.NANOSECONDS);
        });
  }

  /** Requests a refresh of a sample of known masters; dropped while debounced. */
  public void refresh() {
    onLoop(null, () -> doRefresh(null));
  }

  /** Requests a refresh querying (a sample of) {@code addresses}; dropped while debounced. */
  public void refresh(@NonNull final Collection<NodeAddress> addresses) {
    final var targets = List.copyOf(addresses);
    onLoop(null, () -> doRefresh(targets));
  }

  /** Currently published mapping; {@link ClusterSlotMapping#EMPTY} until the first reply. */
  public ClusterSlotMapping currentMapping() {
    return mapping;
  }

  /** Completes with the first non-empty mapping, or fails when the monitor is closed first. */
  public CompletableFuture<ClusterSlotMapping> firstMapping() {
    return firstMapping;
  }

  /** Node client for {@code address}, created if absent. */
  public CompletableFuture<RedisNodeClient> clientFor(@NonNull final NodeAddress address) {
    final var result = new CompletableFuture<RedisNodeClient>();
    onLoop(
        result,
        () -> {
          if (closed) {
            result.completeExceptionally(new ClientStoppedException());
            return;
          }
          result.complete(clientForLocal(address));
        });
    return result;
  }

  /** Masters of the published mapping (seeds before the first reply). */
  public CompletableFuture<List<NodeAddress>> knownMasters() {
    final var result = new CompletableFuture<List<NodeAddress>>();
    onLoop(result, () -> result.complete(List.copyOf(knownMasters)));
    return result;
  }

  /** Stops refreshing and closes every monitoring lane and node client. Idempotent. */
  @Override
  public void close() {
    onLoop(
        null,
        () -> {
          if (closed) {
            return;
          }
          closed = true;
          if (autoRefreshTask != null) {
            autoRefreshTask.cancel(false);
          }
          monitoringLanes.values().forEach(ConnectionLane::close);
          monitoringLanes.clear();
          clients.values().forEach(RedisNodeClient::close);
          clients.clear();
          firstMapping.completeExceptionally(new ClientStoppedException());
          log.info("Cluster topology monitor closed");
        });
  }

  // ---------------------------------------------------------------------------------------------
  // Event loop
  // ---------------------------------------------------------------------------------------------

  private void onLoop(final CompletableFuture<?> failOnReject, final Runnable task) {
    try {
      eventLoop.execute(task);
    } catch (RejectedExecutionException e) {
      log.debug("Cluster topology monitor event loop is shut down, dropping task");
      firstMapping.completeExceptionally(new ClientStoppedException());
      if (failOnReject != null) {
        failOnReject.completeExceptionally(new ClientStoppedException());
      }
    }
  }

  private void doRefresh(final List<NodeAddress> targets) {
    if (closed) {
      return;
    }
    if (suspended && System.nanoTime() - suspendUntilNanos < 0) {
      log.debug("Dropping topology refresh request, last refresh too recent");
      return;
    }
    markRefreshed();

    final var candidates =
        new ArrayList<>(targets != null ? targets : knownMasters.isEmpty() ? seeds : knownMasters);
    final var count =
        Math.max(
            1,
            Math.min(
                candidates.size(),
                config.getNodesToQueryForState().applyAsInt(candidates.size())));
    // Partial Fisher-Yates: the first 'count' positions end up a uniform sample
    final var random = ThreadLocalRandom.current();
    for (var i = 0; i < count; i++) {
      final var j = i + random.nextInt(candidates.size() - i);
      final var swapped = candidates.get(j);
      candidates.set(j, candidates.get(i));
      candidates.set(i, swapped);
    }
    if (log.isDebugEnabled()) {
      log.debug("Refreshing cluster topology from {}", candidates.subList(0, count));
    }
    for (var i = 0; i < count; i++) {
      query(candidates.get(i));
    }
  }

  private void markRefreshed() {
    suspended = true;
    suspendUntilNanos = System.nanoTime() + config.getMinRefreshInterval().toNanos();
  }

  private void query(final NodeAddress address) {
    final var lane =
        monitoringLanes.computeIfAbsent(
            address,
            a -> {
              final var created =
                  new ConnectionLane(
                      0,
                      a,
                      config.getMonitoringConnectionConfigs().apply(a),
                      resources,
                      config.getMetrics(),
                      config.getClientName() + "-monitor@" + a);
              created.open(false);
              return created;
            });
    final var batch = RedisCommands.clusterSlots(address);
    resources
        .withTimeout(lane.execute(batch.rawCommandPacks()), config.getAutoRefreshInterval())
        .whenComplete(
            (replies, error) ->
                onLoop(
                    null,
                    () -> {
                      if (closed) {
                        return;
                      }
                      if (error != null && monitoringLanes.get(address) != lane) {
                        log.debug("Dropping failed query to {}, its lane was retired", address);
                        return;
                      }
                      if (error != null) {
                        onQueryFailed(address, error);
                        return;
                      }
                      final List<SlotRangeMapping> ranges;
                      try {
                        ranges = batch.decodeReplies(replies);
                      } catch (RuntimeException e) {
                        onQueryFailed(address, e);
                        return;
                      }
                      config.getMetrics().recordTopologyRefresh(config.getClientName(), true);
                      onSlots(address, ranges);
                    }));
  }

  private void onQueryFailed(final NodeAddress address, final Throwable error) {
    final var cause =
        error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    config.getMetrics().recordTopologyRefresh(config.getClientName(), false);
    log.error("Cluster topology query to {} failed, keeping current mapping", address, cause);
  }

  private void onSlots(final NodeAddress answeringNode, final List<SlotRangeMapping> ranges) {
    final var entries = new ArrayList<ClusterSlotMapping.Entry>(ranges.size());
    for (final var range : ranges) {
      entries.add(
          new ClusterSlotMapping.Entry(
              range.range(), range.master(), clientForLocal(range.master())));
    }
    final var updated = ClusterSlotMapping.of(entries);
    final var previous = mapping;
    if (updated.sameRoutingAs(previous)) {
      log.debug("Cluster topology from {} unchanged", answeringNode);
    } else {
      publish(answeringNode, updated);
    }
    if (!updated.isEmpty()) {
      retireNonMasters(updated.masters());
    }
  }

  private void publish(final NodeAddress answeringNode, final ClusterSlotMapping updated) {
    mapping = updated;
    knownMasters = List.copyOf(updated.masters());
    config
        .getMetrics()
        .recordSlotMappingChange(config.getClientName(), updated.getEntries().size());
    log.info("Cluster slot mapping changed (reported by {}): {}", answeringNode, updated);
    try {
      listener.onMappingChanged(updated);
    } catch (RuntimeException e) {
      log.error("Cluster mapping listener failed", e);
    }
    if (!updated.isEmpty()) {
      firstMapping.complete(updated);
    }
  }

  private void retireNonMasters(final Collection<NodeAddress> masters) {
    final var retiredLanes = new HashSet<>(monitoringLanes.keySet());
    retiredLanes.removeAll(masters);
    for (final var address : retiredLanes) {
      log.debug("{} is not a master, closing its monitoring connection", address);
      monitoringLanes.remove(address).close();
    }
    final var retiredClients = new HashSet<>(clients.keySet());
    retiredClients.removeAll(masters);
    for (final var address : retiredClients) {
      final var client = clients.remove(address);
      log.info(
          "{} does not serve slots, closing its client in {} ms",
          address,
          config.getNodeClientCloseDelay().toMillis());
      eventLoop.schedule(
          client::close, config.getNodeClientCloseDelay().toNanos(), TimeUnit.NANOSECONDS);
    }
  }

  private RedisNodeClient clientForLocal(final NodeAddress address) {
    return clients.computeIfAbsent(
        address, a -> new RedisNodeClient(a, nodeConfigFor(a), resources));
  }

  /** Node clients report as {@code <cluster client>@<address>}, into the cluster's metrics. */
  private NodeConfig nodeConfigFor(final NodeAddress address) {
    final var nodeConfig = config.getNodeConfigs().apply(address);
    final var metrics =
        nodeConfig.getMetrics() == RedisClientMetrics.NOOP
            ? config.getMetrics()
            : nodeConfig.getMetrics();
    return nodeConfig.toBuilder()
        .clientName(config.getClientName() + "@" + address)
        .metrics(metrics)
        .build();
  }
}
