/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.macstab.oss.redis.pipelined.cluster.ClusterSlotMapping;
import com.macstab.oss.redis.pipelined.cluster.ClusterTopologyMonitor;
import com.macstab.oss.redis.pipelined.cluster.Slots;
import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisCommands;
import com.macstab.oss.redis.pipelined.command.RedisOp;
import com.macstab.oss.redis.pipelined.config.ClusterConfig;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.RedisException;
import com.macstab.oss.redis.pipelined.exception.TooManyRedirectionsException;
import com.macstab.oss.redis.pipelined.exception.UnmappedSlotException;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPack;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Cluster-aware client.
 *
 * <p><strong>Batches:</strong> every command pack is routed by the hash slot of its keys through
 * the monitor's current {@link ClusterSlotMapping} snapshot. Packs for the same master travel as
 * one batch on one of its lanes; replies are put back into the original command order. Keyless
 * packs go to the master of the lowest slot range. Packs whose keys hash to different slots are
 * rejected with {@link com.macstab.oss.redis.pipelined.exception.CrossSlotException}.
 *
 * <p><strong>Redirections:</strong> a {@code MOVED} reply requests a (debounced) topology refresh
 * and resends the pack to the named node; an {@code ASK} reply resends it there once, preceded by
 * {@code ASKING}. At most {@code maxRedirections} hops per pack, then {@link
 * TooManyRedirectionsException}.
 *
 * <p><strong>Operations</strong> run on the node owning the slot of the first step's keys (or the
 * first master, for keyless first steps), reserved for the whole chain. Later steps must stay on
 * that node.
 *
 * <p>Work submitted before the first mapping arrives waits for it.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisClusterClient implements RedisOpExecutor {

  private static final String CLIENT_TYPE = "RedisClusterClient";

  ClusterConfig config;
  RedisClientResources resources;
  @Getter ClusterTopologyMonitor monitor;
  CompletableFuture<RedisClusterClient> initialized;
  AtomicBoolean closed = new AtomicBoolean();

  public RedisClusterClient(
      @NonNull final Collection<NodeAddress> seeds,
      @NonNull final ClusterConfig config,
      @NonNull final RedisClientResources resources) {
    this(seeds, config, resources, ClusterTopologyMonitor.Listener.NOOP);
  }

  public RedisClusterClient(
      @NonNull final Collection<NodeAddress> seeds,
      @NonNull final ClusterConfig config,
      @NonNull final RedisClientResources resources,
      @NonNull final ClusterTopologyMonitor.Listener listener) {
    if (config.getMaxRedirections() < 0) {
      throw new IllegalArgumentException(
          "maxRedirections must be >= 0, got: " + config.getMaxRedirections());
    }
    this.config = config;
    this.resources = resources;
    this.monitor = new ClusterTopologyMonitor(seeds, config, resources, listener);
    this.initialized = monitor.firstMapping().thenApply(ignored -> this);
    monitor.start();
    log.info(
        "Created RedisClusterClient with seeds {} (client: {})", seeds, config.getClientName());
  }

  @Override
  public <A> CompletableFuture<A> executeBatch(
      @NonNull final RedisBatch<A> batch, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException());
    }
    final var packs = batch.rawCommandPacks();
    try {
      packs.requireLevel(Level.CLUSTER, CLIENT_TYPE);
    } catch (RedisException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (packs.isEmpty()) {
      return Futures.decodeLocally(batch);
    }
    final var replies = whenInitialized(mapping -> dispatch(packs, mapping, timeout));
    return resources.withTimeout(Futures.decode(replies, batch), timeout);
  }

  @Override
  public <A> CompletableFuture<A> executeOp(
      @NonNull final RedisOp<A> op, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException());
    }
    final var result =
        whenInitialized(
            mapping -> {
              final RedisNodeClient client;
              try {
                client = route(op.batch().rawCommandPacks().getPacks(), mapping);
              } catch (RedisException e) {
                return CompletableFuture.<A>failedFuture(e);
              }
              return client.executeOp(op, timeout);
            });
    return resources.withTimeout(result, timeout);
  }

  @Override
  public CompletableFuture<RedisClusterClient> initialized() {
    return initialized;
  }

  /** Currently published slot mapping. */
  public ClusterSlotMapping currentMapping() {
    return monitor.currentMapping();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      monitor.close();
      log.info("Closed RedisClusterClient (client: {})", config.getClientName());
    }
  }

  // ---------------------------------------------------------------------------------------------
  // Routing
  // ---------------------------------------------------------------------------------------------

  private <T> CompletableFuture<T> whenInitialized(
      final Function<ClusterSlotMapping, CompletableFuture<T>> action) {
    if (initialized.isDone() && !initialized.isCompletedExceptionally()) {
      return action.apply(monitor.currentMapping());
    }
    return initialized.thenCompose(ignored -> action.apply(monitor.currentMapping()));
  }

  /** Groups packs by node, sends one batch per node and restores command order. */
  private CompletableFuture<List<RedisReply>> dispatch(
      final RawCommandPacks packs, final ClusterSlotMapping mapping, final Duration timeout) {
    final var packList = packs.getPacks();
    final var groups = new IdentityHashMap<RedisNodeClient, List<Integer>>();
    final var clientOrder = new ArrayList<RedisNodeClient>();
    try {
      for (var i = 0; i < packList.size(); i++) {
        final var client = route(List.of(packList.get(i)), mapping);
        groups
            .computeIfAbsent(
                client,
                c -> {
                  clientOrder.add(c);
                  return new ArrayList<>();
                })
            .add(i);
      }
    } catch (RedisException e) {
      return CompletableFuture.failedFuture(e);
    }

    @SuppressWarnings("unchecked")
    final List<RedisReply>[] repliesPerPack = new List[packList.size()];
    final var sends = new ArrayList<CompletableFuture<Void>>(clientOrder.size());
    for (final var client : clientOrder) {
      final var indexes = groups.get(client);
      final var subPacks = new ArrayList<RawCommandPack>(indexes.size());
      for (final var index : indexes) {
        subPacks.add(packList.get(index));
      }
      sends.add(
          client
              .executeRaw(RawCommandPacks.of(subPacks), timeout)
              .thenCompose(
                  replies -> {
                    final var redirected = new ArrayList<CompletableFuture<Void>>();
                    var offset = 0;
                    for (final var index : indexes) {
                      final var pack = packList.get(index);
                      final var slice = replies.subList(offset, offset + pack.size());
                      offset += pack.size();
                      redirected.add(
                          followRedirections(pack, slice, 0, timeout)
                              .thenAccept(finalReplies -> repliesPerPack[index] = finalReplies));
                    }
                    return CompletableFuture.allOf(redirected.toArray(new CompletableFuture<?>[0]));
                  }));
    }

    return CompletableFuture.allOf(sends.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            ignored -> {
              final var all = new ArrayList<RedisReply>(packs.getCommandCount());
              for (final var replies : repliesPerPack) {
                all.addAll(replies);
              }
              return all;
            });
  }

  private RedisNodeClient route(
      final List<RawCommandPack> packs, final ClusterSlotMapping mapping) {
    var slot = Slots.NO_SLOT;
    for (final var pack : packs) {
      slot = Slots.slotOf(pack);
      if (slot != Slots.NO_SLOT) {
        break;
      }
    }
    final var client = slot == Slots.NO_SLOT ? mapping.firstClient() : mapping.clientForSlot(slot);
    if (client == null) {
      throw new UnmappedSlotException(slot);
    }
    return client;
  }

  private CompletableFuture<List<RedisReply>> followRedirections(
      final RawCommandPack pack,
      final List<RedisReply> replies,
      final int redirections,
      final Duration timeout) {
    final var redirect = findRedirect(replies);
    if (redirect == null) {
      return CompletableFuture.completedFuture(List.copyOf(replies));
    }
    if (redirections >= config.getMaxRedirections()) {
      return CompletableFuture.failedFuture(
          new TooManyRedirectionsException(redirections, redirect.message()));
    }
    final var parts = redirect.message().split(" ");
    final NodeAddress target;
    try {
      target = NodeAddress.parse(parts[2]);
    } catch (RuntimeException e) {
      return CompletableFuture.completedFuture(List.copyOf(replies));
    }
    final var ask = "ASK".equals(redirect.errorCode());
    config.getMetrics().recordRedirection(config.getClientName(), ask ? "ask" : "moved");
    if (log.isDebugEnabled()) {
      log.debug("Following {} for {} to {}", redirect.errorCode(), pack, target);
    }
    if (!ask) {
      monitor.refresh();
    }
    final var resend =
        ask
            ? RawCommandPacks.of(List.of(RawCommandPack.of(RedisCommands.asking()), pack))
            : RawCommandPacks.of(pack);
    return monitor
        .clientFor(target)
        .thenCompose(client -> client.executeRaw(resend, timeout))
        .thenCompose(
            resent ->
                followRedirections(
                    pack,
                    ask ? resent.subList(1, resent.size()) : resent,
                    redirections + 1,
                    timeout));
  }

  /** First MOVED or ASK error among the pack's replies, or null. */
  private static RedisReply.ErrorReply findRedirect(final List<RedisReply> replies) {
    for (final var reply : replies) {
      if (reply instanceof RedisReply.ErrorReply error) {
        final var code = error.errorCode();
        final var redirect = "MOVED".equals(code) || "ASK".equals(code);
        if (redirect && error.message().split(" ").length >= 3) {
          return error;
        }
      }
    }
    return null;
  }
}
