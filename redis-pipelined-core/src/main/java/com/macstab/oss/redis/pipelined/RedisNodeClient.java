/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisOp;
import com.macstab.oss.redis.pipelined.config.NodeConfig;
import com.macstab.oss.redis.pipelined.connection.ConnectionLane;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.RequiredLevelViolationException;
import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;
import com.macstab.oss.redis.pipelined.operation.OperationInterpreter;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;
import com.macstab.oss.redis.pipelined.strategy.LaneSelectionStrategy;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Pooled client for one Redis node.
 *
 * <p>Holds {@code poolSize} lanes to the same node. Each batch goes to one lane picked by the
 * configured {@link LaneSelectionStrategy}; lanes are fully pipelined, so a pool of a few lanes
 * serves thousands of concurrent callers. A slow command only delays the batches queued behind it
 * on its own lane.
 *
 * <pre>
 *   caller A ──┐                 ┌── lane 0 ── TCP ──┐
 *   caller B ──┼── strategy ─────┼── lane 1 ── TCP ──┼── Redis node
 *   caller C ──┘                 └── lane 2 ── TCP ──┘
 * </pre>
 *
 * <p>Operations ({@link #executeOp}) reserve their lane for the whole chain, so {@code WATCH ...
 * MULTI ... EXEC} is never interleaved with other callers' commands. Commands that change
 * connection state outside of an operation are rejected with {@link
 * RequiredLevelViolationException}: the next batch on that lane may come from another caller.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisNodeClient implements RedisOpExecutor {

  private static final String CLIENT_TYPE = "RedisNodeClient";

  @Getter NodeAddress address;
  RedisClientResources resources;
  ConnectionLane[] lanes;
  @Getter LaneSelectionStrategy strategy;
  RedisClientMetrics metrics;
  String clientName;
  CompletableFuture<RedisNodeClient> initialized;
  AtomicBoolean closed = new AtomicBoolean();

  public RedisNodeClient(
      @NonNull final NodeAddress address,
      @NonNull final NodeConfig config,
      @NonNull final RedisClientResources resources) {
    if (config.getPoolSize() < 1) {
      throw new IllegalArgumentException("poolSize must be >= 1, got: " + config.getPoolSize());
    }
    this.address = address;
    this.resources = resources;
    this.metrics = config.getMetrics();
    this.clientName = config.getClientName();
    this.lanes = new ConnectionLane[config.getPoolSize()];
    for (var i = 0; i < lanes.length; i++) {
      lanes[i] =
          new ConnectionLane(
              i, address, config.getConnectionConfigs().apply(i), resources, metrics, clientName);
    }
    this.strategy = config.getLaneSelectionStrategy().get();
    strategy.initialize(lanes);

    final var ready = new CompletableFuture<?>[lanes.length];
    for (var i = 0; i < lanes.length; i++) {
      ready[i] = lanes[i].open(false);
    }
    this.initialized = CompletableFuture.allOf(ready).thenApply(ignored -> this);

    log.info(
        "Created RedisNodeClient for {} with {} lanes (strategy: {}, client: {})",
        address,
        lanes.length,
        strategy.getName(),
        clientName);
  }

  @Override
  public <A> CompletableFuture<A> executeBatch(
      @NonNull final RedisBatch<A> batch, @NonNull final Duration timeout) {
    final var packs = batch.rawCommandPacks();
    try {
      packs.requireLevel(Level.NODE, CLIENT_TYPE);
    } catch (RequiredLevelViolationException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (packs.isEmpty()) {
      return closed.get()
          ? CompletableFuture.failedFuture(new ClientStoppedException(address))
          : Futures.decodeLocally(batch);
    }
    return Futures.decode(executeRaw(packs, timeout), batch);
  }

  /**
   * Sends {@code packs} on one lane without level checks; used by the cluster client, which has
   * already checked them, and for its {@code ASKING} prefix.
   *
   * @return one reply per command, in command order
   */
  public CompletableFuture<List<RedisReply>> executeRaw(
      @NonNull final RawCommandPacks packs, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException(address));
    }
    final var laneIndex = acquireLane();
    final var future = resources.withTimeout(lanes[laneIndex].execute(packs), timeout);
    future.whenComplete((replies, error) -> releaseLane(laneIndex));
    return future;
  }

  @Override
  public <A> CompletableFuture<A> executeOp(
      @NonNull final RedisOp<A> op, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException(address));
    }
    final var laneIndex = acquireLane();
    final var future =
        resources.withTimeout(new OperationInterpreter<A>(lanes[laneIndex]).execute(op), timeout);
    future.whenComplete((value, error) -> releaseLane(laneIndex));
    return future;
  }

  @Override
  public CompletableFuture<RedisNodeClient> initialized() {
    return initialized;
  }

  public int getPoolSize() {
    return lanes.length;
  }

  /** In-flight batches/operations per lane, for diagnostics. */
  public int getInFlightCount(final int laneIndex) {
    return lanes[laneIndex].getInFlightCount().get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    closeAsync();
  }

  /** Like {@link #close()}; the future completes once every lane has terminated. */
  public CompletableFuture<Void> closeAsync() {
    if (!closed.compareAndSet(false, true)) {
      return CompletableFuture.allOf(terminations());
    }
    for (final var lane : lanes) {
      lane.close();
    }
    metrics.close(clientName);
    log.info("Closed RedisNodeClient for {} (client: {})", address, clientName);
    return CompletableFuture.allOf(terminations());
  }

  private CompletableFuture<?>[] terminations() {
    final var futures = new CompletableFuture<?>[lanes.length];
    for (var i = 0; i < lanes.length; i++) {
      futures[i] = lanes[i].terminationFuture();
    }
    return futures;
  }

  private int acquireLane() {
    final var laneIndex = strategy.selectLane(lanes.length);
    metrics.recordLaneSelection(clientName, laneIndex, strategy.getName());
    lanes[laneIndex].recordAcquire();
    strategy.onLaneAcquired(laneIndex);
    return laneIndex;
  }

  private void releaseLane(final int laneIndex) {
    lanes[laneIndex].recordRelease();
    strategy.onLaneReleased(laneIndex);
  }
}
