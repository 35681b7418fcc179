/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisOp;
import com.macstab.oss.redis.pipelined.config.ConnectionConfig;
import com.macstab.oss.redis.pipelined.config.NoRetryStrategy;
import com.macstab.oss.redis.pipelined.connection.ConnectionLane;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.RequiredLevelViolationException;
import com.macstab.oss.redis.pipelined.operation.OperationInterpreter;
import com.macstab.oss.redis.pipelined.protocol.Level;

import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Client over exactly one connection, for commands that change connection state ({@code WATCH},
 * {@code CLIENT SETNAME}, {@code SELECT}, ...).
 *
 * <p>Never reconnects and never resubmits: once the connection drops, pending and later batches
 * fail with {@link com.macstab.oss.redis.pipelined.exception.ConnectionFaultException} and the
 * caller decides how to rebuild its connection state. The first connection attempt must succeed,
 * otherwise {@link #initialized()} fails.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisConnectionClient implements RedisOpExecutor {

  private static final String CLIENT_TYPE = "RedisConnectionClient";

  @Getter NodeAddress address;
  RedisClientResources resources;
  ConnectionLane lane;
  CompletableFuture<RedisConnectionClient> initialized;
  AtomicBoolean closed = new AtomicBoolean();

  public RedisConnectionClient(
      @NonNull final NodeAddress address,
      @NonNull final ConnectionConfig config,
      @NonNull final RedisClientResources resources) {
    this.address = address;
    this.resources = resources;
    final var effective =
        config.toBuilder()
            .reconnectionStrategy(NoRetryStrategy.INSTANCE)
            .retryStrategy(NoRetryStrategy.INSTANCE)
            .build();
    this.lane = new ConnectionLane(0, address, effective, resources);
    this.initialized = lane.open(true).thenApply(ignored -> this);
    log.info(
        "Created RedisConnectionClient for {} (connection: {})",
        address,
        config.getConnectionName());
  }

  @Override
  public <A> CompletableFuture<A> executeBatch(
      @NonNull final RedisBatch<A> batch, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException(address));
    }
    final var packs = batch.rawCommandPacks();
    try {
      packs.requireLevel(Level.CONNECTION, CLIENT_TYPE);
    } catch (RequiredLevelViolationException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (packs.isEmpty()) {
      return Futures.decodeLocally(batch);
    }
    return Futures.decode(resources.withTimeout(lane.execute(packs), timeout), batch);
  }

  @Override
  public <A> CompletableFuture<A> executeOp(
      @NonNull final RedisOp<A> op, @NonNull final Duration timeout) {
    if (closed.get()) {
      return CompletableFuture.failedFuture(new ClientStoppedException(address));
    }
    return resources.withTimeout(new OperationInterpreter<A>(lane).execute(op), timeout);
  }

  @Override
  public CompletableFuture<RedisConnectionClient> initialized() {
    return initialized;
  }

  public boolean isConnected() {
    return lane.isConnected();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      lane.close();
      log.info("Closed RedisConnectionClient for {}", address);
    }
  }
}
