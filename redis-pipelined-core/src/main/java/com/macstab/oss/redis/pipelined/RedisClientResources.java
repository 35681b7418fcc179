/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.RedisTimeoutException;

import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import lombok.experimental.FieldDefaults;

/**
 * Event loops shared by any number of clients.
 *
 * <p>Every connection lane and every topology monitor is pinned to one loop taken from {@link
 * #nextEventLoop()}; all their state is confined to that thread. Clients never close the
 * resources they were given: the creator does, after closing the clients.
 *
 * <pre>{@code
 * try (var resources = RedisClientResources.create();
 *     var client = new RedisNodeClient(NodeAddress.DEFAULT, NodeConfig.defaults(), resources)) {
 *   client.executeBatch(RedisCommands.ping(), Duration.ofSeconds(1)).join();
 * }
 * }</pre>
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisClientResources implements AutoCloseable {

  @Getter EventLoopGroup eventLoopGroup;
  AtomicBoolean closed = new AtomicBoolean();

  private RedisClientResources(final EventLoopGroup eventLoopGroup) {
    this.eventLoopGroup = eventLoopGroup;
  }

  /** One event loop per available processor. */
  public static RedisClientResources create() {
    return create(Runtime.getRuntime().availableProcessors());
  }

  public static RedisClientResources create(final int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
    }
    final var group =
        new NioEventLoopGroup(threads, new DefaultThreadFactory("redis-pipelined", true));
    log.info("Created Redis client resources with {} event loop(s)", threads);
    return new RedisClientResources(group);
  }

  public EventLoop nextEventLoop() {
    return eventLoopGroup.next();
  }

  public Class<? extends Channel> channelType() {
    return NioSocketChannel.class;
  }

  /** Runs {@code task} after {@code delay} on some loop of the group. */
  public void schedule(final Runnable task, final Duration delay) {
    eventLoopGroup.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
  }

  /**
   * Fails {@code future} with {@link RedisTimeoutException} unless it completes within {@code
   * timeout}. The work behind the future is not cancelled: Redis has no way to retract a command
   * that is already on the wire, so the lane discards the late reply instead.
   *
   * @return {@code future}
   */
  public <T> CompletableFuture<T> withTimeout(
      final CompletableFuture<T> future, final Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    if (future.isDone()) {
      return future;
    }
    try {
      final var task =
          eventLoopGroup.schedule(
              () -> future.completeExceptionally(new RedisTimeoutException(timeout)),
              timeout.toNanos(),
              TimeUnit.NANOSECONDS);
      future.whenComplete((value, error) -> task.cancel(false));
    } catch (RejectedExecutionException e) {
      future.completeExceptionally(new ClientStoppedException());
    }
    return future;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
      log.info("Redis client resources closed");
    }
  }
}
