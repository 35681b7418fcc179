/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.RedisClientResources;
import com.macstab.oss.redis.pipelined.config.ConnectionConfig;
import com.macstab.oss.redis.pipelined.exception.AbortedOperationException;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.ConnectionFaultException;
import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.exception.RedisException;
import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.handler.codec.CodecException;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * One logical connection to one Redis node: pipelined execution, reconnection and an exclusive
 * reservation protocol.
 *
 * <p><strong>Threading:</strong> the lane is pinned to one Netty {@link EventLoop}. Every channel
 * it opens registers on that loop, and every public method hops onto it before touching state, so
 * all mutable fields below are confined to a single thread and need no locking. Public methods are
 * safe to call from any thread; submissions from one thread reach the wire in call order.
 *
 * <p><strong>Ordering:</strong> each batch is written as one contiguous sequence of commands and
 * appended to the {@code sent} queue. Redis answers a connection strictly in order, so every reply
 * belongs to the head of {@code sent}.
 *
 * <p><strong>Reservation:</strong>
 *
 * <pre>
 * reserving(packs, R)   idle      -> reserved(R), packs written
 *                       reserved  -> queued in arrival order
 * execute(packs, R)     R holds   -> written (or parked until reconnected)
 *                       R lost    -> failed with ConnectionFaultException
 *                       otherwise -> failed with AbortedOperationException
 * release(R)            R holds   -> UNWATCH/DISCARD if R left WATCH/MULTI open,
 *                                    then idle, queue drained in arrival order
 *                       R lost    -> forgotten
 *                       otherwise -> R's queued batches removed and failed
 * </pre>
 *
 * <p><strong>Disconnect:</strong> batches of the reservation holder are failed and the reservation
 * is dropped (server-side {@code WATCH}/{@code MULTI} state is gone). The lane remembers the lost
 * holder until it releases, so its later steps fail instead of running unwatched on the new
 * connection. Other written but unanswered batches are re-queued at the head when the retry
 * strategy allows another attempt, otherwise failed with {@link ConnectionFaultException}. Then the
 * reconnection strategy decides between a delayed reconnect and giving up, which closes the lane
 * for good.
 */
@Slf4j
@FieldDefaults(level = PRIVATE)
public class ConnectionLane {

  enum State {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING,
    CLOSED
  }

  @Getter final int index;
  @Getter final NodeAddress address;
  @Getter final ConnectionConfig config;
  final EventLoop eventLoop;
  final Bootstrap bootstrap;
  final RedisClientMetrics metrics;
  final String clientName;

  /** Batches and operations currently assigned to this lane (read by least-used selection). */
  @Getter final AtomicInteger inFlightCount = new AtomicInteger(0);

  final CompletableFuture<Void> readyFuture = new CompletableFuture<>();
  final CompletableFuture<Void> terminationFuture = new CompletableFuture<>();

  // Event-loop confined state
  State state = State.DISCONNECTED;
  boolean opened;
  boolean mustInitiallyConnect;
  boolean everConnected;
  int reconnectAttempt;
  Channel channel;
  RedisException channelFailure;
  RedisException terminationCause;
  ScheduledFuture<?> reconnectTask;
  Reservation reservedBy;
  boolean holderWatching;
  boolean holderInMulti;
  final Set<Reservation> lostReservations = new HashSet<>();
  final ArrayDeque<Request> waiting = new ArrayDeque<>();
  final ArrayDeque<Request> holderPending = new ArrayDeque<>();
  final ArrayDeque<Request> sent = new ArrayDeque<>();

  volatile boolean connected;
  volatile boolean terminated;

  public ConnectionLane(
      final int index,
      @NonNull final NodeAddress address,
      @NonNull final ConnectionConfig config,
      @NonNull final RedisClientResources resources) {
    this(index, address, config, resources, RedisClientMetrics.NOOP, config.getConnectionName());
  }

  public ConnectionLane(
      final int index,
      @NonNull final NodeAddress address,
      @NonNull final ConnectionConfig config,
      @NonNull final RedisClientResources resources,
      @NonNull final RedisClientMetrics metrics,
      @NonNull final String clientName) {
    if (index < 0) {
      throw new IllegalArgumentException("Lane index must be >= 0, got: " + index);
    }
    this.index = index;
    this.address = address;
    this.config = config;
    this.eventLoop = resources.nextEventLoop();
    this.metrics = metrics;
    this.clientName = clientName;
    this.bootstrap =
        new Bootstrap()
            .group(eventLoop)
            .channel(resources.channelType())
            .option(
                ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .handler(LaneChannelHandler.initializer(this));
  }

  // ---------------------------------------------------------------------------------------------
  // Public API (any thread)
  // ---------------------------------------------------------------------------------------------

  /**
   * Starts connecting. Idempotent.
   *
   * @param mustInitiallyConnect when set, a failed first attempt terminates the lane instead of
   *     entering the reconnection cycle
   * @return completes when the lane is connected (init commands done) for the first time, or
   *     exceptionally when the lane terminates before that
   */
  public CompletableFuture<Void> open(final boolean mustInitiallyConnect) {
    runOnLoop(
        () -> {
          if (opened || state != State.DISCONNECTED) {
            return;
          }
          opened = true;
          this.mustInitiallyConnect = mustInitiallyConnect;
          connect();
        },
        readyFuture);
    return readyFuture;
  }

  /** Anonymous batch: queued behind any reservation. */
  public CompletableFuture<List<RedisReply>> execute(final RawCommandPacks packs) {
    return submit(packs, null, false);
  }

  /**
   * Batch on behalf of {@code owner}, which must hold the lane; written immediately, or parked
   * while the lane reconnects.
   */
  public CompletableFuture<List<RedisReply>> execute(
      final RawCommandPacks packs, @NonNull final Reservation owner) {
    return submit(packs, owner, false);
  }

  /** Claims the lane for {@code owner} and writes {@code packs} as the first reserved batch. */
  public CompletableFuture<List<RedisReply>> reserving(
      final RawCommandPacks packs, @NonNull final Reservation owner) {
    return submit(packs, owner, true);
  }

  public void release(@NonNull final Reservation owner) {
    runOnLoop(() -> doRelease(owner), null);
  }

  /** Stops the lane; pending batches fail with {@link ClientStoppedException}. Idempotent. */
  public CompletableFuture<Void> close() {
    runOnLoop(this::doClose, null);
    return terminationFuture;
  }

  /** Completes once the lane reached its terminal state (closed or gave up reconnecting). */
  public CompletableFuture<Void> terminationFuture() {
    return terminationFuture;
  }

  public boolean isConnected() {
    return connected;
  }

  /** True once the lane started failing its queues for good; never reset. */
  public boolean isTerminated() {
    return terminated;
  }

  /** Counts one more batch or operation assigned to this lane. */
  public void recordAcquire() {
    final var count = inFlightCount.incrementAndGet();
    metrics.setInFlightOperations(clientName, index, count);
  }

  public void recordRelease() {
    final var count = inFlightCount.updateAndGet(c -> Math.max(0, c - 1));
    metrics.setInFlightOperations(clientName, index, count);
  }

  @Override
  public String toString() {
    return String.format("Lane[%d, %s, connected=%s]", index, address, connected);
  }

  // ---------------------------------------------------------------------------------------------
  // Channel callbacks (event loop)
  // ---------------------------------------------------------------------------------------------

  void onReply(final Channel source, final RedisReply reply) {
    if (source != channel) {
      return;
    }
    final var head = sent.peek();
    if (head == null) {
      log.warn("Unsolicited reply from {} on lane {}: {}", address, index, reply);
      resetChannel(new ProtocolErrorException("Unsolicited reply from " + address + ": " + reply));
      return;
    }
    head.replies.add(reply);
    if (head.replies.size() < head.commands.size()) {
      return;
    }
    sent.poll();
    if (!head.future.complete(List.copyOf(head.replies)) && log.isDebugEnabled()) {
      log.debug("Discarding late reply on lane {} to {}, caller already gone", index, address);
    }
  }

  void onChannelException(final Channel source, final Throwable cause) {
    if (source != channel) {
      return;
    }
    if (cause instanceof CodecException || cause instanceof ProtocolErrorException) {
      log.warn("Malformed reply from {} on lane {}: {}", address, index, cause.toString());
      resetChannel(new ProtocolErrorException("Malformed reply from " + address, cause));
    } else {
      resetChannel(
          new ConnectionFaultException(address, String.valueOf(cause.getMessage()), cause));
    }
  }

  void onChannelInactive(final Channel source) {
    if (source != channel) {
      return;
    }
    channel = null;
    connected = false;
    final var cause =
        channelFailure != null
            ? channelFailure
            : new ConnectionFaultException(address, "connection closed");
    channelFailure = null;

    if (state == State.CLOSING) {
      finishClose();
      return;
    }
    failOrRequeueInFlight(cause);
    scheduleReconnect(cause);
  }

  // ---------------------------------------------------------------------------------------------
  // Internals (event loop)
  // ---------------------------------------------------------------------------------------------

  private CompletableFuture<List<RedisReply>> submit(
      @NonNull final RawCommandPacks packs, final Reservation owner, final boolean reserving) {
    final var request = new Request(packs.getCommands(), owner, reserving);
    runOnLoop(() -> accept(request), request.future);
    return request.future;
  }

  private void runOnLoop(final Runnable task, final CompletableFuture<?> failOnReject) {
    try {
      eventLoop.execute(task);
    } catch (RejectedExecutionException e) {
      if (failOnReject != null) {
        failOnReject.completeExceptionally(new ClientStoppedException(address));
      }
      // Event loop shut down underneath us
      terminated = true;
      terminationFuture.complete(null);
    }
  }

  private void accept(final Request request) {
    if (state == State.CLOSING || state == State.CLOSED) {
      request.future.completeExceptionally(
          terminationCause != null ? terminationCause : new ClientStoppedException(address));
      return;
    }
    if (request.owner != null && lostReservations.contains(request.owner)) {
      request.future.completeExceptionally(
          new ConnectionFaultException(
              address, request.owner + " was lost when the connection dropped"));
      return;
    }
    if (request.owner != null && request.owner == reservedBy) {
      holderPending.add(request);
    } else if (request.owner != null && !request.reserving) {
      request.future.completeExceptionally(
          new AbortedOperationException(request.owner + " does not hold lane " + index));
      return;
    } else {
      waiting.add(request);
    }
    drain();
  }

  private void drain() {
    if (state != State.CONNECTED) {
      return;
    }
    var written = false;
    while (!holderPending.isEmpty()) {
      written |= write(holderPending.poll());
    }
    while (reservedBy == null && !waiting.isEmpty()) {
      final var request = waiting.poll();
      if (request.future.isDone()) {
        log.debug("Skipping batch on lane {}, caller already gone", index);
        continue;
      }
      if (request.reserving) {
        reservedBy = request.owner;
        holderWatching = false;
        holderInMulti = false;
      }
      written |= write(request);
    }
    if (written) {
      channel.flush();
    }
  }

  private boolean write(final Request request) {
    if (request.commands.isEmpty()) {
      request.future.complete(List.of());
      return false;
    }
    final var byHolder = request.owner != null && request.owner == reservedBy;
    for (final RawCommand command : request.commands) {
      if (byHolder) {
        trackHolderState(command.getName());
      }
      channel.write(command, channel.voidPromise());
    }
    sent.add(request);
    return true;
  }

  private void trackHolderState(final String commandName) {
    switch (commandName) {
      case "WATCH":
        holderWatching = true;
        break;
      case "UNWATCH":
        holderWatching = false;
        break;
      case "MULTI":
        holderInMulti = true;
        break;
      case "EXEC":
      case "DISCARD":
        holderWatching = false;
        holderInMulti = false;
        break;
      default:
        break;
    }
  }

  /** Clears WATCH/MULTI state the releasing holder left on the connection. */
  private boolean writeHolderReset() {
    if (state != State.CONNECTED || (!holderWatching && !holderInMulti)) {
      return false;
    }
    final var command = RawCommand.of(Level.CONNECTION, holderInMulti ? "DISCARD" : "UNWATCH");
    holderWatching = false;
    holderInMulti = false;
    final var reset = new Request(List.of(command), null, false);
    reset.noRetry = true;
    reset.future.whenComplete(
        (replies, error) -> {
          if (error == null && replies.get(0) instanceof RedisReply.ErrorReply reply) {
            log.warn("{} after release failed on lane {}: {}", command, index, reply.message());
          }
        });
    if (log.isDebugEnabled()) {
      log.debug("Lane {} sending {} for {} before serving the queue", index, command, reservedBy);
    }
    return write(reset);
  }

  private void connect() {
    if (state == State.CLOSING || state == State.CLOSED) {
      return;
    }
    state = State.CONNECTING;
    if (log.isDebugEnabled()) {
      log.debug("Lane {} connecting to {}", index, address);
    }
    bootstrap
        .connect(address.host(), address.port())
        .addListener((ChannelFutureListener) this::onConnectComplete);
  }

  private void onConnectComplete(final ChannelFuture future) {
    if (state != State.CONNECTING) {
      if (future.isSuccess()) {
        future.channel().close();
      }
      return;
    }
    if (!future.isSuccess()) {
      final var cause = future.cause();
      scheduleReconnect(
          new ConnectionFaultException(address, "connect failed: " + cause.getMessage(), cause));
      return;
    }
    channel = future.channel();
    runInitCommands(channel);
  }

  private void runInitCommands(final Channel ch) {
    final var initBatch = config.getInitCommands();
    final var commands = initBatch.rawCommandPacks().getCommands();
    if (commands.isEmpty()) {
      onConnected();
      return;
    }
    final var init = new Request(commands, null, false);
    init.noRetry = true;
    init.future.whenComplete(
        (replies, error) -> {
          if (error != null || ch != channel) {
            return;
          }
          try {
            initBatch.decodeReplies(replies);
          } catch (RuntimeException e) {
            log.error("Init commands failed on lane {} to {}", index, address, e);
            resetChannel(new ConnectionFaultException(address, "init commands failed", e));
            return;
          }
          onConnected();
        });
    write(init);
    ch.flush();
  }

  private void onConnected() {
    state = State.CONNECTED;
    connected = true;
    everConnected = true;
    reconnectAttempt = 0;
    log.info("Lane {} connected to {}", index, address);
    readyFuture.complete(null);
    drain();
  }

  private void resetChannel(final RedisException cause) {
    if (channel == null) {
      return;
    }
    if (channelFailure == null) {
      channelFailure = cause;
    }
    channel.close();
  }

  private void failOrRequeueInFlight(final RedisException cause) {
    final var lostReservation = reservedBy;
    reservedBy = null;
    holderWatching = false;
    holderInMulti = false;
    final var protocolError = cause instanceof ProtocolErrorException;

    final var retry = new ArrayList<Request>();
    for (final var request : sent) {
      if (request.noRetry
          || protocolError
          || request.future.isDone()
          || (request.owner != null && request.owner == lostReservation)) {
        request.future.completeExceptionally(cause);
        continue;
      }
      if (config.getRetryStrategy().retryDelay(request.attempts).isPresent()) {
        request.attempts++;
        request.replies.clear();
        retry.add(request);
      } else {
        request.future.completeExceptionally(cause);
      }
    }
    sent.clear();

    for (final var request : holderPending) {
      request.future.completeExceptionally(cause);
    }
    holderPending.clear();

    for (var i = retry.size() - 1; i >= 0; i--) {
      waiting.addFirst(retry.get(i));
    }
    if (lostReservation != null) {
      lostReservations.add(lostReservation);
      log.debug("Lane {} dropped {} after disconnect", index, lostReservation);
    }
  }

  private void scheduleReconnect(final RedisException cause) {
    if (mustInitiallyConnect && !everConnected) {
      log.error("Initial connection of lane {} to {} failed", index, address, cause);
      terminate(cause);
      return;
    }
    final var delay = config.getReconnectionStrategy().retryDelay(reconnectAttempt);
    if (delay.isEmpty()) {
      log.error(
          "Lane {} to {} gave up reconnecting after {} attempt(s)",
          index,
          address,
          reconnectAttempt);
      terminate(cause);
      return;
    }
    reconnectAttempt++;
    state = State.CONNECTING;
    metrics.recordReconnect(clientName, index);
    log.warn(
        "Lane {} lost connection to {} ({}), reconnecting in {} ms (attempt {})",
        index,
        address,
        cause.getMessage(),
        delay.get().toMillis(),
        reconnectAttempt);
    reconnectTask = eventLoop.schedule(this::connect, delay.get().toNanos(), TimeUnit.NANOSECONDS);
  }

  private void doRelease(final Reservation owner) {
    if (lostReservations.remove(owner)) {
      return;
    }
    if (owner == reservedBy) {
      final var reset = writeHolderReset();
      reservedBy = null;
      drain();
      if (reset) {
        channel.flush();
      }
      return;
    }
    final var aborted =
        new AbortedOperationException("Reservation " + owner + " released before it was granted");
    waiting.removeIf(
        request -> {
          if (request.owner != owner) {
            return false;
          }
          request.future.completeExceptionally(aborted);
          return true;
        });
  }

  private void doClose() {
    if (state == State.CLOSING || state == State.CLOSED) {
      return;
    }
    terminationCause = new ClientStoppedException(address);
    if (reconnectTask != null) {
      reconnectTask.cancel(false);
    }
    if (channel != null) {
      state = State.CLOSING;
      channel.close();
    } else {
      finishClose();
    }
  }

  private void finishClose() {
    log.info("Lane {} to {} closed", index, address);
    terminate(terminationCause != null ? terminationCause : new ClientStoppedException(address));
  }

  private void terminate(final RedisException cause) {
    terminated = true;
    state = State.CLOSED;
    connected = false;
    terminationCause = cause;
    reservedBy = null;
    lostReservations.clear();
    failAll(sent, cause);
    failAll(holderPending, cause);
    failAll(waiting, cause);
    readyFuture.completeExceptionally(cause);
    terminationFuture.complete(null);
  }

  private static void failAll(final ArrayDeque<Request> queue, final RedisException cause) {
    for (final var request : queue) {
      request.future.completeExceptionally(cause);
    }
    queue.clear();
  }

  /** One submitted batch. */
  static final class Request {

    final List<RawCommand> commands;
    final Reservation owner;
    final boolean reserving;
    final CompletableFuture<List<RedisReply>> future = new CompletableFuture<>();
    final List<RedisReply> replies = new ArrayList<>();
    int attempts;
    boolean noRetry;

    Request(final List<RawCommand> commands, final Reservation owner, final boolean reserving) {
      this.commands = commands;
      this.owner = owner;
      this.reserving = reserving;
    }
  }
}
