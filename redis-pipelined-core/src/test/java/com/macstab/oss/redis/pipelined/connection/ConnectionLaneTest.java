/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.pipelined.RedisClientResources;
import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisCommands;
import com.macstab.oss.redis.pipelined.command.Replies;
import com.macstab.oss.redis.pipelined.config.ConnectionConfig;
import com.macstab.oss.redis.pipelined.config.ExponentialBackoff;
import com.macstab.oss.redis.pipelined.config.ImmediateRetry;
import com.macstab.oss.redis.pipelined.config.NoRetryStrategy;
import com.macstab.oss.redis.pipelined.exception.AbortedOperationException;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.ConnectionFaultException;
import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.exception.RedisTimeoutException;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;
import com.macstab.oss.redis.pipelined.testing.FakeRedisServer;

/**
 * Tests for {@link ConnectionLane} against an in-process Redis.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Reply matching and write contiguity with concurrent submitters
 *   <li>Reservation exclusivity and release by holder and non-holder
 *   <li>A reservation lost on disconnect stays unusable until released; a released holder's open
 *       {@code WATCH}/{@code MULTI} is cleared before other callers run
 *   <li>Malformed or unsolicited replies reset the connection
 *   <li>Disconnect handling: retry, no retry, init commands after reconnect
 *   <li>Termination: close, giving up, failed mandatory first connect
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("ConnectionLane")
class ConnectionLaneTest {

  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final List<RedisReply> PONG = List.of(new RedisReply.SimpleStringReply("PONG"));

  private RedisClientResources resources;
  private FakeRedisServer server;
  private ConnectionLane lane;

  @BeforeEach
  void setUp() {
    resources = RedisClientResources.create(2);
    server = new FakeRedisServer();
  }

  @AfterEach
  void tearDown() {
    if (lane != null) {
      lane.close();
    }
    server.close();
    resources.close();
  }

  private ConnectionLane openLane(final ConnectionConfig config) {
    lane = new ConnectionLane(0, server.address(), config, resources);
    assertThat(lane.open(false)).succeedsWithin(WAIT);
    return lane;
  }

  private static RawCommandPacks packs(final RedisBatch<?>... batches) {
    var packs = RawCommandPacks.EMPTY;
    for (final var batch : batches) {
      packs = packs.concat(batch.rawCommandPacks());
    }
    return packs;
  }

  private static RawCommandPacks debugSleep(final String seconds) {
    return RawCommandPacks.of(RawCommand.of(Level.NODE, "DEBUG", "SLEEP", seconds));
  }

  @Nested
  @DisplayName("Ordering")
  class Ordering {

    @Test
    @DisplayName("Should match replies to batches in submission order")
    void shouldMatchRepliesInSubmissionOrder() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var futures = new ArrayList<CompletableFuture<List<RedisReply>>>();

      // Act
      for (int i = 0; i < 200; i++) {
        futures.add(lane.execute(packs(RedisCommands.incr("counter"))));
      }

      // Assert
      for (int i = 0; i < futures.size(); i++) {
        assertThat(futures.get(i))
            .succeedsWithin(WAIT)
            .isEqualTo(List.of(new RedisReply.IntegerReply(i + 1)));
      }
    }

    @Test
    @DisplayName("Should write each batch contiguously when submitted from many threads")
    void shouldWriteBatchesContiguously() throws Exception {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final ExecutorService submitters = Executors.newFixedThreadPool(4);
      final var futures = new ArrayList<CompletableFuture<List<RedisReply>>>();

      // Act
      try {
        final var submitted = new ArrayList<Future<?>>();
        for (int t = 0; t < 4; t++) {
          final int thread = t;
          submitted.add(
              submitters.submit(
                  () -> {
                    for (int b = 0; b < 25; b++) {
                      final var key = "k:" + thread + ":" + b;
                      final var future =
                          lane.execute(
                              packs(
                                  RedisCommands.set(key, "0"),
                                  RedisCommands.set(key, "1"),
                                  RedisCommands.set(key, "2")));
                      synchronized (futures) {
                        futures.add(future);
                      }
                    }
                  }));
        }
        for (final var task : submitted) {
          task.get(5, TimeUnit.SECONDS);
        }
      } finally {
        submitters.shutdownNow();
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
          .get(5, TimeUnit.SECONDS);

      // Assert
      final var received = server.received();
      assertThat(received).hasSize(300);
      for (int i = 0; i < received.size(); i += 3) {
        final var key = received.get(i).args().get(1);
        assertThat(List.of(received.get(i), received.get(i + 1), received.get(i + 2)))
            .as("batch starting at command %d", i)
            .extracting(FakeRedisServer.ReceivedCommand::line)
            .containsExactly("SET " + key + " 0", "SET " + key + " 1", "SET " + key + " 2");
      }
    }

    @Test
    @DisplayName("Should complete an empty batch without writing")
    void shouldCompleteEmptyBatchLocally() {
      // Arrange
      openLane(ConnectionConfig.defaults());

      // Act & Assert
      assertThat(lane.execute(RawCommandPacks.EMPTY)).succeedsWithin(WAIT).isEqualTo(List.of());
      assertThat(server.received()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Reservation")
  class ReservationProtocol {

    @Test
    @DisplayName("Should keep other batches queued until the holder releases")
    void shouldQueueOthersUntilRelease() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      server.put("k", "v1");
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.watch("k")), holder)).succeedsWithin(WAIT);

      // Act
      final var anonymous = lane.execute(packs(RedisCommands.set("k", "other")));
      await()
          .during(Duration.ofMillis(200))
          .atMost(WAIT)
          .until(() -> !anonymous.isDone());
      final var transaction = RedisCommands.set("k", "mine").transaction();
      final var replies = lane.execute(transaction.rawCommandPacks(), holder);

      // Assert
      assertThat(replies).succeedsWithin(WAIT);
      assertThat(transaction.decodeReplies(replies.join()))
          .as("watched key untouched while reserved")
          .isTrue();
      assertThat(anonymous).isNotDone();

      lane.release(holder);
      assertThat(anonymous).succeedsWithin(WAIT);
      assertThat(server.receivedLines())
          .containsExactly("WATCH k", "MULTI", "SET k mine", "EXEC", "SET k other");
      assertThat(server.value("k")).isEqualTo("other");
    }

    @Test
    @DisplayName("Should abort queued batches of a reservation released before it was granted")
    void shouldAbortUngrantedReservation() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.ping()), holder)).succeedsWithin(WAIT);
      final var waiter = new Reservation();

      // Act
      final var queued = lane.reserving(packs(RedisCommands.ping()), waiter);
      lane.release(waiter);

      // Assert
      assertThat(queued)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(AbortedOperationException.class);

      lane.release(holder);
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);
      assertThat(server.count("PING")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail the holder's batches and drop the reservation on disconnect")
    void shouldDropReservationOnDisconnect() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.watch("k")), holder)).succeedsWithin(WAIT);
      server.closeConnectionOnKey("k");

      // Act
      final var inReservation = lane.execute(packs(RedisCommands.get("k")), holder);

      // Assert
      assertThat(inReservation)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(lane.execute(packs(RedisCommands.ping())))
          .as("lane is free again after reconnecting")
          .succeedsWithin(WAIT)
          .isEqualTo(PONG);
    }

    @Test
    @DisplayName("Should fail later batches of a reservation lost on disconnect until released")
    void shouldFailLostReservationUntilReleased() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.watch("k")), holder)).succeedsWithin(WAIT);
      server.dropConnections();
      await().atMost(WAIT).until(() -> server.acceptedConnections() == 2 && lane.isConnected());
      server.put("k", "changed elsewhere");

      // Act
      final var transaction = RedisCommands.set("k", "mine").transaction();
      final var afterReconnect = lane.execute(transaction.rawCommandPacks(), holder);
      final var other = lane.execute(packs(RedisCommands.set("k", "other")));

      // Assert
      assertThat(afterReconnect)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(other).succeedsWithin(WAIT);
      assertThat(server.count("MULTI")).isZero();
      assertThat(server.value("k")).isEqualTo("other");

      lane.release(holder);
      assertThat(lane.reserving(packs(RedisCommands.ping()), new Reservation()))
          .as("lane can be reserved again")
          .succeedsWithin(WAIT)
          .isEqualTo(PONG);
    }

    @Test
    @DisplayName("Should refuse batches of a reservation that does not hold the lane")
    void shouldRefuseBatchOfNonHolder() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.ping()), holder)).succeedsWithin(WAIT);
      lane.release(holder);

      // Act
      final var late = lane.execute(packs(RedisCommands.ping()), holder);

      // Assert
      assertThat(late)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(AbortedOperationException.class);
      assertThat(server.count("PING")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should clear a WATCH left by the holder before serving the queue")
    void shouldUnwatchOnRelease() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.watch("k")), holder)).succeedsWithin(WAIT);
      final var transaction = RedisCommands.set("x", "1").transaction();
      final var queued = lane.execute(transaction.rawCommandPacks());
      server.put("k", "changed elsewhere");

      // Act
      lane.release(holder);

      // Assert
      assertThat(queued).succeedsWithin(WAIT);
      assertThat(transaction.decodeReplies(queued.join())).isTrue();
      assertThat(server.receivedLines())
          .containsExactly("WATCH k", "UNWATCH", "MULTI", "SET x 1", "EXEC");
    }

    @Test
    @DisplayName("Should not send UNWATCH when the holder finished with EXEC")
    void shouldNotResetAfterExec() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var holder = new Reservation();
      assertThat(lane.reserving(packs(RedisCommands.watch("k")), holder)).succeedsWithin(WAIT);
      assertThat(
              lane.execute(RedisCommands.set("k", "v").transaction().rawCommandPacks(), holder))
          .succeedsWithin(WAIT);

      // Act
      lane.release(holder);

      // Assert
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);
      assertThat(server.count("UNWATCH")).isZero();
    }
  }

  @Nested
  @DisplayName("Protocol Errors")
  class ProtocolErrors {

    @Test
    @DisplayName("Should fail the in-flight batch and reconnect on a malformed reply")
    void shouldResetOnMalformedReply() {
      // Arrange
      openLane(ConnectionConfig.builder().retryStrategy(new ImmediateRetry(3)).build());
      server.rawReplyOnKey("garbled", "?not resp\r\n");

      // Act
      final var future = lane.execute(packs(RedisCommands.get("garbled")));

      // Assert
      assertThat(future)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ProtocolErrorException.class);
      assertThat(server.count("GET")).as("protocol errors are never retried").isEqualTo(1);
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);
      assertThat(server.acceptedConnections()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reset the connection on a reply nobody asked for")
    void shouldResetOnUnsolicitedReply() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      server.rawReplyOnKey("chatty", "+OK\r\n+OK\r\n");

      // Act
      final var future = lane.execute(packs(RedisCommands.get("chatty")));

      // Assert
      assertThat(future)
          .succeedsWithin(WAIT)
          .isEqualTo(List.of(RedisReply.SimpleStringReply.OK));
      await().atMost(WAIT).until(() -> server.acceptedConnections() == 2 && lane.isConnected());
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);
    }
  }

  @Nested
  @DisplayName("Disconnects")
  class Disconnects {

    @Test
    @DisplayName("Should fail in-flight batch with ConnectionFaultException without retry")
    void shouldFailWithoutRetry() {
      // Arrange
      openLane(ConnectionConfig.builder().retryStrategy(NoRetryStrategy.INSTANCE).build());
      server.closeConnectionOnKey("boom");

      // Act
      final var future = lane.execute(packs(RedisCommands.get("boom")));

      // Assert
      assertThat(future)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);
      assertThat(server.count("GET")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should resubmit an unanswered batch after reconnecting")
    void shouldResubmitAfterReconnect() {
      // Arrange
      openLane(
          ConnectionConfig.builder()
              .retryStrategy(new ImmediateRetry(1))
              .reconnectionStrategy(
                  ExponentialBackoff.unbounded(Duration.ofMillis(500), Duration.ofSeconds(1)))
              .build());
      server.closeConnectionOnKey("flaky");

      // Act
      final var future = lane.execute(packs(RedisCommands.get("flaky")));
      await().atMost(WAIT).until(() -> server.count("GET") == 1);
      server.closeConnectionOnKey(null);

      // Assert
      assertThat(future)
          .succeedsWithin(WAIT)
          .isEqualTo(List.of(RedisReply.BulkStringReply.NIL));
      assertThat(server.count("GET")).isEqualTo(2);
      assertThat(server.acceptedConnections()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail once the retry strategy is exhausted")
    void shouldFailWhenRetriesExhausted() {
      // Arrange
      openLane(ConnectionConfig.builder().retryStrategy(new ImmediateRetry(1)).build());
      server.closeConnectionOnKey("boom");

      // Act
      final var future = lane.execute(packs(RedisCommands.get("boom")));

      // Assert
      assertThat(future)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(server.count("GET")).as("one original attempt plus one retry").isEqualTo(2);
    }

    @Test
    @DisplayName("Should run init commands first on every new connection")
    void shouldRunInitCommandsOnReconnect() {
      // Arrange
      openLane(
          ConnectionConfig.builder().initCommands(RedisCommands.clientSetname("lane-a")).build());
      assertThat(server.clientNames()).containsValue("lane-a");

      // Act
      server.dropConnections();
      await()
          .atMost(WAIT)
          .until(() -> server.acceptedConnections() == 2 && server.clientNames().size() == 2);
      assertThat(lane.execute(packs(RedisCommands.ping()))).succeedsWithin(WAIT).isEqualTo(PONG);

      // Assert
      final var secondConnection =
          server.received().stream().filter(command -> command.connectionId() == 2).toList();
      assertThat(secondConnection)
          .extracting(FakeRedisServer.ReceivedCommand::line)
          .containsExactly("CLIENT SETNAME lane-a", "PING");
    }

    @Test
    @DisplayName("Should terminate when a mandatory first connect fails its init commands")
    void shouldTerminateWhenInitCommandsFail() {
      // Arrange
      final var config =
          ConnectionConfig.builder()
              .initCommands(
                  RedisBatch.command(RawCommand.of(Level.CONNECTION, "BOGUS"), Replies::ok))
              .build();
      lane = new ConnectionLane(0, server.address(), config, resources);

      // Act
      final var ready = lane.open(true);

      // Assert
      assertThat(ready)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(lane.terminationFuture()).succeedsWithin(WAIT);
      assertThat(lane.isTerminated()).isTrue();
    }

    @Test
    @DisplayName("Should discard a reply whose caller already timed out")
    void shouldDiscardLateReply() {
      // Arrange
      openLane(ConnectionConfig.defaults());

      // Act
      final var slow =
          resources.withTimeout(lane.execute(debugSleep("0.3")), Duration.ofMillis(50));

      // Assert
      assertThat(slow)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(RedisTimeoutException.class);
      assertThat(lane.execute(packs(RedisCommands.ping())))
          .as("next batch gets its own reply, not the late one")
          .succeedsWithin(WAIT)
          .isEqualTo(PONG);
    }
  }

  @Nested
  @DisplayName("Termination")
  class Termination {

    @Test
    @DisplayName("Should fail pending and later batches with ClientStoppedException on close")
    void shouldFailPendingOnClose() {
      // Arrange
      openLane(ConnectionConfig.defaults());
      final var pending = lane.execute(debugSleep("0.5"));

      // Act
      final var terminated = lane.close();

      // Assert
      assertThat(terminated).succeedsWithin(WAIT);
      assertThat(pending)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ClientStoppedException.class);
      assertThat(lane.execute(packs(RedisCommands.ping())))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ClientStoppedException.class);
      assertThat(lane.isConnected()).isFalse();
    }

    @Test
    @DisplayName("Should terminate when the reconnection strategy gives up")
    void shouldTerminateWhenGivingUp() {
      // Arrange
      openLane(
          ConnectionConfig.builder().reconnectionStrategy(NoRetryStrategy.INSTANCE).build());

      // Act
      server.dropConnections();

      // Assert
      assertThat(lane.terminationFuture()).succeedsWithin(WAIT);
      assertThat(lane.isTerminated()).isTrue();
      assertThat(lane.execute(packs(RedisCommands.ping())))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
    }

    @Test
    @DisplayName("Should terminate when a mandatory first connect is refused")
    void shouldTerminateWhenFirstConnectRefused() {
      // Arrange
      final var dead = new FakeRedisServer();
      final var address = dead.address();
      dead.close();
      lane = new ConnectionLane(0, address, ConnectionConfig.defaults(), resources);

      // Act
      final var ready = lane.open(true);

      // Assert
      assertThat(ready)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ConnectionFaultException.class);
      assertThat(lane.isTerminated()).isTrue();
    }
  }
}
