/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.pipelined.command.RedisBatch;
import com.macstab.oss.redis.pipelined.command.RedisCommands;
import com.macstab.oss.redis.pipelined.command.RedisOp;
import com.macstab.oss.redis.pipelined.command.Replies;
import com.macstab.oss.redis.pipelined.config.NodeConfig;
import com.macstab.oss.redis.pipelined.exception.ClientStoppedException;
import com.macstab.oss.redis.pipelined.exception.OptimisticLockException;
import com.macstab.oss.redis.pipelined.exception.RedisTimeoutException;
import com.macstab.oss.redis.pipelined.exception.RequiredLevelViolationException;
import com.macstab.oss.redis.pipelined.metrics.RedisClientMetrics;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.strategy.LeastUsedStrategy;
import com.macstab.oss.redis.pipelined.testing.FakeRedisServer;

/**
 * Tests for {@link RedisNodeClient} against an in-process Redis.
 *
 * <p><strong>Test Strategy:</strong>
 *
 * <ul>
 *   <li>Batches are pipelined on one lane and decoded in order
 *   <li>Connection-level commands are rejected outside operations
 *   <li>Operations run WATCH/MULTI/EXEC chains on one reserved lane; other callers of the lane
 *       wait, and a failed operation leaves no WATCH behind for them
 *   <li>Lane accounting feeds the selection strategy and the metrics SPI
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("RedisNodeClient")
class RedisNodeClientTest {

  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  private RedisClientResources resources;
  private FakeRedisServer server;
  private RedisNodeClient client;

  @BeforeEach
  void setUp() {
    resources = RedisClientResources.create(2);
    server = new FakeRedisServer();
  }

  @AfterEach
  void tearDown() {
    if (client != null) {
      client.close();
    }
    server.close();
    resources.close();
  }

  private RedisNodeClient connect(final NodeConfig config) {
    client = new RedisNodeClient(server.address(), config, resources);
    assertThat(client.initialized()).succeedsWithin(WAIT);
    return client;
  }

  private static RedisBatch<Void> debugSleep(final String seconds) {
    return RedisBatch.command(RawCommand.of(Level.NODE, "DEBUG", "SLEEP", seconds), Replies::ok);
  }

  /** WATCH n, GET n, then MULTI / SET n (n + 1) / EXEC. */
  private static RedisOp<Long> increment(final String key, final Runnable beforeExec) {
    return RedisCommands.watch(key)
        .operation()
        .then(RedisCommands.get(key))
        .flatMap(
            value -> {
              final long next = value == null ? 1 : Long.parseLong(value) + 1;
              beforeExec.run();
              return RedisCommands.set(key, Long.toString(next))
                  .transaction()
                  .map(ignored -> next)
                  .operation();
            });
  }

  @Nested
  @DisplayName("Batches")
  class Batches {

    @Test
    @DisplayName("Should pipeline a sequence and decode replies in order")
    void shouldPipelineSequence() {
      // Arrange
      connect(NodeConfig.builder().poolSize(2).build());

      // Act
      final var result =
          client.executeBatch(
              RedisBatch.sequence(List.of(RedisCommands.set("k", "v"), RedisCommands.get("k"))),
              TIMEOUT);

      // Assert
      assertThat(result).succeedsWithin(WAIT).isEqualTo(List.of(true, "v"));
      assertThat(server.receivedLines()).containsExactly("SET k v", "GET k");
    }

    @Test
    @DisplayName("Should reject connection-level commands without sending anything")
    void shouldRejectConnectionLevel() {
      // Arrange
      connect(NodeConfig.defaults());

      // Act
      final var result = client.executeBatch(RedisCommands.watch("k"), TIMEOUT);

      // Assert
      assertThat(result)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(RequiredLevelViolationException.class);
      assertThat(server.received()).isEmpty();
    }

    @Test
    @DisplayName("Should complete an empty batch locally")
    void shouldCompleteEmptyBatch() {
      // Arrange
      connect(NodeConfig.defaults());

      // Act & Assert
      assertThat(client.executeBatch(RedisBatch.success("local"), TIMEOUT))
          .succeedsWithin(WAIT)
          .isEqualTo("local");
      assertThat(server.received()).isEmpty();
    }

    @Test
    @DisplayName("Should time out a slow batch and keep serving later ones")
    void shouldTimeOut() {
      // Arrange
      connect(NodeConfig.builder().poolSize(1).build());

      // Act
      final var slow = client.executeBatch(debugSleep("0.3"), Duration.ofMillis(50));

      // Assert
      assertThat(slow)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(RedisTimeoutException.class);
      assertThat(client.executeBatch(RedisCommands.ping(), TIMEOUT))
          .succeedsWithin(WAIT)
          .isEqualTo("PONG");
      await().atMost(WAIT).until(() -> client.getInFlightCount(0) == 0);
    }
  }

  @Nested
  @DisplayName("Operations")
  class Operations {

    @Test
    @DisplayName("Should run an optimistic increment on one connection")
    void shouldRunOptimisticIncrement() {
      // Arrange
      connect(NodeConfig.builder().poolSize(2).build());
      server.put("n", "41");

      // Act
      final var result = client.executeOp(increment("n", () -> {}), TIMEOUT);

      // Assert
      assertThat(result).succeedsWithin(WAIT).isEqualTo(42L);
      assertThat(server.value("n")).isEqualTo("42");
      final var connectionIds =
          server.received().stream().map(FakeRedisServer.ReceivedCommand::connectionId).distinct();
      assertThat(connectionIds).hasSize(1);
      assertThat(server.receivedLines())
          .containsExactly("WATCH n", "GET n", "MULTI", "SET n 42", "EXEC");
    }

    @Test
    @DisplayName("Should fail with OptimisticLockException when the watched key changes")
    void shouldFailOnConcurrentModification() {
      // Arrange
      connect(NodeConfig.defaults());
      server.put("n", "1");

      // Act
      final var result = client.executeOp(increment("n", () -> server.put("n", "99")), TIMEOUT);

      // Assert
      assertThat(result)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(OptimisticLockException.class);
      assertThat(server.value("n")).isEqualTo("99");
    }

    @Test
    @DisplayName("Should keep another caller's batch out of the WATCH to EXEC window")
    void shouldKeepOtherCallerOutOfWatchWindow() {
      // Arrange
      connect(NodeConfig.builder().poolSize(1).build());
      server.put("n", "41");
      final var other = new AtomicReference<CompletableFuture<Boolean>>();

      // Act
      final var result =
          client.executeOp(
              increment(
                  "n", () -> other.set(client.executeBatch(RedisCommands.set("n", "0"), TIMEOUT))),
              TIMEOUT);

      // Assert
      assertThat(result).succeedsWithin(WAIT).isEqualTo(42L);
      assertThat(other.get()).succeedsWithin(WAIT).isEqualTo(true);
      assertThat(server.receivedLines())
          .containsExactly("WATCH n", "GET n", "MULTI", "SET n 42", "EXEC", "SET n 0");
      assertThat(server.value("n")).isEqualTo("0");
    }

    @Test
    @DisplayName("Should not leave a WATCH behind when an operation fails after watching")
    void shouldNotLeakWatchAfterFailure() {
      // Arrange
      connect(NodeConfig.builder().poolSize(1).build());
      final RedisOp<String> failing =
          RedisCommands.watch("k")
              .operation()
              .flatMap(
                  ignored -> {
                    throw new IllegalStateException("continuation failed");
                  });
      assertThat(client.executeOp(failing, TIMEOUT))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(IllegalStateException.class);
      server.put("k", "changed elsewhere");

      // Act
      final var unrelated =
          client.executeBatch(RedisCommands.set("x", "1").transaction(), TIMEOUT);

      // Assert
      assertThat(unrelated).succeedsWithin(WAIT).isEqualTo(true);
      assertThat(server.receivedLines())
          .containsExactly("WATCH k", "UNWATCH", "MULTI", "SET x 1", "EXEC");
    }

    @Test
    @DisplayName("Should report an operation outcome without throwing")
    void shouldReportOutcome() {
      // Arrange
      connect(NodeConfig.defaults());

      // Act
      final var result = client.executeOpForResult(RedisCommands.incr("n").operation(), TIMEOUT);

      // Assert
      assertThat(result).succeedsWithin(WAIT);
      assertThat(result.join().isSuccess()).isTrue();
      assertThat(result.join().get()).isEqualTo(1L);
    }
  }

  @Nested
  @DisplayName("Lanes")
  class Lanes {

    @Test
    @DisplayName("Should steer around a busy lane with the least-used strategy")
    void shouldUseLeastUsedLane() {
      // Arrange
      connect(
          NodeConfig.builder().poolSize(2).laneSelectionStrategy(LeastUsedStrategy::new).build());

      // Act
      final var first = client.executeBatch(debugSleep("0.5"), TIMEOUT);
      await().atMost(WAIT).until(() -> server.count("DEBUG") == 1);
      final var second = client.executeBatch(RedisCommands.ping(), TIMEOUT);

      // Assert
      assertThat(client.getInFlightCount(0)).isEqualTo(1);
      assertThat(client.getInFlightCount(1)).isEqualTo(1);
      assertThat(first).succeedsWithin(WAIT);
      assertThat(second).succeedsWithin(WAIT);
      await()
          .atMost(WAIT)
          .until(() -> client.getInFlightCount(0) == 0 && client.getInFlightCount(1) == 0);
    }

    @Test
    @DisplayName("Should report lane selections and in-flight counts to the metrics SPI")
    void shouldReportMetrics() {
      // Arrange
      final var metrics = mock(RedisClientMetrics.class);
      connect(NodeConfig.builder().poolSize(1).metrics(metrics).clientName("orders").build());

      // Act
      assertThat(client.executeBatch(RedisCommands.ping(), TIMEOUT)).succeedsWithin(WAIT);
      client.close();

      // Assert
      verify(metrics).recordLaneSelection("orders", 0, "round-robin");
      verify(metrics).setInFlightOperations("orders", 0, 1);
      verify(metrics, timeout(1000).atLeastOnce())
          .setInFlightOperations(eq("orders"), anyInt(), eq(0));
      verify(metrics).close("orders");
    }

    @Test
    @DisplayName("Should reject a pool without lanes")
    void shouldRejectEmptyPool() {
      final var config = NodeConfig.builder().poolSize(0).build();
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new RedisNodeClient(server.address(), config, resources))
          .withMessageContaining("poolSize must be >= 1");
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("Should fail work submitted after close")
    void shouldFailAfterClose() {
      // Arrange
      connect(NodeConfig.defaults());

      // Act
      final var closed = client.closeAsync();

      // Assert
      assertThat(closed).succeedsWithin(WAIT);
      assertThat(client.isClosed()).isTrue();
      assertThat(client.executeBatch(RedisCommands.ping(), TIMEOUT))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ClientStoppedException.class);
      assertThat(client.executeOp(RedisCommands.ping().operation(), TIMEOUT))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ClientStoppedException.class);
      await().atMost(WAIT).until(() -> server.openConnections() == 0);
    }

    @Test
    @DisplayName("Should open every lane")
    void shouldOpenEveryLane() {
      // Act
      connect(NodeConfig.builder().poolSize(3).build());

      // Assert
      assertThat(client.getPoolSize()).isEqualTo(3);
      await().atMost(WAIT).until(() -> server.openConnections() == 3);
    }
  }
}
