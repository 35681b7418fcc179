/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.cluster.ClusterSlotsDecoder;
import com.macstab.oss.redis.pipelined.cluster.SlotRangeMapping;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;

import lombok.experimental.UtilityClass;

/**
 * Commands the runtime itself needs (topology queries, transactions, connection setup) plus the
 * basic string commands used to exercise it. Not a typed command API.
 */
@UtilityClass
public class RedisCommands {

  public RedisBatch<String> ping() {
    return RedisBatch.command(RawCommand.of(Level.CLUSTER, "PING"), Replies::simpleString);
  }

  /** {@code GET key}; {@code null} when the key does not exist. */
  public RedisBatch<String> get(final String key) {
    return RedisBatch.command(
        RawCommand.builder(Level.CLUSTER, "GET").key(key).build(), Replies::bulkString);
  }

  public RedisBatch<Boolean> set(final String key, final String value) {
    return RedisBatch.command(
        RawCommand.builder(Level.CLUSTER, "SET").key(key).arg(value).build(), Replies::okOrNil);
  }

  public RedisBatch<Long> incr(final String key) {
    return RedisBatch.command(
        RawCommand.builder(Level.CLUSTER, "INCR").key(key).build(), Replies::integer);
  }

  public RedisBatch<Long> del(final String key) {
    return RedisBatch.command(
        RawCommand.builder(Level.CLUSTER, "DEL").key(key).build(), Replies::integer);
  }

  /** Connection state: only valid on a connection client or inside an operation. */
  public RedisBatch<Void> watch(final String... keys) {
    final var builder = RawCommand.builder(Level.CONNECTION, "WATCH");
    for (final String key : keys) {
      builder.key(key);
    }
    return RedisBatch.command(builder.build(), Replies::ok);
  }

  public RedisBatch<Void> unwatch() {
    return RedisBatch.command(RawCommand.of(Level.CONNECTION, "UNWATCH"), Replies::ok);
  }

  public RedisBatch<Void> clientSetname(final String name) {
    return RedisBatch.command(
        RawCommand.builder(Level.CONNECTION, "CLIENT SETNAME").arg(name).build(), Replies::ok);
  }

  /** Topology query; {@code answeringNode} resolves empty hosts in the reply. */
  public RedisBatch<List<SlotRangeMapping>> clusterSlots(final NodeAddress answeringNode) {
    return RedisBatch.command(
        RawCommand.of(Level.NODE, "CLUSTER", "SLOTS"),
        reply -> ClusterSlotsDecoder.decode(reply, answeringNode));
  }

  /** Raw {@code ASKING}, sent before a command redirected by an {@code -ASK} error. */
  public RawCommand asking() {
    return RawCommand.of(Level.CONNECTION, "ASKING");
  }
}
