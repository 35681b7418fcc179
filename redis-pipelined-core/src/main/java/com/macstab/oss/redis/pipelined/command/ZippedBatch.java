/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;
import java.util.function.BiFunction;

import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

final class ZippedBatch<A, B, C> implements RedisBatch<C> {

  private final RedisBatch<A> first;
  private final RedisBatch<B> second;
  private final BiFunction<? super A, ? super B, ? extends C> combiner;

  ZippedBatch(
      final RedisBatch<A> first,
      final RedisBatch<B> second,
      final BiFunction<? super A, ? super B, ? extends C> combiner) {
    this.first = first;
    this.second = second;
    this.combiner = combiner;
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return first.rawCommandPacks().concat(second.rawCommandPacks());
  }

  @Override
  public C decodeReplies(final List<RedisReply> replies) {
    final int split = first.rawCommandPacks().getCommandCount();
    final int total = split + second.rawCommandPacks().getCommandCount();
    if (replies.size() != total) {
      throw new ProtocolErrorException("Expected " + total + " replies, got " + replies.size());
    }
    final A a = first.decodeReplies(replies.subList(0, split));
    final B b = second.decodeReplies(replies.subList(split, total));
    return combiner.apply(a, b);
  }
}
