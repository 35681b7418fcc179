/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;
import java.util.function.Function;

import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

final class MappedBatch<A, B> implements RedisBatch<B> {

  private final RedisBatch<A> source;
  private final Function<? super A, ? extends B> mapper;

  MappedBatch(final RedisBatch<A> source, final Function<? super A, ? extends B> mapper) {
    this.source = source;
    this.mapper = mapper;
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return source.rawCommandPacks();
  }

  @Override
  public B decodeReplies(final List<RedisReply> replies) {
    return mapper.apply(source.decodeReplies(replies));
  }
}
