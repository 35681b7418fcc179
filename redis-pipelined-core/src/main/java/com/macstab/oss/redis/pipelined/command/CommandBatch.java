/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;
import java.util.function.Function;

import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

final class CommandBatch<A> implements RedisBatch<A> {

  private final RawCommandPacks packs;
  private final Function<RedisReply, ? extends A> decoder;

  CommandBatch(final RawCommand command, final Function<RedisReply, ? extends A> decoder) {
    this.packs = RawCommandPacks.of(command);
    this.decoder = decoder;
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return packs;
  }

  @Override
  public A decodeReplies(final List<RedisReply> replies) {
    if (replies.size() != 1) {
      throw new ProtocolErrorException("Expected 1 reply, got " + replies.size());
    }
    return decoder.apply(replies.get(0));
  }

  @Override
  public String toString() {
    return packs.toString();
  }
}
