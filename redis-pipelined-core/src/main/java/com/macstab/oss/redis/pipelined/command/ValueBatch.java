/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.List;

import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

final class ValueBatch<A> implements RedisBatch<A> {

  private final A value;

  ValueBatch(final A value) {
    this.value = value;
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return RawCommandPacks.EMPTY;
  }

  @Override
  public A decodeReplies(final List<RedisReply> replies) {
    return value;
  }
}
