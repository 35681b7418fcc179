/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

/**
 * N batches pipelined as one.
 *
 * <p>Each sub-batch decodes its own slice of the reply list. The first failing sub-decoder fails
 * the whole batch, after every slice has been consumed.
 */
final class SequencedBatch<A> implements RedisBatch<List<A>> {

  private final List<RedisBatch<? extends A>> batches;
  private final RawCommandPacks packs;

  SequencedBatch(final List<? extends RedisBatch<? extends A>> batches) {
    this.batches = List.copyOf(batches);
    var combined = RawCommandPacks.EMPTY;
    for (final var batch : this.batches) {
      combined = combined.concat(batch.rawCommandPacks());
    }
    this.packs = combined;
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return packs;
  }

  @Override
  public List<A> decodeReplies(final List<RedisReply> replies) {
    if (replies.size() != packs.getCommandCount()) {
      throw new ProtocolErrorException(
          "Expected " + packs.getCommandCount() + " replies, got " + replies.size());
    }
    final var results = new ArrayList<A>(batches.size());
    RuntimeException failure = null;
    int offset = 0;
    for (final var batch : batches) {
      final int count = batch.rawCommandPacks().getCommandCount();
      try {
        results.add(batch.decodeReplies(replies.subList(offset, offset + count)));
      } catch (final RuntimeException e) {
        if (failure == null) {
          failure = e;
        }
      }
      offset += count;
    }
    if (failure != null) {
      throw failure;
    }
    return Collections.unmodifiableList(results);
  }
}
