/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.pipelined.exception.ErrorReplyException;
import com.macstab.oss.redis.pipelined.exception.OptimisticLockException;
import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.Level;
import com.macstab.oss.redis.pipelined.protocol.RawCommand;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPack;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPacks;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

/**
 * {@code MULTI}, inner commands, {@code EXEC} as a single pack.
 *
 * <p>Replies on the wire: {@code +OK}, one {@code +QUEUED} (or error) per inner command, then the
 * {@code EXEC} reply. The inner batch decodes the elements of the {@code EXEC} array. A nil
 * {@code EXEC} array means a watched key changed.
 */
final class TransactionBatch<A> implements RedisBatch<A> {

  static final RawCommand MULTI = RawCommand.of(Level.CLUSTER, "MULTI");
  static final RawCommand EXEC = RawCommand.of(Level.CLUSTER, "EXEC");

  private final RedisBatch<A> inner;
  private final int innerCount;
  private final RawCommandPacks packs;

  TransactionBatch(final RedisBatch<A> inner) {
    this.inner = inner;
    final var innerPacks = inner.rawCommandPacks();
    this.innerCount = innerPacks.getCommandCount();
    if (innerCount == 0) {
      this.packs = RawCommandPacks.EMPTY;
    } else {
      final var commands = new ArrayList<RawCommand>(innerCount + 2);
      commands.add(MULTI);
      commands.addAll(innerPacks.getCommands());
      commands.add(EXEC);
      this.packs = RawCommandPacks.of(RawCommandPack.of(commands));
    }
  }

  @Override
  public RawCommandPacks rawCommandPacks() {
    return packs;
  }

  @Override
  public A decodeReplies(final List<RedisReply> replies) {
    if (innerCount == 0) {
      return inner.decodeReplies(List.of());
    }
    if (replies.size() != innerCount + 2) {
      throw new ProtocolErrorException(
          "Expected " + (innerCount + 2) + " transaction replies, got " + replies.size());
    }
    Replies.ok(replies.get(0));
    final var execReply = replies.get(innerCount + 1);
    if (execReply instanceof RedisReply.ErrorReply execError) {
      // EXECABORT: report the command that was rejected while queueing
      for (final var queued : replies.subList(1, innerCount + 1)) {
        if (queued instanceof RedisReply.ErrorReply queueError) {
          throw new ErrorReplyException(queueError);
        }
      }
      throw new ErrorReplyException(execError);
    }
    if (execReply instanceof RedisReply.ArrayReply array) {
      if (array.isNil()) {
        throw new OptimisticLockException();
      }
      return inner.decodeReplies(array.elements());
    }
    throw Replies.unexpected("EXEC array", execReply);
  }
}
