/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.command;

import com.macstab.oss.redis.pipelined.exception.ErrorReplyException;
import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.experimental.UtilityClass;

/** Reply decoders shared by command factories. Error replies always become exceptions. */
@UtilityClass
public class Replies {

  public RedisReply checked(final RedisReply reply) {
    if (reply instanceof RedisReply.ErrorReply error) {
      throw new ErrorReplyException(error);
    }
    return reply;
  }

  /** Expects {@code +OK}; returns {@code null} so it can decode {@code Void} batches. */
  public Void ok(final RedisReply reply) {
    if (checked(reply) instanceof RedisReply.SimpleStringReply simple
        && "OK".equals(simple.value())) {
      return null;
    }
    throw unexpected("+OK", reply);
  }

  public String simpleString(final RedisReply reply) {
    if (checked(reply) instanceof RedisReply.SimpleStringReply simple) {
      return simple.value();
    }
    throw unexpected("simple string", reply);
  }

  public long integer(final RedisReply reply) {
    if (checked(reply) instanceof RedisReply.IntegerReply integer) {
      return integer.value();
    }
    throw unexpected("integer", reply);
  }

  /** Bulk string as UTF-8; {@code null} for the nil bulk string. */
  public String bulkString(final RedisReply reply) {
    if (checked(reply) instanceof RedisReply.BulkStringReply bulk) {
      return bulk.utf8();
    }
    throw unexpected("bulk string", reply);
  }

  /** {@code +OK} as {@code true}, nil bulk string as {@code false} (conditional {@code SET}). */
  public boolean okOrNil(final RedisReply reply) {
    final var checked = checked(reply);
    if (checked instanceof RedisReply.BulkStringReply bulk && bulk.isNil()) {
      return false;
    }
    ok(checked);
    return true;
  }

  public ProtocolErrorException unexpected(final String expected, final RedisReply actual) {
    return new ProtocolErrorException("Expected " + expected + " reply, got: " + actual);
  }
}
