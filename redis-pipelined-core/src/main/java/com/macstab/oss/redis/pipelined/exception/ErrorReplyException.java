/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.exception;

import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.Getter;

/** Redis answered a command with an error reply ({@code -ERR ...}, {@code -WRONGTYPE ...}). */
@Getter
public class ErrorReplyException extends RedisException {

  private static final long serialVersionUID = 1L;

  private final transient RedisReply.ErrorReply reply;

  public ErrorReplyException(final RedisReply.ErrorReply reply) {
    super(reply.message());
    this.reply = reply;
  }
}
