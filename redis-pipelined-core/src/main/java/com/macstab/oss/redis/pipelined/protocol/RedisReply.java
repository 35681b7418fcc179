/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable RESP2 reply.
 *
 * <p>Produced by {@link RedisReplyDecoder} from Netty's {@code RedisMessage} tree. Netty messages
 * are reference counted and tied to the channel's allocator; these values are plain heap objects
 * that can safely cross threads and outlive the channel.
 */
public sealed interface RedisReply
    permits RedisReply.SimpleStringReply,
        RedisReply.ErrorReply,
        RedisReply.IntegerReply,
        RedisReply.BulkStringReply,
        RedisReply.ArrayReply {

  /** {@code +OK}, {@code +QUEUED}, {@code +PONG}. */
  record SimpleStringReply(String value) implements RedisReply {

    public static final SimpleStringReply OK = new SimpleStringReply("OK");
    public static final SimpleStringReply QUEUED = new SimpleStringReply("QUEUED");
  }

  /** {@code -ERR ...}, {@code -MOVED 3999 127.0.0.1:6381}. */
  record ErrorReply(String message) implements RedisReply {

    /** First word of the message ({@code ERR}, {@code MOVED}, {@code WRONGTYPE}). */
    public String errorCode() {
      final int space = message.indexOf(' ');
      return space < 0 ? message : message.substring(0, space);
    }
  }

  record IntegerReply(long value) implements RedisReply {}

  /** Bulk string; {@code data == null} is the nil bulk string ({@code $-1}). */
  record BulkStringReply(byte[] data) implements RedisReply {

    public static final BulkStringReply NIL = new BulkStringReply(null);

    public static BulkStringReply of(final String value) {
      return new BulkStringReply(value.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNil() {
      return data == null;
    }

    public String utf8() {
      return data == null ? null : new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(final Object o) {
      return o instanceof BulkStringReply other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
      return data == null ? "BulkStringReply[nil]" : "BulkStringReply[" + utf8() + "]";
    }
  }

  /** Array; {@code elements == null} is the nil array ({@code *-1}, aborted {@code EXEC}). */
  record ArrayReply(List<RedisReply> elements) implements RedisReply {

    public static final ArrayReply NIL = new ArrayReply(null);

    public ArrayReply {
      elements = elements == null ? null : List.copyOf(elements);
    }

    public boolean isNil() {
      return elements == null;
    }
  }
}
