/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.redis.ArrayRedisMessage;
import io.netty.handler.codec.redis.ErrorRedisMessage;
import io.netty.handler.codec.redis.FullBulkStringRedisMessage;
import io.netty.handler.codec.redis.IntegerRedisMessage;
import io.netty.handler.codec.redis.RedisMessage;
import io.netty.handler.codec.redis.SimpleStringRedisMessage;

/**
 * Converts aggregated Netty {@code RedisMessage}s into immutable {@link RedisReply} values.
 *
 * <p>Must sit after {@code RedisDecoder -> RedisBulkStringAggregator -> RedisArrayAggregator}, so
 * only complete bulk strings and arrays arrive here. Content is copied out of the pooled buffers;
 * {@link MessageToMessageDecoder} releases the input afterwards.
 */
public final class RedisReplyDecoder extends MessageToMessageDecoder<RedisMessage> {

  @Override
  protected void decode(
      final ChannelHandlerContext ctx, final RedisMessage msg, final List<Object> out) {
    out.add(convert(msg));
  }

  static RedisReply convert(final RedisMessage msg) {
    if (msg instanceof SimpleStringRedisMessage simple) {
      final var content = simple.content();
      if ("OK".equals(content)) {
        return RedisReply.SimpleStringReply.OK;
      }
      if ("QUEUED".equals(content)) {
        return RedisReply.SimpleStringReply.QUEUED;
      }
      return new RedisReply.SimpleStringReply(content);
    }
    if (msg instanceof ErrorRedisMessage error) {
      return new RedisReply.ErrorReply(error.content());
    }
    if (msg instanceof IntegerRedisMessage integer) {
      return new RedisReply.IntegerReply(integer.value());
    }
    if (msg instanceof FullBulkStringRedisMessage bulk) {
      return bulk.isNull()
          ? RedisReply.BulkStringReply.NIL
          : new RedisReply.BulkStringReply(ByteBufUtil.getBytes(bulk.content()));
    }
    if (msg instanceof ArrayRedisMessage array) {
      if (array.isNull()) {
        return RedisReply.ArrayReply.NIL;
      }
      final var elements = new ArrayList<RedisReply>(array.children().size());
      for (final var child : array.children()) {
        elements.add(convert(child));
      }
      return new RedisReply.ArrayReply(elements);
    }
    throw new ProtocolErrorException(
        "Unexpected RESP message type: " + msg.getClass().getSimpleName());
  }
}
