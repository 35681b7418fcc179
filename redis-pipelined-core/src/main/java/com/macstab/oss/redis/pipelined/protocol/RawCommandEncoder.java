/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.util.ArrayList;
import java.util.List;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageEncoder;
import io.netty.handler.codec.redis.ArrayRedisMessage;
import io.netty.handler.codec.redis.FullBulkStringRedisMessage;
import io.netty.handler.codec.redis.RedisMessage;

/**
 * Turns a {@link RawCommand} into the RESP array of bulk strings Redis expects from clients.
 *
 * <p>Byte-level serialization is left to Netty's {@code RedisEncoder} further down the pipeline.
 * Arguments are wrapped, not copied.
 */
@ChannelHandler.Sharable
public final class RawCommandEncoder extends MessageToMessageEncoder<RawCommand> {

  public static final RawCommandEncoder INSTANCE = new RawCommandEncoder();

  @Override
  protected void encode(
      final ChannelHandlerContext ctx, final RawCommand msg, final List<Object> out) {
    final var args = msg.getArgs();
    final var children = new ArrayList<RedisMessage>(args.size());
    for (final byte[] arg : args) {
      children.add(new FullBulkStringRedisMessage(Unpooled.wrappedBuffer(arg)));
    }
    out.add(new ArrayRedisMessage(children));
  }
}
