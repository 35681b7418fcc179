/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import com.macstab.oss.redis.pipelined.NodeAddress;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import lombok.RequiredArgsConstructor;

/** Reports raw buffer sizes to a {@link DebugListener}. Sits at the head of the pipeline. */
@RequiredArgsConstructor
final class TrafficObserver extends ChannelDuplexHandler {

  private final NodeAddress address;
  private final DebugListener listener;

  @Override
  public void channelRead(final ChannelHandlerContext ctx, final Object msg) {
    if (msg instanceof ByteBuf buf) {
      listener.onReceive(address, buf.readableBytes());
    }
    ctx.fireChannelRead(msg);
  }

  @Override
  public void write(
      final ChannelHandlerContext ctx, final Object msg, final ChannelPromise promise) {
    if (msg instanceof ByteBuf buf) {
      listener.onSend(address, buf.readableBytes());
    }
    ctx.write(msg, promise);
  }
}
