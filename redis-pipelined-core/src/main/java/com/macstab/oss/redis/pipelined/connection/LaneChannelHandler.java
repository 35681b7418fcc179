/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.connection;

import com.macstab.oss.redis.pipelined.protocol.RawCommandEncoder;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;
import com.macstab.oss.redis.pipelined.protocol.RedisReplyDecoder;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.redis.RedisArrayAggregator;
import io.netty.handler.codec.redis.RedisBulkStringAggregator;
import io.netty.handler.codec.redis.RedisDecoder;
import io.netty.handler.codec.redis.RedisEncoder;
import lombok.RequiredArgsConstructor;

/**
 * Last inbound handler of a lane's channel: hands replies and channel events back to the lane.
 *
 * <p>Pipeline, head to tail:
 *
 * <pre>
 * [TrafficObserver] RedisDecoder, RedisBulkStringAggregator, RedisArrayAggregator,
 * RedisReplyDecoder, RedisEncoder, RawCommandEncoder, LaneChannelHandler
 * </pre>
 */
@RequiredArgsConstructor
final class LaneChannelHandler extends SimpleChannelInboundHandler<RedisReply> {

  private final ConnectionLane lane;

  static ChannelInitializer<Channel> initializer(final ConnectionLane lane) {
    return new ChannelInitializer<>() {
      @Override
      protected void initChannel(final Channel ch) {
        final var pipeline = ch.pipeline();
        final var listener = lane.getConfig().getDebugListener();
        if (listener != DebugListener.NOOP) {
          pipeline.addLast(new TrafficObserver(lane.getAddress(), listener));
        }
        pipeline.addLast(new RedisDecoder());
        pipeline.addLast(new RedisBulkStringAggregator());
        pipeline.addLast(new RedisArrayAggregator());
        pipeline.addLast(new RedisReplyDecoder());
        pipeline.addLast(new RedisEncoder());
        pipeline.addLast(RawCommandEncoder.INSTANCE);
        pipeline.addLast(new LaneChannelHandler(lane));
      }
    };
  }

  @Override
  protected void channelRead0(final ChannelHandlerContext ctx, final RedisReply reply) {
    lane.onReply(ctx.channel(), reply);
  }

  @Override
  public void channelInactive(final ChannelHandlerContext ctx) {
    lane.onChannelInactive(ctx.channel());
  }

  @Override
  public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
    lane.onChannelException(ctx.channel(), cause);
  }
}
