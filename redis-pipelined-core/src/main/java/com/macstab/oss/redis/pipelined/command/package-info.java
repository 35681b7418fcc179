/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Composable descriptions of Redis work.
 *
 * <p>A {@link com.macstab.oss.redis.pipelined.command.RedisBatch} is a fixed list of commands
 * plus a decoder for their replies; nothing is sent until a client executes it. A {@link
 * com.macstab.oss.redis.pipelined.command.RedisOp} chains batches where the next one depends on
 * the previous result, for example {@code WATCH}, {@code GET}, then {@code MULTI}/{@code EXEC}.
 */
package com.macstab.oss.redis.pipelined.command;
