/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Pipelined Redis client on Netty: batches of commands written back to back, replies matched by
 * position, optional cluster routing.
 *
 * <h2>Core Idea: Positional Reply Matching</h2>
 *
 * <p>RESP has no request IDs. A connection that writes commands without waiting for replies must
 * remember the order it wrote them in and hand out replies in exactly that order. Every {@link
 * com.macstab.oss.redis.pipelined.connection.ConnectionLane} keeps that order in a FIFO of sent
 * batches and owns its Netty channel from a single event loop thread, so no locks are needed.
 *
 * <h2>Clients</h2>
 *
 * <pre>
 * Client                  Accepts level   Connections          Reconnects
 * RedisConnectionClient   CONNECTION+     1                    never
 * RedisNodeClient         NODE+           poolSize lanes       yes
 * RedisClusterClient      CLUSTER         one node client      yes
 *                                         per master
 * </pre>
 *
 * <p>Connection-level commands ({@code WATCH}, {@code MULTI}) change connection state and are only
 * meaningful on a client that keeps using one connection. Pooled clients accept them inside a
 * {@link com.macstab.oss.redis.pipelined.command.RedisOp}, which reserves one lane for the whole
 * chain of batches.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (var resources = RedisClientResources.create(2);
 *     var client = new RedisNodeClient(NodeAddress.DEFAULT, NodeConfig.defaults(), resources)) {
 *   client.initialized().join();
 *   Boolean stored = client.executeBatch(RedisCommands.set("k", "v"), ofSeconds(1)).join();
 * }
 * }</pre>
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link com.macstab.oss.redis.pipelined.command}: commands, batches, operations
 *   <li>{@link com.macstab.oss.redis.pipelined.connection}: lanes and their Netty handlers
 *   <li>{@link com.macstab.oss.redis.pipelined.strategy}: lane selection for pooled clients
 *   <li>{@link com.macstab.oss.redis.pipelined.cluster}: slot hashing and topology monitoring
 *   <li>{@link com.macstab.oss.redis.pipelined.metrics}: metrics SPI
 * </ul>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.redis.pipelined;
