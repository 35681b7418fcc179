/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.command.Replies;
import com.macstab.oss.redis.pipelined.exception.ProtocolErrorException;
import com.macstab.oss.redis.pipelined.protocol.RedisReply;

import lombok.experimental.UtilityClass;

/**
 * Decodes the {@code CLUSTER SLOTS} reply.
 *
 * <pre>
 * 1) 1) (integer) 0
 *    2) (integer) 8191
 *    3) 1) "10.0.0.1"      master host
 *       2) (integer) 7000  master port
 *       3) "09dbe9..."     node id (optional)
 *    4) 1) "10.0.0.2"      replica (zero or more)
 *       2) (integer) 7001
 * </pre>
 *
 * <p>An empty host means "the node that answered", which is how Redis reports an endpoint it does
 * not know the preferred address for.
 */
@UtilityClass
public class ClusterSlotsDecoder {

  public List<SlotRangeMapping> decode(final RedisReply reply, final NodeAddress answeringNode) {
    if (!(Replies.checked(reply) instanceof RedisReply.ArrayReply array) || array.isNil()) {
      throw Replies.unexpected("CLUSTER SLOTS array", reply);
    }
    final var mappings = new ArrayList<SlotRangeMapping>(array.elements().size());
    for (final var element : array.elements()) {
      mappings.add(decodeEntry(element, answeringNode));
    }
    return mappings;
  }

  private SlotRangeMapping decodeEntry(final RedisReply element, final NodeAddress answeringNode) {
    if (!(element instanceof RedisReply.ArrayReply entry)
        || entry.isNil()
        || entry.elements().size() < 3) {
      throw new ProtocolErrorException("Malformed CLUSTER SLOTS entry: " + element);
    }
    final var fields = entry.elements();
    final var range =
        new SlotRange((int) Replies.integer(fields.get(0)), (int) Replies.integer(fields.get(1)));
    final var master = decodeNode(fields.get(2), answeringNode);
    final var replicas = new ArrayList<NodeAddress>(fields.size() - 3);
    for (final var replica : fields.subList(3, fields.size())) {
      replicas.add(decodeNode(replica, answeringNode));
    }
    return new SlotRangeMapping(range, master, replicas);
  }

  private NodeAddress decodeNode(final RedisReply node, final NodeAddress answeringNode) {
    if (!(node instanceof RedisReply.ArrayReply fields)
        || fields.isNil()
        || fields.elements().size() < 2) {
      throw new ProtocolErrorException("Malformed CLUSTER SLOTS node: " + node);
    }
    final var host = Replies.bulkString(fields.elements().get(0));
    final int port = (int) Replies.integer(fields.elements().get(1));
    return new NodeAddress(host == null || host.isEmpty() ? answeringNode.host() : host, port);
  }
}
