/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Commands that must be written contiguously to the same node.
 *
 * <p>A plain command is a pack of one. A {@code MULTI ... EXEC} block is one pack: splitting it
 * across cluster nodes, or interleaving it with another pack, would break the transaction.
 */
@Getter
@EqualsAndHashCode
public final class RawCommandPack {

  private final List<RawCommand> commands;

  private RawCommandPack(final List<RawCommand> commands) {
    this.commands = List.copyOf(commands);
  }

  public static RawCommandPack of(@NonNull final RawCommand command) {
    return new RawCommandPack(List.of(command));
  }

  public static RawCommandPack of(@NonNull final List<RawCommand> commands) {
    if (commands.isEmpty()) {
      throw new IllegalArgumentException("Command pack must not be empty");
    }
    return new RawCommandPack(commands);
  }

  public int size() {
    return commands.size();
  }

  /** Keys of all commands in this pack, in command order. */
  public List<byte[]> getKeys() {
    final var keys = new ArrayList<byte[]>();
    for (final var command : commands) {
      keys.addAll(command.getKeys());
    }
    return keys;
  }

  @Override
  public String toString() {
    return commands.toString();
  }
}
