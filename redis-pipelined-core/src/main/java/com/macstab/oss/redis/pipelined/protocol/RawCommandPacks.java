/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.pipelined.exception.RequiredLevelViolationException;

import lombok.Getter;
import lombok.NonNull;

/**
 * Ordered sequence of command packs making up one batch.
 *
 * <p>Replies come back one per command, in {@link #getCommands()} order, regardless of how the
 * packs were distributed across connections or nodes.
 */
@Getter
public final class RawCommandPacks {

  public static final RawCommandPacks EMPTY = new RawCommandPacks(List.of());

  private final List<RawCommandPack> packs;

  private RawCommandPacks(final List<RawCommandPack> packs) {
    this.packs = List.copyOf(packs);
  }

  public static RawCommandPacks of(@NonNull final List<RawCommandPack> packs) {
    return packs.isEmpty() ? EMPTY : new RawCommandPacks(packs);
  }

  public static RawCommandPacks of(@NonNull final RawCommandPack pack) {
    return new RawCommandPacks(List.of(pack));
  }

  public static RawCommandPacks of(@NonNull final RawCommand command) {
    return of(RawCommandPack.of(command));
  }

  /** Concatenation preserving order: {@code this} first. */
  public RawCommandPacks concat(@NonNull final RawCommandPacks other) {
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    final var merged = new ArrayList<RawCommandPack>(packs.size() + other.packs.size());
    merged.addAll(packs);
    merged.addAll(other.packs);
    return new RawCommandPacks(merged);
  }

  public boolean isEmpty() {
    return packs.isEmpty();
  }

  public int getCommandCount() {
    int count = 0;
    for (final var pack : packs) {
      count += pack.size();
    }
    return count;
  }

  public List<RawCommand> getCommands() {
    final var commands = new ArrayList<RawCommand>(getCommandCount());
    for (final var pack : packs) {
      commands.addAll(pack.getCommands());
    }
    return commands;
  }

  /**
   * Verifies every command may run on a client surface of level {@code surface}.
   *
   * @param surface level of the executing client
   * @param clientType client description used in the error message
   * @return {@code this}, for chaining
   * @throws RequiredLevelViolationException on the first command that is too restrictive
   */
  public RawCommandPacks requireLevel(final Level surface, final String clientType) {
    for (final var pack : packs) {
      for (final var command : pack.getCommands()) {
        if (!surface.accepts(command.getLevel())) {
          throw new RequiredLevelViolationException(
              command.getName(), command.getLevel(), clientType);
        }
      }
    }
    return this;
  }

  @Override
  public String toString() {
    return packs.toString();
  }
}
