/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import lombok.Getter;
import lombok.NonNull;

/**
 * One Redis command as it travels on the wire: an array of binary arguments.
 *
 * <p>Carries two pieces of routing metadata the wire format does not: the {@link Level} of client
 * surface allowed to run it, and which arguments are keys (cluster slot routing).
 *
 * <pre>{@code
 * RawCommand set = RawCommand.builder(Level.CLUSTER, "SET").key("user:1").arg("alice").build();
 * }</pre>
 */
public final class RawCommand {

  private final List<byte[]> args;
  @Getter private final Level level;
  private final int[] keyIndices;

  private RawCommand(final List<byte[]> args, final Level level, final int[] keyIndices) {
    this.args = Collections.unmodifiableList(args);
    this.level = level;
    this.keyIndices = keyIndices;
  }

  /** Keyless command made of plain words, e.g. {@code of(Level.NODE, "CLUSTER", "SLOTS")}. */
  public static RawCommand of(@NonNull final Level level, final String... words) {
    if (words.length == 0) {
      throw new IllegalArgumentException("Command must have at least one word");
    }
    final var builder = new Builder(level, words[0]);
    for (int i = 1; i < words.length; i++) {
      builder.arg(words[i]);
    }
    return builder.build();
  }

  public static Builder builder(@NonNull final Level level, @NonNull final String name) {
    return new Builder(level, name);
  }

  public List<byte[]> getArgs() {
    return args;
  }

  /** Upper-cased first argument ({@code GET}, {@code CLUSTER}). */
  public String getName() {
    return new String(args.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
  }

  public List<byte[]> getKeys() {
    if (keyIndices.length == 0) {
      return List.of();
    }
    final var keys = new ArrayList<byte[]>(keyIndices.length);
    for (final int index : keyIndices) {
      keys.add(args.get(index));
    }
    return keys;
  }

  public boolean hasKeys() {
    return keyIndices.length > 0;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder();
    for (int i = 0; i < args.size() && i < 8; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      final byte[] arg = args.get(i);
      sb.append(new String(arg, 0, Math.min(arg.length, 64), StandardCharsets.UTF_8));
    }
    if (args.size() > 8) {
      sb.append(" ...");
    }
    return sb.toString();
  }

  /** Incremental builder; argument order on the wire is call order. */
  public static final class Builder {

    private final Level level;
    private final List<byte[]> args = new ArrayList<>();
    private final List<Integer> keyIndices = new ArrayList<>();

    private Builder(final Level level, final String name) {
      this.level = level;
      for (final String word : name.split(" ")) {
        args.add(word.getBytes(StandardCharsets.UTF_8));
      }
    }

    public Builder key(@NonNull final String key) {
      return key(key.getBytes(StandardCharsets.UTF_8));
    }

    public Builder key(@NonNull final byte[] key) {
      keyIndices.add(args.size());
      args.add(key);
      return this;
    }

    public Builder arg(@NonNull final String arg) {
      return arg(arg.getBytes(StandardCharsets.UTF_8));
    }

    public Builder arg(final long arg) {
      return arg(Long.toString(arg));
    }

    public Builder arg(@NonNull final byte[] arg) {
      args.add(arg);
      return this;
    }

    public RawCommand build() {
      return new RawCommand(
          new ArrayList<>(args), level, keyIndices.stream().mapToInt(Integer::intValue).toArray());
    }
  }
}
