/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.macstab.oss.redis.pipelined.NodeAddress;
import com.macstab.oss.redis.pipelined.RedisNodeClient;

import lombok.NonNull;

/**
 * Immutable slot routing table: {@code (range, master, client)} entries sorted by range start.
 *
 * <p>Published by the topology monitor as a whole; readers take the reference once and route
 * against that snapshot. May leave slots uncovered while the cluster is resharding: {@link
 * #clientForSlot(int)} then returns {@code null}.
 */
public final class ClusterSlotMapping {

  public static final ClusterSlotMapping EMPTY = new ClusterSlotMapping(List.of());

  /** One routed range. */
  public record Entry(SlotRange range, NodeAddress master, RedisNodeClient client) {}

  private final List<Entry> entries;
  private final int[] starts;

  private ClusterSlotMapping(final List<Entry> sortedEntries) {
    this.entries = List.copyOf(sortedEntries);
    this.starts = new int[entries.size()];
    for (var i = 0; i < starts.length; i++) {
      starts[i] = entries.get(i).range().start();
    }
  }

  public static ClusterSlotMapping of(@NonNull final List<Entry> entries) {
    final var sorted = new ArrayList<>(entries);
    sorted.sort(Comparator.comparingInt(entry -> entry.range().start()));
    return sorted.isEmpty() ? EMPTY : new ClusterSlotMapping(sorted);
  }

  /** Binary search for the entry whose range contains {@code slot}, or {@code null}. */
  public Entry entryForSlot(final int slot) {
    var low = 0;
    var high = starts.length - 1;
    var candidate = -1;
    while (low <= high) {
      final var mid = (low + high) >>> 1;
      if (starts[mid] <= slot) {
        candidate = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    if (candidate < 0) {
      return null;
    }
    final var entry = entries.get(candidate);
    return entry.range().contains(slot) ? entry : null;
  }

  public RedisNodeClient clientForSlot(final int slot) {
    final var entry = entryForSlot(slot);
    return entry == null ? null : entry.client();
  }

  /** Client of the lowest range; target of keyless commands. */
  public RedisNodeClient firstClient() {
    return entries.isEmpty() ? null : entries.get(0).client();
  }

  public List<Entry> getEntries() {
    return entries;
  }

  /** Distinct masters, in slot order. */
  public Set<NodeAddress> masters() {
    final var masters = new LinkedHashSet<NodeAddress>();
    for (final var entry : entries) {
      masters.add(entry.master());
    }
    return masters;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Same ranges owned by the same masters; clients are not compared. */
  public boolean sameRoutingAs(@NonNull final ClusterSlotMapping other) {
    if (entries.size() != other.entries.size()) {
      return false;
    }
    for (var i = 0; i < entries.size(); i++) {
      final var mine = entries.get(i);
      final var theirs = other.entries.get(i);
      if (!mine.range().equals(theirs.range()) || !mine.master().equals(theirs.master())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder("ClusterSlotMapping[");
    for (var i = 0; i < entries.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(entries.get(i).range()).append(" -> ").append(entries.get(i).master());
    }
    return sb.append(']').toString();
  }
}
