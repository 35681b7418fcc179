/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.pipelined.cluster;

import java.util.List;

import com.macstab.oss.redis.pipelined.exception.CrossSlotException;
import com.macstab.oss.redis.pipelined.protocol.RawCommandPack;

import io.lettuce.core.cluster.SlotHash;
import lombok.experimental.UtilityClass;

/** Key to hash slot, using Lettuce's CRC16 implementation ({@code {hash tag}} aware). */
@UtilityClass
public class Slots {

  /** Marker returned by {@link #slotOf(RawCommandPack)} for packs without keys. */
  public static final int NO_SLOT = -1;

  public int slotOf(final byte[] key) {
    return SlotHash.getSlot(key);
  }

  /**
   * Slot all keys of the pack hash to, or {@link #NO_SLOT} for keyless packs.
   *
   * @throws CrossSlotException if keys hash to different slots
   */
  public int slotOf(final RawCommandPack pack) {
    final List<byte[]> keys = pack.getKeys();
    if (keys.isEmpty()) {
      return NO_SLOT;
    }
    final int slot = slotOf(keys.get(0));
    for (int i = 1; i < keys.size(); i++) {
      if (slotOf(keys.get(i)) != slot) {
        throw new CrossSlotException(pack.getCommands().get(0).getName());
      }
    }
    return slot;
  }
}
