package com.github.simbo1905.exodus;

import java.util.BitSet;

/// Tracks which 1-based slots of a fixed-capacity catalog are claimed and hands out the
/// smallest free one. This is the in-memory counterpart of a status array: the caller
/// serializes a claim to disk after it is made here.
final class SlotTracker {

  private final String catalog;
  private final int capacity;
  private final BitSet claimed;

  /// @param catalog name used in error messages, e.g. "element block"
  /// @param capacity number of slots, fixed for the life of the file
  SlotTracker(String catalog, int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be non-negative, got " + capacity);
    }
    this.catalog = catalog;
    this.capacity = capacity;
    this.claimed = new BitSet(capacity);
  }

  /// Returns the smallest free slot without claiming it.
  ///
  /// @throws CapacityExhaustedException if every slot is claimed
  int firstFree() {
    final int bit = claimed.nextClearBit(0);
    if (bit >= capacity) {
      throw new CapacityExhaustedException(
          String.format("All %d %s slots are already claimed", capacity, catalog));
    }
    return bit + 1;
  }

  /// Claims a slot previously returned by [#firstFree()].
  void claim(int slot) {
    if (slot < 1 || slot > capacity) {
      throw new IllegalArgumentException(
          String.format("%s slot %d is outside 1..%d", catalog, slot, capacity));
    }
    if (claimed.get(slot - 1)) {
      throw new IllegalStateException(String.format("%s slot %d is already claimed", catalog, slot));
    }
    claimed.set(slot - 1);
  }

  boolean isClaimed(int slot) {
    return slot >= 1 && slot <= capacity && claimed.get(slot - 1);
  }

  int claimedCount() {
    return claimed.cardinality();
  }

  int capacity() {
    return capacity;
  }

  /// The status array entry for one slot: 1 when claimed and 0 when free.
  int status(int slot) {
    return isClaimed(slot) ? ExodusSchema.SLOT_CLAIMED : ExodusSchema.SLOT_FREE;
  }
}
