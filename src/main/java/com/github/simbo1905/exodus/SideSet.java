package com.github.simbo1905.exodus;

/// A side set tagging mesh boundaries as (element, local side) pairs.
///
/// @param id the caller's external id, stored in `ss_prop1`
/// @param slot the 1-based allocator slot
/// @param numSides number of (element, side) pairs
public record SideSet(int id, int slot, int numSides) {}
