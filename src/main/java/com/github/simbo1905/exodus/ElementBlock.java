package com.github.simbo1905.exodus;

/// An element block: a group of elements sharing one element type.
///
/// @param id the caller's external id, stored in `eb_prop1`
/// @param slot the 1-based allocator slot that names the block's dimensions and arrays
/// @param elementType element type tag such as `TETRA` or `HEX8`
/// @param numElements number of elements in the block
/// @param nodesPerElement nodes in each element, the width of a connectivity row
public record ElementBlock(
    int id, int slot, String elementType, int numElements, int nodesPerElement) {

  /// Total number of entries in the connectivity array.
  public long connectivitySize() {
    return (long) numElements * nodesPerElement;
  }
}
