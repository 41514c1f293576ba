package com.github.simbo1905.exodus;

/// Identifies the value array of one element variable on one element block.
///
/// @param variableIndex 1-based index in the element variable catalog
/// @param blockId the block's external id
record ElementValueKey(int variableIndex, int blockId) {}
