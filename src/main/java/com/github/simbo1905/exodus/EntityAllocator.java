package com.github.simbo1905.exodus;

import static com.github.simbo1905.exodus.ExodusSchema.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Hands out slots for element blocks and side sets and records the caller's ids against them.
///
/// Claims are made in a [SlotTracker] first; the status and property arrays in the container
/// are then updated one entry at a time, so allocation never reads the arrays back.
///
/// Block and side set ids must both be unique within their catalog.
final class EntityAllocator {

  private static final Logger logger = Logger.getLogger(EntityAllocator.class.getName());

  private final Container container;
  private final int fileElementCount;

  private final SlotTracker blockSlots;
  private final SlotTracker sideSetSlots;
  private final Map<Integer, ElementBlock> blocks = new LinkedHashMap<>();
  private final Map<Integer, SideSet> sideSets = new LinkedHashMap<>();
  private final FixedWidthText blockNames;
  private final FixedWidthText sideSetNames;

  EntityAllocator(Container container, int fileElementCount, int numBlocks, int numSideSets) {
    this.container = container;
    this.fileElementCount = fileElementCount;
    this.blockSlots = new SlotTracker("element block", numBlocks);
    this.sideSetSlots = new SlotTracker("side set", numSideSets);
    this.blockNames = new FixedWidthText(numBlocks, LEN_NAME);
    this.sideSetNames = new FixedWidthText(numSideSets, LEN_NAME);
  }

  /// Claims the first free block slot and creates the block's dimensions and connectivity array.
  ///
  /// @throws ValidationException for a bad count, non-zero attributes or a duplicate id
  /// @throws CapacityExhaustedException if every block slot is claimed
  ElementBlock allocateBlock(
      int id, String elementType, int numElements, int nodesPerElement, int attributesPerElement)
      throws IOException {
    if (elementType == null || elementType.isBlank()) {
      throw new ValidationException("element type must be given for block " + id);
    }
    if (numElements < 1 || numElements > fileElementCount) {
      throw new ValidationException(
          String.format(
              "Block %d has %d elements but must have between 1 and the file's %d",
              id, numElements, fileElementCount));
    }
    if (nodesPerElement < 1) {
      throw new ValidationException(
          String.format("Block %d must have at least one node per element, got %d", id, nodesPerElement));
    }
    if (attributesPerElement != 0) {
      throw new ValidationException(
          "Only zero attributes per element are supported, got " + attributesPerElement);
    }
    if (blocks.containsKey(id)) {
      throw new ValidationException("Element block id " + id + " already exists");
    }

    final int slot = blockSlots.firstFree();
    final var block = new ElementBlock(id, slot, elementType, numElements, nodesPerElement);

    final var numElemName = numElemInBlock(slot);
    final var nodesPerElemName = numNodesPerElem(slot);
    container.declareDimension(numElemName, numElements);
    container.declareDimension(nodesPerElemName, nodesPerElement);
    container.createVariable(connect(slot), ValueType.INT, numElemName, nodesPerElemName);
    container.setAttribute(connect(slot), ATT_ELEM_TYPE, elementType);

    blockSlots.claim(slot);
    blocks.put(id, block);
    recordClaim(blockSlots, VAR_EB_STATUS, VAR_EB_PROP1, slot, id);

    logger.log(
        Level.FINE,
        () ->
            String.format(
                "allocated %s, %d of %d block slots in use",
                block, blockSlots.claimedCount(), blockSlots.capacity()));
    return block;
  }

  /// Claims the first free side set slot and creates its element and side arrays.
  ///
  /// @throws ValidationException for non-zero distribution factors, a bad count or a duplicate
  ///     id. The duplicate check comes first so it applies even when no slot is left.
  /// @throws CapacityExhaustedException if the declared side set capacity is filled
  SideSet allocateSideSet(int id, int numSides, int numDistFactors) throws IOException {
    if (numDistFactors != 0) {
      throw new ValidationException(
          "Only zero distribution factors are supported, got " + numDistFactors);
    }
    if (sideSets.containsKey(id)) {
      throw new ValidationException("Side set id " + id + " already exists");
    }
    if (numSides < 1) {
      throw new ValidationException(
          String.format("Side set %d must have at least one side, got %d", id, numSides));
    }

    final int slot = sideSetSlots.firstFree();
    final var sideSet = new SideSet(id, slot, numSides);

    final var dim = numSidesInSet(slot);
    container.declareDimension(dim, numSides);
    container.createVariable(elemSideSet(slot), ValueType.INT, dim);
    container.createVariable(sideSideSet(slot), ValueType.INT, dim);

    sideSetSlots.claim(slot);
    sideSets.put(id, sideSet);
    recordClaim(sideSetSlots, VAR_SS_STATUS, VAR_SS_PROP1, slot, id);

    logger.log(
        Level.FINE,
        () ->
            String.format(
                "allocated %s, %d of %d side set slots in use",
                sideSet, sideSetSlots.claimedCount(), sideSetSlots.capacity()));
    return sideSet;
  }

  /// Serializes one claim already made in the tracker: the id into the property array then the
  /// tracker's flag for the slot into the status array.
  private void recordClaim(SlotTracker slots, String status, String prop, int slot, int id)
      throws IOException {
    final int[] origin = {slot - 1};
    final int[] shape = {1};
    container.writeInts(prop, origin, shape, new int[] {id});
    container.writeInts(status, origin, shape, new int[] {slots.status(slot)});
  }

  ElementBlock block(int id) {
    final var block = blocks.get(id);
    if (block == null) {
      throw new EntityNotFoundException("Element block id " + id + " does not exist");
    }
    return block;
  }

  SideSet sideSet(int id) {
    final var sideSet = sideSets.get(id);
    if (sideSet == null) {
      throw new EntityNotFoundException("Side set id " + id + " does not exist");
    }
    return sideSet;
  }

  void putBlockName(int id, String name) throws IOException {
    final int slot = block(id).slot();
    writeName(VAR_EB_NAMES, blockNames, slot, name);
  }

  void putSideSetName(int id, String name) throws IOException {
    final int slot = sideSet(id).slot();
    writeName(VAR_SS_NAMES, sideSetNames, slot, name);
  }

  String blockName(int id) {
    return blockNames.get(block(id).slot() - 1);
  }

  String sideSetName(int id) {
    return sideSetNames.get(sideSet(id).slot() - 1);
  }

  private void writeName(String variable, FixedWidthText names, int slot, String name)
      throws IOException {
    final var bytes = names.put(slot - 1, name);
    container.writeChars(variable, new int[] {slot - 1, 0}, new int[] {1, names.width()}, bytes);
  }

  /// Block ids in slot order. Slots are never released, so claim order is slot order.
  List<Integer> blockIds() {
    return blocks.values().stream().map(ElementBlock::id).toList();
  }

  /// Side set ids in slot order.
  List<Integer> sideSetIds() {
    return sideSets.values().stream().map(SideSet::id).toList();
  }

  int blockCapacity() {
    return blockSlots.capacity();
  }

  int sideSetCapacity() {
    return sideSetSlots.capacity();
  }
}
