package com.github.simbo1905.exodus;

import static com.github.simbo1905.exodus.ExodusSchema.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Writes the large integer arrays of a mesh: block connectivity and side set indices.
///
/// Callers that index from zero pass an index shift, usually 1, which is added to every entry
/// on the way out. Without a shift the caller's array is written as is in one call. With a
/// shift, connectivity is copied and written a chunk of rows at a time so the extra memory
/// stays near the chunk budget however large the block is.
final class BulkArrayWriter {

  private static final Logger logger = Logger.getLogger(BulkArrayWriter.class.getName());

  private final Container container;

  BulkArrayWriter(Container container) {
    this.container = container;
  }

  /// @param block the block the connectivity belongs to
  /// @param connectivity node indices, row-major, `numElements * nodesPerElement` long
  /// @param indexShift added to every entry before it is written
  /// @param chunkBytes upper bound on the bytes copied per chunk when shifting
  /// @throws ValidationException if the array has the wrong size or the chunk budget is not
  ///     positive
  void writeConnectivity(ElementBlock block, int[] connectivity, int indexShift, long chunkBytes)
      throws IOException {
    if (connectivity == null || connectivity.length != block.connectivitySize()) {
      throw new ValidationException(
          String.format(
              "Connectivity of block %d needs %d x %d = %d entries, got %d",
              block.id(),
              block.numElements(),
              block.nodesPerElement(),
              block.connectivitySize(),
              connectivity == null ? 0 : connectivity.length));
    }
    if (chunkBytes <= 0) {
      throw new ValidationException("Chunk size must be positive, got " + chunkBytes);
    }

    final var variable = connect(block.slot());
    final int rows = block.numElements();
    final int width = block.nodesPerElement();

    if (indexShift == 0) {
      container.writeInts(variable, new int[] {0, 0}, new int[] {rows, width}, connectivity);
      return;
    }

    final long rowBytes = (long) width * ValueType.INT.size;
    final int rowsPerChunk = (int) Math.max(1, Math.min(rows, chunkBytes / rowBytes));
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "%s: shifting %d rows by %d in chunks of %d rows",
                variable, rows, indexShift, rowsPerChunk));

    final var chunk = new int[rowsPerChunk * width];
    for (int row = 0; row < rows; row += rowsPerChunk) {
      final int count = Math.min(rowsPerChunk, rows - row);
      final int offset = row * width;
      final int length = count * width;
      shift(connectivity, offset, chunk, length, indexShift);
      final var values = length == chunk.length ? chunk : Arrays.copyOf(chunk, length);
      container.writeInts(variable, new int[] {row, 0}, new int[] {count, width}, values);
      final int from = row;
      logger.log(
          Level.FINER, () -> String.format("%s: wrote rows %d..%d", variable, from, from + count));
    }
  }

  /// Writes the element and local side arrays of a side set in one call each.
  ///
  /// @throws ValidationException unless both arrays have exactly `numSides` entries
  void writeSideSet(SideSet sideSet, int[] elements, int[] sides, int indexShift)
      throws IOException {
    checkSideSetLength(sideSet, "element", elements);
    checkSideSetLength(sideSet, "side", sides);
    final int n = sideSet.numSides();
    final int[] origin = {0};
    final int[] shape = {n};
    container.writeInts(elemSideSet(sideSet.slot()), origin, shape, shifted(elements, indexShift));
    container.writeInts(sideSideSet(sideSet.slot()), origin, shape, shifted(sides, indexShift));
  }

  private static void checkSideSetLength(SideSet sideSet, String what, int[] values) {
    if (values == null || values.length != sideSet.numSides()) {
      throw new ValidationException(
          String.format(
              "Side set %d needs %d %s entries, got %d",
              sideSet.id(), sideSet.numSides(), what, values == null ? 0 : values.length));
    }
  }

  private static int[] shifted(int[] values, int indexShift) {
    if (indexShift == 0) {
      return values;
    }
    final var out = new int[values.length];
    shift(values, 0, out, values.length, indexShift);
    return out;
  }

  private static void shift(int[] from, int offset, int[] to, int length, int indexShift) {
    try {
      for (int i = 0; i < length; i++) {
        to[i] = Math.addExact(from[offset + i], indexShift);
      }
    } catch (ArithmeticException e) {
      throw new ValidationException("Index shift of " + indexShift + " overflows an int", e);
    }
  }
}
