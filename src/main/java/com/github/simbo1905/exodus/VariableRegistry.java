package com.github.simbo1905.exodus;

import static com.github.simbo1905.exodus.ExodusSchema.*;

import java.io.IOException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Catalogs of global, element and node variables and the time axis they are recorded against.
///
/// Each catalog is declared once with a fixed count. Global values share one array and every
/// node variable gets its own array at declare time. Element variables only get a names array
/// up front; the value array for a (variable, block) pair is created the first time a value is
/// written to that pair.
final class VariableRegistry {

  private static final Logger logger = Logger.getLogger(VariableRegistry.class.getName());

  private final Container container;
  private final EntityAllocator allocator;
  private final ValueType floats;
  private final int numNodes;

  private final Map<VariableKind, FixedWidthText> catalogs = new EnumMap<>(VariableKind.class);
  private final Map<ElementValueKey, String> elementValueArrays = new HashMap<>();

  VariableRegistry(Container container, EntityAllocator allocator, WordSize wordSize, int numNodes) {
    this.container = container;
    this.allocator = allocator;
    this.floats = wordSize.valueType;
    this.numNodes = numNodes;
  }

  /// Sizes a catalog. A count of zero leaves the catalog undeclared.
  ///
  /// @throws ValidationException if the count is negative or the catalog was already declared
  void declare(VariableKind kind, int count) throws IOException {
    if (count < 0) {
      throw new ValidationException(
          String.format("Number of %s variables must be non-negative, got %d", kind.label, count));
    }
    if (count == 0) {
      logger.log(Level.FINE, () -> String.format("no %s variables declared", kind.label));
      return;
    }
    if (catalogs.containsKey(kind)) {
      throw new ValidationException(
          String.format(
              "The number of %s variables was already set to %d",
              kind.label, catalogs.get(kind).rows()));
    }

    // size the name table before the container sees anything
    final var names = new FixedWidthText(count, LEN_NAME);
    container.declareDimension(kind.countDimension, count);
    container.createVariable(kind.namesVariable, ValueType.CHAR, kind.countDimension, DIM_LEN_NAME);
    switch (kind) {
      case GLOBAL -> container.createVariable(
          VariableKind.GLOBAL_VALUES, floats, DIM_TIME_STEP, kind.countDimension);
      case NODE -> {
        for (int index = 1; index <= count; index++) {
          container.createVariable(nodeValues(index), floats, DIM_TIME_STEP, DIM_NUM_NODES);
        }
      }
      case ELEMENT -> {
        // value arrays are created per block on first write
      }
    }
    catalogs.put(kind, names);
    logger.log(Level.FINE, () -> String.format("declared %d %s variables", count, kind.label));
  }

  int count(VariableKind kind) {
    final var names = catalogs.get(kind);
    return names == null ? 0 : names.rows();
  }

  /// Names the variable at a 1-based index.
  ///
  /// @throws ValidationException if the catalog is undeclared, the index is outside
  ///     1..count or the name is longer than [ExodusSchema#MAX_NAME_LENGTH] bytes
  void putName(VariableKind kind, String name, int index) throws IOException {
    final var names = catalogs.get(kind);
    if (names == null) {
      throw new ValidationException(
          String.format("Set the number of %s variables before naming them", kind.label));
    }
    if (index < 1 || index > names.rows()) {
      throw new ValidationException(
          String.format(
              "%s variable index %d is outside 1..%d", kind.label, index, names.rows()));
    }
    final var bytes = names.put(index - 1, name);
    container.writeChars(
        kind.namesVariable, new int[] {index - 1, 0}, new int[] {1, names.width()}, bytes);
    logger.log(
        Level.FINEST, () -> String.format("%s variable %d named '%s'", kind.label, index, name));
  }

  /// Names in slot order. An undeclared catalog has no names.
  List<String> names(VariableKind kind) {
    final var names = catalogs.get(kind);
    return names == null ? List.of() : names.all();
  }

  /// 1-based index of the first variable with exactly this name.
  ///
  /// @throws EntityNotFoundException if no variable has the name
  int indexOf(VariableKind kind, String name) {
    final var names = catalogs.get(kind);
    final int row = names == null ? -1 : names.indexOf(name);
    if (row < 0) {
      throw new EntityNotFoundException(
          String.format("No %s variable named '%s'", kind.label, name));
    }
    return row + 1;
  }

  void putTime(int step, double value) throws IOException {
    checkStep(step);
    container.writeDoubles(
        VAR_TIME_WHOLE, new int[] {step - 1}, new int[] {1}, new double[] {value});
  }

  void putGlobalValue(String name, int step, double value) throws IOException {
    checkStep(step);
    final int index = indexOf(VariableKind.GLOBAL, name);
    container.writeDoubles(
        VariableKind.GLOBAL_VALUES,
        new int[] {step - 1, index - 1},
        new int[] {1, 1},
        new double[] {value});
  }

  void putNodeValues(String name, int step, double[] values) throws IOException {
    checkStep(step);
    final int index = indexOf(VariableKind.NODE, name);
    checkLength("node variable " + name, values, numNodes);
    container.writeDoubles(
        nodeValues(index), new int[] {step - 1, 0}, new int[] {1, numNodes}, values);
  }

  void putElementValues(int blockId, String name, int step, double[] values) throws IOException {
    checkStep(step);
    final var block = allocator.block(blockId);
    final int index = indexOf(VariableKind.ELEMENT, name);
    checkLength("element variable " + name + " on block " + blockId, values, block.numElements());
    final var variable = elementValueArray(new ElementValueKey(index, blockId));
    container.writeDoubles(
        variable, new int[] {step - 1, 0}, new int[] {1, block.numElements()}, values);
  }

  /// Returns the value array for the pair, creating it on first use. The array is named after
  /// the block's slot so it lines up with the block's `num_el_in_blk` dimension.
  String elementValueArray(ElementValueKey key) throws IOException {
    final var existing = elementValueArrays.get(key);
    if (existing != null) {
      return existing;
    }
    final var block = allocator.block(key.blockId());
    final var variable = elementValues(key.variableIndex(), block.slot());
    container.createVariable(variable, floats, DIM_TIME_STEP, numElemInBlock(block.slot()));
    elementValueArrays.put(key, variable);
    logger.log(Level.FINE, () -> String.format("created %s for %s", variable, key));
    return variable;
  }

  /// @throws ValidationException unless 1 <= step <= the fixed number of time steps
  private void checkStep(int step) {
    final int steps = container.dimensionLength(DIM_TIME_STEP);
    if (step < 1 || step > steps) {
      throw new ValidationException(
          String.format("Time step %d is outside 1..%d", step, steps));
    }
  }

  private static void checkLength(String what, double[] values, int expected) {
    if (values == null || values.length != expected) {
      throw new ValidationException(
          String.format(
              "%s needs %d values, got %d",
              what, expected, values == null ? 0 : values.length));
    }
  }
}
