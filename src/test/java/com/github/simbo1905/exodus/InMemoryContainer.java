package com.github.simbo1905.exodus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A [Container] held entirely in memory that records every call it receives.
///
/// Lets the allocator, registry and bulk writer be tested without netCDF. Slices are bounds
/// checked like the real container and FLOAT variables hold values narrowed to single
/// precision. Every array passed in is copied so callers that reuse a buffer are caught.
class InMemoryContainer implements Container {

  private static final Logger logger = Logger.getLogger(InMemoryContainer.class.getName());

  private final Map<String, Integer> dimensions = new LinkedHashMap<>();
  private final Map<String, ValueType> types = new LinkedHashMap<>();
  private final Map<String, int[]> shapes = new HashMap<>();
  private final Map<String, Object> data = new HashMap<>();
  private final Map<String, Object> attributes = new HashMap<>();

  /// One entry per call, e.g. `createVariable connect1` or `writeInts eb_prop1 [0]`.
  final List<String> operations = new ArrayList<>();

  boolean closed;
  int closeCount;

  private void record(String operation) {
    operations.add(operation);
    logger.log(Level.FINEST, () -> "op " + operations.size() + ": " + operation);
  }

  @Override
  public void declareDimension(String name, int length) {
    record("declareDimension " + name + " " + length);
    if (dimensions.containsKey(name)) {
      throw new ValidationException("Dimension already exists: " + name);
    }
    if (length <= 0) {
      throw new ValidationException("Dimension " + name + " must be positive");
    }
    dimensions.put(name, length);
  }

  @Override
  public boolean hasDimension(String name) {
    return dimensions.containsKey(name);
  }

  @Override
  public int dimensionLength(String name) {
    final var length = dimensions.get(name);
    if (length == null) {
      throw new EntityNotFoundException("No such dimension: " + name);
    }
    return length;
  }

  @Override
  public void createVariable(String name, ValueType type, String... dims) {
    record("createVariable " + name);
    if (types.containsKey(name)) {
      throw new ValidationException("Variable already exists: " + name);
    }
    final var shape = new int[dims.length];
    int size = 1;
    for (int i = 0; i < dims.length; i++) {
      shape[i] = dimensionLength(dims[i]);
      size *= shape[i];
    }
    types.put(name, type);
    shapes.put(name, shape);
    data.put(
        name,
        switch (type) {
          case INT -> new int[size];
          case FLOAT, DOUBLE -> new double[size];
          case CHAR -> new byte[size];
        });
  }

  @Override
  public boolean hasVariable(String name) {
    return types.containsKey(name);
  }

  @Override
  public void setAttribute(String variable, String name, String value) {
    record("setAttribute " + (variable == null ? "" : variable) + "/" + name);
    attributes.put((variable == null ? "" : variable) + "/" + name, value);
  }

  @Override
  public void setAttribute(String variable, String name, Number value) {
    record("setAttribute " + (variable == null ? "" : variable) + "/" + name);
    attributes.put((variable == null ? "" : variable) + "/" + name, value);
  }

  @Override
  public Object getAttribute(String variable, String name) {
    return attributes.get((variable == null ? "" : variable) + "/" + name);
  }

  @Override
  public void writeInts(String variable, int[] origin, int[] shape, int[] values) {
    record("writeInts " + variable + " " + Arrays.toString(origin));
    final var target = (int[]) data(variable, ValueType.INT);
    final var copy = values.clone();
    copySlice(variable, origin, shape, copy.length, (from, to) -> target[to] = copy[from]);
  }

  @Override
  public void writeDoubles(String variable, int[] origin, int[] shape, double[] values) {
    record("writeDoubles " + variable + " " + Arrays.toString(origin));
    final var single = types.get(variable) == ValueType.FLOAT;
    final var target =
        (double[]) data(variable, single ? ValueType.FLOAT : ValueType.DOUBLE);
    final var copy = values.clone();
    copySlice(
        variable,
        origin,
        shape,
        copy.length,
        (from, to) -> target[to] = single ? (float) copy[from] : copy[from]);
  }

  @Override
  public void writeChars(String variable, int[] origin, int[] shape, byte[] values) {
    record("writeChars " + variable + " " + Arrays.toString(origin));
    final var target = (byte[]) data(variable, ValueType.CHAR);
    final var copy = values.clone();
    copySlice(variable, origin, shape, copy.length, (from, to) -> target[to] = copy[from]);
  }

  @Override
  public int[] readInts(String variable) {
    return ((int[]) data(variable, ValueType.INT)).clone();
  }

  @Override
  public double[] readDoubles(String variable) {
    final var type = types.get(variable);
    return ((double[]) data(variable, type == ValueType.FLOAT ? type : ValueType.DOUBLE)).clone();
  }

  @Override
  public byte[] readChars(String variable) {
    return ((byte[]) data(variable, ValueType.CHAR)).clone();
  }

  @Override
  public void flush() {
    record("flush");
  }

  @Override
  public void close() throws IOException {
    record("close");
    closeCount++;
    closed = true;
  }

  int[] shapeOf(String variable) {
    data(variable, types.get(variable));
    return shapes.get(variable).clone();
  }

  ValueType typeOf(String variable) {
    return types.get(variable);
  }

  /// Operations whose text starts with the prefix, in call order.
  List<String> operationsStartingWith(String prefix) {
    return operations.stream().filter(op -> op.startsWith(prefix)).toList();
  }

  private Object data(String variable, ValueType expected) {
    final var type = types.get(variable);
    if (type == null) {
      throw new EntityNotFoundException("No such variable: " + variable);
    }
    if (type != expected) {
      throw new IllegalArgumentException(variable + " is " + type + " not " + expected);
    }
    return data.get(variable);
  }

  @FunctionalInterface
  private interface IndexCopy {
    void copy(int from, int to);
  }

  /// Maps each position of a row-major slice onto its flat index in the whole variable.
  private void copySlice(String variable, int[] origin, int[] shape, int count, IndexCopy copy) {
    final var full = shapes.get(variable);
    if (origin.length != full.length || shape.length != full.length) {
      throw new ValidationException("Rank mismatch writing " + variable);
    }
    int size = 1;
    for (int d = 0; d < full.length; d++) {
      if (origin[d] < 0 || shape[d] < 0 || origin[d] + shape[d] > full[d]) {
        throw new ValidationException(
            String.format(
                "Slice origin=%s shape=%s is outside variable %s%s",
                Arrays.toString(origin), Arrays.toString(shape), variable, Arrays.toString(full)));
      }
      size *= shape[d];
    }
    if (size != count) {
      throw new ValidationException(
          String.format("Slice of %s holds %d values, got %d", variable, size, count));
    }
    final var index = new int[full.length];
    for (int i = 0; i < size; i++) {
      int rest = i;
      for (int d = full.length - 1; d >= 0; d--) {
        index[d] = rest % shape[d];
        rest /= shape[d];
      }
      int flat = 0;
      for (int d = 0; d < full.length; d++) {
        flat = flat * full[d] + origin[d] + index[d];
      }
      copy.copy(i, flat);
    }
  }
}
