package com.github.simbo1905.exodus;

import java.io.Closeable;
import java.io.IOException;

/// The self-describing container an Exodus file is laid out in: named dimensions, named typed
/// multi-dimensional variables and attributes. The Exodus logic only ever talks to storage
/// through this interface so that the physical format stays swappable.
///
/// Variables are addressed by name. Slices are given as an origin and a shape in row-major
/// order with the values flattened into a one dimensional array.
interface Container extends Closeable {

  void declareDimension(String name, int length) throws IOException;

  boolean hasDimension(String name);

  /// @throws EntityNotFoundException if the dimension was never declared
  int dimensionLength(String name);

  /// Creates a variable shaped by previously declared dimensions, slowest varying first.
  void createVariable(String name, ValueType type, String... dimensions) throws IOException;

  boolean hasVariable(String name);

  /// Sets a text attribute. A null variable name targets the file itself.
  void setAttribute(String variable, String name, String value) throws IOException;

  /// Sets a numeric attribute. A null variable name targets the file itself.
  void setAttribute(String variable, String name, Number value) throws IOException;

  /// Returns a String or a Number, or null when the attribute is not set.
  Object getAttribute(String variable, String name);

  void writeInts(String variable, int[] origin, int[] shape, int[] values) throws IOException;

  /// Values are narrowed to single precision when the variable was created as FLOAT.
  void writeDoubles(String variable, int[] origin, int[] shape, double[] values)
      throws IOException;

  void writeChars(String variable, int[] origin, int[] shape, byte[] values) throws IOException;

  int[] readInts(String variable) throws IOException;

  double[] readDoubles(String variable) throws IOException;

  byte[] readChars(String variable) throws IOException;

  /// Pushes buffered writes to the underlying storage.
  void flush() throws IOException;
}
