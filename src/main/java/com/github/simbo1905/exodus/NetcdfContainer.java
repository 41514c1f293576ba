package com.github.simbo1905.exodus;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFileWriteable;
import ucar.nc2.Variable;

/// Container backed by a netCDF-3 file written with netCDF-Java.
///
/// netCDF-3 distinguishes define mode (schema changes) from data mode (reads and writes). The
/// Exodus logic interleaves both freely so this class switches modes on demand: schema changes
/// re-enter define mode and data access leaves it, which rewrites the header in place. Extra
/// header space is reserved at creation so those rewrites rarely need to move data.
final class NetcdfContainer implements Container {

  private static final Logger logger = Logger.getLogger(NetcdfContainer.class.getName());

  private final Path path;
  private NetcdfFileWriteable writer;

  /// Set once the header has been written for the first time.
  private boolean created;
  private boolean defineMode = true;

  private final Map<String, Integer> dimensions = new LinkedHashMap<>();
  private final Map<String, ValueType> variables = new LinkedHashMap<>();
  private final Map<String, Object> attributes = new HashMap<>();

  private NetcdfContainer(Path path, NetcdfFileWriteable writer) {
    this.path = path;
    this.writer = writer;
  }

  /// Starts a new netCDF-3 file. Nothing is written to disk until the first data access or close.
  ///
  /// @param path the file to create
  /// @param largeFile true for the 64-bit offset variant
  /// @param extraHeaderSpace bytes reserved after the header for later schema additions
  static NetcdfContainer createNew(Path path, boolean largeFile, int extraHeaderSpace)
      throws IOException {
    final var writer = NetcdfFileWriteable.createNew(path.toString(), true);
    writer.setLargeFile(largeFile);
    writer.setExtraHeaderBytes(extraHeaderSpace);
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "netcdf3 createNew path=%s largeFile=%b extraHeaderSpace=%d",
                path, largeFile, extraHeaderSpace));
    return new NetcdfContainer(path, writer);
  }

  @Override
  public void declareDimension(String name, int length) throws IOException {
    if (dimensions.containsKey(name)) {
      throw new ValidationException("Dimension already exists: " + name);
    }
    if (length <= 0) {
      throw new ValidationException(
          String.format("Dimension %s must have a positive length, got %d", name, length));
    }
    enterDefineMode();
    writer.addDimension(name, length);
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
  public void createVariable(String name, ValueType type, String... dims) throws IOException {
    if (variables.containsKey(name)) {
      throw new ValidationException("Variable already exists: " + name);
    }
    for (String dim : dims) {
      dimensionLength(dim);
    }
    enterDefineMode();
    writer.addVariable(name, dataType(type), String.join(" ", dims));
    variables.put(name, type);
  }

  @Override
  public boolean hasVariable(String name) {
    return variables.containsKey(name);
  }

  @Override
  public void setAttribute(String variable, String name, String value) throws IOException {
    addAttribute(variable, new Attribute(name, value));
    attributes.put(attributeKey(variable, name), value);
  }

  @Override
  public void setAttribute(String variable, String name, Number value) throws IOException {
    addAttribute(variable, new Attribute(name, value));
    attributes.put(attributeKey(variable, name), value);
  }

  private void addAttribute(String variable, Attribute attribute) throws IOException {
    enterDefineMode();
    if (variable == null) {
      writer.addGlobalAttribute(attribute);
    } else {
      typeOf(variable);
      writer.addVariableAttribute(variable, attribute);
    }
  }

  @Override
  public Object getAttribute(String variable, String name) {
    return attributes.get(attributeKey(variable, name));
  }

  private static String attributeKey(String variable, String name) {
    return (variable == null ? "" : variable) + "/" + name;
  }

  @Override
  public void writeInts(String variable, int[] origin, int[] shape, int[] values)
      throws IOException {
    write(variable, origin, Array.factory(DataType.INT, shape, values));
  }

  @Override
  public void writeDoubles(String variable, int[] origin, int[] shape, double[] values)
      throws IOException {
    if (typeOf(variable) == ValueType.FLOAT) {
      final var narrowed = new float[values.length];
      for (int i = 0; i < values.length; i++) {
        narrowed[i] = (float) values[i];
      }
      write(variable, origin, Array.factory(DataType.FLOAT, shape, narrowed));
    } else {
      write(variable, origin, Array.factory(DataType.DOUBLE, shape, values));
    }
  }

  @Override
  public void writeChars(String variable, int[] origin, int[] shape, byte[] values)
      throws IOException {
    final var chars = new char[values.length];
    for (int i = 0; i < values.length; i++) {
      chars[i] = (char) (values[i] & 0xFF);
    }
    write(variable, origin, Array.factory(DataType.CHAR, shape, chars));
  }

  private void write(String name, int[] origin, Array values) throws IOException {
    enterDataMode();
    typeOf(name);
    try {
      writer.write(name, origin, values);
    } catch (InvalidRangeException e) {
      throw new ValidationException(
          String.format(
              "Slice origin=%s shape=%s is outside variable %s",
              Arrays.toString(origin), Arrays.toString(values.getShape()), name),
          e);
    }
  }

  @Override
  public int[] readInts(String variable) throws IOException {
    final var array = read(variable);
    final var out = new int[(int) array.getSize()];
    for (int i = 0; i < out.length; i++) {
      out[i] = array.getInt(i);
    }
    return out;
  }

  @Override
  public double[] readDoubles(String variable) throws IOException {
    final var array = read(variable);
    final var out = new double[(int) array.getSize()];
    for (int i = 0; i < out.length; i++) {
      out[i] = array.getDouble(i);
    }
    return out;
  }

  @Override
  public byte[] readChars(String variable) throws IOException {
    final var array = read(variable);
    final var out = new byte[(int) array.getSize()];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) array.getChar(i);
    }
    return out;
  }

  private Array read(String name) throws IOException {
    enterDataMode();
    final var v = variable(name);
    // small variables are cached by netCDF-Java and the cache does not see our writes
    v.invalidateCache();
    return v.read();
  }

  private ValueType typeOf(String name) {
    final var type = variables.get(name);
    if (type == null) {
      throw new EntityNotFoundException("No such variable: " + name);
    }
    return type;
  }

  private Variable variable(String name) {
    typeOf(name);
    final var v = writer.findVariable(name);
    if (v == null) {
      throw new IllegalStateException("netCDF writer lost variable " + name + " in " + path);
    }
    return v;
  }

  private void enterDefineMode() throws IOException {
    if (!defineMode) {
      writer.setRedefineMode(true);
      defineMode = true;
    }
  }

  private void enterDataMode() throws IOException {
    if (!created) {
      writer.create();
      created = true;
      defineMode = false;
      logger.log(
          Level.FINE,
          () ->
              String.format(
                  "created %s with %d dimensions and %d variables",
                  path, dimensions.size(), variables.size()));
    } else if (defineMode) {
      final var rewritten = writer.setRedefineMode(false);
      defineMode = false;
      if (rewritten) {
        logger.log(
            Level.FINE,
            () -> String.format("header of %s outgrew its reserved space, file rewritten", path));
      }
    }
  }

  @Override
  public void flush() throws IOException {
    enterDataMode();
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    if (writer == null) {
      return;
    }
    try {
      // a file that never saw a data write still needs its header on disk
      enterDataMode();
    } finally {
      try {
        writer.close();
      } finally {
        writer = null;
      }
    }
  }

  private static DataType dataType(ValueType type) {
    return switch (type) {
      case INT -> DataType.INT;
      case FLOAT -> DataType.FLOAT;
      case DOUBLE -> DataType.DOUBLE;
      case CHAR -> DataType.CHAR;
    };
  }

  @Override
  public String toString() {
    return "NetcdfContainer[" + path + "]";
  }
}
