package com.github.simbo1905.exodus;

/// Precision of every floating point array in the file: coordinates, the time axis and all
/// variable values. Inputs are always doubles and are narrowed when the file is single precision.
public enum WordSize {
  SINGLE(4, ValueType.FLOAT),
  DOUBLE(8, ValueType.DOUBLE);

  final int bytes;
  final ValueType valueType;

  WordSize(int bytes, ValueType valueType) {
    this.bytes = bytes;
    this.valueType = valueType;
  }

  public int bytes() {
    return bytes;
  }

  /// Resolves the `io_size` convention of the Exodus API.
  ///
  /// @param ioSize 0 for the machine word size, 4 for single or 8 for double precision
  /// @throws ValidationException for any other value
  public static WordSize fromIoSize(int ioSize) {
    return switch (ioSize) {
      case 0 -> "32".equals(System.getProperty("sun.arch.data.model")) ? SINGLE : DOUBLE;
      case 4 -> SINGLE;
      case 8 -> DOUBLE;
      default -> throw new ValidationException("io size must be 0, 4 or 8, got " + ioSize);
    };
  }
}
