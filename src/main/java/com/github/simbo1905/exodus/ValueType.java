package com.github.simbo1905.exodus;

/// Storage types the Exodus schema needs from the container.
enum ValueType {
  INT(Integer.BYTES),
  FLOAT(Float.BYTES),
  DOUBLE(Double.BYTES),
  /// single byte characters used for all fixed-width text
  CHAR(Byte.BYTES);

  final int size;

  ValueType(int size) {
    this.size = size;
  }
}
