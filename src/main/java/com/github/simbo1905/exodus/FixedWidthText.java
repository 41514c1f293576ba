package com.github.simbo1905.exodus;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// A table of fixed-width, zero-padded text slots, the in-memory image of a character
/// variable such as `name_glo_var (num_glo_var, len_name)`.
///
/// Text is stored as UTF-8 bytes left aligned in its slot. The last byte of every slot is
/// reserved for the NUL terminator, so the longest text a slot holds is `width - 1` bytes.
/// Longer text is rejected at encode time rather than truncated.
final class FixedWidthText {

  private final int rows;
  private final int width;
  private final byte[] buffer;

  /// @param rows number of slots
  /// @param width bytes per slot including the terminator
  FixedWidthText(int rows, int width) {
    if (rows < 0) {
      throw new IllegalArgumentException("rows must be non-negative, got " + rows);
    }
    if (width < 2) {
      throw new IllegalArgumentException("width must leave room for text and NUL, got " + width);
    }
    final int size;
    try {
      size = Math.multiplyExact(rows, width);
    } catch (ArithmeticException e) {
      throw new ValidationException(
          String.format("%d slots of %d bytes do not fit in one array", rows, width), e);
    }
    this.rows = rows;
    this.width = width;
    this.buffer = new byte[size];
  }

  int rows() {
    return rows;
  }

  int width() {
    return width;
  }

  /// Encodes text into a zero-filled slot image of exactly `width` bytes.
  ///
  /// @throws ValidationException if the text is null, contains NUL or does not fit
  static byte[] encode(String text, int width) {
    if (text == null) {
      throw new ValidationException("text must not be null");
    }
    if (text.indexOf('\0') >= 0) {
      throw new ValidationException("text must not contain NUL characters: " + text);
    }
    final var bytes = text.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > width - 1) {
      throw new ValidationException(
          String.format(
              "'%s' is %d bytes but at most %d fit a %d byte slot",
              text, bytes.length, width - 1, width));
    }
    return Arrays.copyOf(bytes, width);
  }

  /// Decodes one slot image, dropping the zero padding.
  static String decode(byte[] slot, int offset, int width) {
    int end = offset;
    final int limit = offset + width;
    while (end < limit && slot[end] != 0) {
      end++;
    }
    return new String(slot, offset, end - offset, StandardCharsets.UTF_8);
  }

  /// Clears slot `row` (0-based) and copies the text into it.
  ///
  /// @return the encoded slot bytes, ready to be written to the container
  byte[] put(int row, String text) {
    checkRow(row);
    final var encoded = encode(text, width);
    System.arraycopy(encoded, 0, buffer, row * width, width);
    return encoded;
  }

  String get(int row) {
    checkRow(row);
    return decode(buffer, row * width, width);
  }

  /// All slots in slot order. Unwritten slots decode as empty strings.
  List<String> all() {
    final List<String> out = new ArrayList<>(rows);
    for (int row = 0; row < rows; row++) {
      out.add(get(row));
    }
    return out;
  }

  /// 0-based position of the first slot holding exactly this text, or -1.
  int indexOf(String text) {
    for (int row = 0; row < rows; row++) {
      if (get(row).equals(text)) {
        return row;
      }
    }
    return -1;
  }

  private void checkRow(int row) {
    if (row < 0 || row >= rows) {
      throw new ValidationException(
          String.format("slot %d is outside 1..%d", row + 1, rows));
    }
  }
}
