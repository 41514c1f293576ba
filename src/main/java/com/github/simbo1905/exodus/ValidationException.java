package com.github.simbo1905.exodus;

/// Thrown when a caller violates a precondition of the Exodus schema: a bad dimensionality,
/// an unsupported non-zero count, an array of the wrong size, a time step out of range or a
/// name that does not fit its fixed-width slot.
///
/// The file stays open and usable after this is thrown.
public class ValidationException extends IllegalArgumentException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
