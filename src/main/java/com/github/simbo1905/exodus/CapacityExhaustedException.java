package com.github.simbo1905.exodus;

/// Thrown when every slot of a fixed-capacity catalog (element blocks, side sets) is already
/// claimed. Capacities are declared when the file is created and never grow.
public class CapacityExhaustedException extends IllegalStateException {

  public CapacityExhaustedException(String message) {
    super(message);
  }
}
