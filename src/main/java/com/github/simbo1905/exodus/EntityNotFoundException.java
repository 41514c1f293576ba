package com.github.simbo1905.exodus;

import java.util.NoSuchElementException;

/// Thrown when a block id, side set id or variable name does not exist in the file.
public class EntityNotFoundException extends NoSuchElementException {

  public EntityNotFoundException(String message) {
    super(message);
  }
}
