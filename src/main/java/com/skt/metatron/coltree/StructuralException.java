package com.skt.metatron.coltree;

/**
 * Violation of a column tree invariant: duplicate names at one level, two columns at one path,
 * columns of unequal length.
 */
public class StructuralException extends ColTreeException {
  public StructuralException(String message) {
    super(message);
  }
}
