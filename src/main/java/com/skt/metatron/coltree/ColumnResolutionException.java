package com.skt.metatron.coltree;

/**
 * A selector references a name or path that does not exist, or addresses through a non-group column.
 */
public class ColumnResolutionException extends ColTreeException {
  public ColumnResolutionException(String message) {
    super(message);
  }
}
