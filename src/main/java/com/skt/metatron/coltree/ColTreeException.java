package com.skt.metatron.coltree;

public class ColTreeException extends Exception {
  public ColTreeException(String message) {
    super(message);
  }

  public ColTreeException(String message, Throwable cause) {
    super(message, cause);
  }
}
