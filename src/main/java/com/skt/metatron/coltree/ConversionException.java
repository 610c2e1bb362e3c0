package com.skt.metatron.coltree;

public class ConversionException extends ColTreeException {
  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
