package com.skt.metatron.coltree.type;

import com.skt.metatron.coltree.DataFrame;
import com.skt.metatron.coltree.Row;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Closed set of element type tags. Numeric tags form the widening chain INT &lt; LONG &lt; DOUBLE,
 * with DECIMAL above INT and LONG and NUMBER above every numeric tag.
 */
public enum DataType {
  BOOLEAN,
  INT,
  LONG,
  DOUBLE,
  DECIMAL,
  NUMBER,
  STRING,
  DATE,
  TIME,
  DATETIME,
  LIST,
  ROW,
  FRAME,
  ANY;

  public boolean isNumeric() {
    switch (this) {
      case INT:
      case LONG:
      case DOUBLE:
      case DECIMAL:
      case NUMBER:
        return true;
      default:
        return false;
    }
  }

  // the class values of this tag are normalized to, null for abstract tags
  public Class<?> javaClass() {
    switch (this) {
      case BOOLEAN:
        return Boolean.class;
      case INT:
        return Integer.class;
      case LONG:
        return Long.class;
      case DOUBLE:
        return Double.class;
      case DECIMAL:
        return BigDecimal.class;
      case STRING:
        return String.class;
      case DATE:
        return LocalDate.class;
      case TIME:
        return LocalTime.class;
      case DATETIME:
        return LocalDateTime.class;
      default:
        return null;
    }
  }

  public static DataType of(Object value) {
    if (value == null) {
      return ANY;
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return INT;
    } else if (value instanceof Long) {
      return LONG;
    } else if (value instanceof Double || value instanceof Float) {
      return DOUBLE;
    } else if (value instanceof BigDecimal || value instanceof BigInteger) {
      return DECIMAL;
    } else if (value instanceof Number) {
      return NUMBER;
    } else if (value instanceof String) {
      return STRING;
    } else if (value instanceof LocalDate) {
      return DATE;
    } else if (value instanceof LocalTime) {
      return TIME;
    } else if (value instanceof LocalDateTime) {
      return DATETIME;
    } else if (value instanceof List) {
      return LIST;
    } else if (value instanceof Row) {
      return ROW;
    } else if (value instanceof DataFrame) {
      return FRAME;
    }
    return ANY;
  }
}
