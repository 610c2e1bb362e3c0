package com.skt.metatron.coltree.type;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric widening and narrowing between the numeric tags.
 */
public class Numbers {

  private Numbers() {
  }

  public static Object convert(Number value, DataType target) {
    switch (target) {
      case INT:
        return value instanceof Integer ? value : Integer.valueOf(value.intValue());
      case LONG:
        return value instanceof Long ? value : Long.valueOf(value.longValue());
      case DOUBLE:
        return value instanceof Double ? value : Double.valueOf(value.doubleValue());
      case DECIMAL:
        return toDecimal(value);
      case NUMBER:
        return value;
      default:
        throw new IllegalArgumentException("convert(): not a numeric type: " + target);
    }
  }

  private static BigDecimal toDecimal(Number value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    } else if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(value.doubleValue());
    }
    return BigDecimal.valueOf(value.longValue());
  }
}
