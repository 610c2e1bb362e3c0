package com.skt.metatron.coltree.type;

import com.skt.metatron.coltree.ConversionException;

/**
 * Converts one non-null value between two types.
 */
public interface TypeConverter {
  Object convert(Object value) throws ConversionException;
}
