package com.skt.metatron.coltree.type;

import com.skt.metatron.coltree.ConversionException;
import com.skt.metatron.coltree.column.Column;
import com.skt.metatron.coltree.column.ValueColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converters between column types, created on first use and memoized per (from, to) pair.
 * Safe to share between threads.
 */
public class ConverterRegistry {
  private static Logger LOGGER = LoggerFactory.getLogger(ConverterRegistry.class);

  private static final ConverterRegistry DEFAULT = new ConverterRegistry();

  // ConcurrentHashMap holds no nulls; this marks pairs known to have no converter
  private static final TypeConverter NO_CONVERTER = new TypeConverter() {
    @Override
    public Object convert(Object value) throws ConversionException {
      throw new ConversionException("convert(): no converter");
    }
  };

  private static final TypeConverter IDENTITY = new TypeConverter() {
    @Override
    public Object convert(Object value) {
      return value;
    }
  };

  private static final TypeConverter TO_STRING = new TypeConverter() {
    @Override
    public Object convert(Object value) {
      return value.toString();
    }
  };

  private final Map<ConversionKey, TypeConverter> converters = new ConcurrentHashMap<>();

  public static ConverterRegistry getDefault() {
    return DEFAULT;
  }

  /**
   * @return the converter between the two types, ignoring nullability, or null if there is none
   */
  public TypeConverter getConverter(ColumnType from, ColumnType to) {
    ConversionKey key = new ConversionKey(from.withNullable(false), to.withNullable(false));
    TypeConverter converter = converters.get(key);
    if (converter == null) {
      converter = createConverter(key.from, key.to);
      if (converter == null) {
        converter = NO_CONVERTER;
      }
      TypeConverter prev = converters.putIfAbsent(key, converter);
      if (prev != null) {
        converter = prev;
      }
    }
    return converter == NO_CONVERTER ? null : converter;
  }

  public int cachedPairs() {
    return converters.size();
  }

  protected TypeConverter createConverter(ColumnType from, ColumnType to) {
    if (from.equals(to)) {
      return IDENTITY;
    }
    if (from.isList() || to.isList()) {
      return null;
    }

    final DataType fromType = from.getDataType();
    final DataType toType = to.getDataType();
    if (fromType == DataType.ROW || fromType == DataType.FRAME || toType == DataType.ROW || toType == DataType.FRAME) {
      return null;
    }
    if (toType == DataType.ANY) {
      return IDENTITY;
    }

    if (fromType == DataType.STRING) {
      return StringParsers.converterFor(toType);
    }
    if (toType == DataType.STRING) {
      return TO_STRING;
    }
    if (fromType.isNumeric() && toType.isNumeric()) {
      return new TypeConverter() {
        @Override
        public Object convert(Object value) throws ConversionException {
          if (!(value instanceof Number)) {
            throw new ConversionException(String.format("convert(): not a number: '%s'", value));
          }
          return Numbers.convert((Number) value, toType);
        }
      };
    }
    if (fromType == DataType.ANY) {
      return new TypeConverter() {
        @Override
        public Object convert(Object value) throws ConversionException {
          TypeConverter converter = getConverter(ColumnType.ofValue(value), ColumnType.of(toType));
          if (converter == null) {
            throw new ConversionException(String.format("convert(): cannot convert '%s' to %s", value, toType));
          }
          return converter.convert(value);
        }
      };
    }
    return null;
  }

  /**
   * Converts the values of a value column to {@code newType}. A column that already is a subtype only
   * gets its declared type changed. Nulls stay null.
   */
  public Column castTo(Column column, ColumnType newType) throws ConversionException {
    ColumnType from = column.type();
    if (from.equals(newType)) {
      return column;
    }
    if (!(column instanceof ValueColumn)) {
      String msg = String.format("castTo(): cannot cast %s column %s to %s", column.kind(), column.name(), newType);
      LOGGER.error(msg);
      throw new ConversionException(msg);
    }
    ValueColumn valueColumn = (ValueColumn) column;

    if (from.isSubtypeOf(newType)) {
      return valueColumn.withType(newType.withNullable(valueColumn.hasNulls()));
    }

    TypeConverter converter = getConverter(from, newType);
    if (converter == null) {
      String msg = String.format("castTo(): no converter from %s to %s for column %s", from, newType, column.name());
      LOGGER.error(msg);
      throw new ConversionException(msg);
    }

    List<Object> values = new ArrayList<>(column.size());
    boolean hasNulls = false;
    try {
      for (Object value : column.values()) {
        Object converted = value == null ? null : converter.convert(value);
        hasNulls |= converted == null;
        values.add(converted);
      }
    } catch (ConversionException e) {
      LOGGER.error(String.format("castTo(): column %s to %s: %s", column.name(), newType, e.getMessage()));
      throw e;
    }
    return new ValueColumn(column.name(), values, newType.withNullable(hasNulls));
  }

  private static class ConversionKey {
    private final ColumnType from;
    private final ColumnType to;

    ConversionKey(ColumnType from, ColumnType to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ConversionKey)) {
        return false;
      }
      ConversionKey that = (ConversionKey) o;
      return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
      return 31 * from.hashCode() + to.hashCode();
    }
  }
}
